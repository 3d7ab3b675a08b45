package com.example.towermud.world;

import com.example.towermud.model.AreaDefinition;
import com.example.towermud.model.Mobile;
import com.example.towermud.model.MobileTemplate;
import com.example.towermud.model.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The room graph and every mobile ever created. Owned by the engine that
 * hosts it; the combat, respawn and population services all share one
 * instance.
 *
 * Mobiles live in an append-only arena: the index handed out by
 * {@link #createMobile} never changes, including across death and respawn.
 */
public class World {
    private static final Logger logger = LoggerFactory.getLogger(World.class);

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();
    private final Map<String, AreaDefinition> areas = new ConcurrentHashMap<>();
    private final List<Mobile> arena = new ArrayList<>();
    private final String startingRoomId;

    public World(String startingRoomId) {
        this.startingRoomId = startingRoomId;
    }

    // Rooms

    public void addRoom(Room room) {
        rooms.put(room.getId(), room);
    }

    /** @return the room, or null when no room has that id */
    public Room getRoom(String roomId) {
        if (roomId == null) return null;
        return rooms.get(roomId);
    }

    public int getRoomCount() {
        return rooms.size();
    }

    public String getStartingRoomId() {
        return startingRoomId;
    }

    public Room getStartingRoom() {
        return getRoom(startingRoomId);
    }

    public List<Room> getRoomsOnFloor(int floor) {
        List<Room> out = new ArrayList<>();
        for (Room r : rooms.values()) {
            if (r.getFloor() == floor) out.add(r);
        }
        out.sort((a, b) -> a.getId().compareTo(b.getId()));
        return out;
    }

    /** Tower floors that have been generated (floor 0, the city, is not one). */
    public Set<Integer> getGeneratedFloors() {
        Set<Integer> floors = new TreeSet<>();
        for (Room r : rooms.values()) {
            if (r.getFloor() > 0) floors.add(r.getFloor());
        }
        return floors;
    }

    public int getGeneratedFloorCount() {
        return getGeneratedFloors().size();
    }

    // Areas

    public void addArea(AreaDefinition area) {
        areas.put(area.getId(), area);
    }

    public AreaDefinition getArea(String areaId) {
        if (areaId == null) return null;
        return areas.get(areaId);
    }

    public List<AreaDefinition> getAreas() {
        return new ArrayList<>(areas.values());
    }

    // Mobiles

    /**
     * Create a mobile from a template and place it in a room.
     * @throws IllegalArgumentException if the room does not exist
     */
    public Mobile createMobile(MobileTemplate template, String roomId) {
        Room room = getRoom(roomId);
        if (room == null) {
            throw new IllegalArgumentException("Unknown room for spawn: " + roomId);
        }
        Mobile mobile;
        synchronized (arena) {
            mobile = new Mobile(arena.size(), template, roomId, room.getFloor(), room.getAreaId());
            arena.add(mobile);
        }
        room.addMobile(mobile);
        logger.debug("[World] Created {} in room {}", mobile, roomId);
        return mobile;
    }

    /** @return the mobile at that arena index, or null */
    public Mobile getMobile(int instanceId) {
        synchronized (arena) {
            if (instanceId < 0 || instanceId >= arena.size()) return null;
            return arena.get(instanceId);
        }
    }

    public List<Mobile> getMobiles() {
        synchronized (arena) {
            return new ArrayList<>(arena);
        }
    }

    public int getMobileCount() {
        synchronized (arena) {
            return arena.size();
        }
    }

    /** Living mobiles currently standing on the given floor. */
    public int countLiveMobilesOnFloor(int floor) {
        int count = 0;
        for (Room r : getRoomsOnFloor(floor)) {
            for (Mobile m : r.getMobiles()) {
                if (m.isAlive()) count++;
            }
        }
        return count;
    }

    /** True if a living mobile from this template is anywhere in the world. */
    public boolean hasLiveMobile(String templateKey) {
        for (Mobile m : getMobiles()) {
            if (m.getTemplateKey().equals(templateKey) && m.isAlive()) return true;
        }
        return false;
    }

    /**
     * Put a mobile in a room.
     * @return false if the room does not exist
     */
    public boolean placeMobile(Mobile mobile, String roomId) {
        Room room = getRoom(roomId);
        if (room == null) return false;
        mobile.setCurrentRoom(roomId);
        room.addMobile(mobile);
        return true;
    }

    public void removeMobileFromRoom(Mobile mobile) {
        Room room = getRoom(mobile.getCurrentRoom());
        if (room != null) {
            room.removeMobile(mobile);
        }
    }

    /**
     * Move a mobile to another room.
     * @return false if the destination does not exist; the mobile stays put
     */
    public boolean moveMobile(Mobile mobile, String toRoomId) {
        Room to = getRoom(toRoomId);
        if (to == null) return false;
        removeMobileFromRoom(mobile);
        mobile.setCurrentRoom(toRoomId);
        to.addMobile(mobile);
        return true;
    }

    // Players

    /** Put a player into the room they are standing in (login). */
    public void enterWorld(Player player) {
        Room room = getRoom(player.getCurrentRoom());
        if (room == null) {
            logger.warn("[World] Player {} is in unknown room {}, using starting room", player.getName(), player.getCurrentRoom());
            player.setCurrentRoom(startingRoomId);
            room = getRoom(startingRoomId);
        }
        if (room != null) {
            room.addPlayer(player.getName());
        }
    }

    public void leaveWorld(Player player) {
        Room room = getRoom(player.getCurrentRoom());
        if (room != null) {
            room.removePlayer(player.getName());
        }
    }

    /**
     * Move a player to another room.
     * @return false if the destination does not exist; the player stays put
     */
    public boolean movePlayer(Player player, String toRoomId) {
        Room to = getRoom(toRoomId);
        if (to == null) return false;
        Room from = getRoom(player.getCurrentRoom());
        if (from != null) {
            from.removePlayer(player.getName());
        }
        player.setCurrentRoom(toRoomId);
        to.addPlayer(player.getName());
        return true;
    }

    public List<Room> getRooms() {
        return Collections.unmodifiableList(new ArrayList<>(rooms.values()));
    }
}
