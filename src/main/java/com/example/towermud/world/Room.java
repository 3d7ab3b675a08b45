package com.example.towermud.world;

import com.example.towermud.model.Mobile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * A room in the world. The exit graph is fixed at load time; occupants and
 * floor items change as players move and mobiles spawn, die and respawn.
 */
public class Room {
    private final String id;
    private final String name;
    private final String description;
    private final int floor;               // 0 = city, 1.. = tower floors
    private final String areaId;           // Nullable

    private final Map<Direction, String> exits;

    private final Set<String> playerNames = ConcurrentHashMap.newKeySet();
    // Ordered so "first mobile in the room" is stable
    private final CopyOnWriteArrayList<Mobile> mobiles = new CopyOnWriteArrayList<>();
    private final List<String> items = new CopyOnWriteArrayList<>();

    public Room(String id, String name, String description, int floor, String areaId,
                Map<Direction, String> exits) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Room id is required");
        }
        this.id = id;
        this.name = name == null ? id : name;
        this.description = description == null ? "" : description;
        this.floor = floor;
        this.areaId = areaId;
        EnumMap<Direction, String> copy = new EnumMap<>(Direction.class);
        if (exits != null) copy.putAll(exits);
        this.exits = Collections.unmodifiableMap(copy);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public int getFloor() { return floor; }
    public String getAreaId() { return areaId; }

    // Exits

    public String getExit(Direction direction) {
        return exits.get(direction);
    }

    public Map<Direction, String> getExits() {
        return exits;
    }

    /** Exits that stay on this floor (everything but up and down). */
    public List<String> getHorizontalExits() {
        List<String> out = new ArrayList<>();
        for (Map.Entry<Direction, String> e : exits.entrySet()) {
            if (!e.getKey().isVertical()) out.add(e.getValue());
        }
        return out;
    }

    // Players

    public void addPlayer(String playerName) { playerNames.add(playerName); }
    public void removePlayer(String playerName) { playerNames.remove(playerName); }
    public boolean hasPlayer(String playerName) { return playerNames.contains(playerName); }

    public Set<String> getPlayerNames() {
        return Collections.unmodifiableSet(playerNames);
    }

    // Mobiles

    /** @return false if the mobile was already here */
    public boolean addMobile(Mobile mobile) {
        return mobiles.addIfAbsent(mobile);
    }

    public boolean removeMobile(Mobile mobile) {
        return mobiles.remove(mobile);
    }

    public boolean hasMobile(Mobile mobile) {
        return mobiles.contains(mobile);
    }

    public List<Mobile> getMobiles() {
        return Collections.unmodifiableList(mobiles);
    }

    /**
     * Find a living mobile by name for a player. A mobile already fighting
     * that player wins over others with the same name.
     */
    public Mobile findMobileFor(String playerName, String mobileName) {
        if (mobileName == null || mobileName.isEmpty()) return null;
        Mobile first = null;
        for (Mobile m : mobiles) {
            if (!m.isAlive() || !m.getName().equalsIgnoreCase(mobileName)) continue;
            if (playerName != null && m.isEngagedWith(playerName)) return m;
            if (first == null) first = m;
        }
        return first;
    }

    public Mobile findMobile(String mobileName) {
        return findMobileFor(null, mobileName);
    }

    // Floor items

    public void addItem(String itemName) { items.add(itemName); }
    public boolean removeItem(String itemName) { return items.remove(itemName); }

    public List<String> getItems() {
        return Collections.unmodifiableList(items);
    }

    /**
     * Text a player sees on arrival.
     */
    public String describe(String viewer) {
        StringBuilder sb = new StringBuilder();
        sb.append(name).append("\n").append(description).append("\n");
        String exitList = exits.keySet().stream().map(Direction::getDisplayName).collect(Collectors.joining(" "));
        sb.append("[Exits: ").append(exitList.isEmpty() ? "none" : exitList).append("]\n");
        for (Mobile m : mobiles) {
            if (m.isAlive()) sb.append(m.getName()).append(" is here.\n");
        }
        for (String p : playerNames) {
            if (!p.equals(viewer)) sb.append(p).append(" is here.\n");
        }
        if (!items.isEmpty()) {
            sb.append("On the ground: ").append(String.join(", ", items)).append("\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Room{id=" + id + ", floor=" + floor + "}";
    }
}
