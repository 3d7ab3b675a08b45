package com.example.towermud;

import com.example.towermud.model.AreaDefinition;
import com.example.towermud.model.CharacterClass;
import com.example.towermud.model.Player;
import com.example.towermud.world.Direction;
import com.example.towermud.world.QueuedMessageSink;
import com.example.towermud.world.Room;
import com.example.towermud.world.World;

import java.util.EnumMap;
import java.util.Map;

/**
 * A small tower used across tests.
 *
 * <pre>
 *   floor 2:  f2_throne
 *                 | up/down
 *   floor 1:  f1_hall --east-- f1_den        f1_stair (only an up exit)
 *                 | up/down
 *   floor 0:  city_square
 * </pre>
 */
final class TowerFixtures {

    static final String START = "city_square";
    static final String HALL = "f1_hall";
    static final String DEN = "f1_den";
    static final String STAIR = "f1_stair";
    static final String THRONE = "f2_throne";
    static final String AREA = "spire";

    private TowerFixtures() {}

    static World tower() {
        World world = new World(START);
        world.addRoom(room(START, 0, null, Direction.UP, HALL));
        world.addRoom(room(HALL, 1, AREA, Direction.DOWN, START, Direction.EAST, DEN, Direction.UP, THRONE));
        world.addRoom(room(DEN, 1, AREA, Direction.WEST, HALL));
        world.addRoom(room(STAIR, 1, AREA, Direction.UP, THRONE));
        world.addRoom(room(THRONE, 2, AREA, Direction.DOWN, HALL));
        world.addArea(new AreaDefinition(AREA, "The Spire", 2, "Spirebreaker", "Spirewalker", true));
        return world;
    }

    private static Room room(String id, int floor, String area, Object... exitPairs) {
        Map<Direction, String> exits = new EnumMap<>(Direction.class);
        for (int i = 0; i < exitPairs.length; i += 2) {
            exits.put((Direction) exitPairs[i], (String) exitPairs[i + 1]);
        }
        return new Room(id, id, "", floor, area, exits);
    }

    /** Level-1 player with average stats, 50 HP, no armor and a queued sink. */
    static Player player(String name, CharacterClass cls, String roomId) {
        Player p = new Player(name, cls, 1, 50, 10, roomId, 10, 10, 10, 10, 10, 10, 0);
        p.setSink(new QueuedMessageSink(name));
        return p;
    }

    static String output(Player p) {
        return ((QueuedMessageSink) p.getSink()).drainText();
    }
}
