package com.example.towermud;

import com.example.towermud.event.SpawnConfig;
import com.example.towermud.event.SpawnManager;
import com.example.towermud.model.AreaDefinition;
import com.example.towermud.model.LootEntry;
import com.example.towermud.model.MobType;
import com.example.towermud.model.MobileBehavior;
import com.example.towermud.model.MobileTemplate;
import com.example.towermud.persistence.WorldLoader;
import com.example.towermud.util.Dice;
import com.example.towermud.world.Direction;
import com.example.towermud.world.Room;
import com.example.towermud.world.World;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WorldLoader Tests")
public class WorldLoaderTest {

    private World world;
    private SpawnManager spawns;
    private WorldLoader loader;

    @BeforeEach
    void setUp() {
        world = new World("city_square");
        spawns = new SpawnManager(world, new Dice(new ScriptedRandom()));
        loader = new WorldLoader(world, spawns);
    }

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("The bundled world data loads and populates")
    void bundledWorld() throws IOException {
        loader.loadDefaults();

        assertEquals(7, world.getRoomCount());
        assertNotNull(world.getStartingRoom());
        assertEquals(Set.of(1, 2), world.getGeneratedFloors());
        AreaDefinition spire = world.getArea("ashen_spire");
        assertNotNull(spire);
        assertEquals(2, spire.getFinalFloor());
        assertEquals(5, spawns.getTemplateCount());
        assertEquals(5, spawns.getSpawns().size());
        assertEquals(List.of("cave_rat", "goblin_scout"), spawns.candidatesForFloor(1));

        assertEquals(6, spawns.triggerInitialSpawns());
        assertEquals(3, world.countLiveMobilesOnFloor(1));
        assertEquals(2, world.countLiveMobilesOnFloor(2));
    }

    @Test
    @DisplayName("The bundled boss is unique, fearless and drops its crown")
    void bundledBoss() throws IOException {
        loader.loadDefaults();
        MobileTemplate lord = spawns.getTemplate("cinder_lord");

        assertTrue(lord.isBoss());
        assertTrue(lord.isUnique());
        assertTrue(lord.isAggressive());
        assertEquals(MobType.DEMON, lord.getMobType());
        assertEquals(0.0, lord.getFleeThreshold(), 1e-9);
        assertEquals(List.of(new LootEntry("ash_crown", 100.0)), lord.getLootTable());
        assertEquals(1800, lord.getRespawnMedian());
    }

    @Test
    @DisplayName("Rooms keep their exits; bad exits and rooms without ids are skipped")
    void loadRooms() {
        int count = loader.loadRooms(yaml(
            "rooms:\n" +
            "  - id: a\n" +
            "    name: Room A\n" +
            "    floor: 3\n" +
            "    area: depths\n" +
            "    exits:\n" +
            "      north: b\n" +
            "      sideways: b\n" +
            "      u: c\n" +
            "  - id: b\n" +
            "    exits: {south: a}\n" +
            "  - name: No Id\n"));

        assertEquals(2, count);
        Room a = world.getRoom("a");
        assertEquals("Room A", a.getName());
        assertEquals(3, a.getFloor());
        assertEquals("depths", a.getAreaId());
        assertEquals("b", a.getExit(Direction.NORTH));
        assertEquals("c", a.getExit(Direction.UP));
        assertEquals(2, a.getExits().size());
        assertEquals(List.of("b"), a.getHorizontalExits());
        assertEquals("b", world.getRoom("b").getName());
        assertEquals(0, world.getRoom("b").getFloor());
    }

    @Test
    @DisplayName("Areas without titles get generated ones")
    void loadAreasDefaults() {
        assertEquals(1, loader.loadAreas(yaml("areas:\n  - id: depths\n    name: The Depths\n    final_floor: 5\n  - name: nameless\n")));

        AreaDefinition depths = world.getArea("depths");
        assertEquals("Conqueror of The Depths", depths.getFirstClearTitle());
        assertEquals("Champion of The Depths", depths.getSharedTitle());
        assertTrue(depths.countsTowardUnlock());
    }

    @Test
    @DisplayName("Mobile templates parse behaviors, loot and defaults")
    void loadMobiles() {
        int count = loader.loadMobiles(yaml(
            "mobs:\n" +
            "  - key: wolf\n" +
            "    name: a grey wolf\n" +
            "    hp: 25\n" +
            "    type: beast\n" +
            "    aggressive: true\n" +
            "    loot:\n" +
            "      - item: pelt\n" +
            "      - chance: 50\n" +
            "  - key: golem\n" +
            "    behaviors: fearless\n" +
            "    flee_threshold: 0.4\n" +
            "  - name: keyless\n"));

        assertEquals(2, count);
        MobileTemplate wolf = spawns.getTemplate("wolf");
        assertEquals("a grey wolf", wolf.getName());
        assertEquals(25, wolf.getHpMax());
        assertEquals(MobType.BEAST, wolf.getMobType());
        assertTrue(wolf.isAggressive());
        assertEquals(0.15, wolf.getFleeThreshold(), 1e-9);
        assertEquals(List.of(new LootEntry("pelt", 100.0)), wolf.getLootTable());
        assertEquals(0, wolf.getRespawnMedian());

        MobileTemplate golem = spawns.getTemplate("golem");
        assertEquals("golem", golem.getName());
        assertTrue(golem.hasBehavior(MobileBehavior.FEARLESS));
        assertEquals(0.0, golem.getFleeThreshold(), 1e-9);
    }

    @Test
    @DisplayName("Spawn points and floor pools load; duplicates and incomplete entries are skipped")
    void loadSpawns() {
        int count = loader.loadSpawns(yaml(
            "spawns:\n" +
            "  - mob: wolf\n" +
            "    room: a\n" +
            "    quantity: 3\n" +
            "  - mob: wolf\n" +
            "    room: a\n" +
            "  - mob: bear\n" +
            "floor_pools:\n" +
            "  4: [wolf, bear]\n" +
            "  \"5\": [golem]\n" +
            "  top: [nothing]\n"));

        assertEquals(1, count);
        SpawnConfig wolves = spawns.getSpawns().get(0);
        assertEquals("wolf", wolves.templateKey);
        assertEquals(3, wolves.quantity);
        assertEquals(List.of("wolf", "bear"), spawns.candidatesForFloor(4));
        assertEquals(List.of("golem"), spawns.candidatesForFloor(5));
    }
}
