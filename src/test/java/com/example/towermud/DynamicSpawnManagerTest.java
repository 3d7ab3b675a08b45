package com.example.towermud;

import com.example.towermud.event.DynamicSpawnManager;
import com.example.towermud.event.MobSpawner;
import com.example.towermud.model.CharacterClass;
import com.example.towermud.model.Player;
import com.example.towermud.world.Room;
import com.example.towermud.world.SessionRegistry;
import com.example.towermud.world.World;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DynamicSpawnManager Tests")
public class DynamicSpawnManagerTest {

    private World world;
    private SessionRegistry sessions;
    private final List<int[]> requests = new ArrayList<>();
    private final MobSpawner recorder = (floor, count) -> {
        requests.add(new int[] {floor, count});
        return count;
    };

    @BeforeEach
    void setUp() {
        world = TowerFixtures.tower();
        sessions = new SessionRegistry();
        requests.clear();
    }

    private void login(String name) {
        Player p = TowerFixtures.player(name, CharacterClass.WARRIOR, TowerFixtures.START);
        sessions.register(p);
        world.enterWorld(p);
    }

    @Test
    @DisplayName("Target population never drops below the baseline")
    void targetFloorsAtBaseline() {
        assertEquals(15, DynamicSpawnManager.targetPopulation(1, 2, 5.0, 15.0));
        assertEquals(15, DynamicSpawnManager.targetPopulation(6, 2, 5.0, 15.0));
    }

    @Test
    @DisplayName("Target population scales with players per floor")
    void targetScalesWithLoad() {
        // 12 players over 2 floors: 6 per floor * 5 = 30 desired
        assertEquals(30, DynamicSpawnManager.targetPopulation(12, 2, 5.0, 15.0));
        assertEquals(22, DynamicSpawnManager.targetPopulation(9, 2, 5.0, 15.0));
    }

    @Test
    @DisplayName("Target population is capped at ten times the baseline")
    void targetIsCapped() {
        assertEquals(150, DynamicSpawnManager.targetPopulation(1000, 1, 5.0, 15.0));
    }

    @Test
    @DisplayName("No players online means no spawn requests")
    void noPlayersNoSpawns() {
        DynamicSpawnManager population = new DynamicSpawnManager(world, sessions, recorder);

        assertEquals(0, population.sweep());
        assertTrue(requests.isEmpty());
    }

    @Test
    @DisplayName("No generated floors means no spawn requests")
    void noFloorsNoSpawns() {
        World cityOnly = new World("square");
        cityOnly.addRoom(new Room("square", "Square", "", 0, null, Map.of()));
        login("Alice");
        DynamicSpawnManager population = new DynamicSpawnManager(cityOnly, sessions, recorder);

        assertEquals(0, population.sweep());
        assertTrue(requests.isEmpty());
    }

    @Test
    @DisplayName("Empty floors are topped up at most five at a time")
    void spawnsCappedPerFloor() {
        login("Alice");
        DynamicSpawnManager population = new DynamicSpawnManager(world, sessions, recorder);

        assertEquals(10, population.sweep());

        assertEquals(2, requests.size());
        assertArrayEquals(new int[] {1, 5}, requests.get(0));
        assertArrayEquals(new int[] {2, 5}, requests.get(1));
    }

    @Test
    @DisplayName("Floors already at target are left alone")
    void fullFloorsSkipped() {
        login("Alice");
        world.createMobile(MobFixtures.mob("rat").build(), TowerFixtures.DEN);
        // 1 player over 2 floors at 0.1 per player: baseline of 1 wins
        DynamicSpawnManager population = new DynamicSpawnManager(world, sessions, recorder, true,
            DynamicSpawnManager.DEFAULT_INTERVAL_MS, 0.1, 1.0, 5);

        assertEquals(1, population.sweep());

        assertEquals(1, requests.size());
        assertArrayEquals(new int[] {2, 1}, requests.get(0));
    }

    @Test
    @DisplayName("Dead mobiles do not count toward a floor's population")
    void deadMobilesNotCounted() {
        login("Alice");
        world.createMobile(MobFixtures.mob("rat").build(), TowerFixtures.DEN).markDead();
        DynamicSpawnManager population = new DynamicSpawnManager(world, sessions, recorder, true,
            DynamicSpawnManager.DEFAULT_INTERVAL_MS, 0.1, 1.0, 5);

        assertEquals(2, population.sweep());
    }

    @Test
    @DisplayName("A disabled controller requests nothing and does not start")
    void disabledDoesNothing() {
        login("Alice");
        DynamicSpawnManager population = new DynamicSpawnManager(world, sessions, recorder, false,
            DynamicSpawnManager.DEFAULT_INTERVAL_MS, 5.0, 15.0, 5);

        population.start();
        assertFalse(population.isRunning());
        assertEquals(0, population.sweep());
        assertTrue(requests.isEmpty());
    }

    @Test
    @DisplayName("A zero interval keeps the controller off even when asked to run")
    void zeroIntervalNeverStarts() {
        login("Alice");
        DynamicSpawnManager population = new DynamicSpawnManager(world, sessions, recorder, true,
            0, 5.0, 15.0, 5);
        population.setEnabled(true);

        assertFalse(population.isEnabled());
        population.start();
        assertFalse(population.isRunning());
    }
}
