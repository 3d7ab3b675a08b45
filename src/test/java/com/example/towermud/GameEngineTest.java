package com.example.towermud;

import com.example.towermud.model.CharacterClass;
import com.example.towermud.model.Mobile;
import com.example.towermud.model.MobileState;
import com.example.towermud.model.Player;
import com.example.towermud.util.Dice;
import com.example.towermud.world.Room;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GameEngine Tests")
public class GameEngineTest {

    private GameEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        Properties props = new Properties();
        props.setProperty("towermud.db.url", "jdbc:h2:mem:engine-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        props.setProperty("towermud.population.enabled", "false");
        GameConfig config = new GameConfig().applyOverrides(props);
        engine = new GameEngine(config, new Dice(new ScriptedRandom()));
        engine.init();
    }

    @AfterEach
    void tearDown() {
        engine.stop();
    }

    @Test
    @DisplayName("Init loads the world, items and boss tracking without spawning")
    void initLoadsEverything() {
        assertEquals(7, engine.getWorld().getRoomCount());
        assertEquals(0, engine.getWorld().getMobileCount());
        assertNotNull(engine.getDeathHandler().getItemCatalog());
        assertNotNull(engine.getDeathHandler().getBossTracker());
        assertFalse(engine.getDeathHandler().getBossTracker().isFullyUnlocked());
        assertFalse(engine.isStarted());
    }

    @Test
    @DisplayName("Start populates the world and runs the services once")
    void startAndStop() {
        engine.start();
        engine.start();

        assertTrue(engine.isStarted());
        assertEquals(6, engine.getWorld().getMobileCount());
        assertTrue(engine.getCombatManager().isRunning());
        assertTrue(engine.getRespawnManager().isRunning());
        assertTrue(engine.getRegenerationService().isRunning());
        assertFalse(engine.getDynamicSpawnManager().isRunning());

        engine.stop();

        assertFalse(engine.isStarted());
        assertFalse(engine.getCombatManager().isRunning());
        assertFalse(engine.getRespawnManager().isRunning());
        assertFalse(engine.getRegenerationService().isRunning());
    }

    @Test
    @DisplayName("Connecting shows the room and announces the arrival")
    void connect() {
        engine.start();
        Player alice = TowerFixtures.player("Alice", CharacterClass.WARRIOR, "city_square");
        Player bob = TowerFixtures.player("Bob", CharacterClass.MAGE, "city_square");

        assertTrue(engine.connect(alice));
        String seen = TowerFixtures.output(alice);
        assertTrue(seen.contains("City Square"));
        assertTrue(seen.contains("a city guard is here."));

        assertTrue(engine.connect(bob));
        assertTrue(TowerFixtures.output(alice).contains("Bob has arrived."));
        assertTrue(TowerFixtures.output(bob).contains("Alice is here."));

        assertFalse(engine.connect(TowerFixtures.player("alice", CharacterClass.ROGUE, "city_square")));
        assertEquals(2, engine.getSessions().getOnlineCount());
    }

    @Test
    @DisplayName("Players in unknown rooms are placed at the start")
    void unknownRoomFallsBack() {
        Player alice = TowerFixtures.player("Alice", CharacterClass.WARRIOR, "collapsed_room");

        assertTrue(engine.connect(alice));
        assertEquals("city_square", alice.getCurrentRoom());
    }

    @Test
    @DisplayName("Disconnecting drops the player from every fight in the room")
    void disconnectEndsCombat() {
        engine.start();
        Player alice = TowerFixtures.player("Alice", CharacterClass.WARRIOR, "ash_1_hall");
        engine.connect(alice);
        Room hall = engine.getWorld().getRoom("ash_1_hall");
        Mobile goblin = hall.getMobiles().get(0);
        goblin.engage("Alice");
        alice.startCombat(goblin.getName());

        assertSame(alice, engine.disconnect("alice"));

        assertFalse(goblin.isEngagedWith("Alice"));
        assertEquals(MobileState.IDLE, goblin.getState());
        assertFalse(alice.isInCombat());
        assertFalse(hall.hasPlayer("Alice"));
        assertFalse(engine.getSessions().isOnline("Alice"));
        assertNull(engine.disconnect("Alice"));
    }
}
