package com.example.towermud;

import com.example.towermud.model.CharacterClass;
import com.example.towermud.model.Mobile;
import com.example.towermud.model.MobileState;
import com.example.towermud.model.Player;
import com.example.towermud.util.RegenerationService;
import com.example.towermud.world.SessionRegistry;
import com.example.towermud.world.World;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RegenerationService Tests")
public class RegenerationServiceTest {

    private World world;
    private SessionRegistry sessions;
    private RegenerationService regen;

    @BeforeEach
    void setUp() {
        world = TowerFixtures.tower();
        sessions = new SessionRegistry();
        regen = new RegenerationService(world, sessions);
    }

    private Player login(Player p) {
        sessions.register(p);
        world.enterWorld(p);
        return p;
    }

    @Test
    @DisplayName("Players regain one percent of health and mana")
    void playersRegainOnePercent() {
        Player p = login(new Player("Alice", CharacterClass.CLERIC, 10, 300, 200, TowerFixtures.START,
            10, 10, 10, 10, 10, 10, 0));
        p.setHpCur(100);
        p.setMpCur(0);

        assertEquals(1, regen.regeneratePlayers());

        assertEquals(103, p.getHpCur());
        assertEquals(2, p.getMpCur());
    }

    @Test
    @DisplayName("Small pools still regain at least one point")
    void minimumOnePoint() {
        Player p = login(TowerFixtures.player("Alice", CharacterClass.WARRIOR, TowerFixtures.START));
        p.setHpCur(10);

        regen.regeneratePlayers();

        assertEquals(11, p.getHpCur());
    }

    @Test
    @DisplayName("Fighting, dead and healthy players are skipped")
    void skippedPlayers() {
        Player fighting = login(TowerFixtures.player("Alice", CharacterClass.WARRIOR, TowerFixtures.START));
        fighting.setHpCur(10);
        fighting.startCombat("rat");
        Player dead = login(TowerFixtures.player("Bob", CharacterClass.WARRIOR, TowerFixtures.START));
        dead.setHpCur(0);
        login(TowerFixtures.player("Carol", CharacterClass.WARRIOR, TowerFixtures.START));

        assertEquals(0, regen.regeneratePlayers());
        assertEquals(10, fighting.getHpCur());
        assertEquals(0, dead.getHpCur());
    }

    @Test
    @DisplayName("Idle mobiles heal; fighting and dead ones do not")
    void mobileRegen() {
        Mobile idle = world.createMobile(MobFixtures.mob("rat").hp(20).build(), TowerFixtures.DEN);
        idle.setHpCur(10);
        Mobile fighting = world.createMobile(MobFixtures.mob("wolf").hp(20).build(), TowerFixtures.DEN);
        fighting.setHpCur(10);
        fighting.engage("Alice");
        Mobile dead = world.createMobile(MobFixtures.mob("bat").hp(20).build(), TowerFixtures.DEN);
        dead.setHpCur(0);
        dead.markDead();

        assertEquals(1, regen.regenerateMobiles());

        assertEquals(11, idle.getHpCur());
        assertEquals(10, fighting.getHpCur());
        assertEquals(0, dead.getHpCur());
    }

    @Test
    @DisplayName("A fleeing mobile calms down once it recovers past its flee threshold")
    void fleeingMobileCalmsDown() {
        Mobile recovered = world.createMobile(MobFixtures.mob("rat").hp(20).flee(0.25).build(), TowerFixtures.DEN);
        recovered.setHpCur(5);
        recovered.startFleeing();
        Mobile hurt = world.createMobile(MobFixtures.mob("rat").hp(20).flee(0.25).build(), TowerFixtures.HALL);
        hurt.setHpCur(3);
        hurt.startFleeing();

        regen.regenerateMobiles();

        assertEquals(6, recovered.getHpCur());
        assertEquals(MobileState.IDLE, recovered.getState());
        assertEquals(4, hurt.getHpCur());
        assertEquals(MobileState.FLEEING, hurt.getState());
    }

    @Test
    @DisplayName("Start and shutdown toggle the running flag")
    void lifecycle() {
        regen.start();
        assertTrue(regen.isRunning());
        regen.shutdown();
        assertFalse(regen.isRunning());
    }
}
