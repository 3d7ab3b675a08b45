package com.example.towermud;

import com.example.towermud.event.RespawnEntry;
import com.example.towermud.event.RespawnManager;
import com.example.towermud.model.CharacterClass;
import com.example.towermud.model.Mobile;
import com.example.towermud.model.MobileState;
import com.example.towermud.model.Player;
import com.example.towermud.util.Dice;
import com.example.towermud.world.SessionRegistry;
import com.example.towermud.world.World;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RespawnManager Tests")
public class RespawnManagerTest {

    private static final long NOW = 10_000L;

    private ScriptedRandom rng;
    private World world;
    private SessionRegistry sessions;
    private RespawnManager respawn;

    @BeforeEach
    void setUp() {
        rng = new ScriptedRandom();
        world = TowerFixtures.tower();
        sessions = new SessionRegistry();
        respawn = new RespawnManager(world, sessions, new Dice(rng), RespawnManager.DEFAULT_SWEEP_MS);
    }

    private Mobile dieIn(Mobile mob, String roomId) {
        world.moveMobile(mob, roomId);
        mob.engage("Alice");
        mob.addThreat("Alice", 7);
        mob.setHpCur(0);
        mob.markDead();
        world.removeMobileFromRoom(mob);
        return mob;
    }

    @Test
    @DisplayName("Mobiles respawn in their origin room, not where they died")
    void respawnsAtOrigin() {
        Player p = TowerFixtures.player("Alice", CharacterClass.WARRIOR, TowerFixtures.DEN);
        sessions.register(p);
        world.enterWorld(p);
        Mobile rat = world.createMobile(MobFixtures.mob("rat").respawn(10, 0).build(), TowerFixtures.DEN);
        dieIn(rat, TowerFixtures.HALL);

        respawn.enqueue(rat, NOW);
        assertEquals(0, respawn.sweep(NOW + 9_999));
        assertEquals(1, respawn.sweep(NOW + 10_000));

        assertEquals(TowerFixtures.DEN, rat.getCurrentRoom());
        assertTrue(world.getRoom(TowerFixtures.DEN).hasMobile(rat));
        assertFalse(world.getRoom(TowerFixtures.HALL).hasMobile(rat));
        assertEquals(MobileState.IDLE, rat.getState());
        assertEquals(rat.getHpMax(), rat.getHpCur());
        assertTrue(rat.getAttackers().isEmpty());
        assertEquals(0, respawn.getQueueSize());
        assertTrue(TowerFixtures.output(p).contains("rat appears in the area."));
    }

    @Test
    @DisplayName("Respawn keeps the mobile's arena identity")
    void respawnKeepsIdentity() {
        Mobile rat = world.createMobile(MobFixtures.mob("rat").respawn(1, 0).build(), TowerFixtures.DEN);
        int id = rat.getInstanceId();
        dieIn(rat, TowerFixtures.DEN);

        respawn.enqueue(rat, NOW);
        respawn.sweep(NOW + 1_000);

        assertSame(rat, world.getMobile(id));
        assertEquals(1, world.getMobileCount());
        assertTrue(rat.isSneakAttackEligible("Alice"));
    }

    @Test
    @DisplayName("A median of zero means the mobile is never queued")
    void zeroMedianNeverQueued() {
        Mobile lord = world.createMobile(MobFixtures.mob("lord").respawn(0, 30).build(), TowerFixtures.THRONE);
        dieIn(lord, TowerFixtures.THRONE);

        assertNull(respawn.enqueue(lord, NOW));
        assertEquals(0, respawn.getQueueSize());
    }

    @Test
    @DisplayName("Sweeping an empty queue does nothing")
    void emptySweep() {
        assertEquals(0, respawn.sweep(NOW));
        assertEquals(0, respawn.getQueueSize());
    }

    @Test
    @DisplayName("Deadline jitter spans median minus to median plus variation")
    void deadlineJitter() {
        Mobile a = world.createMobile(MobFixtures.mob("rat").respawn(60, 10).build(), TowerFixtures.DEN);
        Mobile b = world.createMobile(MobFixtures.mob("rat").respawn(60, 10).build(), TowerFixtures.DEN);

        // between(-10, 10): raw 0 is -10, raw 20 is +10
        rng.scriptInts(0, 20);
        RespawnEntry early = respawn.enqueue(a, NOW);
        RespawnEntry late = respawn.enqueue(b, NOW);

        assertEquals(NOW + 50_000, early.getDeadline());
        assertEquals(NOW + 70_000, late.getDeadline());
        List<RespawnEntry> entries = respawn.getEntries();
        assertSame(early, entries.get(0));
        assertSame(late, entries.get(1));
    }

    @Test
    @DisplayName("Respawn delay is never less than one second")
    void delayAtLeastOneSecond() {
        rng.scriptInts(0);
        assertEquals(1, respawn.rollRespawnDelaySeconds(2, 5));
        assertEquals(45, respawn.rollRespawnDelaySeconds(45, 0));
    }

    @Test
    @DisplayName("Only entries whose deadline has passed are respawned")
    void onlyDueEntriesRespawn() {
        Mobile quick = world.createMobile(MobFixtures.mob("rat").respawn(5, 0).build(), TowerFixtures.DEN);
        Mobile slow = world.createMobile(MobFixtures.mob("ogre").respawn(50, 0).build(), TowerFixtures.HALL);
        dieIn(quick, TowerFixtures.DEN);
        dieIn(slow, TowerFixtures.HALL);
        respawn.enqueue(slow, NOW);
        respawn.enqueue(quick, NOW);

        assertEquals(1, respawn.sweep(NOW + 5_000));
        assertEquals(MobileState.IDLE, quick.getState());
        assertEquals(MobileState.DEAD, slow.getState());
        assertTrue(respawn.isQueued(slow));
        assertFalse(respawn.isQueued(quick));
    }

    @Test
    @DisplayName("An entry whose origin room no longer exists is dropped")
    void missingOriginRoomDropsEntry() {
        Mobile ghost = new Mobile(99, MobFixtures.mob("ghost").respawn(1, 0).build(), "nowhere", 1, null);
        ghost.markDead();

        respawn.enqueue(ghost, NOW);
        assertEquals(0, respawn.sweep(NOW + 1_000));
        assertEquals(0, respawn.getQueueSize());
        assertEquals(MobileState.DEAD, ghost.getState());
    }

    @Test
    @DisplayName("Start and shutdown toggle the running flag")
    void lifecycle() {
        assertFalse(respawn.isRunning());
        respawn.start();
        assertTrue(respawn.isRunning());
        respawn.shutdown();
        assertFalse(respawn.isRunning());
    }
}
