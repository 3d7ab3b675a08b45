package com.example.towermud.util;

import com.example.towermud.model.GameCharacter;
import com.example.towermud.model.Mobile;
import com.example.towermud.model.MobileState;
import com.example.towermud.model.Player;
import com.example.towermud.world.SessionRegistry;
import com.example.towermud.world.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handles natural regeneration for all characters (players and mobiles).
 *
 * Every 10 seconds, characters out of combat regain 1% of max HP/MP (at
 * least one point). A fleeing mobile that has recovered past its flee
 * threshold stops fleeing and goes back to idle.
 */
public class RegenerationService {
    private static final Logger logger = LoggerFactory.getLogger(RegenerationService.class);

    public static final long DEFAULT_INTERVAL_MS = 10_000;
    public static final int REGEN_PERCENT = 1;

    private final World world;
    private final SessionRegistry sessions;
    private final long intervalMs;

    private final TickService tickService = new TickService("regen");
    private final AtomicBoolean running = new AtomicBoolean(false);

    public RegenerationService(World world, SessionRegistry sessions, long intervalMs) {
        this.world = world;
        this.sessions = sessions;
        this.intervalMs = intervalMs;
    }

    public RegenerationService(World world, SessionRegistry sessions) {
        this(world, sessions, DEFAULT_INTERVAL_MS);
    }

    public void start() {
        if (!running.compareAndSet(false, true)) return;
        tickService.scheduleAtFixedRate("regeneration", this::tick, intervalMs, intervalMs);
        logger.info("[RegenerationService] Initialized with {}ms interval", intervalMs);
    }

    public void shutdown() {
        if (!running.compareAndSet(true, false)) return;
        tickService.shutdown();
        logger.info("[RegenerationService] Stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    private void tick() {
        if (!running.get()) return;
        try {
            regeneratePlayers();
            regenerateMobiles();
        } catch (RuntimeException e) {
            logger.warn("[RegenerationService] Error during regen tick: {}", e.getMessage(), e);
        }
    }

    static int regenAmount(int max) {
        return Math.max(1, (max * REGEN_PERCENT) / 100);
    }

    private static void regenerate(GameCharacter c) {
        c.heal(regenAmount(c.getHpMax()));
        if (c.getMpMax() > 0) {
            c.restoreMana(regenAmount(c.getMpMax()));
        }
    }

    /**
     * Regenerate all online players who are not in combat.
     * @return number of players that regained something
     */
    public int regeneratePlayers() {
        int count = 0;
        for (Player p : sessions.snapshot()) {
            try {
                if (p.isInCombat() || !p.isAlive() || !p.needsRegen()) continue;
                regenerate(p);
                count++;
            } catch (RuntimeException e) {
                logger.warn("[RegenerationService] Error regenerating player {}: {}", p.getName(), e.getMessage(), e);
            }
        }
        return count;
    }

    /**
     * Regenerate all mobiles who are not in combat and not dead.
     * @return number of mobiles that regained something
     */
    public int regenerateMobiles() {
        int count = 0;
        for (Mobile mobile : world.getMobiles()) {
            try {
                MobileState state = mobile.getState();
                if (state == MobileState.DEAD || state == MobileState.IN_COMBAT) continue;
                if (mobile.needsRegen()) {
                    regenerate(mobile);
                    count++;
                }
                if (state == MobileState.FLEEING && !mobile.isBelowFleeThreshold() && mobile.calmDown()) {
                    logger.debug("[RegenerationService] {} has calmed down in {}", mobile.getName(), mobile.getCurrentRoom());
                }
            } catch (RuntimeException e) {
                logger.warn("[RegenerationService] Error regenerating mobile {}: {}", mobile.getInstanceId(), e.getMessage(), e);
            }
        }
        return count;
    }
}
