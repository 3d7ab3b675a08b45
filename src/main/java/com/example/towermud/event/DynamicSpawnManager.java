package com.example.towermud.event;

import com.example.towermud.util.TickService;
import com.example.towermud.world.SessionRegistry;
import com.example.towermud.world.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scales tower population with the number of players online.
 *
 * Every interval the desired population per floor is recomputed from the
 * players-per-floor ratio, and floors below it get topped up (a few at a
 * time) through the {@link MobSpawner}. Nothing happens while the server
 * is empty.
 */
public class DynamicSpawnManager {
    private static final Logger logger = LoggerFactory.getLogger(DynamicSpawnManager.class);

    public static final long DEFAULT_INTERVAL_MS = 30_000;
    public static final double DEFAULT_MOBS_PER_PLAYER = 5.0;
    public static final double DEFAULT_BASE_MOBS_PER_FLOOR = 15.0;
    public static final int DEFAULT_MAX_SPAWNS_PER_FLOOR = 5;

    /** Population never grows past this multiple of the base */
    public static final double MAX_MULTIPLIER = 10.0;

    private final World world;
    private final SessionRegistry sessions;
    private final MobSpawner spawner;

    private final long intervalMs;
    private final double mobsPerPlayer;
    private final double baseMobsPerFloor;
    private final int maxSpawnsPerFloor;
    private volatile boolean enabled;

    private final TickService tickService = new TickService("population");
    private final AtomicBoolean running = new AtomicBoolean(false);

    public DynamicSpawnManager(World world, SessionRegistry sessions, MobSpawner spawner, boolean enabled,
                               long intervalMs, double mobsPerPlayer, double baseMobsPerFloor, int maxSpawnsPerFloor) {
        this.world = world;
        this.sessions = sessions;
        this.spawner = spawner;
        // A non-positive interval cannot be scheduled, so it means off
        this.enabled = enabled && intervalMs > 0;
        this.intervalMs = intervalMs;
        this.mobsPerPlayer = mobsPerPlayer;
        this.baseMobsPerFloor = baseMobsPerFloor;
        this.maxSpawnsPerFloor = maxSpawnsPerFloor;
    }

    public DynamicSpawnManager(World world, SessionRegistry sessions, MobSpawner spawner) {
        this(world, sessions, spawner, true, DEFAULT_INTERVAL_MS, DEFAULT_MOBS_PER_PLAYER,
            DEFAULT_BASE_MOBS_PER_FLOOR, DEFAULT_MAX_SPAWNS_PER_FLOOR);
    }

    public void start() {
        if (!enabled) {
            logger.info("[DynamicSpawnManager] Disabled, not starting");
            return;
        }
        if (!running.compareAndSet(false, true)) return;
        tickService.scheduleAtFixedRate("population-sweep", this::tick, intervalMs, intervalMs);
        logger.info("[DynamicSpawnManager] Initialized: every {}ms, {} mobs/player, base {}/floor",
            intervalMs, mobsPerPlayer, baseMobsPerFloor);
    }

    public void shutdown() {
        if (!running.compareAndSet(true, false)) return;
        tickService.shutdown();
        logger.info("[DynamicSpawnManager] Stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled && intervalMs > 0;
    }

    private void tick() {
        if (!running.get()) return;
        try {
            sweep();
        } catch (RuntimeException e) {
            logger.warn("[DynamicSpawnManager] Error during population sweep: {}", e.getMessage(), e);
        }
    }

    /**
     * Target live mobiles per floor for a given load.
     */
    public static int targetPopulation(int onlinePlayers, int floorCount, double mobsPerPlayer, double baseMobsPerFloor) {
        if (onlinePlayers <= 0 || floorCount <= 0 || baseMobsPerFloor <= 0) {
            return (int) Math.max(0, baseMobsPerFloor);
        }
        double playersPerFloor = (double) onlinePlayers / floorCount;
        double desired = playersPerFloor * mobsPerPlayer;
        double multiplier = desired / baseMobsPerFloor;
        multiplier = Math.max(1.0, Math.min(MAX_MULTIPLIER, multiplier));
        return (int) (baseMobsPerFloor * multiplier);
    }

    /**
     * One population pass over every generated floor.
     * @return number of spawns requested
     */
    public int sweep() {
        if (!enabled) return 0;
        int online = sessions.getOnlineCount();
        if (online == 0) return 0;
        Set<Integer> floors = world.getGeneratedFloors();
        if (floors.isEmpty()) return 0;

        int target = targetPopulation(online, floors.size(), mobsPerPlayer, baseMobsPerFloor);
        int requested = 0;
        for (int floor : floors) {
            int live = world.countLiveMobilesOnFloor(floor);
            if (live >= target) continue;
            int toSpawn = Math.min(target - live, maxSpawnsPerFloor);
            requested += toSpawn;
            int created = spawner.spawnOnFloor(floor, toSpawn);
            logger.debug("[DynamicSpawnManager] Floor {}: {} live, target {}, spawned {}/{}",
                floor, live, target, created, toSpawn);
        }
        if (requested > 0) {
            logger.info("[DynamicSpawnManager] {} players online, target {}/floor, requested {} spawns",
                online, target, requested);
        }
        return requested;
    }
}
