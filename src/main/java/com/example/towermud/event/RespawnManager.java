package com.example.towermud.event;

import com.example.towermud.model.Mobile;
import com.example.towermud.util.Dice;
import com.example.towermud.util.TickService;
import com.example.towermud.world.Room;
import com.example.towermud.world.SessionRegistry;
import com.example.towermud.world.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Queue of dead mobiles and the periodic sweep that brings them back.
 *
 * A mobile respawns in its origin room, not where it died, after
 * median +/- variation seconds (at least one second). Mobiles with a
 * median of zero never respawn.
 */
public class RespawnManager {
    private static final Logger logger = LoggerFactory.getLogger(RespawnManager.class);

    public static final long DEFAULT_SWEEP_MS = 5000;

    private final World world;
    private final SessionRegistry sessions;
    private final Dice dice;
    private final long sweepMs;

    /** Ordered by deadline; guarded by its own monitor */
    private final PriorityQueue<RespawnEntry> queue = new PriorityQueue<>();

    private final TickService tickService = new TickService("respawn");
    private final AtomicBoolean running = new AtomicBoolean(false);

    public RespawnManager(World world, SessionRegistry sessions, Dice dice, long sweepMs) {
        this.world = world;
        this.sessions = sessions;
        this.dice = dice;
        this.sweepMs = sweepMs;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) return;
        tickService.scheduleAtFixedRate("respawn-sweep", this::tick, sweepMs, sweepMs);
        logger.info("[RespawnManager] Initialized with {}ms sweep", sweepMs);
    }

    public void shutdown() {
        if (!running.compareAndSet(true, false)) return;
        tickService.shutdown();
        logger.info("[RespawnManager] Stopped with {} mobiles still queued", getQueueSize());
    }

    public boolean isRunning() {
        return running.get();
    }

    private void tick() {
        if (!running.get()) return;
        try {
            sweep(System.currentTimeMillis());
        } catch (RuntimeException e) {
            logger.warn("[RespawnManager] Error during respawn sweep: {}", e.getMessage(), e);
        }
    }

    /**
     * Seconds until respawn: median plus a uniform jitter in
     * [-variation, +variation], never less than one.
     */
    public int rollRespawnDelaySeconds(int median, int variation) {
        int jitter = variation > 0 ? dice.between(-variation, variation) : 0;
        return Math.max(1, median + jitter);
    }

    /**
     * Queue a dead mobile for respawn.
     * @return the queued entry, or null when the mobile does not respawn
     */
    public RespawnEntry enqueue(Mobile mobile, long now) {
        int median = mobile.getRespawnMedian();
        if (median <= 0) {
            logger.debug("[RespawnManager] {} does not respawn", mobile.getName());
            return null;
        }
        int seconds = rollRespawnDelaySeconds(median, mobile.getRespawnVariation());
        RespawnEntry entry = new RespawnEntry(mobile, now + seconds * 1000L);
        synchronized (queue) {
            queue.add(entry);
        }
        logger.debug("[RespawnManager] Queued {} to respawn in {}s", mobile.getName(), seconds);
        return entry;
    }

    /**
     * Respawn every mobile whose deadline has passed. Due entries leave the
     * queue under the lock; rooms and messages are handled after it is released.
     * @return number of mobiles respawned
     */
    public int sweep(long now) {
        List<RespawnEntry> due = new ArrayList<>();
        synchronized (queue) {
            while (!queue.isEmpty() && queue.peek().isDue(now)) {
                due.add(queue.poll());
            }
        }
        int respawned = 0;
        for (RespawnEntry entry : due) {
            try {
                if (respawn(entry.getMobile())) respawned++;
            } catch (RuntimeException e) {
                logger.warn("[RespawnManager] Failed to respawn {}: {}", entry.getMobile(), e.getMessage(), e);
            }
        }
        return respawned;
    }

    private boolean respawn(Mobile mobile) {
        Room origin = world.getRoom(mobile.getOriginRoomId());
        if (origin == null) {
            logger.warn("[RespawnManager] Cannot respawn {} - room {} not found", mobile.getName(), mobile.getOriginRoomId());
            return false;
        }
        mobile.reset();
        world.placeMobile(mobile, origin.getId());
        logger.info("[RespawnManager] {} respawned in {}", mobile.getName(), origin.getId());
        sessions.broadcastToRoom(origin, mobile.getName() + " appears in the area.\n");
        return true;
    }

    public int getQueueSize() {
        synchronized (queue) {
            return queue.size();
        }
    }

    public boolean isQueued(Mobile mobile) {
        synchronized (queue) {
            for (RespawnEntry e : queue) {
                if (e.getMobile() == mobile) return true;
            }
            return false;
        }
    }

    /** Queued entries, soonest first. */
    public List<RespawnEntry> getEntries() {
        List<RespawnEntry> out;
        synchronized (queue) {
            out = new ArrayList<>(queue);
        }
        out.sort(null);
        return out;
    }
}
