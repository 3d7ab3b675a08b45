package com.example.towermud.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Simple scheduler for periodic "tick" tasks. Each background service owns
 * one, so a slow sweep in one service never delays another.
 *
 * Shutdown is cooperative: no new tick starts, and the tick already running
 * is allowed to finish.
 */
public class TickService {
    private static final Logger logger = LoggerFactory.getLogger(TickService.class);

    private static final long SHUTDOWN_WAIT_MS = 5000;

    private final String name;
    private final ScheduledExecutorService scheduler;
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public TickService(String name) {
        this.name = name;
        // single-threaded scheduler to serialize this service's ticks
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "towermud-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    public String getName() {
        return name;
    }

    public ScheduledFuture<?> scheduleAtFixedRate(String taskName, Runnable task, long initialDelayMs, long periodMs) {
        if (periodMs <= 0) {
            throw new IllegalArgumentException("Tick period must be positive: " + periodMs);
        }
        ScheduledFuture<?> f = scheduler.scheduleAtFixedRate(task, initialDelayMs, periodMs, TimeUnit.MILLISECONDS);
        tasks.put(taskName, f);
        return f;
    }

    public boolean cancel(String taskName) {
        ScheduledFuture<?> f = tasks.remove(taskName);
        if (f == null) return false;
        return f.cancel(false);
    }

    public boolean isShutdown() {
        return scheduler.isShutdown();
    }

    /**
     * Stop scheduling and wait for an in-flight tick to finish.
     * @return true if the worker stopped within the wait
     */
    public boolean shutdown() {
        for (ScheduledFuture<?> f : tasks.values()) {
            f.cancel(false);
        }
        tasks.clear();
        scheduler.shutdown();
        try {
            boolean stopped = scheduler.awaitTermination(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS);
            if (!stopped) {
                logger.warn("[TickService] {} did not stop within {}ms", name, SHUTDOWN_WAIT_MS);
            }
            return stopped;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
