package com.example.towermud.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks which areas have had their final boss defeated, backed by a
 * {@link BossKillStore}. The server is fully unlocked once every area that
 * counts toward the unlock has been cleared at least once.
 */
public class BossTracker {
    private static final Logger logger = LoggerFactory.getLogger(BossTracker.class);

    private final BossKillStore store;
    private final Set<String> requiredAreas;
    private final Set<String> defeatedAreas = ConcurrentHashMap.newKeySet();
    private volatile boolean fullyUnlocked;

    /**
     * @param requiredAreas areas whose clear counts toward the full unlock
     * @throws SQLException if the initial state cannot be loaded
     */
    public BossTracker(BossKillStore store, Collection<String> requiredAreas) throws SQLException {
        this.store = store;
        this.requiredAreas = new LinkedHashSet<>(requiredAreas);
        loadState();
    }

    private void loadState() throws SQLException {
        for (String areaId : requiredAreas) {
            if (store.hasAreaBeenDefeated(areaId)) {
                defeatedAreas.add(areaId);
            }
        }
        fullyUnlocked = !requiredAreas.isEmpty() && defeatedAreas.containsAll(requiredAreas);
        logger.info("[BossTracker] Loaded: {}/{} areas defeated, fullyUnlocked={}",
            defeatedAreas.size(), requiredAreas.size(), fullyUnlocked);
    }

    /**
     * Record a final-boss kill.
     * @return true if this was the first kill ever recorded for the area
     */
    public synchronized boolean recordKill(String areaId, String playerName) throws SQLException {
        boolean first = store.recordBossKill(areaId, playerName);
        defeatedAreas.add(areaId);
        if (first && !fullyUnlocked && requiredAreas.contains(areaId)
            && defeatedAreas.containsAll(requiredAreas)) {
            fullyUnlocked = true;
            logger.info("[BossTracker] All required areas defeated, server fully unlocked");
        }
        return first;
    }

    public boolean hasBeenDefeated(String areaId) {
        return defeatedAreas.contains(areaId);
    }

    public int getDefeatedCount() {
        return defeatedAreas.size();
    }

    public boolean isFullyUnlocked() {
        return fullyUnlocked;
    }

    public BossKillStore getStore() {
        return store;
    }
}
