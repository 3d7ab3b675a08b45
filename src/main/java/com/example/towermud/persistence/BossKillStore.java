package com.example.towermud.persistence;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of area boss kills.
 */
public interface BossKillStore {

    record BossKill(long id, String areaId, String playerName, Instant killedAt, boolean firstKill) { }

    /**
     * Record a kill.
     * @return true if nobody had killed this area's boss before
     */
    boolean recordBossKill(String areaId, String playerName) throws SQLException;

    boolean hasAreaBeenDefeated(String areaId) throws SQLException;

    Optional<BossKill> getFirstKill(String areaId) throws SQLException;

    List<BossKill> getPlayerBossKills(String playerName) throws SQLException;
}
