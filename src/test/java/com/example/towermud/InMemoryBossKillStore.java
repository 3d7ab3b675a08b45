package com.example.towermud;

import com.example.towermud.persistence.BossKillStore;

import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * BossKillStore kept in a list. Can be told to fail like an unreachable database.
 */
class InMemoryBossKillStore implements BossKillStore {

    private final List<BossKill> kills = new ArrayList<>();
    private boolean failing;

    void setFailing(boolean failing) {
        this.failing = failing;
    }

    private void check() throws SQLException {
        if (failing) throw new SQLException("database unavailable");
    }

    @Override
    public synchronized boolean recordBossKill(String areaId, String playerName) throws SQLException {
        check();
        boolean first = !hasAreaBeenDefeated(areaId);
        kills.add(new BossKill(kills.size() + 1, areaId, playerName, Instant.now(), first));
        return first;
    }

    @Override
    public synchronized boolean hasAreaBeenDefeated(String areaId) throws SQLException {
        check();
        return kills.stream().anyMatch(k -> k.areaId().equals(areaId));
    }

    @Override
    public synchronized Optional<BossKill> getFirstKill(String areaId) throws SQLException {
        check();
        return kills.stream().filter(k -> k.areaId().equals(areaId) && k.firstKill()).findFirst();
    }

    @Override
    public synchronized List<BossKill> getPlayerBossKills(String playerName) throws SQLException {
        check();
        List<BossKill> out = new ArrayList<>();
        for (BossKill k : kills) {
            if (k.playerName().equals(playerName)) out.add(k);
        }
        return out;
    }
}
