package com.example.towermud.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * H2-backed boss kill store.
 */
public class BossKillDAO implements BossKillStore {
    private static final Logger logger = LoggerFactory.getLogger(BossKillDAO.class);

    public static final String DEFAULT_URL = "jdbc:h2:file:./data/towermud;AUTO_SERVER=TRUE;DB_CLOSE_DELAY=-1";
    private static final String USER = "sa";
    private static final String PASS = "";

    private final String url;

    public BossKillDAO() {
        this(System.getProperty("towermud.db.url", DEFAULT_URL));
    }

    public BossKillDAO(String url) {
        this.url = url;
    }

    public String getUrl() {
        return url;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(url, USER, PASS);
    }

    /**
     * Create the boss_kills table if it does not exist yet.
     */
    public void ensureTable() {
        try (Connection c = connect();
             Statement s = c.createStatement()) {
            s.execute("CREATE TABLE IF NOT EXISTS boss_kills (" +
                "id BIGINT AUTO_INCREMENT PRIMARY KEY, " +
                "area_id VARCHAR(64) NOT NULL, " +
                "player_name VARCHAR(64) NOT NULL, " +
                "killed_at TIMESTAMP NOT NULL, " +
                "is_first_kill BOOLEAN NOT NULL DEFAULT FALSE" +
            ")");
            s.execute("CREATE INDEX IF NOT EXISTS idx_boss_kills_area ON boss_kills(area_id)");
            logger.info("BossKillDAO: ensured boss_kills table");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create boss_kills table", e);
        }
    }

    /**
     * Count and insert in one transaction so exactly one kill per area is
     * flagged as the first. Synchronized so kills recorded from this
     * process never interleave.
     */
    @Override
    public synchronized boolean recordBossKill(String areaId, String playerName) throws SQLException {
        try (Connection c = connect()) {
            c.setAutoCommit(false);
            try {
                boolean first;
                try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM boss_kills WHERE area_id = ?")) {
                    ps.setString(1, areaId);
                    try (ResultSet rs = ps.executeQuery()) {
                        rs.next();
                        first = rs.getInt(1) == 0;
                    }
                }
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO boss_kills (area_id, player_name, killed_at, is_first_kill) VALUES (?, ?, ?, ?)")) {
                    ps.setString(1, areaId);
                    ps.setString(2, playerName);
                    ps.setTimestamp(3, Timestamp.from(Instant.now()));
                    ps.setBoolean(4, first);
                    ps.executeUpdate();
                }
                c.commit();
                logger.debug("BossKillDAO: recorded kill area={} player={} first={}", areaId, playerName, first);
                return first;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        }
    }

    @Override
    public boolean hasAreaBeenDefeated(String areaId) throws SQLException {
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM boss_kills WHERE area_id = ?")) {
            ps.setString(1, areaId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getInt(1) > 0;
            }
        }
    }

    @Override
    public Optional<BossKill> getFirstKill(String areaId) throws SQLException {
        String sql = "SELECT id, area_id, player_name, killed_at, is_first_kill FROM boss_kills " +
            "WHERE area_id = ? AND is_first_kill = TRUE ORDER BY id LIMIT 1";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, areaId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
                return Optional.empty();
            }
        }
    }

    @Override
    public List<BossKill> getPlayerBossKills(String playerName) throws SQLException {
        String sql = "SELECT id, area_id, player_name, killed_at, is_first_kill FROM boss_kills " +
            "WHERE player_name = ? ORDER BY id";
        List<BossKill> out = new ArrayList<>();
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, playerName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapRow(rs));
                }
            }
        }
        return out;
    }

    private static BossKill mapRow(ResultSet rs) throws SQLException {
        Timestamp ts = rs.getTimestamp("killed_at");
        return new BossKill(
            rs.getLong("id"),
            rs.getString("area_id"),
            rs.getString("player_name"),
            ts == null ? null : ts.toInstant(),
            rs.getBoolean("is_first_kill")
        );
    }
}
