package com.example.towermud;

import com.example.towermud.combat.CombatManager;
import com.example.towermud.event.DynamicSpawnManager;
import com.example.towermud.event.RespawnManager;
import com.example.towermud.persistence.BossKillDAO;
import com.example.towermud.persistence.YamlSupport;
import com.example.towermud.util.RegenerationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * Engine settings. Read from {@code /config/game.yaml} on the classpath;
 * missing keys keep their defaults, and a few system properties override
 * the file:
 * <ul>
 *   <li>{@code towermud.pilgrim} - pilgrim mode (no combat)</li>
 *   <li>{@code towermud.db.url} - JDBC url of the boss-kill database</li>
 *   <li>{@code towermud.population.enabled} - dynamic population on/off</li>
 * </ul>
 */
public class GameConfig {
    private static final Logger logger = LoggerFactory.getLogger(GameConfig.class);

    public static final String DEFAULT_RESOURCE = "/config/game.yaml";

    private String startingRoom = "city_square";
    private boolean pilgrimMode = false;
    private String dbUrl = BossKillDAO.DEFAULT_URL;

    private long combatTickMs = CombatManager.DEFAULT_TICK_MS;
    private double fleeChance = CombatManager.DEFAULT_FLEE_CHANCE;
    private long respawnSweepMs = RespawnManager.DEFAULT_SWEEP_MS;
    private long regenIntervalMs = RegenerationService.DEFAULT_INTERVAL_MS;

    private boolean populationEnabled = true;
    private long populationIntervalMs = DynamicSpawnManager.DEFAULT_INTERVAL_MS;
    private double mobsPerPlayer = DynamicSpawnManager.DEFAULT_MOBS_PER_PLAYER;
    private double baseMobsPerFloor = DynamicSpawnManager.DEFAULT_BASE_MOBS_PER_FLOOR;
    private int maxSpawnsPerFloor = DynamicSpawnManager.DEFAULT_MAX_SPAWNS_PER_FLOOR;

    /** Defaults only. */
    public GameConfig() {
    }

    /**
     * Load the default resource and apply system property overrides.
     */
    public static GameConfig load() throws IOException {
        GameConfig config = new GameConfig();
        try (InputStream in = GameConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.warn("[GameConfig] {} not found, using defaults", DEFAULT_RESOURCE);
            } else {
                config.read(in);
            }
        }
        config.applyOverrides(System.getProperties());
        return config;
    }

    /**
     * Read settings from a YAML document. Keys not present are left alone.
     */
    public GameConfig read(InputStream in) {
        Map<String, Object> root = new Yaml().load(in);
        if (root == null) return this;

        startingRoom = YamlSupport.getString(root, "starting_room", startingRoom);
        pilgrimMode = YamlSupport.getBoolean(root, "pilgrim", pilgrimMode);
        dbUrl = YamlSupport.getString(YamlSupport.getMap(root, "database"), "url", dbUrl);

        Map<String, Object> combat = YamlSupport.getMap(root, "combat");
        combatTickMs = YamlSupport.getLong(combat, "tick_ms", combatTickMs);
        fleeChance = YamlSupport.getDouble(combat, "flee_chance", fleeChance);

        respawnSweepMs = YamlSupport.getLong(YamlSupport.getMap(root, "respawn"), "sweep_ms", respawnSweepMs);
        regenIntervalMs = YamlSupport.getLong(YamlSupport.getMap(root, "regen"), "interval_ms", regenIntervalMs);

        Map<String, Object> population = YamlSupport.getMap(root, "population");
        populationEnabled = YamlSupport.getBoolean(population, "enabled", populationEnabled);
        populationIntervalMs = YamlSupport.getLong(population, "interval_ms", populationIntervalMs);
        mobsPerPlayer = YamlSupport.getDouble(population, "mobs_per_player", mobsPerPlayer);
        baseMobsPerFloor = YamlSupport.getDouble(population, "base_mobs_per_floor", baseMobsPerFloor);
        maxSpawnsPerFloor = YamlSupport.getInt(population, "max_spawns_per_floor", maxSpawnsPerFloor);

        validate();
        return this;
    }

    public GameConfig applyOverrides(Properties props) {
        String pilgrim = props.getProperty("towermud.pilgrim");
        if (pilgrim != null && !pilgrim.isEmpty()) {
            pilgrimMode = Boolean.parseBoolean(pilgrim.trim());
        }
        String url = props.getProperty("towermud.db.url");
        if (url != null && !url.isEmpty()) {
            dbUrl = url;
        }
        String population = props.getProperty("towermud.population.enabled");
        if (population != null && !population.isEmpty()) {
            populationEnabled = Boolean.parseBoolean(population.trim());
        }
        return this;
    }

    private void validate() {
        if (combatTickMs <= 0) {
            throw new IllegalArgumentException("combat.tick_ms must be positive: " + combatTickMs);
        }
        if (fleeChance < 0 || fleeChance > 1) {
            throw new IllegalArgumentException("combat.flee_chance must be within [0, 1]: " + fleeChance);
        }
        if (respawnSweepMs <= 0) {
            throw new IllegalArgumentException("respawn.sweep_ms must be positive: " + respawnSweepMs);
        }
        if (regenIntervalMs <= 0) {
            throw new IllegalArgumentException("regen.interval_ms must be positive: " + regenIntervalMs);
        }
    }

    public String getStartingRoom() { return startingRoom; }
    public boolean isPilgrimMode() { return pilgrimMode; }
    public String getDbUrl() { return dbUrl; }
    public long getCombatTickMs() { return combatTickMs; }
    public double getFleeChance() { return fleeChance; }
    public long getRespawnSweepMs() { return respawnSweepMs; }
    public long getRegenIntervalMs() { return regenIntervalMs; }
    /** Off whenever the interval is not positive, whatever the flag says. */
    public boolean isPopulationEnabled() { return populationEnabled && populationIntervalMs > 0; }
    public long getPopulationIntervalMs() { return populationIntervalMs; }
    public double getMobsPerPlayer() { return mobsPerPlayer; }
    public double getBaseMobsPerFloor() { return baseMobsPerFloor; }
    public int getMaxSpawnsPerFloor() { return maxSpawnsPerFloor; }

    @Override
    public String toString() {
        return "GameConfig{start=" + startingRoom + ", pilgrim=" + pilgrimMode
            + ", combatTickMs=" + combatTickMs + ", fleeChance=" + fleeChance
            + ", respawnSweepMs=" + respawnSweepMs + ", population=" + isPopulationEnabled() + "}";
    }
}
