package com.example.towermud;

import com.example.towermud.combat.AggressionScanner;
import com.example.towermud.combat.CombatCalculator;
import com.example.towermud.combat.CombatManager;
import com.example.towermud.combat.DeathHandler;
import com.example.towermud.event.DynamicSpawnManager;
import com.example.towermud.event.RespawnManager;
import com.example.towermud.event.SpawnManager;
import com.example.towermud.model.AreaDefinition;
import com.example.towermud.model.Mobile;
import com.example.towermud.model.Player;
import com.example.towermud.persistence.BossKillDAO;
import com.example.towermud.persistence.BossTracker;
import com.example.towermud.persistence.WorldLoader;
import com.example.towermud.persistence.YamlItemCatalog;
import com.example.towermud.util.Dice;
import com.example.towermud.util.RegenerationService;
import com.example.towermud.world.Room;
import com.example.towermud.world.SessionRegistry;
import com.example.towermud.world.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Hosts the combat and NPC lifecycle services: builds the world, wires the
 * services together and starts or stops them as a unit.
 */
public class GameEngine {
    private static final Logger logger = LoggerFactory.getLogger(GameEngine.class);

    private final GameConfig config;
    private final Dice dice;

    private final World world;
    private final SessionRegistry sessions = new SessionRegistry();
    private final SpawnManager spawnManager;
    private final YamlItemCatalog itemCatalog;
    private final RespawnManager respawnManager;
    private final DeathHandler deathHandler;
    private final AggressionScanner aggressionScanner;
    private final CombatManager combatManager;
    private final RegenerationService regenerationService;
    private final DynamicSpawnManager dynamicSpawnManager;

    private final AtomicBoolean started = new AtomicBoolean(false);

    public GameEngine(GameConfig config, Dice dice) {
        this.config = config;
        this.dice = dice;
        this.world = new World(config.getStartingRoom());
        this.spawnManager = new SpawnManager(world, dice);
        this.itemCatalog = new YamlItemCatalog(dice);
        this.respawnManager = new RespawnManager(world, sessions, dice, config.getRespawnSweepMs());
        this.deathHandler = new DeathHandler(world, sessions, respawnManager, dice);
        this.aggressionScanner = new AggressionScanner(world, sessions, config.isPilgrimMode());
        this.combatManager = new CombatManager(world, sessions, new CombatCalculator(dice), deathHandler,
            aggressionScanner, dice, config.getCombatTickMs(), config.getFleeChance());
        this.regenerationService = new RegenerationService(world, sessions, config.getRegenIntervalMs());
        this.dynamicSpawnManager = new DynamicSpawnManager(world, sessions, spawnManager,
            config.isPopulationEnabled(), config.getPopulationIntervalMs(), config.getMobsPerPlayer(),
            config.getBaseMobsPerFloor(), config.getMaxSpawnsPerFloor());
    }

    /**
     * Load world data, the item catalog and boss-kill state. A missing item
     * catalog or an unreachable database disables loot or boss titles; a
     * missing room file is fatal.
     */
    public void init() throws IOException {
        new WorldLoader(world, spawnManager).loadDefaults();

        try {
            itemCatalog.loadFromResource(YamlItemCatalog.DEFAULT_RESOURCE);
            deathHandler.setItemCatalog(itemCatalog);
        } catch (IOException e) {
            logger.warn("[GameEngine] Item catalog unavailable, loot drops disabled: {}", e.getMessage());
        }

        try {
            BossKillDAO dao = new BossKillDAO(config.getDbUrl());
            dao.ensureTable();
            List<String> required = new ArrayList<>();
            for (AreaDefinition area : world.getAreas()) {
                if (area.countsTowardUnlock()) required.add(area.getId());
            }
            deathHandler.setBossTracker(new BossTracker(dao, required));
        } catch (SQLException | RuntimeException e) {
            logger.warn("[GameEngine] Boss tracking unavailable: {}", e.getMessage(), e);
        }

        logger.info("[GameEngine] World ready: {} rooms, {} floors, {} mobile templates, {} spawn points",
            world.getRoomCount(), world.getGeneratedFloorCount(), spawnManager.getTemplateCount(),
            spawnManager.getSpawns().size());
    }

    /**
     * Populate the world and start every background service.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) return;
        spawnManager.triggerInitialSpawns();
        try {
            combatManager.start();
            respawnManager.start();
            regenerationService.start();
            dynamicSpawnManager.start();
        } catch (RuntimeException e) {
            logger.error("[GameEngine] Startup failed, stopping services: {}", e.getMessage(), e);
            stop();
            throw e;
        }
        logger.info("[GameEngine] Started {}", config);
    }

    /**
     * Stop every background service, waiting for in-flight ticks.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) return;
        logger.info("[GameEngine] Shutting down...");
        dynamicSpawnManager.shutdown();
        combatManager.shutdown();
        regenerationService.shutdown();
        respawnManager.shutdown();
        logger.info("[GameEngine] Stopped");
    }

    public boolean isStarted() {
        return started.get();
    }

    // ==================== SESSIONS ====================

    /**
     * Bring a player into the world.
     * @return false if someone with that name is already connected
     */
    public boolean connect(Player player) {
        if (!sessions.register(player)) {
            logger.info("[GameEngine] {} is already connected", player.getName());
            return false;
        }
        world.enterWorld(player);
        Room room = world.getRoom(player.getCurrentRoom());
        if (room != null) {
            player.send(room.describe(player.getName()) + "\n");
            sessions.broadcastToRoom(room, player.getName() + " has arrived.\n", List.of(player.getName()));
        }
        logger.info("[GameEngine] {} connected ({} online)", player.getName(), sessions.getOnlineCount());
        return true;
    }

    /**
     * Take a player out of the world. Any mobile fighting them drops them.
     */
    public Player disconnect(String name) {
        Player player = sessions.remove(name);
        if (player == null) return null;
        Room room = world.getRoom(player.getCurrentRoom());
        if (room != null) {
            for (Mobile mob : room.getMobiles()) {
                mob.disengage(player.getName());
            }
        }
        player.endCombat();
        world.leaveWorld(player);
        logger.info("[GameEngine] {} disconnected ({} online)", player.getName(), sessions.getOnlineCount());
        return player;
    }

    public GameConfig getConfig() { return config; }
    public Dice getDice() { return dice; }
    public World getWorld() { return world; }
    public SessionRegistry getSessions() { return sessions; }
    public SpawnManager getSpawnManager() { return spawnManager; }
    public RespawnManager getRespawnManager() { return respawnManager; }
    public DeathHandler getDeathHandler() { return deathHandler; }
    public CombatManager getCombatManager() { return combatManager; }
    public RegenerationService getRegenerationService() { return regenerationService; }
    public DynamicSpawnManager getDynamicSpawnManager() { return dynamicSpawnManager; }

    public static void main(String[] args) throws Exception {
        GameEngine engine = new GameEngine(GameConfig.load(), new Dice());
        engine.init();
        engine.start();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            engine.stop();
            stopped.countDown();
        }, "towermud-shutdown"));
        stopped.await();
    }
}
