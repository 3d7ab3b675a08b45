package com.example.towermud.event;

import com.example.towermud.model.Mobile;
import com.example.towermud.model.MobileTemplate;
import com.example.towermud.util.Dice;
import com.example.towermud.world.Room;
import com.example.towermud.world.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The one place mobiles are created: fixed spawn points at startup and
 * extra mobiles requested by the population controller both come through
 * here.
 */
public class SpawnManager implements MobSpawner {
    private static final Logger logger = LoggerFactory.getLogger(SpawnManager.class);

    private final World world;
    private final Dice dice;

    private final Map<String, MobileTemplate> templates = new ConcurrentHashMap<>();

    /** Fixed spawns in registration order */
    private final Map<String, SpawnConfig> spawns = new LinkedHashMap<>();

    /** Templates allowed to appear anywhere on a floor, by floor number */
    private final Map<Integer, List<String>> floorPools = new ConcurrentHashMap<>();

    public SpawnManager(World world, Dice dice) {
        this.world = world;
        this.dice = dice;
    }

    public void registerTemplate(MobileTemplate template) {
        templates.put(template.getKey(), template);
    }

    public MobileTemplate getTemplate(String key) {
        return templates.get(key);
    }

    public int getTemplateCount() {
        return templates.size();
    }

    /**
     * Register a fixed spawn. Duplicates (same template and room) are ignored.
     * @return false if it was already registered
     */
    public synchronized boolean registerSpawn(SpawnConfig config) {
        return spawns.putIfAbsent(config.getSpawnId(), config) == null;
    }

    public synchronized List<SpawnConfig> getSpawns() {
        return new ArrayList<>(spawns.values());
    }

    public void registerFloorPool(int floor, List<String> templateKeys) {
        floorPools.put(floor, List.copyOf(templateKeys));
    }

    /**
     * Create a mobile from a template in a room.
     * @return the new mobile, or null if the template or room is unknown, or
     *         the template is unique and one is already alive
     */
    public Mobile spawnMobile(String templateKey, String roomId) {
        MobileTemplate template = templates.get(templateKey);
        if (template == null) {
            logger.warn("[SpawnManager] Unknown mobile template {} for room {}", templateKey, roomId);
            return null;
        }
        if (world.getRoom(roomId) == null) {
            logger.warn("[SpawnManager] Unknown room {} for template {}", roomId, templateKey);
            return null;
        }
        if (template.isUnique() && world.hasLiveMobile(templateKey)) {
            logger.debug("[SpawnManager] Unique mobile {} already alive, not spawning", templateKey);
            return null;
        }
        return world.createMobile(template, roomId);
    }

    /**
     * Populate every fixed spawn point.
     * @return number of mobiles created
     */
    public int triggerInitialSpawns() {
        logger.info("[SpawnManager] Triggering initial spawns...");
        int total = 0;
        for (SpawnConfig config : getSpawns()) {
            for (int i = 0; i < config.quantity; i++) {
                try {
                    if (spawnMobile(config.templateKey, config.roomId) != null) total++;
                } catch (RuntimeException e) {
                    logger.warn("[SpawnManager] Error in initial spawn {}: {}", config, e.getMessage(), e);
                }
            }
        }
        logger.info("[SpawnManager] Created {} mobiles from {} spawn points", total, spawns.size());
        return total;
    }

    /**
     * Templates eligible for extra spawns on a floor: the floor's pool if it
     * has one, otherwise the ordinary (non-boss, non-unique) mobiles from
     * fixed spawns on that floor.
     */
    public List<String> candidatesForFloor(int floor) {
        List<String> pool = floorPools.get(floor);
        if (pool != null && !pool.isEmpty()) {
            return pool;
        }
        Set<String> keys = new HashSet<>();
        List<String> out = new ArrayList<>();
        for (SpawnConfig config : getSpawns()) {
            Room room = world.getRoom(config.roomId);
            MobileTemplate t = templates.get(config.templateKey);
            if (room == null || t == null || room.getFloor() != floor) continue;
            if (t.isBoss() || t.isUnique()) continue;
            if (keys.add(t.getKey())) out.add(t.getKey());
        }
        Collections.sort(out);
        return out;
    }

    @Override
    public int spawnOnFloor(int floor, int count) {
        if (count <= 0) return 0;
        List<String> candidates = candidatesForFloor(floor);
        List<Room> rooms = world.getRoomsOnFloor(floor);
        if (candidates.isEmpty() || rooms.isEmpty()) {
            logger.debug("[SpawnManager] Nothing to spawn on floor {}", floor);
            return 0;
        }
        int spawned = 0;
        for (int i = 0; i < count; i++) {
            String key = candidates.get(dice.random().nextInt(candidates.size()));
            Room room = rooms.get(dice.random().nextInt(rooms.size()));
            if (spawnMobile(key, room.getId()) != null) spawned++;
        }
        return spawned;
    }
}
