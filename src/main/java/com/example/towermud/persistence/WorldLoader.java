package com.example.towermud.persistence;

import com.example.towermud.event.SpawnConfig;
import com.example.towermud.event.SpawnManager;
import com.example.towermud.model.AreaDefinition;
import com.example.towermud.model.LootEntry;
import com.example.towermud.model.MobType;
import com.example.towermud.model.MobileBehavior;
import com.example.towermud.model.MobileTemplate;
import com.example.towermud.world.Direction;
import com.example.towermud.world.Room;
import com.example.towermud.world.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the static world from YAML resources under {@code /data/}:
 * areas, rooms, mobile templates and spawn points.
 *
 * Rooms go into the {@link World}; templates, spawn points and floor pools
 * go into the {@link SpawnManager}. Nothing is spawned here.
 */
public class WorldLoader {
    private static final Logger logger = LoggerFactory.getLogger(WorldLoader.class);

    public static final String AREAS_RESOURCE = "/data/areas.yaml";
    public static final String ROOMS_RESOURCE = "/data/rooms.yaml";
    public static final String MOBS_RESOURCE = "/data/mobs.yaml";
    public static final String SPAWNS_RESOURCE = "/data/spawns.yaml";

    private final World world;
    private final SpawnManager spawnManager;

    public WorldLoader(World world, SpawnManager spawnManager) {
        this.world = world;
        this.spawnManager = spawnManager;
    }

    /**
     * Load all four default resources. Rooms are required; the other files
     * are optional.
     */
    public void loadDefaults() throws IOException {
        loadOptional(AREAS_RESOURCE, this::loadAreas);
        try (InputStream in = open(ROOMS_RESOURCE)) {
            if (in == null) {
                throw new IOException("Room data not found: " + ROOMS_RESOURCE);
            }
            loadRooms(in);
        }
        loadOptional(MOBS_RESOURCE, this::loadMobiles);
        loadOptional(SPAWNS_RESOURCE, this::loadSpawns);
        if (world.getStartingRoom() == null) {
            logger.warn("[WorldLoader] Starting room {} is not defined", world.getStartingRoomId());
        }
    }

    private interface Section {
        int load(InputStream in);
    }

    private void loadOptional(String resource, Section section) throws IOException {
        try (InputStream in = open(resource)) {
            if (in == null) {
                logger.info("[WorldLoader] {} not present, skipping", resource);
                return;
            }
            section.load(in);
        }
    }

    private static InputStream open(String resource) {
        return WorldLoader.class.getResourceAsStream(resource);
    }

    private static Map<String, Object> parse(InputStream in) {
        Map<String, Object> root = new Yaml().load(in);
        return root == null ? Map.of() : root;
    }

    public int loadAreas(InputStream in) {
        int count = 0;
        for (Map<String, Object> data : YamlSupport.getMapList(parse(in), "areas")) {
            String id = YamlSupport.getString(data, "id", null);
            if (id == null) {
                logger.warn("[WorldLoader] Skipping area without id: {}", data);
                continue;
            }
            String name = YamlSupport.getString(data, "name", id);
            world.addArea(new AreaDefinition(
                id,
                name,
                YamlSupport.getInt(data, "final_floor", 0),
                YamlSupport.getString(data, "first_clear_title", "Conqueror of " + name),
                YamlSupport.getString(data, "shared_title", "Champion of " + name),
                YamlSupport.getBoolean(data, "counts_toward_unlock", true)));
            count++;
        }
        logger.info("[WorldLoader] Loaded {} areas", count);
        return count;
    }

    public int loadRooms(InputStream in) {
        int count = 0;
        for (Map<String, Object> data : YamlSupport.getMapList(parse(in), "rooms")) {
            String id = YamlSupport.getString(data, "id", null);
            if (id == null) {
                logger.warn("[WorldLoader] Skipping room without id: {}", data);
                continue;
            }
            Map<Direction, String> exits = new EnumMap<>(Direction.class);
            for (Map.Entry<?, ?> e : YamlSupport.getMap(data, "exits").entrySet()) {
                Direction dir = Direction.fromString(String.valueOf(e.getKey()));
                if (dir == null || e.getValue() == null) {
                    logger.warn("[WorldLoader] Room {} has bad exit {}", id, e.getKey());
                    continue;
                }
                exits.put(dir, e.getValue().toString());
            }
            world.addRoom(new Room(
                id,
                YamlSupport.getString(data, "name", id),
                YamlSupport.getString(data, "description", ""),
                YamlSupport.getInt(data, "floor", 0),
                YamlSupport.getString(data, "area", null),
                exits));
            count++;
        }
        // Exits are resolved after all rooms are known
        for (Room room : world.getRooms()) {
            for (Map.Entry<Direction, String> e : room.getExits().entrySet()) {
                if (world.getRoom(e.getValue()) == null) {
                    logger.warn("[WorldLoader] Room {} exit {} leads to unknown room {}",
                        room.getId(), e.getKey().getDisplayName(), e.getValue());
                }
            }
        }
        logger.info("[WorldLoader] Loaded {} rooms", count);
        return count;
    }

    public int loadMobiles(InputStream in) {
        int count = 0;
        for (Map<String, Object> data : YamlSupport.getMapList(parse(in), "mobs")) {
            try {
                spawnManager.registerTemplate(parseTemplate(data));
                count++;
            } catch (IllegalArgumentException e) {
                logger.warn("[WorldLoader] Skipping bad mobile template {}: {}", data.get("key"), e.getMessage());
            }
        }
        logger.info("[WorldLoader] Loaded {} mobile templates", count);
        return count;
    }

    static MobileTemplate parseTemplate(Map<String, Object> data) {
        String key = YamlSupport.getString(data, "key", null);
        List<MobileBehavior> behaviors = new ArrayList<>();
        for (String b : YamlSupport.getStringList(data, "behaviors")) {
            MobileBehavior behavior = MobileBehavior.fromString(b);
            if (behavior != null) behaviors.add(behavior);
        }
        if (YamlSupport.getBoolean(data, "aggressive", false) && !behaviors.contains(MobileBehavior.AGGRESSIVE)) {
            behaviors.add(MobileBehavior.AGGRESSIVE);
        }
        List<LootEntry> loot = new ArrayList<>();
        for (Map<String, Object> l : YamlSupport.getMapList(data, "loot")) {
            String item = YamlSupport.getString(l, "item", null);
            if (item != null) loot.add(new LootEntry(item, YamlSupport.getDouble(l, "chance", 100.0)));
        }
        return new MobileTemplate(
            key,
            YamlSupport.getString(data, "name", key),
            YamlSupport.getString(data, "description", ""),
            YamlSupport.getBoolean(data, "unique", false),
            YamlSupport.getInt(data, "level", 1),
            YamlSupport.getInt(data, "hp", 10),
            YamlSupport.getInt(data, "mp", 0),
            YamlSupport.getInt(data, "str", 10),
            YamlSupport.getInt(data, "dex", 10),
            YamlSupport.getInt(data, "con", 10),
            YamlSupport.getInt(data, "int", 10),
            YamlSupport.getInt(data, "wis", 10),
            YamlSupport.getInt(data, "cha", 10),
            YamlSupport.getInt(data, "armor", 0),
            YamlSupport.getInt(data, "damage", 4),
            YamlSupport.getInt(data, "damage_bonus", 0),
            behaviors,
            MobType.fromString(YamlSupport.getString(data, "type", null)),
            YamlSupport.getDouble(data, "flee_threshold", -1.0),
            YamlSupport.getInt(data, "xp", 0),
            YamlSupport.getInt(data, "gold_min", 0),
            YamlSupport.getInt(data, "gold_max", 0),
            loot,
            YamlSupport.getInt(data, "respawn_median", 0),
            YamlSupport.getInt(data, "respawn_variation", 0),
            YamlSupport.getBoolean(data, "boss", false));
    }

    public int loadSpawns(InputStream in) {
        Map<String, Object> root = parse(in);
        int count = 0;
        for (Map<String, Object> data : YamlSupport.getMapList(root, "spawns")) {
            String mob = YamlSupport.getString(data, "mob", null);
            String room = YamlSupport.getString(data, "room", null);
            if (mob == null || room == null) {
                logger.warn("[WorldLoader] Skipping incomplete spawn: {}", data);
                continue;
            }
            if (spawnManager.registerSpawn(new SpawnConfig(mob, room, YamlSupport.getInt(data, "quantity", 1)))) {
                count++;
            }
        }
        // YAML reads unquoted floor numbers as Integer keys
        Object pools = root.get("floor_pools");
        if (pools instanceof Map) {
            for (Map.Entry<?, ?> e : ((Map<?, ?>) pools).entrySet()) {
                try {
                    int floor = Integer.parseInt(String.valueOf(e.getKey()).trim());
                    List<String> keys = new ArrayList<>();
                    if (e.getValue() instanceof List) {
                        for (Object o : (List<?>) e.getValue()) if (o != null) keys.add(o.toString());
                    }
                    spawnManager.registerFloorPool(floor, keys);
                } catch (NumberFormatException ex) {
                    logger.warn("[WorldLoader] Bad floor number in floor_pools: {}", e.getKey());
                }
            }
        }
        logger.info("[WorldLoader] Loaded {} spawn points", count);
        return count;
    }
}
