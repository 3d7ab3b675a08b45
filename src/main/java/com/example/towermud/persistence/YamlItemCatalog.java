package com.example.towermud.persistence;

import com.example.towermud.model.Item;
import com.example.towermud.model.LootEntry;
import com.example.towermud.model.Mobile;
import com.example.towermud.util.Dice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Item catalog loaded from {@code /data/items.yaml}.
 *
 * Bosses drop every item on their loot table; other mobiles roll each
 * entry against its percentage chance.
 */
public class YamlItemCatalog implements ItemCatalog {
    private static final Logger logger = LoggerFactory.getLogger(YamlItemCatalog.class);

    public static final String DEFAULT_RESOURCE = "/data/items.yaml";

    private final Map<String, Item> items = new ConcurrentHashMap<>();
    private final Dice dice;

    public YamlItemCatalog(Dice dice) {
        this.dice = dice;
    }

    public void addItem(Item item) {
        items.put(item.getId(), item);
    }

    public int size() {
        return items.size();
    }

    /**
     * Load item definitions from a classpath resource.
     * @return number of items loaded
     */
    public int loadFromResource(String resourcePath) throws IOException {
        try (InputStream in = YamlItemCatalog.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IOException("Item resource not found: " + resourcePath);
            }
            return load(in);
        }
    }

    public int load(InputStream in) {
        Map<String, Object> root = new Yaml().load(in);
        if (root == null) return 0;
        int count = 0;
        for (Map<String, Object> data : YamlSupport.getMapList(root, "items")) {
            String id = YamlSupport.getString(data, "id", null);
            if (id == null || id.isEmpty()) {
                logger.warn("[YamlItemCatalog] Skipping item without id: {}", data);
                continue;
            }
            Item item = new Item(
                id,
                YamlSupport.getString(data, "name", id),
                YamlSupport.getString(data, "description", ""),
                YamlSupport.getInt(data, "value", 0),
                YamlSupport.getString(data, "damage", null),
                Item.WeaponType.fromString(YamlSupport.getString(data, "weapon_type", null)),
                YamlSupport.getInt(data, "armor", 0));
            addItem(item);
            count++;
        }
        logger.info("[YamlItemCatalog] Loaded {} items", count);
        return count;
    }

    @Override
    public Optional<Item> findItem(String itemId) {
        if (itemId == null) return Optional.empty();
        return Optional.ofNullable(items.get(itemId));
    }

    @Override
    public List<String> rollLoot(Mobile mobile) {
        List<LootEntry> table = mobile.getLootTable();
        if (table.isEmpty()) return Collections.emptyList();
        List<String> dropped = new ArrayList<>();
        for (LootEntry entry : table) {
            if (mobile.isBoss() || dice.percent() < entry.dropChance()) {
                dropped.add(entry.itemId());
            }
        }
        return dropped;
    }

    @Override
    public int rollGold(Mobile mobile) {
        if (mobile.getGoldMax() <= 0) return 0;
        return dice.between(mobile.getGoldMin(), mobile.getGoldMax());
    }
}
