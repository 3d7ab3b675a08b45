package com.example.towermud;

import com.example.towermud.model.Item;
import com.example.towermud.model.Mobile;
import com.example.towermud.persistence.YamlItemCatalog;
import com.example.towermud.util.Dice;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("YamlItemCatalog Tests")
public class YamlItemCatalogTest {

    private ScriptedRandom rng;
    private YamlItemCatalog catalog;

    @BeforeEach
    void setUp() {
        rng = new ScriptedRandom();
        catalog = new YamlItemCatalog(new Dice(rng));
    }

    private static Mobile mobile(MobFixtures.Builder builder) {
        return new Mobile(0, builder.build(), TowerFixtures.DEN, 1, null);
    }

    @Test
    @DisplayName("The bundled item file loads weapons and plain items")
    void bundledItems() throws IOException {
        assertEquals(6, catalog.loadFromResource(YamlItemCatalog.DEFAULT_RESOURCE));

        Item bow = catalog.findItem("short_bow").orElseThrow();
        assertTrue(bow.isWeapon());
        assertTrue(bow.isRanged());
        assertEquals("1d6", bow.getDamageDice());

        Item dagger = catalog.findItem("rusty_dagger").orElseThrow();
        assertTrue(dagger.isFinesse());

        Item tail = catalog.findItem("rat_tail").orElseThrow();
        assertFalse(tail.isWeapon());
        assertEquals(Item.WeaponType.NONE, tail.getWeaponType());

        assertTrue(catalog.findItem("excalibur").isEmpty());
        assertTrue(catalog.findItem(null).isEmpty());
    }

    @Test
    @DisplayName("A missing resource is an IOException")
    void missingResource() {
        assertThrows(IOException.class, () -> catalog.loadFromResource("/data/nope.yaml"));
    }

    @Test
    @DisplayName("Items without an id are skipped")
    void itemWithoutId() {
        String yaml = "items:\n  - name: mystery\n  - id: coin\n    value: 1\n";
        assertEquals(1, catalog.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
        assertEquals("coin", catalog.findItem("coin").orElseThrow().getName());
    }

    @Test
    @DisplayName("Bosses drop their whole loot table")
    void bossDropsEverything() {
        Mobile boss = mobile(MobFixtures.mob("lord").boss().loot("crown", 1).loot("ring", 0));
        assertEquals(List.of("crown", "ring"), catalog.rollLoot(boss));
    }

    @Test
    @DisplayName("Ordinary mobiles roll each entry against its chance")
    void lootRolledPerEntry() {
        Mobile rat = mobile(MobFixtures.mob("rat").loot("tail", 50).loot("tooth", 10).loot("whisker", 100));
        // percent rolls of 30, 20 and the default 99.9
        rng.scriptDoubles(0.3, 0.2);

        assertEquals(List.of("tail", "whisker"), catalog.rollLoot(rat));
        assertTrue(catalog.rollLoot(mobile(MobFixtures.mob("slime"))).isEmpty());
    }

    @Test
    @DisplayName("Gold falls within the mobile's range")
    void goldRange() {
        rng.scriptInts(3);
        assertEquals(5, catalog.rollGold(mobile(MobFixtures.mob("goblin").gold(2, 8))));
        assertEquals(0, catalog.rollGold(mobile(MobFixtures.mob("rat"))));
    }
}
