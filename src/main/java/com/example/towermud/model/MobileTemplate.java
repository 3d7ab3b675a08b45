package com.example.towermud.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Template for creating mobile instances, loaded from /data/mobs.yaml.
 */
public class MobileTemplate {

    private final String key;              // e.g. "cave_rat"
    private final String name;             // e.g. "a cave rat"
    private final String description;
    private final boolean unique;
    private final int level;

    private final int hpMax;
    private final int mpMax;

    private final int str;
    private final int dex;
    private final int con;
    private final int intel;
    private final int wis;
    private final int cha;
    private final int armor;

    // Damage profile: 1d(baseDamage) + damageBonus
    private final int baseDamage;
    private final int damageBonus;

    private final Set<MobileBehavior> behaviors;
    private final MobType mobType;
    private final double fleeThreshold;    // fraction of max HP, 0 = never

    private final int experienceValue;
    private final int goldMin;
    private final int goldMax;
    private final List<LootEntry> lootTable;

    // Respawn timing in seconds; median 0 = never respawns
    private final int respawnMedian;
    private final int respawnVariation;

    private final boolean boss;

    /**
     * @param fleeThreshold fraction of max health to flee at; a negative value
     *                      means "use the mob type's default"
     */
    public MobileTemplate(String key, String name, String description, boolean unique,
                          int level, int hpMax, int mpMax,
                          int str, int dex, int con, int intel, int wis, int cha,
                          int armor, int baseDamage, int damageBonus,
                          List<MobileBehavior> behaviors, MobType mobType, double fleeThreshold,
                          int experienceValue, int goldMin, int goldMax, List<LootEntry> lootTable,
                          int respawnMedian, int respawnVariation, boolean boss) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Mobile template key is required");
        }
        this.key = key;
        this.name = name == null || name.isEmpty() ? key : name;
        this.description = description == null ? "" : description;
        this.unique = unique;
        this.level = Math.max(1, level);
        this.hpMax = Math.max(1, hpMax);
        this.mpMax = Math.max(0, mpMax);
        this.str = str;
        this.dex = dex;
        this.con = con;
        this.intel = intel;
        this.wis = wis;
        this.cha = cha;
        this.armor = armor;
        this.baseDamage = Math.max(1, baseDamage);
        this.damageBonus = damageBonus;
        this.behaviors = behaviors == null || behaviors.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(MobileBehavior.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(behaviors));
        this.mobType = mobType == null ? MobType.UNKNOWN : mobType;
        if (this.behaviors.contains(MobileBehavior.FEARLESS)) {
            this.fleeThreshold = 0.0;
        } else {
            this.fleeThreshold = fleeThreshold < 0 ? this.mobType.getDefaultFleeThreshold() : fleeThreshold;
        }
        this.experienceValue = Math.max(0, experienceValue);
        this.goldMin = Math.max(0, goldMin);
        this.goldMax = Math.max(this.goldMin, goldMax);
        this.lootTable = lootTable == null ? Collections.emptyList() : List.copyOf(lootTable);
        this.respawnMedian = Math.max(0, respawnMedian);
        this.respawnVariation = Math.max(0, respawnVariation);
        this.boss = boss;
    }

    public String getKey() { return key; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public boolean isUnique() { return unique; }
    public int getLevel() { return level; }
    public int getHpMax() { return hpMax; }
    public int getMpMax() { return mpMax; }
    public int getStr() { return str; }
    public int getDex() { return dex; }
    public int getCon() { return con; }
    public int getIntel() { return intel; }
    public int getWis() { return wis; }
    public int getCha() { return cha; }
    public int getArmor() { return armor; }
    public int getBaseDamage() { return baseDamage; }
    public int getDamageBonus() { return damageBonus; }
    public Set<MobileBehavior> getBehaviors() { return behaviors; }
    public MobType getMobType() { return mobType; }
    public double getFleeThreshold() { return fleeThreshold; }
    public int getExperienceValue() { return experienceValue; }
    public int getGoldMin() { return goldMin; }
    public int getGoldMax() { return goldMax; }
    public List<LootEntry> getLootTable() { return lootTable; }
    public int getRespawnMedian() { return respawnMedian; }
    public int getRespawnVariation() { return respawnVariation; }
    public boolean isBoss() { return boss; }

    public boolean hasBehavior(MobileBehavior behavior) {
        return behaviors.contains(behavior);
    }

    public boolean isAggressive() {
        return hasBehavior(MobileBehavior.AGGRESSIVE);
    }

    @Override
    public String toString() {
        return "MobileTemplate{key=" + key + ", name=" + name + ", level=" + level + "}";
    }
}
