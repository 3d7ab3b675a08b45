package com.example.towermud.model;

/**
 * Player character classes with the numbers combat and leveling need.
 */
public enum CharacterClass {
    WARRIOR("Warrior", 10, 0),
    MAGE("Mage", 6, 5),
    CLERIC("Cleric", 8, 4),
    ROGUE("Rogue", 8, 2),
    RANGER("Ranger", 10, 3),
    PALADIN("Paladin", 10, 3);

    private final String displayName;
    private final int hitDie;
    private final int manaPerLevel;

    CharacterClass(String displayName, int hitDie, int manaPerLevel) {
        this.displayName = displayName;
        this.hitDie = hitDie;
        this.manaPerLevel = manaPerLevel;
    }

    public String getDisplayName() { return displayName; }
    public int getHitDie() { return hitDie; }
    public int getManaPerLevel() { return manaPerLevel; }

    /**
     * Ability modifier added to mana gained per level.
     */
    public int castingModifier(GameCharacter c) {
        switch (this) {
            case MAGE:
            case ROGUE:
                return c.getIntMod();
            case CLERIC:
            case RANGER:
                return c.getWisMod();
            case PALADIN:
                return c.getChaMod();
            default:
                return 0;
        }
    }

    public static CharacterClass fromString(String str) {
        if (str == null || str.isEmpty()) return null;
        try {
            return CharacterClass.valueOf(str.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
