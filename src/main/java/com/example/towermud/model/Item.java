package com.example.towermud.model;

/**
 * An item definition from the item catalog. Only the fields combat and
 * loot distribution look at are modeled here.
 */
public class Item {

    public enum WeaponType {
        NONE,
        SIMPLE,
        MARTIAL,
        FINESSE,
        RANGED;

        public static WeaponType fromString(String str) {
            if (str == null || str.isEmpty()) return NONE;
            try {
                return WeaponType.valueOf(str.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                return NONE;
            }
        }
    }

    private final String id;
    private final String name;
    private final String description;
    private final int value;
    private final String damageDice;   // e.g. "1d8", "2d4+1"; null for non-weapons
    private final WeaponType weaponType;
    private final int armor;

    public Item(String id, String name, String description, int value,
                String damageDice, WeaponType weaponType, int armor) {
        this.id = id;
        this.name = name;
        this.description = description == null ? "" : description;
        this.value = value;
        this.damageDice = damageDice;
        this.weaponType = weaponType == null ? WeaponType.NONE : weaponType;
        this.armor = armor;
    }

    /** A plain item with no combat stats (keys, trophies, junk). */
    public static Item simple(String id, String name) {
        return new Item(id, name, "", 0, null, WeaponType.NONE, 0);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public int getValue() { return value; }
    public String getDamageDice() { return damageDice; }
    public WeaponType getWeaponType() { return weaponType; }
    public int getArmor() { return armor; }

    public boolean isWeapon() {
        return damageDice != null && !damageDice.isEmpty();
    }

    public boolean isRanged() { return weaponType == WeaponType.RANGED; }
    public boolean isFinesse() { return weaponType == WeaponType.FINESSE; }

    @Override
    public String toString() {
        return name;
    }
}
