package com.example.towermud.model;

/**
 * Shared live state of anything that can fight: players and mobiles.
 * Mutators are synchronized so each character is only changed by one
 * subsystem at a time.
 */
public class GameCharacter {
    private final String name;

    private int hpMax;
    private int hpCur;

    private int mpMax;
    private int mpCur;

    // Current room id (nullable while the character is out of the world)
    private String currentRoom;

    // Ability scores
    private int str;
    private int dex;
    private int con;
    private int intel;
    private int wis;
    private int cha;

    private int armor;

    public GameCharacter(String name,
                         int hpMax, int hpCur,
                         int mpMax, int mpCur,
                         String currentRoom,
                         int str, int dex, int con, int intel, int wis, int cha,
                         int armor) {
        this.name = name;
        this.hpMax = Math.max(1, hpMax);
        this.hpCur = Math.max(0, Math.min(hpCur, this.hpMax));
        this.mpMax = Math.max(0, mpMax);
        this.mpCur = Math.max(0, Math.min(mpCur, this.mpMax));
        this.currentRoom = currentRoom;
        this.str = str;
        this.dex = dex;
        this.con = con;
        this.intel = intel;
        this.wis = wis;
        this.cha = cha;
        this.armor = armor;
    }

    public String getName() { return name; }

    public synchronized int getHpMax() { return hpMax; }
    public synchronized int getHpCur() { return hpCur; }
    public synchronized void setHpCur(int hpCur) { this.hpCur = Math.max(0, Math.min(hpCur, hpMax)); }
    public synchronized void setHpMax(int hpMax) { this.hpMax = Math.max(1, hpMax); }

    public synchronized int getMpMax() { return mpMax; }
    public synchronized int getMpCur() { return mpCur; }
    public synchronized void setMpCur(int mpCur) { this.mpCur = Math.max(0, Math.min(mpCur, mpMax)); }
    public synchronized void setMpMax(int mpMax) { this.mpMax = Math.max(0, mpMax); }

    /**
     * Heal the character by the given amount (capped at hpMax).
     * @return health actually restored
     */
    public synchronized int heal(int amount) {
        if (amount <= 0) return 0;
        int before = hpCur;
        setHpCur(hpCur + amount);
        return hpCur - before;
    }

    /**
     * Restore mana by the given amount (capped at mpMax).
     */
    public synchronized int restoreMana(int amount) {
        if (amount <= 0) return 0;
        int before = mpCur;
        setMpCur(mpCur + amount);
        return mpCur - before;
    }

    /** Full health and mana. */
    public synchronized void restoreFully() {
        hpCur = hpMax;
        mpCur = mpMax;
    }

    public synchronized boolean isAlive() { return hpCur > 0; }

    public synchronized boolean needsRegen() {
        return hpCur < hpMax || mpCur < mpMax;
    }

    public synchronized String getCurrentRoom() { return currentRoom; }
    public synchronized void setCurrentRoom(String currentRoom) { this.currentRoom = currentRoom; }

    // Ability score getters
    public synchronized int getStr() { return str; }
    public synchronized int getDex() { return dex; }
    public synchronized int getCon() { return con; }
    public synchronized int getIntel() { return intel; }
    public synchronized int getWis() { return wis; }
    public synchronized int getCha() { return cha; }

    public synchronized void setStr(int str) { this.str = str; }
    public synchronized void setDex(int dex) { this.dex = dex; }
    public synchronized void setCon(int con) { this.con = con; }
    public synchronized void setIntel(int intel) { this.intel = intel; }
    public synchronized void setWis(int wis) { this.wis = wis; }
    public synchronized void setCha(int cha) { this.cha = cha; }

    public synchronized int getArmor() { return armor; }
    public synchronized void setArmor(int armor) { this.armor = armor; }

    /**
     * Standard ability modifier: (score - 10) / 2, rounded toward negative infinity.
     */
    public static int abilityModifier(int score) {
        return Math.floorDiv(score - 10, 2);
    }

    public int getStrMod() { return abilityModifier(getStr()); }
    public int getDexMod() { return abilityModifier(getDex()); }
    public int getConMod() { return abilityModifier(getCon()); }
    public int getIntMod() { return abilityModifier(getIntel()); }
    public int getWisMod() { return abilityModifier(getWis()); }
    public int getChaMod() { return abilityModifier(getCha()); }

    @Override
    public String toString() {
        return String.format("%s (%d/%d HP)", name, getHpCur(), getHpMax());
    }
}
