package com.example.towermud.model;

import com.example.towermud.util.Leveling;
import com.example.towermud.world.MessageSink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A connected player's live character. Persistence of these fields is
 * handled outside the combat engine.
 */
public class Player extends GameCharacter {

    private final CharacterClass characterClass;
    private int level;
    private int experience;
    private int gold;

    private Item weapon;                   // null = unarmed

    // Name of the mobile being fought; empty when not in combat
    private String combatTarget = "";

    private final Set<String> titles = new LinkedHashSet<>();
    private final PlayerStatistics statistics = new PlayerStatistics();

    private volatile MessageSink sink;

    public Player(String name, CharacterClass characterClass, int level,
                  int hpMax, int mpMax, String currentRoom,
                  int str, int dex, int con, int intel, int wis, int cha,
                  int armor) {
        super(name, hpMax, hpMax, mpMax, mpMax, currentRoom, str, dex, con, intel, wis, cha, armor);
        this.characterClass = characterClass == null ? CharacterClass.WARRIOR : characterClass;
        this.level = Math.max(1, level);
        this.experience = Leveling.xpForLevel(this.level);
        this.sink = MessageSink.NONE;
    }

    public CharacterClass getCharacterClass() { return characterClass; }

    public synchronized int getLevel() { return level; }
    public synchronized int getExperience() { return experience; }
    public synchronized int getGold() { return gold; }

    public synchronized void addGold(int amount) {
        if (amount <= 0) return;
        gold += amount;
        statistics.addGoldEarned(amount);
    }

    /**
     * Add experience and apply any level-ups it earns. A single award can
     * cross several levels; health and mana are fully restored on level-up.
     * @return one entry per level gained, in order
     */
    public synchronized List<LevelUpInfo> gainExperience(int xp) {
        if (xp <= 0) return Collections.emptyList();
        experience += xp;
        List<LevelUpInfo> levelUps = new ArrayList<>();
        while (level < Leveling.MAX_PLAYER_LEVEL && experience >= Leveling.xpForLevel(level + 1)) {
            levelUps.add(levelUp());
        }
        return levelUps;
    }

    private LevelUpInfo levelUp() {
        level++;
        int hpGain = Math.max(1, characterClass.getHitDie() / 2 + 1 + getConMod());
        int manaGain = Math.max(0, characterClass.getManaPerLevel() + characterClass.castingModifier(this));
        setHpMax(getHpMax() + hpGain);
        setMpMax(getMpMax() + manaGain);
        restoreFully();
        return new LevelUpInfo(level, hpGain, manaGain);
    }

    public synchronized Item getWeapon() { return weapon; }
    public synchronized void setWeapon(Item weapon) { this.weapon = weapon; }

    // Combat state
    public synchronized String getCombatTarget() { return combatTarget; }

    public synchronized boolean isInCombat() { return !combatTarget.isEmpty(); }

    public synchronized void startCombat(String mobileName) {
        this.combatTarget = mobileName == null ? "" : mobileName;
    }

    public synchronized void endCombat() {
        this.combatTarget = "";
    }

    /**
     * Apply incoming physical damage after armor (minimum 1). Health clamps at 0.
     * @return damage actually taken
     */
    public synchronized int takeDamage(int damage) {
        int actual = Math.max(1, damage - getArmor());
        setHpCur(getHpCur() - actual);
        statistics.addDamageTaken(actual);
        return actual;
    }

    public synchronized void recordDamageDealt(int amount) {
        statistics.addDamageDealt(amount);
    }

    public synchronized void recordKill(String mobileName) {
        statistics.recordKill(mobileName);
    }

    public synchronized void recordDeath() {
        statistics.recordDeath();
    }

    public PlayerStatistics getStatistics() { return statistics; }

    /**
     * Grant a title.
     * @return true if the player did not already have it
     */
    public synchronized boolean addTitle(String title) {
        if (title == null || title.isEmpty()) return false;
        return titles.add(title);
    }

    public synchronized boolean hasTitle(String title) {
        return titles.contains(title);
    }

    public synchronized List<String> getTitles() {
        return new ArrayList<>(titles);
    }

    public MessageSink getSink() { return sink; }

    public void setSink(MessageSink sink) {
        this.sink = sink == null ? MessageSink.NONE : sink;
    }

    /** Fire-and-forget message to this player. */
    public void send(String text) {
        sink.send(text);
    }
}
