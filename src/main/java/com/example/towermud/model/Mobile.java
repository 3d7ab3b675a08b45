package com.example.towermud.model;

import com.example.towermud.combat.ThreatTable;
import com.example.towermud.util.Dice;

import java.util.List;
import java.util.Optional;

/**
 * A mobile (NPC/monster) living in the world. Instances are created once
 * and reset in place when they respawn, so the arena index in
 * {@link #getInstanceId()} identifies the same monster for its whole life.
 *
 * Combat state (lifecycle state and threat) is guarded by this object's
 * monitor.
 */
public class Mobile extends GameCharacter {

    private final int instanceId;          // Index in the world's mobile arena
    private final MobileTemplate template;

    // Spawn info
    private final String originRoomId;     // Room the mobile respawns in
    private final int floor;
    private final String areaId;           // Nullable for mobiles outside a boss area

    private MobileState state = MobileState.IDLE;
    private final ThreatTable threat = new ThreatTable();

    // Epoch millis until which crowd control lasts
    private long stunnedUntil;
    private long rootedUntil;

    /**
     * Create a Mobile instance from a template.
     */
    public Mobile(int instanceId, MobileTemplate template, String originRoomId, int floor, String areaId) {
        super(
            template.getName(),
            template.getHpMax(),
            template.getHpMax(), // Start at full HP
            template.getMpMax(),
            template.getMpMax(),
            originRoomId,
            template.getStr(),
            template.getDex(),
            template.getCon(),
            template.getIntel(),
            template.getWis(),
            template.getCha(),
            template.getArmor()
        );
        this.instanceId = instanceId;
        this.template = template;
        this.originRoomId = originRoomId;
        this.floor = floor;
        this.areaId = areaId;
    }

    public int getInstanceId() { return instanceId; }
    public MobileTemplate getTemplate() { return template; }
    public String getTemplateKey() { return template.getKey(); }
    public String getOriginRoomId() { return originRoomId; }
    public int getFloor() { return floor; }
    public String getAreaId() { return areaId; }

    // Cached template data
    public int getLevel() { return template.getLevel(); }
    public boolean isUnique() { return template.isUnique(); }
    public boolean isBoss() { return template.isBoss(); }
    public boolean isAggressive() { return template.isAggressive(); }
    public boolean isAttackable() { return !template.hasBehavior(MobileBehavior.IMMORTAL); }
    public MobType getMobType() { return template.getMobType(); }
    public double getFleeThreshold() { return template.getFleeThreshold(); }
    public int getExperienceValue() { return template.getExperienceValue(); }
    public int getGoldMin() { return template.getGoldMin(); }
    public int getGoldMax() { return template.getGoldMax(); }
    public List<LootEntry> getLootTable() { return template.getLootTable(); }
    public int getRespawnMedian() { return template.getRespawnMedian(); }
    public int getRespawnVariation() { return template.getRespawnVariation(); }
    public int getBaseDamage() { return template.getBaseDamage(); }
    public int getDamageBonus() { return template.getDamageBonus(); }

    /** Target number for player attack rolls. */
    public int getArmorClass() {
        return 10 + getArmor();
    }

    // Lifecycle

    public synchronized MobileState getState() { return state; }

    @Override
    public synchronized boolean isAlive() {
        return state != MobileState.DEAD && super.isAlive();
    }

    public synchronized boolean isInCombat() { return state == MobileState.IN_COMBAT; }

    /** Alive, not fighting and not running away. */
    public synchronized boolean isIdle() {
        return state == MobileState.IDLE && super.isAlive();
    }

    /**
     * Add an attacker to this mobile's fight. A fleeing mobile that is
     * attacked again turns and fights.
     */
    public synchronized void engage(String attacker) {
        if (state == MobileState.DEAD) return;
        threat.engage(attacker);
        state = MobileState.IN_COMBAT;
    }

    public synchronized void addThreat(String attacker, int amount) {
        if (state == MobileState.DEAD) return;
        threat.add(attacker, amount);
        state = MobileState.IN_COMBAT;
    }

    public synchronized int getThreat(String attacker) {
        return threat.get(attacker);
    }

    /** True until the attacker has landed damage on this mobile. */
    public synchronized boolean isSneakAttackEligible(String attacker) {
        return threat.get(attacker) == 0;
    }

    public synchronized Optional<String> highestThreatTarget() {
        return threat.highestThreatTarget();
    }

    public synchronized boolean isEngagedWith(String attacker) {
        return threat.contains(attacker);
    }

    /** Engaged attackers in engagement order. */
    public synchronized List<String> getAttackers() {
        return threat.attackers();
    }

    /**
     * Drop one attacker. With nobody left the mobile leaves combat.
     */
    public synchronized void disengage(String attacker) {
        threat.remove(attacker);
        if (threat.isEmpty() && state == MobileState.IN_COMBAT) {
            state = MobileState.IDLE;
        }
    }

    /**
     * Drop every attacker and go idle.
     * @return the attackers that were engaged, in engagement order
     */
    public synchronized List<String> disengageAll() {
        List<String> attackers = threat.attackers();
        threat.clear();
        if (state != MobileState.DEAD) {
            state = MobileState.IDLE;
        }
        return attackers;
    }

    /**
     * Break off combat and run. Threat is wiped so nobody keeps the mobile targeted.
     * @return the attackers that were engaged, in engagement order
     */
    public synchronized List<String> startFleeing() {
        List<String> attackers = threat.attackers();
        threat.clear();
        state = MobileState.FLEEING;
        return attackers;
    }

    /** A fleeing mobile that has recovered returns to idle. */
    public synchronized boolean calmDown() {
        if (state != MobileState.FLEEING) return false;
        state = MobileState.IDLE;
        return true;
    }

    /**
     * Mark the mobile dead.
     * @return the attackers that were engaged at the moment of death, in engagement order
     */
    public synchronized List<String> markDead() {
        List<String> attackers = threat.attackers();
        threat.clear();
        state = MobileState.DEAD;
        return attackers;
    }

    /**
     * Restore the mobile for respawn: full health and mana, threat cleared,
     * crowd control cleared, idle, back in its origin room.
     */
    public synchronized void reset() {
        restoreFully();
        threat.clear();
        stunnedUntil = 0;
        rootedUntil = 0;
        state = MobileState.IDLE;
        setCurrentRoom(originRoomId);
    }

    // Damage

    /**
     * Apply physical damage after armor (minimum 1). Health clamps at 0.
     * @return damage actually taken
     */
    public synchronized int takeDamage(int damage) {
        int actual = Math.max(1, damage - getArmor());
        setHpCur(getHpCur() - actual);
        return actual;
    }

    /** 1d(baseDamage) + damageBonus, minimum 1. */
    public int rollDamage(Dice dice) {
        return Math.max(1, dice.roll(getBaseDamage()) + getDamageBonus());
    }

    // Crowd control

    public synchronized void stun(long durationMs, long now) {
        stunnedUntil = now + durationMs;
    }

    public synchronized boolean isStunned(long now) {
        return now < stunnedUntil;
    }

    public synchronized void root(long durationMs, long now) {
        rootedUntil = now + durationMs;
    }

    public synchronized boolean isRooted(long now) {
        return now < rootedUntil;
    }

    /** Health at or below the flee threshold. Ignores the random chance roll. */
    public synchronized boolean isBelowFleeThreshold() {
        double threshold = getFleeThreshold();
        if (threshold <= 0) return false;
        return (double) getHpCur() / getHpMax() <= threshold;
    }

    /**
     * Whether the mobile tries to flee this round: not a boss, not rooted,
     * below its flee threshold, and the flee chance roll succeeds.
     */
    public boolean shouldFlee(Dice dice, double fleeChance, long now) {
        if (isBoss()) return false;
        if (isRooted(now)) return false;
        if (!isBelowFleeThreshold()) return false;
        return dice.chance(fleeChance);
    }

    @Override
    public String toString() {
        return String.format("%s#%d (%d/%d HP, %s)", getName(), instanceId, getHpCur(), getHpMax(), getState());
    }
}
