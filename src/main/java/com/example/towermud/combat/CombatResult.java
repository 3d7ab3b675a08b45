package com.example.towermud.combat;

/**
 * Outcome of one attack resolved by the combat tick.
 */
public class CombatResult {

    public enum ResultType {
        HIT,            // Damage dealt, target still standing
        MISS,           // Attack roll below armor class
        DEATH,          // Target was killed
        FLEE,           // Mobile ran instead of attacking
        SKIPPED,        // Stunned, or target dropped this round
        VANISHED        // Target no longer reachable; combat ended
    }

    private final ResultType type;
    private final String attacker;
    private final String target;
    private final int damage;

    private int attackRoll;
    private int armorClass;
    private boolean sneakAttack;
    private String destinationRoom;

    private CombatResult(ResultType type, String attacker, String target, int damage) {
        this.type = type;
        this.attacker = attacker;
        this.target = target;
        this.damage = damage;
    }

    // Static factory methods

    public static CombatResult hit(String attacker, String target, int damage) {
        return new CombatResult(ResultType.HIT, attacker, target, damage);
    }

    public static CombatResult miss(String attacker, String target) {
        return new CombatResult(ResultType.MISS, attacker, target, 0);
    }

    public static CombatResult death(String attacker, String target, int damage) {
        return new CombatResult(ResultType.DEATH, attacker, target, damage);
    }

    public static CombatResult flee(String mobile, String destinationRoom) {
        return new CombatResult(ResultType.FLEE, mobile, null, 0).withDestination(destinationRoom);
    }

    public static CombatResult skipped(String attacker) {
        return new CombatResult(ResultType.SKIPPED, attacker, null, 0);
    }

    public static CombatResult vanished(String attacker, String target) {
        return new CombatResult(ResultType.VANISHED, attacker, target, 0);
    }

    // Fluent setters

    public CombatResult withRoll(int attackRoll, int armorClass) {
        this.attackRoll = attackRoll;
        this.armorClass = armorClass;
        return this;
    }

    public CombatResult withSneakAttack(boolean sneakAttack) {
        this.sneakAttack = sneakAttack;
        return this;
    }

    public CombatResult withDestination(String roomId) {
        this.destinationRoom = roomId;
        return this;
    }

    public ResultType getType() { return type; }
    public String getAttacker() { return attacker; }
    public String getTarget() { return target; }
    public int getDamage() { return damage; }
    public int getAttackRoll() { return attackRoll; }
    public int getArmorClass() { return armorClass; }
    public boolean isSneakAttack() { return sneakAttack; }
    public String getDestinationRoom() { return destinationRoom; }

    public boolean isHit() {
        return type == ResultType.HIT || type == ResultType.DEATH;
    }

    public boolean isKill() {
        return type == ResultType.DEATH;
    }

    @Override
    public String toString() {
        return "CombatResult{" + type + ", " + attacker + " -> " + target + ", damage=" + damage + "}";
    }
}
