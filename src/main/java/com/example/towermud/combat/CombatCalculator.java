package com.example.towermud.combat;

import com.example.towermud.model.CharacterClass;
import com.example.towermud.model.Item;
import com.example.towermud.model.MobType;
import com.example.towermud.model.Mobile;
import com.example.towermud.model.Player;
import com.example.towermud.util.Dice;

/**
 * Attack and damage formulas for player attacks.
 *
 * Attack roll: d20 + modifier against the mobile's armor class (10 + armor).
 * The modifier is STR for melee, DEX for ranged, and the better of the two
 * for finesse weapons. Damage is the weapon's dice (1d4 unarmed) plus the
 * same modifier, plus class bonuses.
 */
public class CombatCalculator {

    static final String UNARMED_DICE = "1d4";

    private final Dice dice;

    public CombatCalculator(Dice dice) {
        this.dice = dice;
    }

    /** Attack modifier and the ability it came from. */
    public record AttackModifier(int value, String stat) { }

    /** Total of an attack roll plus a readable breakdown, e.g. "d20+3(STR) = 17". */
    public record AttackRoll(int total, String breakdown) { }

    public AttackModifier attackModifier(Player p) {
        Item weapon = p.getWeapon();
        int str = p.getStrMod();
        int dex = p.getDexMod();
        if (weapon != null && weapon.isRanged()) {
            return new AttackModifier(dex, "DEX");
        }
        if (weapon != null && weapon.isFinesse() && dex > str) {
            return new AttackModifier(dex, "DEX");
        }
        return new AttackModifier(str, "STR");
    }

    public AttackRoll rollAttack(Player p) {
        int d20 = dice.d20();
        AttackModifier mod = attackModifier(p);
        int total = d20 + mod.value();
        String breakdown = mod.value() >= 0
            ? String.format("d20+%d(%s) = %d", mod.value(), mod.stat(), total)
            : String.format("d20%d(%s) = %d", mod.value(), mod.stat(), total);
        return new AttackRoll(total, breakdown);
    }

    public static boolean isHit(int attackTotal, int armorClass) {
        return attackTotal >= armorClass;
    }

    /** Weapon dice (or unarmed 1d4) plus the attack modifier. */
    public int rollBaseDamage(Player p) {
        Item weapon = p.getWeapon();
        String notation = weapon != null && weapon.isWeapon() ? weapon.getDamageDice() : UNARMED_DICE;
        return dice.roll(notation) + attackModifier(p).value();
    }

    /**
     * Full damage of a landed hit before the mobile's armor is applied.
     * Never less than 1.
     *
     * @param sneakAttack whether the attacker has not yet damaged this mobile
     */
    public int rollDamageAgainst(Player p, Mobile target, boolean sneakAttack) {
        int base = rollBaseDamage(p);
        Item weapon = p.getWeapon();
        boolean ranged = weapon != null && weapon.isRanged();
        CharacterClass cls = p.getCharacterClass();
        int level = p.getLevel();
        int bonus = 0;

        if (cls == CharacterClass.WARRIOR && !ranged) {
            bonus += warriorMeleeBonus(level);
        }
        if (cls == CharacterClass.RANGER && ranged) {
            bonus += rangerRangedBonus(level);
        }
        // Favored enemy: +25% vs beasts, at least 1
        if (cls == CharacterClass.RANGER && target != null && target.getMobType() == MobType.BEAST) {
            bonus += Math.max(1, (base + bonus) / 4);
        }
        if (cls == CharacterClass.PALADIN && target != null
            && (target.getMobType() == MobType.UNDEAD || target.getMobType() == MobType.DEMON)) {
            bonus += 2;
        }
        if (cls == CharacterClass.ROGUE && sneakAttack) {
            bonus += dice.roll(sneakAttackDice(level), 6);
        }
        return Math.max(1, base + bonus);
    }

    public static int warriorMeleeBonus(int level) {
        return level / 3;
    }

    public static int rangerRangedBonus(int level) {
        return 2 + level / 3;
    }

    /** Number of d6 a rogue's sneak attack adds: 1 at level 1, 2 at level 5, and so on. */
    public static int sneakAttackDice(int level) {
        return 1 + level / 5;
    }

    public static String attackVerb(Player p) {
        Item weapon = p.getWeapon();
        return weapon != null && weapon.isRanged() ? "shoot at" : "swing at";
    }

    public static String attackVerbThirdPerson(Player p) {
        Item weapon = p.getWeapon();
        return weapon != null && weapon.isRanged() ? "shoots at" : "swings at";
    }
}
