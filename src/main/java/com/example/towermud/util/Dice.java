package com.example.towermud.util;

import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dice rolling over an injectable Random so combat can be replayed in tests.
 */
public class Dice {

    private static final Pattern NOTATION = Pattern.compile("^(\\d+)d(\\d+)([+-]\\d+)?$");

    private final Random rng;

    public Dice() {
        this(new Random());
    }

    public Dice(Random rng) {
        this.rng = rng;
    }

    public Random random() {
        return rng;
    }

    /** Roll one die with the given number of sides (1..sides). Sides below 1 roll 0. */
    public int roll(int sides) {
        if (sides < 1) return 0;
        return rng.nextInt(sides) + 1;
    }

    /** Roll n dice with the given number of sides and sum them. */
    public int roll(int n, int sides) {
        int total = 0;
        for (int i = 0; i < n; i++) {
            total += roll(sides);
        }
        return total;
    }

    public int d20() {
        return roll(20);
    }

    /**
     * Roll dice notation such as "1d6", "2d4+1" or "1d8-2".
     * Returns 0 for null or malformed notation.
     */
    public int roll(String notation) {
        if (notation == null) return 0;
        Matcher m = NOTATION.matcher(notation.trim().toLowerCase());
        if (!m.matches()) return 0;
        int count = Integer.parseInt(m.group(1));
        int sides = Integer.parseInt(m.group(2));
        int bonus = m.group(3) == null ? 0 : Integer.parseInt(m.group(3));
        return roll(count, sides) + bonus;
    }

    /** Uniform integer in [min, max]; returns min when max <= min. */
    public int between(int min, int max) {
        if (max <= min) return min;
        return min + rng.nextInt(max - min + 1);
    }

    /** True with the given probability (0.0 - 1.0). */
    public boolean chance(double probability) {
        return rng.nextDouble() < probability;
    }

    /** Percentage roll in [0, 100). */
    public double percent() {
        return rng.nextDouble() * 100.0;
    }
}
