package com.example.towermud.util;

/**
 * Experience curve for player levels.
 */
public final class Leveling {

    public static final int MAX_PLAYER_LEVEL = 50;

    private Leveling() {}

    /**
     * Total experience required to reach the given level: 100 * level^1.5.
     * Level 1 (and below) needs nothing.
     */
    public static int xpForLevel(int level) {
        if (level <= 1) return 0;
        return (int) (100 * Math.pow(level, 1.5));
    }

    /** Experience needed to go from currentLevel to the next; 0 at the cap. */
    public static int xpToNextLevel(int currentLevel) {
        if (currentLevel >= MAX_PLAYER_LEVEL) return 0;
        return xpForLevel(currentLevel + 1) - xpForLevel(currentLevel);
    }
}
