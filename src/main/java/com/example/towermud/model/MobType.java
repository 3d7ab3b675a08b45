package com.example.towermud.model;

/**
 * Creature type of a mobile. Drives class bonuses (paladin smite) and the
 * default flee threshold for templates that do not set one.
 */
public enum MobType {
    UNKNOWN(0.12),
    BEAST(0.15),
    HUMANOID(0.12),
    UNDEAD(0.0),
    DEMON(0.05),
    CONSTRUCT(0.0),
    GIANT(0.10);

    private final double defaultFleeThreshold;

    MobType(double defaultFleeThreshold) {
        this.defaultFleeThreshold = defaultFleeThreshold;
    }

    /** Fraction of max health at or below which the mobile considers fleeing (0 = never). */
    public double getDefaultFleeThreshold() {
        return defaultFleeThreshold;
    }

    /**
     * Parse a mob type from a string, case-insensitive. Unknown values map to UNKNOWN.
     */
    public static MobType fromString(String str) {
        if (str == null || str.isEmpty()) return UNKNOWN;
        try {
            return MobType.valueOf(str.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
