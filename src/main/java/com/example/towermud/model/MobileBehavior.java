package com.example.towermud.model;

/**
 * Behaviors that can be assigned to mobile templates.
 */
public enum MobileBehavior {

    AGGRESSIVE("Attacks players on sight"),
    PASSIVE("Won't attack unless attacked first"),
    FEARLESS("Never flees, whatever its health"),
    IMMORTAL("Cannot be attacked");

    private final String description;

    MobileBehavior(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Parse a behavior from a string, case-insensitive.
     */
    public static MobileBehavior fromString(String str) {
        if (str == null || str.isEmpty()) return null;
        try {
            return MobileBehavior.valueOf(str.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
