package com.example.towermud.world;

/**
 * Exit directions. Up and down are vertical and connect floors.
 */
public enum Direction {
    NORTH("n"),
    EAST("e"),
    SOUTH("s"),
    WEST("w"),
    UP("u"),
    DOWN("d");

    private final String shortName;

    Direction(String shortName) {
        this.shortName = shortName;
    }

    public String getShortName() {
        return shortName;
    }

    public String getDisplayName() {
        return name().toLowerCase();
    }

    public boolean isVertical() {
        return this == UP || this == DOWN;
    }

    /**
     * Parse "north", "n", "NORTH" and so on. Returns null when unrecognized.
     */
    public static Direction fromString(String str) {
        if (str == null || str.isEmpty()) return null;
        String s = str.trim().toLowerCase();
        for (Direction d : values()) {
            if (d.shortName.equals(s) || d.getDisplayName().equals(s)) {
                return d;
            }
        }
        return null;
    }
}
