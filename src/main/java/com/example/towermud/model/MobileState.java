package com.example.towermud.model;

/**
 * Lifecycle state of a mobile.
 */
public enum MobileState {
    IDLE("Idle"),
    IN_COMBAT("In Combat"),
    FLEEING("Fleeing"),
    DEAD("Dead");

    private final String displayName;

    MobileState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
