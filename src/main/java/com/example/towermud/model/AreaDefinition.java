package com.example.towermud.model;

/**
 * A boss-gated area: a tower whose final floor boss awards titles.
 * The first player (or group) to clear it earns the first-clear title,
 * everyone after earns the shared one.
 */
public class AreaDefinition {
    private final String id;
    private final String name;
    private final int finalFloor;
    private final String firstClearTitle;
    private final String sharedTitle;
    // Whether clearing this area counts toward the server-wide unlock
    private final boolean countsTowardUnlock;

    public AreaDefinition(String id, String name, int finalFloor, String firstClearTitle, String sharedTitle,
                          boolean countsTowardUnlock) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Area id is required");
        }
        this.id = id;
        this.name = name == null ? id : name;
        this.finalFloor = finalFloor;
        this.firstClearTitle = firstClearTitle;
        this.sharedTitle = sharedTitle;
        this.countsTowardUnlock = countsTowardUnlock;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public int getFinalFloor() { return finalFloor; }
    public String getFirstClearTitle() { return firstClearTitle; }
    public String getSharedTitle() { return sharedTitle; }
    public boolean countsTowardUnlock() { return countsTowardUnlock; }

    @Override
    public String toString() {
        return "AreaDefinition{id=" + id + ", finalFloor=" + finalFloor + "}";
    }
}
