package com.example.towermud.event;

/**
 * A fixed spawn point: which mobile template to place in which room, and
 * how many of it.
 */
public class SpawnConfig {

    /** Template key of the mobile */
    public final String templateKey;

    /** Room where this spawn occurs */
    public final String roomId;

    /** Number to spawn */
    public final int quantity;

    public SpawnConfig(String templateKey, String roomId, int quantity) {
        if (templateKey == null || templateKey.isEmpty() || roomId == null || roomId.isEmpty()) {
            throw new IllegalArgumentException("Spawn needs a template and a room");
        }
        this.templateKey = templateKey;
        this.roomId = roomId;
        this.quantity = Math.max(1, quantity);
    }

    public SpawnConfig(String templateKey, String roomId) {
        this(templateKey, roomId, 1);
    }

    /**
     * Generate a unique ID for this spawn configuration.
     */
    public String getSpawnId() {
        return "spawn-mob-" + templateKey + "-room-" + roomId;
    }

    @Override
    public String toString() {
        return "SpawnConfig{template=" + templateKey + ", room=" + roomId + ", qty=" + quantity + "}";
    }
}
