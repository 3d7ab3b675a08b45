package com.example.towermud.event;

/**
 * Creates additional mobiles on a tower floor.
 */
public interface MobSpawner {

    /**
     * Spawn up to {@code count} mobiles somewhere on the floor.
     * @return how many were actually created
     */
    int spawnOnFloor(int floor, int count);
}
