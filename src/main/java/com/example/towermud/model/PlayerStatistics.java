package com.example.towermud.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running combat statistics for a player.
 */
public class PlayerStatistics {
    private final Map<String, Integer> killsByMobile = new LinkedHashMap<>();
    private int deaths;
    private long damageDealt;
    private long damageTaken;
    private long goldEarned;

    public synchronized void recordKill(String mobileName) {
        killsByMobile.merge(mobileName, 1, Integer::sum);
    }

    public synchronized void recordDeath() { deaths++; }
    public synchronized void addDamageDealt(int amount) { damageDealt += Math.max(0, amount); }
    public synchronized void addDamageTaken(int amount) { damageTaken += Math.max(0, amount); }
    public synchronized void addGoldEarned(int amount) { goldEarned += Math.max(0, amount); }

    public synchronized int getKills(String mobileName) {
        return killsByMobile.getOrDefault(mobileName, 0);
    }

    public synchronized int getTotalKills() {
        int total = 0;
        for (int n : killsByMobile.values()) total += n;
        return total;
    }

    public synchronized Map<String, Integer> getKillsByMobile() {
        return new LinkedHashMap<>(killsByMobile);
    }

    public synchronized int getDeaths() { return deaths; }
    public synchronized long getDamageDealt() { return damageDealt; }
    public synchronized long getDamageTaken() { return damageTaken; }
    public synchronized long getGoldEarned() { return goldEarned; }
}
