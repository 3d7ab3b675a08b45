package com.example.towermud.combat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-mobile record of who is fighting it and how much threat each
 * attacker has built up. Attackers keep the order in which they engaged,
 * which breaks ties in {@link #highestThreatTarget()}.
 *
 * Not thread-safe on its own: the owning Mobile guards every call with its
 * monitor.
 */
public class ThreatTable {

    private final Map<String, Integer> threat = new LinkedHashMap<>();

    /** Register an attacker with zero threat if not already engaged. */
    public void engage(String attacker) {
        threat.putIfAbsent(attacker, 0);
    }

    /** Add threat for an attacker, engaging them first if needed. Negative amounts are ignored. */
    public void add(String attacker, int amount) {
        engage(attacker);
        if (amount > 0) {
            threat.merge(attacker, amount, Integer::sum);
        }
    }

    /** Current threat for an attacker; 0 when absent. */
    public int get(String attacker) {
        return threat.getOrDefault(attacker, 0);
    }

    public boolean contains(String attacker) {
        return threat.containsKey(attacker);
    }

    /**
     * Attacker with the greatest threat. Equal threat goes to whoever engaged first.
     */
    public Optional<String> highestThreatTarget() {
        String best = null;
        int bestThreat = -1;
        for (Map.Entry<String, Integer> e : threat.entrySet()) {
            if (e.getValue() > bestThreat) {
                best = e.getKey();
                bestThreat = e.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    /** @return true if the attacker was engaged */
    public boolean remove(String attacker) {
        return threat.remove(attacker) != null;
    }

    public void clear() {
        threat.clear();
    }

    /** Engaged attackers in engagement order. */
    public List<String> attackers() {
        return new ArrayList<>(threat.keySet());
    }

    public boolean isEmpty() {
        return threat.isEmpty();
    }

    public int size() {
        return threat.size();
    }

    @Override
    public String toString() {
        return threat.toString();
    }
}
