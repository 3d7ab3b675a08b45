package com.example.towermud.combat;

/**
 * Even split of a kill reward between attackers. Integer division: the
 * remainder is not paid to anyone.
 */
public record RewardSplit(int total, int shares, int perShare) {

    public static RewardSplit of(int total, int shares) {
        int t = Math.max(0, total);
        if (shares <= 1) {
            return new RewardSplit(t, Math.max(0, shares), t);
        }
        return new RewardSplit(t, shares, t / shares);
    }

    /** Amount lost to integer division. */
    public int remainder() {
        if (shares <= 1) return 0;
        return total - perShare * shares;
    }

    public boolean isSplit() {
        return shares > 1;
    }
}
