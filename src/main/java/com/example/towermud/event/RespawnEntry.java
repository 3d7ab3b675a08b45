package com.example.towermud.event;

import com.example.towermud.model.Mobile;

/**
 * A dead mobile waiting to respawn. The deadline is fixed when the entry
 * is created.
 */
public final class RespawnEntry implements Comparable<RespawnEntry> {
    private final Mobile mobile;
    private final long deadline;           // epoch millis

    public RespawnEntry(Mobile mobile, long deadline) {
        this.mobile = mobile;
        this.deadline = deadline;
    }

    public Mobile getMobile() { return mobile; }
    public long getDeadline() { return deadline; }

    public boolean isDue(long now) {
        return now >= deadline;
    }

    @Override
    public int compareTo(RespawnEntry other) {
        int c = Long.compare(this.deadline, other.deadline);
        if (c != 0) return c;
        return Integer.compare(this.mobile.getInstanceId(), other.mobile.getInstanceId());
    }

    @Override
    public String toString() {
        return "RespawnEntry{" + mobile.getName() + "#" + mobile.getInstanceId() + ", deadline=" + deadline + "}";
    }
}
