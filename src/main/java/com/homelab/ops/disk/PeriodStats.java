package com.homelab.ops.disk;

/**
 * Per-disk statistics over a requested duration.
 */
public final class PeriodStats {

    private final int changeCount;
    private final TimeInState timeInState;

    public PeriodStats(int changeCount, TimeInState timeInState) {
        this.changeCount = changeCount;
        this.timeInState = timeInState;
    }

    public int getChangeCount() {
        return changeCount;
    }

    public TimeInState getTimeInState() {
        return timeInState;
    }
}
