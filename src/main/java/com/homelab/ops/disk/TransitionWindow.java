package com.homelab.ops.disk;

/**
 * Windows tried, smallest first, when looking for the latest power state change.
 */
public enum TransitionWindow {
    ONE_HOUR("1h", 3_600L),
    SIX_HOURS("6h", 21_600L),
    ONE_DAY("24h", 86_400L),
    ONE_WEEK("7d", 604_800L);

    private final String label;
    private final long seconds;

    TransitionWindow(String label, long seconds) {
        this.label = label;
        this.seconds = seconds;
    }

    public String getLabel() {
        return label;
    }

    public long getSeconds() {
        return seconds;
    }

    public String step() {
        return QuerySteps.forDuration(seconds);
    }
}
