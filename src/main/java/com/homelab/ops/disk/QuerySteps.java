package com.homelab.ops.disk;

/**
 * Range query resolution for a window length.
 */
public final class QuerySteps {

    /** Prometheus refuses range queries above 11,000 points per series. */
    static final long MAX_POINTS = 11_000L;

    private QuerySteps() {
    }

    public static String forDuration(long seconds) {
        if (seconds <= 3_600L) {
            return "15s";
        }
        if (seconds <= 86_400L) {
            return "60s";
        }
        if (seconds / 300L <= MAX_POINTS) {
            return "5m";
        }
        long step = seconds / MAX_POINTS + (seconds % MAX_POINTS == 0 ? 0 : 1);
        return step + "s";
    }
}
