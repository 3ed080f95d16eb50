package com.homelab.ops.disk;

/**
 * Share of elapsed time spent in each {@link StateGroup}, as percentages with one decimal.
 */
public final class TimeInState {

    public static final TimeInState EMPTY = new TimeInState(0.0, 0.0, 0.0);

    private final double activePct;
    private final double standbyPct;
    private final double errorPct;

    public TimeInState(double activePct, double standbyPct, double errorPct) {
        this.activePct = activePct;
        this.standbyPct = standbyPct;
        this.errorPct = errorPct;
    }

    public double getActivePct() {
        return activePct;
    }

    public double getStandbyPct() {
        return standbyPct;
    }

    public double getErrorPct() {
        return errorPct;
    }

    @Override
    public String toString() {
        return "active=" + activePct + "%, standby=" + standbyPct + "%, error=" + errorPct + "%";
    }
}
