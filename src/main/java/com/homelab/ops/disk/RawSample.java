package com.homelab.ops.disk;

/**
 * One point of a power-state series: epoch seconds and the raw state value.
 */
public final class RawSample {

    private final double timestamp;
    private final double value;

    public RawSample(double timestamp, double value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    public double getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public StateGroup group() {
        return PowerStates.classify(value);
    }

    @Override
    public String toString() {
        return "[" + timestamp + ", " + value + "]";
    }
}
