package com.homelab.ops.disk;

/**
 * Latest power state of one disk, from an instant query.
 */
public final class CurrentState {

    private final String deviceId;
    private final String pool;
    private final double timestamp;
    private final double value;

    public CurrentState(String deviceId, String pool, double timestamp, double value) {
        this.deviceId = deviceId;
        this.pool = pool != null ? pool : "";
        this.timestamp = timestamp;
        this.value = value;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getPool() {
        return pool;
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
}
