package com.homelab.ops.disk;

/**
 * Most recent point where consecutive samples of one disk changed {@link StateGroup}.
 */
public final class TransitionEvent {

    private final String deviceId;
    private final String fingerprint;
    private final double timestamp;
    private final double fromValue;
    private final double toValue;

    public TransitionEvent(String deviceId, double timestamp, double fromValue, double toValue) {
        this.deviceId = deviceId;
        this.fingerprint = DiskCrossReference.extractFingerprint(deviceId);
        this.timestamp = timestamp;
        this.fromValue = fromValue;
        this.toValue = toValue;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public double getTimestamp() {
        return timestamp;
    }

    public double getFromValue() {
        return fromValue;
    }

    public double getToValue() {
        return toValue;
    }
}
