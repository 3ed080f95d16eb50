package com.homelab.ops.disk;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Range query result for one disk. Samples are sorted by timestamp on construction
 * so the analyzer never depends on the order the backend returned them in.
 */
public final class DeviceSeries {

    private final String deviceId;
    private final String pool;
    private final List<RawSample> samples;

    public DeviceSeries(String deviceId, String pool, List<RawSample> samples) {
        this.deviceId = deviceId;
        this.pool = pool != null ? pool : "";
        List<RawSample> sorted = new ArrayList<>(samples);
        sorted.sort(Comparator.comparingDouble(RawSample::getTimestamp));
        this.samples = List.copyOf(sorted);
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getPool() {
        return pool;
    }

    public List<RawSample> getSamples() {
        return samples;
    }
}
