package com.homelab.ops.disk;

import com.homelab.ops.backend.BackendException;
import java.util.List;

/**
 * Time-series backend holding {@code disk_power_state}.
 */
public interface MetricsQueryClient {

    /**
     * @throws BackendException on connect, timeout, HTTP status or malformed response failures
     */
    List<CurrentState> instantQuery(String selector);

    /**
     * @param start epoch seconds
     * @param end epoch seconds
     * @param step Prometheus duration, e.g. {@code 15s}
     * @throws BackendException on connect, timeout, HTTP status or malformed response failures
     */
    List<DeviceSeries> rangeQuery(String selector, long start, long end, String step);
}
