package com.homelab.ops.prometheus;

import com.homelab.ops.backend.BackendException;
import com.homelab.ops.backend.BackendFailures;
import com.homelab.ops.disk.CurrentState;
import com.homelab.ops.disk.DeviceSeries;
import com.homelab.ops.disk.MetricsQueryClient;
import com.homelab.ops.disk.RawSample;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

/**
 * {@link MetricsQueryClient} backed by Prometheus.
 *
 * <p>Responses are validated here; everything past this class works on typed samples.
 */
@ApplicationScoped
public class PrometheusMetricsClient implements MetricsQueryClient {

    private static final Logger LOG = Logger.getLogger(PrometheusMetricsClient.class);

    static final String BACKEND = "Prometheus";
    static final String DEVICE_LABEL = "device_id";
    static final String POOL_LABEL = "pool";

    @Inject
    @RestClient
    PrometheusClient prometheus;

    @ConfigProperty(name = "homelab.prometheus.url")
    String prometheusUrl;

    @ConfigProperty(name = "homelab.prometheus.timeout-seconds", defaultValue = "15")
    int timeoutSeconds;

    @Override
    public List<CurrentState> instantQuery(String selector) {
        LOG.debugf("Instant query: %s", selector);
        PrometheusResponse response = BackendFailures.call(BACKEND, prometheusUrl, timeoutSeconds,
            () -> prometheus.query(selector));

        List<CurrentState> states = new ArrayList<>();
        for (PrometheusResponse.Series series : results(response)) {
            Map<String, String> labels = labels(series);
            List<Object> point = series.getValue();
            if (point == null) {
                throw invalid("instant query series without a value");
            }
            double timestamp = number(point, 0);
            double value = number(point, 1);
            if (!Double.isFinite(value)) {
                value = -1;
            }
            states.add(new CurrentState(
                labels.getOrDefault(DEVICE_LABEL, "unknown"),
                labels.getOrDefault(POOL_LABEL, ""),
                timestamp,
                value));
        }
        return states;
    }

    @Override
    public List<DeviceSeries> rangeQuery(String selector, long start, long end, String step) {
        LOG.debugf("Range query: %s [%d, %d] step=%s", selector, start, end, step);
        PrometheusResponse response = BackendFailures.call(BACKEND, prometheusUrl, timeoutSeconds,
            () -> prometheus.queryRange(selector, start, end, step));

        List<DeviceSeries> result = new ArrayList<>();
        for (PrometheusResponse.Series series : results(response)) {
            Map<String, String> labels = labels(series);
            List<List<Object>> values = series.getValues() != null ? series.getValues() : List.of();
            List<RawSample> samples = new ArrayList<>(values.size());
            for (List<Object> point : values) {
                double value = number(point, 1);
                // NaN marks a gap in the series, not a power state
                if (Double.isFinite(value)) {
                    samples.add(new RawSample(number(point, 0), value));
                }
            }
            result.add(new DeviceSeries(
                labels.getOrDefault(DEVICE_LABEL, "unknown"),
                labels.getOrDefault(POOL_LABEL, ""),
                samples));
        }
        return result;
    }

    private List<PrometheusResponse.Series> results(PrometheusResponse response) {
        if (response == null) {
            throw invalid("empty body");
        }
        if (!response.isSuccess()) {
            throw invalid(String.format("status=%s, errorType=%s, error=%s",
                response.getStatus(), response.getErrorType(), response.getError()));
        }
        if (response.getData() == null || response.getData().getResult() == null) {
            return List.of();
        }
        return response.getData().getResult();
    }

    private static Map<String, String> labels(PrometheusResponse.Series series) {
        return series.getMetric() != null ? series.getMetric() : Map.of();
    }

    private double number(List<Object> point, int index) {
        if (point == null || point.size() != 2 || point.get(index) == null) {
            throw invalid("expected [timestamp, value] but got " + point);
        }
        Object raw = point.get(index);
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        try {
            return Double.parseDouble(raw.toString());
        } catch (NumberFormatException e) {
            throw BackendException.invalidResponse(BACKEND, prometheusUrl, "not a number: " + raw, e);
        }
    }

    private BackendException invalid(String detail) {
        return BackendException.invalidResponse(BACKEND, prometheusUrl, detail, null);
    }
}
