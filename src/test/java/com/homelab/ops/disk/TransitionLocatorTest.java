package com.homelab.ops.disk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.homelab.ops.backend.BackendException;
import java.net.ConnectException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class TransitionLocatorTest {

    private static final long NOW = Instant.parse("2025-01-01T12:00:00Z").getEpochSecond();
    private static final String SELECTOR = "disk_power_state{type=\"hdd\"}";
    private static final String DISK_A = "/dev/disk/by-id/wwn-0x5000c500eb02b449";
    private static final String DISK_B = "/dev/disk/by-id/wwn-0x5000c500f742ccbf";

    @Mock
    private MetricsQueryClient metrics;

    private TransitionLocator locator;

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        locator = new TransitionLocator();
        locator.metrics = metrics;
        locator.clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
    }

    @Test
    void stopsAtFirstWindowWithAGroupChange() {
        when(metrics.rangeQuery(SELECTOR, NOW - 3_600, NOW, "15s"))
            .thenReturn(List.of(series(DISK_A, NOW - 3_600, 15, 3, 4, 5, 3), series(DISK_B, NOW - 3_600, 15, 0, 0)));
        when(metrics.rangeQuery(SELECTOR, NOW - 21_600, NOW, "60s"))
            .thenReturn(List.of(series(DISK_A, NOW - 21_600, 60, 0, 0, 2, 2), series(DISK_B, NOW - 21_600, 60, 0, 0)));

        Optional<TransitionWindowMatch> match = locator.findTransitionWindow(null);

        assertThat(match).isPresent();
        assertThat(match.get().getWindow()).isEqualTo(TransitionWindow.SIX_HOURS);
        assertThat(match.get().getWindow().getLabel()).isEqualTo("6h");
        assertThat(match.get().getChangeCounts()).containsEntry(DISK_A, 1).containsEntry(DISK_B, 0);

        verify(metrics, never()).rangeQuery(anyString(), eq(NOW - 86_400), anyLong(), anyString());
        verify(metrics, never()).rangeQuery(anyString(), eq(NOW - 604_800), anyLong(), anyString());
    }

    @Test
    void widensInOrderUntilSevenDaysThenGivesUp() {
        when(metrics.rangeQuery(anyString(), anyLong(), anyLong(), anyString()))
            .thenAnswer(inv -> List.of(series(DISK_A, inv.<Long>getArgument(1), 60, 0, 0, 7, 0)));

        Optional<TransitionWindowMatch> match = locator.findTransitionWindow(null);

        assertThat(match).isEmpty();
        InOrder order = inOrder(metrics);
        order.verify(metrics).rangeQuery(SELECTOR, NOW - 3_600, NOW, "15s");
        order.verify(metrics).rangeQuery(SELECTOR, NOW - 21_600, NOW, "60s");
        order.verify(metrics).rangeQuery(SELECTOR, NOW - 86_400, NOW, "60s");
        order.verify(metrics).rangeQuery(SELECTOR, NOW - 604_800, NOW, "5m");
    }

    @Test
    void rejectedWindowQueryMovesOnToTheNextWindow() {
        when(metrics.rangeQuery(SELECTOR, NOW - 3_600, NOW, "15s")).thenThrow(BackendException.invalidResponse(
            "Prometheus", "http://prometheus:9090", "status=error, errorType=timeout, error=query timed out", null));
        when(metrics.rangeQuery(SELECTOR, NOW - 21_600, NOW, "60s"))
            .thenReturn(List.of(series(DISK_A, NOW - 21_600, 60, 0, 2)));

        Optional<TransitionWindowMatch> match = locator.findTransitionWindow(null);

        assertThat(match).isPresent();
        assertThat(match.get().getWindow()).isEqualTo(TransitionWindow.SIX_HOURS);
    }

    @Test
    void unreachableBackendStopsTheSearch() {
        when(metrics.rangeQuery(SELECTOR, NOW - 3_600, NOW, "15s")).thenThrow(BackendException.connect(
            "Prometheus", "http://prometheus:9090", new ConnectException("Connection refused")));

        assertThatThrownBy(() -> locator.findTransitionWindow(null)).isInstanceOf(BackendException.class);
        verify(metrics, never()).rangeQuery(anyString(), eq(NOW - 21_600), anyLong(), anyString());
    }

    @Test
    void poolFilterIsPassedThrough() {
        String tank = "disk_power_state{type=\"hdd\", pool=\"tank\"}";
        when(metrics.rangeQuery(tank, NOW - 3_600, NOW, "15s"))
            .thenReturn(List.of(series(DISK_A, NOW - 3_600, 15, 2, 0)));

        Optional<TransitionWindowMatch> match = locator.findTransitionWindow("tank");

        assertThat(match).isPresent();
        assertThat(match.get().getWindow()).isEqualTo(TransitionWindow.ONE_HOUR);
    }

    @Test
    void pinpointSeparatesChangedStableAndMissingDisks() {
        long start = NOW - 21_600;
        when(metrics.rangeQuery(SELECTOR, start, NOW, "60s")).thenReturn(List.of(
            series(DISK_A, start, 60, 2, 0, 0, 2, 3, 4),
            series(DISK_B, start, 60, 0, 7, 0),
            series("/dev/sdx", start, 60, 2)));

        TransitionScan scan = locator.locateExactTransitions(TransitionWindow.SIX_HOURS, null);

        assertThat(scan.getWindow()).isEqualTo(TransitionWindow.SIX_HOURS);
        assertThat(scan.getTransitions()).hasSize(1);
        TransitionEvent event = scan.getTransitions().get(0);
        assertThat(event.getDeviceId()).isEqualTo(DISK_A);
        assertThat(event.getTimestamp()).isEqualTo(start + 180.0);
        assertThat(event.getFromValue()).isEqualTo(0.0);
        assertThat(event.getToValue()).isEqualTo(2.0);
        assertThat(scan.getStableDevices()).containsExactly(DISK_B);
        assertThat(scan.getDevicesWithoutData()).containsExactly("/dev/sdx");
    }

    @Test
    void scanQueriesSelectedWindowTwice() {
        when(metrics.rangeQuery(SELECTOR, NOW - 3_600, NOW, "15s"))
            .thenReturn(List.of(series(DISK_A, NOW - 3_600, 15, 0, 2)));

        Optional<TransitionScan> scan = locator.scan(null);

        assertThat(scan).isPresent();
        assertThat(scan.get().getWindow()).isEqualTo(TransitionWindow.ONE_HOUR);
        assertThat(scan.get().getTransitions()).extracting(TransitionEvent::getDeviceId).containsExactly(DISK_A);
        verify(metrics, times(2)).rangeQuery(SELECTOR, NOW - 3_600, NOW, "15s");
        verify(metrics, never()).rangeQuery(anyString(), eq(NOW - 21_600), anyLong(), anyString());
    }

    @Test
    void scanIsEmptyWhenNothingChangedForSevenDays() {
        when(metrics.rangeQuery(anyString(), anyLong(), anyLong(), anyString()))
            .thenAnswer(inv -> List.of(series(DISK_A, inv.<Long>getArgument(1), 60, 0, 0, 0)));

        assertThat(locator.scan(null)).isEmpty();
    }

    static DeviceSeries series(String deviceId, long start, long step, double... values) {
        List<RawSample> samples = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            samples.add(new RawSample(start + i * step, values[i]));
        }
        return new DeviceSeries(deviceId, "tank", samples);
    }
}
