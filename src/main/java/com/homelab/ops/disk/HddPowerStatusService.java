package com.homelab.ops.disk;

import com.homelab.ops.backend.BackendException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * HDD power status report: current state per disk, statistics for a duration,
 * and when each disk last spun up or down.
 *
 * <p>The current-state query is the only mandatory step. Inventory, statistics and
 * transition history degrade to reduced output when their queries fail.
 */
@ApplicationScoped
public class HddPowerStatusService {

    private static final Logger LOG = Logger.getLogger(HddPowerStatusService.class);

    private static final DateTimeFormatter TRANSITION_TIME =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    public static final String DEFAULT_DURATION = "24h";

    @Inject
    MetricsQueryClient metrics;

    @Inject
    InventoryClient inventory;

    @Inject
    TransitionLocator locator;

    @Inject
    Clock clock;

    /**
     * Build the report.
     *
     * @param duration statistics window, e.g. {@code "24h"}, {@code "3d"}, {@code "1w"}
     * @param pool ZFS pool to restrict to, or {@code null} for all HDDs
     * @throws ToolFailureException for an invalid duration, an unreachable metrics backend,
     *         or when no power state series exist
     */
    public String getHddPowerStatus(String duration, String pool) {
        long durationSeconds = Durations.requirePositiveSeconds(duration);
        String selector = PowerStateSelector.forPool(pool);
        LOG.infof("🔍 HDD power status: duration=%s, pool=%s", duration, pool);

        // Step 1: current states (mandatory)
        List<CurrentState> currentStates;
        try {
            currentStates = metrics.instantQuery(selector);
        } catch (BackendException e) {
            LOG.errorf(e, "❌ Current power state query failed: %s", selector);
            throw ToolFailureException.backend(e.getMessage(), e);
        }
        if (currentStates.isEmpty()) {
            throw ToolFailureException.backend(
                "No disk_power_state metrics found. Check that disk-status-exporter is running on TrueNAS.", null);
        }

        // Step 2: inventory names (optional)
        Map<String, DiskIdentity> disks = loadDiskLookup();

        List<String> lines = new ArrayList<>();
        lines.add("HDD Power Status:");
        lines.add("");
        appendCurrentStates(lines, currentStates, disks);

        // Step 3: statistics for the requested duration (optional)
        Map<String, PeriodStats> stats = loadPeriodStats(selector, durationSeconds);
        if (!stats.isEmpty()) {
            appendPeriodStats(lines, duration.trim(), stats, currentStates, disks);
        }

        // Step 4: last transition per disk (optional)
        lines.add("");
        lines.add("Last power state change:");
        appendTransitions(lines, pool, currentStates, disks);

        LOG.infof("✅ HDD power status: %d disk(s), %d with period stats", currentStates.size(), stats.size());
        return String.join("\n", lines);
    }

    private Map<String, DiskIdentity> loadDiskLookup() {
        if (!inventory.isConfigured()) {
            LOG.debug("Disk inventory not configured; showing device ids only");
            return Map.of();
        }
        try {
            return DiskCrossReference.buildLookup(inventory.listDisks());
        } catch (RuntimeException e) {
            LOG.warnf(e, "⚠️ Failed to fetch disk inventory; showing device ids only");
            return Map.of();
        }
    }

    private Map<String, PeriodStats> loadPeriodStats(String selector, long durationSeconds) {
        try {
            long end = clock.instant().getEpochSecond();
            List<DeviceSeries> series = metrics.rangeQuery(
                selector, end - durationSeconds, end, QuerySteps.forDuration(durationSeconds));
            Map<String, PeriodStats> stats = new LinkedHashMap<>();
            for (DeviceSeries device : series) {
                stats.put(device.getDeviceId(), TransitionAnalyzer.periodStats(device.getSamples()));
            }
            return stats;
        } catch (RuntimeException e) {
            LOG.warnf(e, "⚠️ Failed to query power state statistics for %ds", durationSeconds);
            return Map.of();
        }
    }

    private void appendCurrentStates(List<String> lines, List<CurrentState> states, Map<String, DiskIdentity> disks) {
        List<String> active = new ArrayList<>();
        List<String> standby = new ArrayList<>();
        List<String> other = new ArrayList<>();

        for (CurrentState state : states) {
            String line = String.format("  %s - %s%s",
                diskName(disks, state.getDeviceId()),
                PowerStates.describe(state.getValue()),
                poolSuffix(state.getPool()));
            switch (state.group()) {
                case ACTIVE:
                    active.add(line);
                    break;
                case STANDBY:
                    standby.add(line);
                    break;
                default:
                    other.add(line);
                    break;
            }
        }

        appendGroup(lines, "Spun up", active);
        appendGroup(lines, "In standby", standby);
        appendGroup(lines, "Other", other);
    }

    private static void appendGroup(List<String> lines, String title, List<String> entries) {
        if (entries.isEmpty()) {
            return;
        }
        if (!lines.get(lines.size() - 1).isEmpty()) {
            lines.add("");
        }
        lines.add(String.format("%s (%d):", title, entries.size()));
        lines.addAll(entries);
    }

    private void appendPeriodStats(List<String> lines, String duration, Map<String, PeriodStats> stats,
                                   List<CurrentState> states, Map<String, DiskIdentity> disks) {
        Map<String, String> poolByDevice = new HashMap<>();
        for (CurrentState state : states) {
            poolByDevice.put(state.getDeviceId(), state.getPool());
        }

        int total = 0;
        for (PeriodStats s : stats.values()) {
            total += s.getChangeCount();
        }
        lines.add("");
        lines.add(String.format("Last %s: %d state change(s) total", duration, total));

        for (Map.Entry<String, PeriodStats> entry : stats.entrySet()) {
            String deviceId = entry.getKey();
            PeriodStats s = entry.getValue();
            TimeInState time = s.getTimeInState();
            String errorPart = time.getErrorPct() > 0
                ? String.format(Locale.ROOT, ", error %.1f%%", time.getErrorPct())
                : "";
            lines.add(String.format(Locale.ROOT, "  %s%s - %d change(s), standby %.1f%%, active %.1f%%%s",
                diskName(disks, deviceId),
                poolSuffix(poolByDevice.getOrDefault(deviceId, "")),
                s.getChangeCount(),
                time.getStandbyPct(),
                time.getActivePct(),
                errorPart));
        }
    }

    private void appendTransitions(List<String> lines, String pool, List<CurrentState> states,
                                   Map<String, DiskIdentity> disks) {
        Optional<TransitionScan> result;
        try {
            result = locator.scan(pool);
        } catch (RuntimeException e) {
            LOG.warnf(e, "⚠️ Failed to query transition history");
            lines.add("  Could not determine transition history (Prometheus query failed).");
            return;
        }

        if (result.isEmpty()) {
            lines.add("  No power state changes detected in the last 7 days. "
                + "All disks have been in their current state for at least 7 days.");
            return;
        }

        TransitionScan scan = result.get();
        String window = scan.getWindow().getLabel();
        // the window moved between the two passes and the change fell out of it
        if (scan.getTransitions().isEmpty()) {
            LOG.warnf("⚠️ State change found within %s but not on re-query", window);
            lines.add("  Changes detected in the last " + window + " but could not pinpoint exact times.");
            return;
        }

        Set<String> reported = new HashSet<>();
        for (TransitionEvent event : scan.getTransitions()) {
            lines.add(String.format("  %s - %s (%s → %s)",
                diskName(disks, event.getDeviceId()),
                TRANSITION_TIME.format(Instant.ofEpochMilli((long) (event.getTimestamp() * 1000))),
                PowerStates.describe(event.getFromValue()),
                PowerStates.describe(event.getToValue())));
            reported.add(event.getFingerprint().isEmpty() ? event.getDeviceId() : event.getFingerprint());
        }

        Set<String> stable = new HashSet<>();
        for (String deviceId : scan.getStableDevices()) {
            stable.add(deviceKey(deviceId));
        }
        for (CurrentState state : states) {
            String key = deviceKey(state.getDeviceId());
            if (!reported.add(key)) {
                continue;
            }
            String note = stable.contains(key)
                ? "no change in the last " + window
                : "no data in the last " + window;
            lines.add(String.format("  %s - %s", diskName(disks, state.getDeviceId()), note));
        }
    }

    private static String diskName(Map<String, DiskIdentity> disks, String deviceId) {
        return DiskCrossReference.formatDiskName(DiskCrossReference.find(disks, deviceId), deviceId);
    }

    private static String poolSuffix(String pool) {
        return pool == null || pool.isEmpty() ? "" : " [pool: " + pool + "]";
    }

    private static String deviceKey(String deviceId) {
        String fingerprint = DiskCrossReference.extractFingerprint(deviceId);
        return fingerprint.isEmpty() ? deviceId : fingerprint;
    }
}
