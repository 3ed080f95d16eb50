package com.homelab.ops.disk;

import com.homelab.ops.backend.BackendException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Finds when each disk last changed power state.
 *
 * <p>Range queries widen through {@link TransitionWindow} (1h, 6h, 24h, 7d) and stop at the first
 * window where any disk changed group. That window is then queried again to pinpoint the newest
 * transition per disk. Both passes are sequential; each query depends on the one before it.
 */
@ApplicationScoped
public class TransitionLocator {

    private static final Logger LOG = Logger.getLogger(TransitionLocator.class);

    @Inject
    MetricsQueryClient metrics;

    @Inject
    Clock clock;

    /**
     * Empty when no disk changed state in the last 7 days.
     */
    public Optional<TransitionWindowMatch> findTransitionWindow(String pool) {
        String selector = PowerStateSelector.forPool(pool);
        for (TransitionWindow window : TransitionWindow.values()) {
            List<DeviceSeries> series;
            try {
                series = queryWindow(selector, window);
            } catch (BackendException e) {
                if (e.getKind() != BackendException.Kind.INVALID_RESPONSE) {
                    throw e;
                }
                LOG.warnf("⚠️ Skipping %s window: %s", window.getLabel(), e.getMessage());
                continue;
            }

            Map<String, Integer> counts = new LinkedHashMap<>();
            boolean changed = false;
            for (DeviceSeries device : series) {
                int count = TransitionAnalyzer.countGroupTransitions(device.getSamples());
                counts.put(device.getDeviceId(), count);
                changed |= count > 0;
            }
            if (changed) {
                LOG.debugf("Found state changes within %s: %s", window.getLabel(), counts);
                return Optional.of(new TransitionWindowMatch(window, counts));
            }
            LOG.debugf("No state changes within %s across %d disk(s)", window.getLabel(), series.size());
        }
        return Optional.empty();
    }

    public TransitionScan locateExactTransitions(TransitionWindow window, String pool) {
        List<DeviceSeries> series = queryWindow(PowerStateSelector.forPool(pool), window);

        List<TransitionEvent> transitions = new ArrayList<>();
        List<String> stable = new ArrayList<>();
        List<String> withoutData = new ArrayList<>();
        for (DeviceSeries device : series) {
            if (device.getSamples().size() < 2) {
                withoutData.add(device.getDeviceId());
                continue;
            }
            Optional<TransitionEvent> last = TransitionAnalyzer.findLastTransition(device);
            if (last.isPresent()) {
                transitions.add(last.get());
            } else {
                stable.add(device.getDeviceId());
            }
        }
        return new TransitionScan(window, transitions, stable, withoutData);
    }

    /**
     * Locate, then pinpoint. Empty means every disk has been stable for at least 7 days.
     */
    public Optional<TransitionScan> scan(String pool) {
        Optional<TransitionWindowMatch> match = findTransitionWindow(pool);
        if (match.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(locateExactTransitions(match.get().getWindow(), pool));
    }

    private List<DeviceSeries> queryWindow(String selector, TransitionWindow window) {
        long end = clock.instant().getEpochSecond();
        long start = end - window.getSeconds();
        return metrics.rangeQuery(selector, start, end, window.step());
    }
}
