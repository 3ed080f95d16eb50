package com.homelab.ops.disk;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Transition counting and time-in-state over an ordered power-state series.
 *
 * <p>Only changes of {@link StateGroup} count. A disk moving between idle_a, idle_b and idle_c
 * is still the same "active" disk.
 */
public final class TransitionAnalyzer {

    private TransitionAnalyzer() {
    }

    public static int countGroupTransitions(List<RawSample> samples) {
        if (samples.size() < 2) {
            return 0;
        }
        int transitions = 0;
        StateGroup previous = samples.get(0).group();
        for (int i = 1; i < samples.size(); i++) {
            StateGroup current = samples.get(i).group();
            if (current != previous) {
                transitions++;
                previous = current;
            }
        }
        return transitions;
    }

    /**
     * Each gap between two samples is attributed to the group of the earlier sample.
     */
    public static TimeInState computeTimeInState(List<RawSample> samples) {
        if (samples.size() < 2) {
            return TimeInState.EMPTY;
        }
        Map<StateGroup, Double> seconds = new EnumMap<>(StateGroup.class);
        for (StateGroup group : StateGroup.values()) {
            seconds.put(group, 0.0);
        }
        double total = 0.0;
        for (int i = 0; i < samples.size() - 1; i++) {
            RawSample current = samples.get(i);
            double elapsed = samples.get(i + 1).getTimestamp() - current.getTimestamp();
            seconds.merge(current.group(), elapsed, Double::sum);
            total += elapsed;
        }
        if (total <= 0.0) {
            return TimeInState.EMPTY;
        }
        return new TimeInState(
            percent(seconds.get(StateGroup.ACTIVE), total),
            percent(seconds.get(StateGroup.STANDBY), total),
            percent(seconds.get(StateGroup.ERROR), total));
    }

    public static PeriodStats periodStats(List<RawSample> samples) {
        return new PeriodStats(countGroupTransitions(samples), computeTimeInState(samples));
    }

    /**
     * Walks backwards from the newest sample to the most recent group change.
     * Samples must be ascending by timestamp, which {@link DeviceSeries} guarantees.
     */
    public static Optional<TransitionEvent> findLastTransition(DeviceSeries series) {
        List<RawSample> samples = series.getSamples();
        for (int i = samples.size() - 1; i > 0; i--) {
            RawSample current = samples.get(i);
            RawSample previous = samples.get(i - 1);
            if (current.group() != previous.group()) {
                return Optional.of(new TransitionEvent(
                    series.getDeviceId(),
                    current.getTimestamp(),
                    previous.getValue(),
                    current.getValue()));
            }
        }
        return Optional.empty();
    }

    private static double percent(double part, double total) {
        return BigDecimal.valueOf(part / total * 100.0)
            .setScale(1, RoundingMode.HALF_UP)
            .doubleValue();
    }
}
