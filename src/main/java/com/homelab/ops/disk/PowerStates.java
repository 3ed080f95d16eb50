package com.homelab.ops.disk;

import java.util.Map;
import java.util.Set;

/**
 * Power state codes reported by disk-status-exporter as {@code disk_power_state}.
 *
 * <pre>
 * -2 error, -1 unknown, 0 standby, 1 idle, 2 active_or_idle,
 *  3 idle_a, 4 idle_b, 5 idle_c, 6 active, 7 sleep
 * </pre>
 */
public final class PowerStates {

    public static final Map<Integer, String> LABELS = Map.of(
        -2, "error",
        -1, "unknown",
        0, "standby",
        1, "idle",
        2, "active_or_idle",
        3, "idle_a",
        4, "idle_b",
        5, "idle_c",
        6, "active",
        7, "sleep"
    );

    public static final Set<Integer> ACTIVE_CODES = Set.of(1, 2, 3, 4, 5, 6);
    public static final Set<Integer> STANDBY_CODES = Set.of(0, 7);
    public static final Set<Integer> ERROR_CODES = Set.of(-2, -1);

    private PowerStates() {
    }

    public static StateGroup classify(int code) {
        if (ACTIVE_CODES.contains(code)) {
            return StateGroup.ACTIVE;
        }
        if (STANDBY_CODES.contains(code)) {
            return StateGroup.STANDBY;
        }
        return StateGroup.ERROR;
    }

    /**
     * Raw sample values arrive as floats; they are truncated toward zero before lookup.
     */
    public static StateGroup classify(double value) {
        return classify(toCode(value));
    }

    public static String label(int code) {
        String label = LABELS.get(code);
        return label != null ? label : "unknown state (" + code + ")";
    }

    /**
     * Label with the numeric code appended, e.g. {@code "standby (0)"}.
     */
    public static String describe(double value) {
        int code = toCode(value);
        String label = LABELS.get(code);
        return label != null ? label + " (" + code + ")" : "unknown state (" + code + ")";
    }

    static int toCode(double value) {
        return (int) value;
    }
}
