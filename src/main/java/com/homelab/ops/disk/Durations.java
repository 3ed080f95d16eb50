package com.homelab.ops.disk;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prometheus-style durations: {@code 90}, {@code 15s}, {@code 5m}, {@code 24h}, {@code 3d}, {@code 1w}.
 */
public final class Durations {

    private static final Pattern DURATION = Pattern.compile("^(\\d+(?:\\.\\d+)?)([smhdw]?)$");

    private static final Map<String, Long> UNIT_SECONDS = Map.of(
        "s", 1L,
        "m", 60L,
        "h", 3_600L,
        "d", 86_400L,
        "w", 604_800L
    );

    private Durations() {
    }

    /**
     * Seconds in {@code text}, or empty if it is not a duration. A bare number is seconds.
     */
    public static OptionalDouble parseSeconds(String text) {
        if (text == null) {
            return OptionalDouble.empty();
        }
        Matcher matcher = DURATION.matcher(text.trim());
        if (!matcher.matches()) {
            return OptionalDouble.empty();
        }
        double amount = Double.parseDouble(matcher.group(1));
        String unit = matcher.group(2);
        long multiplier = unit.isEmpty() ? 1L : UNIT_SECONDS.get(unit);
        return OptionalDouble.of(amount * multiplier);
    }

    /**
     * Whole seconds of a positive duration.
     *
     * @throws ToolFailureException if {@code text} is not a positive duration
     */
    public static long requirePositiveSeconds(String text) {
        OptionalDouble seconds = parseSeconds(text);
        if (seconds.isEmpty() || seconds.getAsDouble() <= 0) {
            throw ToolFailureException.userInput(String.format(
                "Invalid duration '%s'. Use a value like '1h', '6h', '12h', '24h', '3d', or '1w'.", text));
        }
        return Math.max(1L, (long) seconds.getAsDouble());
    }
}
