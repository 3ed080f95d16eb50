package com.homelab.ops.disk;

/**
 * PromQL selector for HDD power state, optionally narrowed to one pool.
 */
public final class PowerStateSelector {

    public static final String METRIC = "disk_power_state";

    private PowerStateSelector() {
    }

    public static String forPool(String pool) {
        if (pool == null || pool.isBlank()) {
            return METRIC + "{type=\"hdd\"}";
        }
        return METRIC + "{type=\"hdd\", pool=\"" + escape(pool.trim()) + "\"}";
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
