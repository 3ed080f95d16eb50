package com.homelab.ops.disk;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Joins Prometheus device ids with inventory identifiers.
 *
 * <p>Both systems embed the same hex id for a disk, in different shapes:
 * <pre>
 *   Prometheus device_id: /dev/disk/by-id/wwn-0x5000c500eb02b449
 *   TrueNAS identifier:   {serial_lunid}5000c500eb02b449
 * </pre>
 * The longest hex run of at least 8 characters, lower-cased, is the join key.
 */
public final class DiskCrossReference {

    private static final Pattern HEX_RUN = Pattern.compile("[0-9a-fA-F]{8,}");
    private static final String[] BYTE_UNITS = {"B", "KiB", "MiB", "GiB", "TiB"};

    private DiskCrossReference() {
    }

    /**
     * Longest hex run (8+ chars) in {@code s}, lower-cased, or an empty string.
     * Equal-length runs resolve to the first one found.
     */
    public static String extractFingerprint(String s) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        String longest = "";
        Matcher matcher = HEX_RUN.matcher(s);
        while (matcher.find()) {
            String run = matcher.group();
            if (run.length() > longest.length()) {
                longest = run;
            }
        }
        return longest.toLowerCase(Locale.ROOT);
    }

    /**
     * Index disks by fingerprint. Disks without one are skipped; the first disk wins a collision.
     */
    public static Map<String, DiskIdentity> buildLookup(Collection<DiskIdentity> disks) {
        Map<String, DiskIdentity> lookup = new LinkedHashMap<>();
        for (DiskIdentity disk : disks) {
            String fingerprint = extractFingerprint(disk.getIdentifier());
            if (!fingerprint.isEmpty()) {
                lookup.putIfAbsent(fingerprint, disk);
            }
        }
        return Collections.unmodifiableMap(lookup);
    }

    public static DiskIdentity find(Map<String, DiskIdentity> lookup, String deviceId) {
        String fingerprint = extractFingerprint(deviceId);
        return fingerprint.isEmpty() ? null : lookup.get(fingerprint);
    }

    /**
     * {@code "sdc: ST8000VN004 (7.3 TiB, serial=WWZ5TZSF)"}, or the last path segment of the
     * device id when the disk is not in the inventory.
     */
    public static String formatDiskName(DiskIdentity disk, String fallbackDeviceId) {
        if (disk != null) {
            String serial = disk.getSerial();
            String serialPart = serial != null && !serial.isBlank() ? ", serial=" + serial : "";
            return String.format("%s: %s (%s%s)",
                orPlaceholder(disk.getName()),
                orPlaceholder(disk.getModel()),
                formatBytes(disk.getSizeBytes()),
                serialPart);
        }
        return shortDeviceId(fallbackDeviceId);
    }

    public static String shortDeviceId(String deviceId) {
        if (deviceId == null) {
            return "unknown";
        }
        int slash = deviceId.lastIndexOf('/');
        return slash >= 0 ? deviceId.substring(slash + 1) : deviceId;
    }

    /**
     * Binary units with one decimal place, e.g. {@code 8_000_000_000_000 -> "7.3 TiB"}.
     */
    public static String formatBytes(long bytes) {
        double n = bytes;
        for (String unit : BYTE_UNITS) {
            if (Math.abs(n) < 1024) {
                return String.format(Locale.ROOT, "%.1f %s", n, unit);
            }
            n /= 1024;
        }
        return String.format(Locale.ROOT, "%.1f PiB", n);
    }

    private static String orPlaceholder(String value) {
        return value != null && !value.isBlank() ? value : "?";
    }
}
