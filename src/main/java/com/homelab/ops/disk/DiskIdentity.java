package com.homelab.ops.disk;

/**
 * A disk as known to the storage inventory.
 */
public final class DiskIdentity {

    private final String identifier;
    private final String name;
    private final String model;
    private final String serial;
    private final long sizeBytes;
    private final String pool;
    private final String standbyTimer;

    public DiskIdentity(String identifier, String name, String model, String serial,
                        long sizeBytes, String pool, String standbyTimer) {
        this.identifier = identifier;
        this.name = name;
        this.model = model;
        this.serial = serial;
        this.sizeBytes = sizeBytes;
        this.pool = pool;
        this.standbyTimer = standbyTimer;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getName() {
        return name;
    }

    public String getModel() {
        return model;
    }

    public String getSerial() {
        return serial;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public String getPool() {
        return pool;
    }

    public String getStandbyTimer() {
        return standbyTimer;
    }
}
