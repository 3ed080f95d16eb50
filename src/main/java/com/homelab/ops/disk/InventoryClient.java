package com.homelab.ops.disk;

import com.homelab.ops.backend.BackendException;
import java.util.List;

/**
 * Storage system that knows disk names, models and serials.
 */
public interface InventoryClient {

    /**
     * False when no inventory endpoint is configured; the report then shows device ids only.
     */
    boolean isConfigured();

    /**
     * @throws BackendException on connect, timeout, HTTP status or malformed response failures
     */
    List<DiskIdentity> listDisks();
}
