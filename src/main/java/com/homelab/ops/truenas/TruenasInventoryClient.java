package com.homelab.ops.truenas;

import com.homelab.ops.backend.BackendFailures;
import com.homelab.ops.disk.DiskIdentity;
import com.homelab.ops.disk.InventoryClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

/**
 * {@link InventoryClient} backed by the TrueNAS disk list.
 */
@ApplicationScoped
public class TruenasInventoryClient implements InventoryClient {

    private static final Logger LOG = Logger.getLogger(TruenasInventoryClient.class);

    static final String BACKEND = "TrueNAS";

    @Inject
    @RestClient
    TruenasClient truenas;

    @ConfigProperty(name = "homelab.truenas.url")
    Optional<String> truenasUrl;

    @ConfigProperty(name = "homelab.truenas.timeout-seconds", defaultValue = "15")
    int timeoutSeconds;

    @Override
    public boolean isConfigured() {
        return truenasUrl.isPresent() && !truenasUrl.get().isBlank();
    }

    @Override
    public List<DiskIdentity> listDisks() {
        String endpoint = truenasUrl.orElse("<not configured>");
        List<TruenasDisk> disks = BackendFailures.call(BACKEND, endpoint, timeoutSeconds, () -> truenas.listDisks());
        if (disks == null) {
            return List.of();
        }

        List<DiskIdentity> identities = new ArrayList<>(disks.size());
        for (TruenasDisk disk : disks) {
            identities.add(new DiskIdentity(
                disk.getIdentifier() != null ? disk.getIdentifier() : "",
                disk.getName(),
                disk.getModel(),
                disk.getSerial(),
                disk.getSize() != null ? disk.getSize() : 0L,
                disk.getPool() != null ? disk.getPool() : "",
                disk.getHddStandby()));
        }
        LOG.debugf("Loaded %d disk(s) from TrueNAS", identities.size());
        return identities;
    }

    /**
     * Reachability probe for the health endpoint.
     */
    public void ping() {
        BackendFailures.call(BACKEND, truenasUrl.orElse("<not configured>"), timeoutSeconds, () -> truenas.ping());
    }
}
