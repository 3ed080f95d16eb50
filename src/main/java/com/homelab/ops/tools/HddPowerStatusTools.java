package com.homelab.ops.tools;

import com.homelab.ops.disk.HddPowerStatusService;
import com.homelab.ops.disk.ToolFailureException;
import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * HDD power tools for the ops agent.
 * These @Tool methods are discovered by LangChain4j through {@code OpsAgent}.
 */
@ApplicationScoped
public class HddPowerStatusTools {

    private static final Logger LOG = Logger.getLogger(HddPowerStatusTools.class);

    @Inject
    HddPowerStatusService powerStatus;

    /**
     * Current HDD power state, period statistics and last transition per disk.
     * Failures come back as text so the model can relay them.
     */
    @Tool("Get a complete HDD power status summary for TrueNAS: which disks are spun up "
        + "or in standby, mapped to human-readable disk names (model, size, serial), "
        + "how many state changes occurred in the requested duration, "
        + "and when each disk last changed power state. "
        + "Use this for ANY question about HDD power state, spinup, spindown, or disk activity. "
        + "Examples: 'Which HDDs are spun up?' -> duration='24h'; "
        + "'Are the backup drives spun down?' -> pool='backup'; "
        + "'How many state changes in the last 12 hours?' -> duration='12h'.")
    public String hddPowerStatus(
        @P("Time window for stats and transition history, e.g. '1h', '6h', '12h', '24h', '3d', '1w'. "
            + "Use '24h' when the user does not say.") String duration,
        @P("ZFS pool name to filter disks (e.g. 'tank', 'backup'). "
            + "Empty string to include all HDD pools.") String pool) {
        String window = duration == null || duration.isBlank() ? HddPowerStatusService.DEFAULT_DURATION : duration;
        String poolFilter = pool == null || pool.isBlank() ? null : pool.trim();
        LOG.infof("💽 Tool hdd_power_status: duration=%s, pool=%s", window, poolFilter);

        try {
            return powerStatus.getHddPowerStatus(window, poolFilter);

        } catch (ToolFailureException e) {
            LOG.warnf("⚠️ HDD power status unavailable: %s", e.getMessage());
            return "Error: " + e.getMessage();

        } catch (Exception e) {
            LOG.errorf(e, "❌ Failed to build HDD power status");
            return "Error retrieving HDD power status: " + e.getMessage();
        }
    }
}
