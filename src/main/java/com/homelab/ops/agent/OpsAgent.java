package com.homelab.ops.agent;

import com.homelab.ops.tools.HddPowerStatusTools;
import dev.langchain4j.service.SystemMessage;
import io.quarkiverse.langchain4j.RegisterAiService;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.faulttolerance.Timeout;

/**
 * SRE assistant for the homelab.
 *
 * Uses LangChain4j @RegisterAiService to connect to the configured LLM and
 * gives it the @Tool methods from HddPowerStatusTools.
 */
@ApplicationScoped
@RegisterAiService(tools = HddPowerStatusTools.class)
public interface OpsAgent {

    @SystemMessage("""
        You are an SRE assistant for a Proxmox homelab with a TrueNAS storage server.

        You have access to live infrastructure tools.

        TOOL SELECTION:
        - hddPowerStatus: ANY question about HDD power state, spinup, spindown,
          standby time, or how often disks changed state.

        GUIDELINES:
        - Never fabricate metric values; only report what the tools return.
        - If a tool returns an error, tell the user clearly and suggest what to check.
        - Keep answers concise and actionable. Lead with the answer, then supporting detail.

        Today is {current_date}.
        """)
    @Timeout(120000) // 2 minutes
    String ask(String question);
}
