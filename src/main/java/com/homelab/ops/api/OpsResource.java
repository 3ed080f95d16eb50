package com.homelab.ops.api;

import com.homelab.ops.agent.OpsAgent;
import com.homelab.ops.disk.HddPowerStatusService;
import com.homelab.ops.disk.ToolFailureException;
import com.homelab.ops.prometheus.PrometheusClient;
import com.homelab.ops.truenas.TruenasInventoryClient;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

/**
 * REST API for the HomeLab Ops Agent
 *
 * - POST /api/v1/ask                 question to the LLM agent
 * - GET  /api/v1/disks/hdd-power     HDD power status report, no LLM involved
 * - GET  /api/v1/health              dependency health
 */
@Path("/api/v1")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class OpsResource {

    private static final Logger LOG = Logger.getLogger(OpsResource.class);

    @Inject
    OpsAgent agent;

    @Inject
    HddPowerStatusService powerStatus;

    @Inject
    @RestClient
    PrometheusClient prometheus;

    @Inject
    TruenasInventoryClient truenas;

    /**
     * POST /api/v1/ask
     * {
     *   "question": "Which HDDs are spun up?",
     *   "sessionId": "optional"
     * }
     */
    @POST
    @Path("/ask")
    public Response ask(AskRequest request) {
        if (request == null || request.question == null || request.question.isBlank()) {
            return Response.status(400)
                .entity(new ErrorResponse("Missing required field: question"))
                .build();
        }

        long startTime = System.currentTimeMillis();
        String sessionId = request.sessionId != null
            ? request.sessionId
            : UUID.randomUUID().toString().substring(0, 8);
        LOG.infof("📨 [%s] Question: %s", sessionId, request.question);

        try {
            String answer = agent.ask(request.question);
            long durationMs = System.currentTimeMillis() - startTime;
            LOG.infof("✅ [%s] Answered in %dms", sessionId, durationMs);
            return Response.ok(new AskResponse(answer, sessionId, durationMs)).build();

        } catch (Exception e) {
            LOG.errorf(e, "❌ [%s] Agent invocation failed", sessionId);
            return Response.status(500)
                .entity(new ErrorResponse("Agent error: " + e.getMessage()))
                .build();
        }
    }

    /**
     * GET /api/v1/disks/hdd-power?duration=24h&pool=tank
     */
    @GET
    @Path("/disks/hdd-power")
    @Produces(MediaType.TEXT_PLAIN)
    public Response hddPower(@QueryParam("duration") @DefaultValue(HddPowerStatusService.DEFAULT_DURATION) String duration,
                             @QueryParam("pool") String pool) {
        try {
            return Response.ok(powerStatus.getHddPowerStatus(duration, pool)).build();
        } catch (ToolFailureException e) {
            int status = e.getCategory() == ToolFailureException.Category.USER_INPUT ? 400 : 503;
            return Response.status(status).entity(e.getMessage()).build();
        }
    }

    /**
     * Health check endpoint - includes Prometheus and, when configured, TrueNAS
     */
    @GET
    @Path("/health")
    public Response health() {
        List<ComponentHealth> components = new ArrayList<>();

        try {
            prometheus.healthy();
            components.add(new ComponentHealth("prometheus", "healthy", null));
        } catch (Exception e) {
            LOG.warn("Prometheus health check failed", e);
            components.add(new ComponentHealth("prometheus", "unhealthy", e.getMessage()));
        }

        if (truenas.isConfigured()) {
            try {
                truenas.ping();
                components.add(new ComponentHealth("truenas", "healthy", null));
            } catch (Exception e) {
                LOG.warn("TrueNAS health check failed", e);
                components.add(new ComponentHealth("truenas", "unhealthy", e.getMessage()));
            }
        }

        boolean healthy = components.stream().allMatch(c -> "healthy".equals(c.status));
        return Response.ok(new HealthResponse(healthy ? "healthy" : "degraded", "HomeLab Ops Agent", components))
            .build();
    }

    // DTOs

    public static class AskRequest {
        public String question;
        public String sessionId;

        public AskRequest() {}
    }

    public static class AskResponse {
        public String response;
        public String sessionId;
        public long durationMs;

        public AskResponse() {}

        public AskResponse(String response, String sessionId, long durationMs) {
            this.response = response;
            this.sessionId = sessionId;
            this.durationMs = durationMs;
        }
    }

    public static class ComponentHealth {
        public String name;
        public String status;
        public String detail;

        public ComponentHealth(String name, String status, String detail) {
            this.name = name;
            this.status = status;
            this.detail = detail;
        }
    }

    public static class HealthResponse {
        public String status;
        public String service;
        public List<ComponentHealth> components;

        public HealthResponse(String status, String service, List<ComponentHealth> components) {
            this.status = status;
            this.service = service;
            this.components = components;
        }
    }

    public static class ErrorResponse {
        public String error;

        public ErrorResponse(String error) {
            this.error = error;
        }
    }
}
