package com.homelab.ops.prometheus;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * REST Client for the Prometheus HTTP API.
 */
@RegisterRestClient(configKey = "prometheus")
public interface PrometheusClient {

    /**
     * Instant query, evaluated at the current server time.
     */
    @GET
    @Path("/api/v1/query")
    @Produces(MediaType.APPLICATION_JSON)
    PrometheusResponse query(@QueryParam("query") String query);

    /**
     * Range query.
     *
     * @param start epoch seconds
     * @param end epoch seconds
     * @param step resolution, e.g. {@code 15s} or {@code 5m}
     */
    @GET
    @Path("/api/v1/query_range")
    @Produces(MediaType.APPLICATION_JSON)
    PrometheusResponse queryRange(
        @QueryParam("query") String query,
        @QueryParam("start") long start,
        @QueryParam("end") long end,
        @QueryParam("step") String step
    );

    @GET
    @Path("/-/healthy")
    @Produces(MediaType.TEXT_PLAIN)
    String healthy();
}
