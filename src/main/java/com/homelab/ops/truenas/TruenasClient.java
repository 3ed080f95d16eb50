package com.homelab.ops.truenas;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import org.eclipse.microprofile.config.ConfigProvider;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * REST Client for the TrueNAS SCALE API.
 * TrueNAS returns plain JSON arrays and objects, not a {@code {"data": ...}} envelope.
 */
@RegisterRestClient(configKey = "truenas")
@Path("/api/v2.0")
@Produces(MediaType.APPLICATION_JSON)
@ClientHeaderParam(name = "Authorization", value = "{bearerToken}")
public interface TruenasClient {

    @GET
    @Path("/disk")
    List<TruenasDisk> listDisks();

    @GET
    @Path("/core/ping")
    String ping();

    default String bearerToken() {
        String apiKey = ConfigProvider.getConfig()
            .getOptionalValue("homelab.truenas.api-key", String.class)
            .orElse("");
        return "Bearer " + apiKey;
    }
}
