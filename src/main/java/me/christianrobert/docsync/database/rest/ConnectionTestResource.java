package me.christianrobert.docsync.database.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.docsync.database.model.DatabaseEndpoint;
import me.christianrobert.docsync.database.service.PostgresConnectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

@Path("/api/database/test")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConnectionTestResource {

    private static final Logger log = LoggerFactory.getLogger(ConnectionTestResource.class);

    @Inject
    PostgresConnectionService postgresConnectionService;

    @GET
    @Path("/status")
    public Response getConnectionStatus() {
        log.debug("Getting connection status for both databases");

        Map<String, Object> status = new LinkedHashMap<>();
        for (DatabaseEndpoint endpoint : DatabaseEndpoint.values()) {
            boolean configured = postgresConnectionService.isConfigured(endpoint);
            status.put(endpoint.getConfigPrefix(), Map.of(
                    "configured", configured,
                    "configurationStatus", configured ?
                            "Connection parameters are configured" :
                            "Connection parameters are missing or incomplete"
            ));
        }

        return Response.ok(status).build();
    }

    @GET
    @Path("/{endpoint}")
    public Response testConnection(@PathParam("endpoint") String endpointName) {
        DatabaseEndpoint endpoint;
        try {
            endpoint = DatabaseEndpoint.fromName(endpointName);
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("status", "error", "message", e.getMessage()))
                    .build();
        }

        log.info("Testing {} database connection via REST API", endpoint);

        Map<String, Object> result = postgresConnectionService.testConnection(endpoint);
        if ("success".equals(result.get("status"))) {
            return Response.ok(result).build();
        }
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .entity(result)
                .build();
    }
}
