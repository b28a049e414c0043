package me.christianrobert.docsync.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.docsync.config.service.ConfigService;
import me.christianrobert.docsync.sync.model.SyncOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

@Path("/api/config")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigRestService {

    private static final Logger log = LoggerFactory.getLogger(ConfigRestService.class);

    @Inject
    ConfigService configService;

    @GET
    public Response getConfiguration() {
        log.info("Getting configuration");

        Map<String, Object> config = new TreeMap<>();
        configService.getAllConfiguration().forEach((key, value) -> config.put(key, maskSecret(key, value)));
        return Response.ok(config).build();
    }

    @POST
    public Response saveConfiguration(Map<String, Object> config) {
        log.info("Saving configuration with {} entries", config.size());

        try {
            configService.updateConfiguration(config);

            // Fail fast on tunables that would only be rejected when the next sync starts
            SyncOptions options = SyncOptions.fromConfig(configService, false);

            Map<String, Object> response = new HashMap<>();
            response.put("status", "success");
            response.put("message", "Configuration saved successfully");
            response.put("syncOptions", options.toString());

            return Response.ok(response).build();
        } catch (IllegalArgumentException e) {
            log.warn("Configuration saved with invalid sync options: {}", e.getMessage());

            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("status", "error", "message", e.getMessage()))
                    .build();
        } catch (Exception e) {
            log.error("Error saving configuration", e);

            Map<String, String> errorResponse = new HashMap<>();
            errorResponse.put("status", "error");
            errorResponse.put("message", "Failed to save configuration: " + e.getMessage());

            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(errorResponse)
                    .build();
        }
    }

    @GET
    @Path("/{key}")
    public Response getConfigValue(@PathParam("key") String key) {
        log.debug("Getting config value for key: {}", key);

        Object value = configService.getConfigValue(key);
        if (value == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", "Configuration key not found: " + key))
                    .build();
        }

        return Response.ok(Map.of("key", key, "value", maskSecret(key, value))).build();
    }

    @PUT
    @Path("/{key}")
    public Response setConfigValue(@PathParam("key") String key, Map<String, Object> body) {
        log.debug("Setting config value for key: {}", key);

        if (body == null || !body.containsKey("value")) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "Request body must contain 'value' field"))
                    .build();
        }

        Object value = body.get("value");
        configService.setConfigValue(key, value);

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", "Configuration value updated successfully");
        response.put("key", key);
        response.put("value", maskSecret(key, value));

        return Response.ok(response).build();
    }

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        log.info("Resetting configuration to defaults");

        configService.resetToDefaults();
        return Response.ok(Map.of(
                "status", "success",
                "message", "Configuration reset to defaults successfully"
        )).build();
    }

    private static Object maskSecret(String key, Object value) {
        if (key.endsWith(".password") && value != null && !value.toString().isEmpty()) {
            return "****";
        }
        return value;
    }
}
