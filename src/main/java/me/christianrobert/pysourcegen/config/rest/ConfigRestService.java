package me.christianrobert.pysourcegen.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.pysourcegen.config.service.ConfigService;
import me.christianrobert.pysourcegen.unparser.dialect.PythonVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * REST endpoint for the unparse settings (indent unit, default dialect, tree output).
 */
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

        Map<String, Object> config = configService.getAllConfiguration();
        return Response.ok(config).build();
    }

    @POST
    public Response saveConfiguration(Map<String, Object> config) {
        log.info("Saving configuration with {} entries", config.size());

        String invalid = validate(config);
        if (invalid != null) {
            log.warn("Rejected configuration: {}", invalid);
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("status", "error", "message", invalid))
                    .build();
        }

        configService.updateConfiguration(config);

        Map<String, String> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", "Configuration saved successfully");
        return Response.ok(response).build();
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

        return Response.ok(Map.of("key", key, "value", value)).build();
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
        Map<String, Object> single = new HashMap<>();
        single.put(key, value);
        String invalid = validate(single);
        if (invalid != null) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", invalid))
                    .build();
        }
        configService.setConfigValue(key, value);

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", "Configuration value updated successfully");
        response.put("key", key);
        response.put("value", value);

        return Response.ok(response).build();
    }

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        log.info("Resetting configuration to defaults");

        configService.resetToDefaults();

        Map<String, String> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", "Configuration reset to defaults successfully");
        return Response.ok(response).build();
    }

    /**
     * @return an error message for the first unusable value, or null if all are usable
     */
    private String validate(Map<String, Object> config) {
        Object dialect = config.get(ConfigService.DEFAULT_DIALECT);
        if (dialect != null) {
            try {
                PythonVersion.fromLabel(dialect.toString());
            } catch (IllegalArgumentException e) {
                return e.getMessage();
            }
        }
        Object indent = config.get(ConfigService.INDENT_UNIT);
        if (indent instanceof Number && ((Number) indent).intValue() < 0) {
            return "Indent width cannot be negative: " + indent;
        }
        return null;
    }
}
