package me.christianrobert.pysourcegen.unparser.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import me.christianrobert.pysourcegen.unparser.context.UnparseResult;
import me.christianrobert.pysourcegen.unparser.service.UnparseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * REST endpoint for rendering Python syntax trees to source.
 *
 * <p>Development aid: post a JSON dump of a Python {@code ast} tree and see the source the chosen
 * dialect produces.</p>
 *
 * <p>Usage:
 * <pre>
 * curl -X POST "http://localhost:8080/api/unparse?version=2.7&amp;showTree=true" \
 *   -H "Content-Type: application/json" \
 *   --data '{"_type": "Module", "body": [{"_type": "Pass", "lineno": 1}]}'
 * </pre>
 *
 * <p>Response format (JSON):
 * <pre>
 * {
 *   "success": true,
 *   "version": "2.7",
 *   "source": "pass",
 *   "errorMessage": null,
 *   "errorKind": null
 * }
 * </pre>
 *
 * <p>Note: Always returns HTTP 200. Check "success" field in response.
 * A tree the dialect cannot render is a valid outcome, not an HTTP error.
 */
@Path("/api/unparse")
@Produces(MediaType.APPLICATION_JSON)
public class UnparseResource {

    private static final Logger log = LoggerFactory.getLogger(UnparseResource.class);

    @Inject
    UnparseService unparseService;

    /**
     * Renders a JSON tree.
     *
     * @param version Optional version label (defaults to the configured dialect)
     * @param showTree Optional flag to include the formatted tree in the response
     * @param treeJson Tree as JSON body
     * @return UnparseResult as JSON (always HTTP 200, check "success" field)
     */
    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public UnparseResult unparse(
            @QueryParam("version") String version,
            @QueryParam("showTree") @DefaultValue("false") boolean showTree,
            String treeJson
    ) {
        log.info("Unparse request received via REST API (version={})", version);
        log.trace("Tree JSON: {}", treeJson);

        if (treeJson == null || treeJson.trim().isEmpty()) {
            log.warn("Empty tree received");
            return UnparseResult.failure(version, "InvalidTree", "Tree JSON cannot be empty");
        }

        UnparseResult result = unparseService.unparseJson(treeJson, version, showTree);

        if (result.isSuccess()) {
            log.info("Unparse succeeded for Python {}", result.getVersion());
            if (result.hasTree()) {
                log.debug("Tree included in response");
            }
        } else {
            log.warn("Unparse failed: {}", result.getErrorMessage());
        }
        return result;
    }

    /**
     * Lists the supported version labels, oldest first.
     */
    @GET
    @Path("/dialects")
    public List<String> dialects() {
        log.debug("Listing supported dialects");
        return unparseService.supportedVersions();
    }
}
