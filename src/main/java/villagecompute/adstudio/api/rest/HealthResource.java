package villagecompute.adstudio.api.rest;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Liveness endpoint for load balancers. Does not touch the database; queue health is exposed through metrics.
 */
@Path("/api/health")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Health",
        description = "Health check operations")
public class HealthResource {

    @ConfigProperty(
            name = "quarkus.application.name",
            defaultValue = "adstudio")
    String applicationName;

    @GET
    @Operation(
            summary = "Health check",
            description = "Check if the application is running")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Application is healthy",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = HealthResponse.class)))})
    public HealthResponse health() {
        return new HealthResponse("UP", applicationName + " generation coordinator is running");
    }

    public record HealthResponse(String status, String message) {
    }
}
