package villagecompute.adstudio.config;

import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Contact;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;
import org.eclipse.microprofile.openapi.annotations.servers.Server;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * OpenAPI 3.0 configuration for the Ad Studio generation API.
 *
 * <p>
 * The document is served at {@code /q/openapi}, Swagger UI at {@code /q/swagger-ui} in dev mode.
 */
@OpenAPIDefinition(
        info = @Info(
                title = "Ad Studio Generation API",
                version = "1.0.0",
                description = """
                        Commissions AI video renders from Higgsfield and TopView and runs the human review workflow.

                        ## Job Lifecycle
                        `pending` -> `review` | `failed` (provider callback), `review` -> `approved` | `rejected`
                        (reviewer). A rejected job can be regenerated as a new `pending` job.

                        ## Errors
                        Errors are returned as `{"error": "..."}`. Invalid transitions are 400 and include the
                        job's current `status`.
                        """,
                contact = @Contact(
                        name = "Village Compute",
                        url = "https://villagecompute.com"),
                license = @License(
                        name = "Proprietary")),
        servers = {@Server(
                url = "http://localhost:8080",
                description = "Local Development")},
        tags = {@Tag(
                name = "Generation Jobs",
                description = "Create, list, review and regenerate AI video jobs"),
                @Tag(
                        name = "Webhooks",
                        description = "Render callbacks from Higgsfield and TopView"),
                @Tag(
                        name = "Health",
                        description = "Health checks")})
public class OpenApiConfig extends Application {
    // Configuration via annotations only
}
