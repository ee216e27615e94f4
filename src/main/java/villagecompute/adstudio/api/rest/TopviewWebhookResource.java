package villagecompute.adstudio.api.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.adstudio.api.types.TopviewCallbackType;
import villagecompute.adstudio.api.types.WebhookHealthType;
import villagecompute.adstudio.api.types.WebhookResultType;
import villagecompute.adstudio.exceptions.ValidationException;
import villagecompute.adstudio.integration.providers.TopviewWebhookNormalizer;
import villagecompute.adstudio.services.WebhookIngestionService;

import java.time.Instant;

/**
 * REST resource for TopView task callbacks.
 *
 * <p>
 * <b>Example Webhook Payload:</b>
 *
 * <pre>
 * {
 *   "task_id": "tv_task_51f0",
 *   "status": "failed",
 *   "error": "render timeout"
 * }
 * </pre>
 *
 * Same response contract as {@link HiggsfieldWebhookResource}, keyed by {@code task_id}.
 */
@Path("/api/webhooks/topview")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Webhooks",
        description = "Provider render callbacks")
public class TopviewWebhookResource {

    private static final Logger LOG = Logger.getLogger(TopviewWebhookResource.class);

    @Inject
    TopviewWebhookNormalizer normalizer;

    @Inject
    WebhookIngestionService ingestionService;

    @Inject
    ObjectMapper objectMapper;

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "TopView callback",
            description = "Applies a TopView task result to its generation job")
    public WebhookResultType handleWebhook(String payload) {
        LOG.debugf("Received TopView webhook, payload length=%d bytes", payload != null ? payload.length() : 0);

        TopviewCallbackType callback;
        try {
            callback = objectMapper.readValue(payload, normalizer.payloadType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.warnf("Rejecting malformed TopView webhook payload: %s", e.getMessage());
            throw new ValidationException("Invalid webhook payload", e);
        }
        if (callback != null) {
            LOG.infof("[TopView Webhook] Received: task_id=%s, status=%s", callback.taskId(), callback.status());
        }

        return ingestionService.ingest(normalizer, callback);
    }

    @GET
    @Operation(
            summary = "TopView webhook identity",
            description = "Lets TopView verify the callback URL")
    public WebhookHealthType health() {
        return new WebhookHealthType("TopView Webhook Handler", "active", Instant.now());
    }
}
