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
import villagecompute.adstudio.api.types.HiggsfieldCallbackType;
import villagecompute.adstudio.api.types.WebhookHealthType;
import villagecompute.adstudio.api.types.WebhookResultType;
import villagecompute.adstudio.exceptions.ValidationException;
import villagecompute.adstudio.integration.providers.HiggsfieldWebhookNormalizer;
import villagecompute.adstudio.services.WebhookIngestionService;

import java.time.Instant;

/**
 * REST resource for Higgsfield render callbacks.
 *
 * <p>
 * <b>Example Webhook Payload:</b>
 *
 * <pre>
 * {
 *   "request_id": "hf_req_8d1c",
 *   "status": "nsfw",
 *   "completed_at": "2025-03-02T18:41:07Z"
 * }
 * </pre>
 *
 * <p>
 * <b>Idempotency:</b> Higgsfield retries deliveries; applying the same callback twice leaves the job unchanged.
 *
 * <p>
 * <b>Responses:</b> 200 when applied (including unrecognized statuses), 400 for malformed JSON or a missing
 * {@code request_id}, 404 when no job matches.
 *
 * @see HiggsfieldWebhookNormalizer
 */
@Path("/api/webhooks/higgsfield")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Webhooks",
        description = "Provider render callbacks")
public class HiggsfieldWebhookResource {

    private static final Logger LOG = Logger.getLogger(HiggsfieldWebhookResource.class);

    @Inject
    HiggsfieldWebhookNormalizer normalizer;

    @Inject
    WebhookIngestionService ingestionService;

    @Inject
    ObjectMapper objectMapper;

    /**
     * Handles a Higgsfield callback.
     *
     * @param payload
     *            raw webhook payload (JSON string)
     * @return acknowledgement with the resolved job id and status
     */
    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Higgsfield callback",
            description = "Applies a Higgsfield render result to its generation job")
    public WebhookResultType handleWebhook(String payload) {
        LOG.debugf("Received Higgsfield webhook, payload length=%d bytes", payload != null ? payload.length() : 0);

        HiggsfieldCallbackType callback;
        try {
            callback = objectMapper.readValue(payload, normalizer.payloadType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.warnf("Rejecting malformed Higgsfield webhook payload: %s", e.getMessage());
            throw new ValidationException("Invalid webhook payload", e);
        }
        if (callback != null) {
            LOG.infof("[Higgsfield Webhook] Received: request_id=%s, status=%s", callback.requestId(),
                    callback.status());
        }

        return ingestionService.ingest(normalizer, callback);
    }

    @GET
    @Operation(
            summary = "Higgsfield webhook identity",
            description = "Lets Higgsfield verify the callback URL")
    public WebhookHealthType health() {
        return new WebhookHealthType("Higgsfield Webhook Handler", "active", Instant.now());
    }
}
