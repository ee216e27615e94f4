package villagecompute.adstudio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Identity response for GET on a webhook endpoint, used by providers to verify the callback URL.
 */
public record WebhookHealthType(@JsonProperty("service") String service, @JsonProperty("status") String status,
        @JsonProperty("timestamp") Instant timestamp) {
}
