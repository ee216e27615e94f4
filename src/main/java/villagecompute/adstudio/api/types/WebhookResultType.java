package villagecompute.adstudio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.adstudio.data.models.GenerationStatus;

/**
 * Acknowledgement returned to a provider after its callback was applied.
 *
 * @param success
 *            always true
 * @param jobId
 *            internal job id the callback resolved to
 * @param status
 *            job status after the callback
 */
public record WebhookResultType(@JsonProperty("success") boolean success, @JsonProperty("jobId") String jobId,
        @JsonProperty("status") GenerationStatus status) {
}
