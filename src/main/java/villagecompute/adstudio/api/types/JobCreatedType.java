package villagecompute.adstudio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.adstudio.data.models.GenerationStatus;

/**
 * Response for POST /api/generate.
 *
 * @param id
 *            new job id
 * @param queueId
 *            id of the queue entry created with the job
 * @param platform
 *            resolved provider tag
 * @param status
 *            always {@code pending}
 * @param message
 *            human-readable confirmation
 */
public record JobCreatedType(@JsonProperty("id") String id, @JsonProperty("queueId") String queueId,
        @JsonProperty("platform") String platform, @JsonProperty("status") GenerationStatus status,
        @JsonProperty("message") String message) {
}
