package villagecompute.adstudio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response for POST /api/generate/{id}/reject.
 *
 * @param success
 *            always true (failures are reported as errors)
 * @param message
 *            human-readable outcome
 * @param newJobId
 *            regenerated job id, null when no regeneration was requested
 */
public record RejectionResultType(@JsonProperty("success") boolean success, @JsonProperty("message") String message,
        @JsonProperty("newJobId") String newJobId) {
}
