package villagecompute.adstudio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response for POST /api/generate/{id}/approve.
 */
public record ApprovalResultType(@JsonProperty("success") boolean success, @JsonProperty("message") String message,
        @JsonProperty("job") GenerationJobType job) {
}
