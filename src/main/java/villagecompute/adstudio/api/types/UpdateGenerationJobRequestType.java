package villagecompute.adstudio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Request type for the administrative job override (PATCH /api/generate/{id}).
 *
 * <p>
 * Every field is optional; only provided fields are written. {@code status} bypasses the normal lifecycle and is meant
 * for operator repair, not for the review workflow.
 *
 * @param status
 *            new status wire value ({@code completed} is stored as {@code review})
 * @param reviewNotes
 *            reviewer notes
 * @param outputVideoUrl
 *            output video URL
 * @param previewUrl
 *            preview still URL
 * @param errorMessage
 *            error text
 * @param creditsUsed
 *            provider credits consumed
 */
public record UpdateGenerationJobRequestType(@JsonProperty("status") String status,
        @JsonProperty("reviewNotes") @Size(
                max = 4000) String reviewNotes,
        @JsonProperty("outputVideoUrl") String outputVideoUrl, @JsonProperty("previewUrl") String previewUrl,
        @JsonProperty("errorMessage") @Size(
                max = 2000) String errorMessage,
        @JsonProperty("creditsUsed") @PositiveOrZero Integer creditsUsed) {
}
