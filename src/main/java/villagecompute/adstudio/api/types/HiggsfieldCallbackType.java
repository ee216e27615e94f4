package villagecompute.adstudio.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Type for Higgsfield render callback payload parsing.
 *
 * <pre>
 * {
 *   "request_id": "hf_req_8d1c...",
 *   "status": "completed",
 *   "video_url": "https://cdn.higgsfield.ai/renders/8d1c.mp4",
 *   "completed_at": "2025-03-02T18:41:07Z",
 *   "model": "dop-turbo"
 * }
 * </pre>
 *
 * <p>
 * Known statuses: {@code completed}, {@code failed}, {@code nsfw}. Anything else is treated as unrecognized.
 *
 * @param requestId
 *            Higgsfield request id (correlation key)
 * @param status
 *            provider status string
 * @param videoUrl
 *            rendered video URL (success only)
 * @param error
 *            provider error text (failure only)
 * @param completedAt
 *            ISO-8601 completion timestamp
 * @param model
 *            model variant that actually rendered
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record HiggsfieldCallbackType(@JsonProperty("request_id") String requestId,
        @JsonProperty("status") String status, @JsonProperty("video_url") String videoUrl,
        @JsonProperty("error") String error, @JsonProperty("completed_at") String completedAt,
        @JsonProperty("model") String model) {
}
