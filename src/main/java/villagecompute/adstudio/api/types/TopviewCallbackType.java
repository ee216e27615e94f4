package villagecompute.adstudio.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Type for TopView task callback payload parsing.
 *
 * <pre>
 * {
 *   "task_id": "tv_task_51f0...",
 *   "status": "completed",
 *   "video_url": "https://files.topview.ai/out/51f0.mp4",
 *   "preview_url": "https://files.topview.ai/out/51f0.jpg",
 *   "completed_at": "2025-03-02T18:41:07Z"
 * }
 * </pre>
 *
 * @param taskId
 *            TopView task id (correlation key)
 * @param status
 *            provider status string ({@code completed}, {@code failed})
 * @param videoUrl
 *            rendered video URL
 * @param previewUrl
 *            still preview URL
 * @param error
 *            provider error text
 * @param completedAt
 *            ISO-8601 completion timestamp
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record TopviewCallbackType(@JsonProperty("task_id") String taskId, @JsonProperty("status") String status,
        @JsonProperty("video_url") String videoUrl, @JsonProperty("preview_url") String previewUrl,
        @JsonProperty("error") String error, @JsonProperty("completed_at") String completedAt) {
}
