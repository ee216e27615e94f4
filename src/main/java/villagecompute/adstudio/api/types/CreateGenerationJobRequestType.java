package villagecompute.adstudio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Request type for creating a generation job (POST /api/generate).
 *
 * <p>
 * <b>Platform Resolution:</b> {@code platform} wins when given; otherwise the provider is chosen from the inputs (see
 * {@link villagecompute.adstudio.integration.providers.PlatformSelector}).
 *
 * <p>
 * The creative inputs ({@code productUrl} through {@code duration}) are snapshotted into the job's {@code inputData}
 * and never change afterwards.
 *
 * @param inputType
 *            input mode, required (e.g. {@code text-to-video}, {@code product-url}, {@code image}, {@code avatar})
 * @param sourceAdId
 *            ad the render is derived from
 * @param platform
 *            explicit provider tag
 * @param model
 *            provider model variant
 * @param productUrl
 *            product page to build the video from
 * @param imageUrl
 *            source still for image-to-video
 * @param avatarId
 *            presenter avatar
 * @param script
 *            voice-over script
 * @param prompt
 *            generation prompt
 * @param offer
 *            offer text overlaid on the video
 * @param aspectRatio
 *            output aspect ratio, defaults to the configured ratio ({@code 9:16})
 * @param duration
 *            requested duration in seconds
 * @param priority
 *            queue priority, defaults to the configured default ({@code 0})
 * @param providerRequestId
 *            provider correlation id when the caller already submitted the render
 */
@Schema(
        description = "Request to create a generation job")
public record CreateGenerationJobRequestType(@Schema(
        description = "Input mode",
        example = "text-to-video",
        required = true) @JsonProperty("inputType") @Size(
                max = 64) String inputType,

        @JsonProperty("sourceAdId") String sourceAdId,

        @Schema(
                description = "Explicit provider",
                example = "higgsfield") @JsonProperty("platform") @Size(
                        max = 32) String platform,

        @JsonProperty("model") String model,

        @JsonProperty("productUrl") String productUrl,

        @JsonProperty("imageUrl") String imageUrl,

        @JsonProperty("avatarId") String avatarId,

        @JsonProperty("script") @Size(
                max = 8000) String script,

        @JsonProperty("prompt") @Size(
                max = 4000) String prompt,

        @JsonProperty("offer") String offer,

        @Schema(
                example = "9:16") @JsonProperty("aspectRatio") String aspectRatio,

        @JsonProperty("duration") @Positive Integer duration,

        @JsonProperty("priority") Integer priority,

        @JsonProperty("providerRequestId") String providerRequestId) {
}
