package villagecompute.adstudio.integration.providers;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.adstudio.api.types.TopviewCallbackType;
import villagecompute.adstudio.data.models.GenerationJob;
import villagecompute.adstudio.exceptions.ValidationException;

import java.util.Locale;
import java.util.Optional;

/**
 * Normalizer for TopView task callbacks. TopView has no safety status and additionally reports a preview image.
 */
@ApplicationScoped
public class TopviewWebhookNormalizer implements WebhookNormalizer<TopviewCallbackType> {

    @Override
    public String provider() {
        return PlatformSelector.TOPVIEW;
    }

    @Override
    public Class<TopviewCallbackType> payloadType() {
        return TopviewCallbackType.class;
    }

    @Override
    public ProviderCallback normalize(TopviewCallbackType payload) {
        if (payload == null || payload.taskId() == null || payload.taskId().isBlank()) {
            throw new ValidationException("Missing task_id");
        }

        String status = payload.status() == null ? "" : payload.status().trim().toLowerCase(Locale.ROOT);
        CallbackOutcome outcome = switch (status) {
            case "completed" -> CallbackOutcome.SUCCEEDED;
            case "failed" -> CallbackOutcome.FAILED;
            default -> CallbackOutcome.UNRECOGNIZED;
        };

        return new ProviderCallback(provider(), payload.taskId(), payload.status(), outcome, payload.videoUrl(),
                payload.previewUrl(), payload.error(), null, ProviderCallback.parseTimestamp(payload.completedAt()));
    }

    @Override
    public Optional<GenerationJob> findCorrelatedJob(String reference) {
        return GenerationJob.findByTopviewTaskId(reference);
    }
}
