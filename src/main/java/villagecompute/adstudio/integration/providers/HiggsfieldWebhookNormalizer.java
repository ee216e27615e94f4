package villagecompute.adstudio.integration.providers;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.adstudio.api.types.HiggsfieldCallbackType;
import villagecompute.adstudio.data.models.GenerationJob;
import villagecompute.adstudio.exceptions.ValidationException;

import java.util.Locale;
import java.util.Optional;

/**
 * Normalizer for Higgsfield render callbacks.
 *
 * <p>
 * <b>Status Mapping:</b>
 * <ul>
 * <li>{@code completed} - {@link CallbackOutcome#SUCCEEDED}</li>
 * <li>{@code failed} - {@link CallbackOutcome#FAILED}, provider {@code error} recorded</li>
 * <li>{@code nsfw} - {@link CallbackOutcome#SAFETY_REJECTED} with {@link #NSFW_MESSAGE}</li>
 * </ul>
 * Higgsfield is the only provider that reports the model variant it used.
 */
@ApplicationScoped
public class HiggsfieldWebhookNormalizer implements WebhookNormalizer<HiggsfieldCallbackType> {

    public static final String NSFW_MESSAGE = "Content flagged as NSFW by Higgsfield safety filters";

    @Override
    public String provider() {
        return PlatformSelector.HIGGSFIELD;
    }

    @Override
    public Class<HiggsfieldCallbackType> payloadType() {
        return HiggsfieldCallbackType.class;
    }

    @Override
    public ProviderCallback normalize(HiggsfieldCallbackType payload) {
        if (payload == null || payload.requestId() == null || payload.requestId().isBlank()) {
            throw new ValidationException("Missing request_id");
        }

        String status = payload.status() == null ? "" : payload.status().trim().toLowerCase(Locale.ROOT);
        CallbackOutcome outcome = switch (status) {
            case "completed" -> CallbackOutcome.SUCCEEDED;
            case "failed" -> CallbackOutcome.FAILED;
            case "nsfw" -> CallbackOutcome.SAFETY_REJECTED;
            default -> CallbackOutcome.UNRECOGNIZED;
        };
        String errorMessage = outcome == CallbackOutcome.SAFETY_REJECTED ? NSFW_MESSAGE : payload.error();

        return new ProviderCallback(provider(), payload.requestId(), payload.status(), outcome, payload.videoUrl(),
                null, errorMessage, payload.model(), ProviderCallback.parseTimestamp(payload.completedAt()));
    }

    @Override
    public Optional<GenerationJob> findCorrelatedJob(String reference) {
        return GenerationJob.findByHiggsfieldRequestId(reference);
    }
}
