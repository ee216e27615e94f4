package villagecompute.adstudio.integration.providers;

import villagecompute.adstudio.data.models.GenerationStatus;

import java.util.Locale;
import java.util.Optional;

/**
 * Provider-neutral outcome of a render callback.
 */
public enum CallbackOutcome {

    SUCCEEDED(GenerationStatus.REVIEW),

    FAILED(GenerationStatus.FAILED),

    /** Provider safety filter refused the content. */
    SAFETY_REJECTED(GenerationStatus.FAILED),

    /** Status string the normalizer does not know; the job status is left alone. */
    UNRECOGNIZED(null);

    private final GenerationStatus targetStatus;

    CallbackOutcome(GenerationStatus targetStatus) {
        this.targetStatus = targetStatus;
    }

    public Optional<GenerationStatus> targetStatus() {
        return Optional.ofNullable(targetStatus);
    }

    /**
     * Lowercase tag used for metrics and logs.
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
