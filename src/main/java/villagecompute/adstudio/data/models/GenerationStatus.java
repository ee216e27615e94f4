package villagecompute.adstudio.data.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle statuses of a {@link GenerationJob}.
 *
 * <p>
 * <b>Transitions:</b>
 * <ul>
 * <li>{@code pending -> review} on a successful provider callback</li>
 * <li>{@code pending -> failed} on a failed or safety-rejected provider callback (or the stale pending sweep)</li>
 * <li>{@code review|completed -> approved|rejected} via human disposition</li>
 * </ul>
 * A rejected job may be regenerated, which creates a new job in {@code pending}; the rejected row itself never moves
 * again.
 *
 * <p>
 * {@link #REVIEW} is the canonical ready-for-review state. {@link #COMPLETED} is a deprecated synonym kept for rows
 * written by older clients; it is accepted wherever {@code review} is, but nothing in the lifecycle produces it.
 */
public enum GenerationStatus {

    /**
     * Job created and owed a result by the provider. The only status that has a queue entry.
     */
    PENDING("pending"),

    /**
     * Provider render succeeded, awaiting human review.
     */
    REVIEW("review"),

    /**
     * Legacy synonym of {@link #REVIEW}. Not produced by any transition.
     */
    COMPLETED("completed"),

    /**
     * Human approved the render.
     */
    APPROVED("approved"),

    /**
     * Human rejected the render.
     */
    REJECTED("rejected"),

    /**
     * Provider failed, flagged the content, or never called back.
     */
    FAILED("failed");

    private final String wireValue;

    GenerationStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Returns the lowercase value used in the REST API and in provider-facing logs.
     */
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Whether a reviewer may approve or reject a job in this status.
     */
    public boolean isReadyForReview() {
        return this == REVIEW || this == COMPLETED;
    }

    /**
     * Whether a human has already disposed the job.
     */
    public boolean isDisposed() {
        return this == APPROVED || this == REJECTED;
    }

    /**
     * Parses a wire value case-insensitively.
     *
     * @param value
     *            status string such as {@code "review"}
     * @return matching status, or empty for null/unknown values
     */
    public static Optional<GenerationStatus> fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (GenerationStatus status : values()) {
            if (status.wireValue.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
