package villagecompute.adstudio.integration.providers;

import org.jboss.logging.Logger;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Render callback after provider vocabulary has been collapsed into the internal model.
 *
 * @param provider
 *            provider tag ({@link PlatformSelector#HIGGSFIELD}, {@link PlatformSelector#TOPVIEW})
 * @param reference
 *            provider correlation id (request id or task id), never blank
 * @param rawStatus
 *            status string exactly as the provider sent it
 * @param outcome
 *            normalized outcome
 * @param videoUrl
 *            output video URL, null when not provided
 * @param previewUrl
 *            preview still URL, null when not provided
 * @param errorMessage
 *            error text to record, null when not provided
 * @param model
 *            provider model variant, null when not provided
 * @param completedAt
 *            provider completion time, null when absent or unparseable
 */
public record ProviderCallback(String provider, String reference, String rawStatus, CallbackOutcome outcome,
        String videoUrl, String previewUrl, String errorMessage, String model, Instant completedAt) {

    private static final Logger LOG = Logger.getLogger(ProviderCallback.class);

    /**
     * Parses a provider timestamp. Accepts ISO-8601 instants ({@code Z}) and offset date-times.
     *
     * @return parsed instant, or null when the value is blank or malformed
     */
    public static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value).toInstant();
            } catch (DateTimeParseException nested) {
                LOG.debugf("Ignoring unparseable provider timestamp '%s'", value);
                return null;
            }
        }
    }
}
