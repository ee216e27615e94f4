package villagecompute.adstudio.integration.providers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.adstudio.api.types.TopviewCallbackType;
import villagecompute.adstudio.exceptions.ValidationException;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link TopviewWebhookNormalizer}.
 */
class TopviewWebhookNormalizerTest {

    private TopviewWebhookNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TopviewWebhookNormalizer();
    }

    @Test
    void testCompletedCarriesVideoAndPreview() {
        ProviderCallback callback = normalizer.normalize(new TopviewCallbackType("tv_1", "completed",
                "https://files.example.com/v.mp4", "https://files.example.com/v.jpg", null,
                "2025-03-02T18:41:07+02:00"));

        assertEquals("topview", callback.provider());
        assertEquals(CallbackOutcome.SUCCEEDED, callback.outcome());
        assertEquals("https://files.example.com/v.mp4", callback.videoUrl());
        assertEquals("https://files.example.com/v.jpg", callback.previewUrl());
        assertEquals(Instant.parse("2025-03-02T16:41:07Z"), callback.completedAt());
        assertNull(callback.model());
    }

    @Test
    void testFailedCarriesError() {
        ProviderCallback callback = normalizer
                .normalize(new TopviewCallbackType("tv_2", "failed", null, null, "render timeout", null));

        assertEquals(CallbackOutcome.FAILED, callback.outcome());
        assertEquals("render timeout", callback.errorMessage());
    }

    @Test
    void testNsfwIsNotATopviewStatus() {
        ProviderCallback callback = normalizer
                .normalize(new TopviewCallbackType("tv_3", "nsfw", null, null, null, null));

        assertEquals(CallbackOutcome.UNRECOGNIZED, callback.outcome());
    }

    @Test
    void testMissingTaskIdIsRejected() {
        assertThrows(ValidationException.class,
                () -> normalizer.normalize(new TopviewCallbackType(null, "completed", null, null, null, null)));
    }
}
