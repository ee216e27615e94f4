package villagecompute.adstudio.integration.providers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.adstudio.api.types.HiggsfieldCallbackType;
import villagecompute.adstudio.data.models.GenerationStatus;
import villagecompute.adstudio.exceptions.ValidationException;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link HiggsfieldWebhookNormalizer}.
 */
class HiggsfieldWebhookNormalizerTest {

    private HiggsfieldWebhookNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new HiggsfieldWebhookNormalizer();
    }

    @Test
    void testCompletedMapsToReview() {
        ProviderCallback callback = normalizer.normalize(new HiggsfieldCallbackType("hf_1", "completed",
                "https://cdn.example.com/v.mp4", null, "2025-03-02T18:41:07Z", "dop-turbo"));

        assertEquals("higgsfield", callback.provider());
        assertEquals("hf_1", callback.reference());
        assertEquals(CallbackOutcome.SUCCEEDED, callback.outcome());
        assertEquals(GenerationStatus.REVIEW, callback.outcome().targetStatus().orElseThrow());
        assertEquals("https://cdn.example.com/v.mp4", callback.videoUrl());
        assertEquals("dop-turbo", callback.model());
        assertEquals(Instant.parse("2025-03-02T18:41:07Z"), callback.completedAt());
        assertNull(callback.previewUrl());
    }

    @Test
    void testFailedCarriesProviderError() {
        ProviderCallback callback = normalizer
                .normalize(new HiggsfieldCallbackType("hf_2", "failed", null, "GPU quota exceeded", null, null));

        assertEquals(CallbackOutcome.FAILED, callback.outcome());
        assertEquals(GenerationStatus.FAILED, callback.outcome().targetStatus().orElseThrow());
        assertEquals("GPU quota exceeded", callback.errorMessage());
        assertNull(callback.completedAt());
    }

    @Test
    void testNsfwUsesFixedMessage() {
        ProviderCallback callback = normalizer
                .normalize(new HiggsfieldCallbackType("hf_3", "nsfw", null, "blocked", null, null));

        assertEquals(CallbackOutcome.SAFETY_REJECTED, callback.outcome());
        assertEquals(GenerationStatus.FAILED, callback.outcome().targetStatus().orElseThrow());
        assertEquals("Content flagged as NSFW by Higgsfield safety filters", callback.errorMessage());
    }

    @Test
    void testStatusIsCaseInsensitive() {
        ProviderCallback callback = normalizer
                .normalize(new HiggsfieldCallbackType("hf_4", "COMPLETED", null, null, null, null));

        assertEquals(CallbackOutcome.SUCCEEDED, callback.outcome());
    }

    @Test
    void testUnknownStatusIsUnrecognized() {
        ProviderCallback callback = normalizer
                .normalize(new HiggsfieldCallbackType("hf_5", "processing", null, null, null, null));

        assertEquals(CallbackOutcome.UNRECOGNIZED, callback.outcome());
        assertTrue(callback.outcome().targetStatus().isEmpty());
        assertEquals("processing", callback.rawStatus());
    }

    @Test
    void testMissingRequestIdIsRejected() {
        assertThrows(ValidationException.class,
                () -> normalizer.normalize(new HiggsfieldCallbackType(null, "completed", null, null, null, null)));
        assertThrows(ValidationException.class,
                () -> normalizer.normalize(new HiggsfieldCallbackType(" ", "completed", null, null, null, null)));
        assertThrows(ValidationException.class, () -> normalizer.normalize(null));
    }

    @Test
    void testUnparseableTimestampIsIgnored() {
        ProviderCallback callback = normalizer
                .normalize(new HiggsfieldCallbackType("hf_6", "completed", null, null, "yesterday", null));

        assertNull(callback.completedAt());
    }
}
