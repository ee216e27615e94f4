package villagecompute.adstudio.data.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GenerationStatusTest {

    @Test
    void testFromWireValue() {
        assertEquals(GenerationStatus.REVIEW, GenerationStatus.fromWireValue("review").orElseThrow());
        assertEquals(GenerationStatus.APPROVED, GenerationStatus.fromWireValue(" Approved ").orElseThrow());
        assertTrue(GenerationStatus.fromWireValue("processing").isEmpty());
        assertTrue(GenerationStatus.fromWireValue(null).isEmpty());
    }

    @Test
    void testReadyForReviewAcceptsLegacyCompleted() {
        assertTrue(GenerationStatus.REVIEW.isReadyForReview());
        assertTrue(GenerationStatus.COMPLETED.isReadyForReview());
        assertFalse(GenerationStatus.PENDING.isReadyForReview());
        assertFalse(GenerationStatus.APPROVED.isReadyForReview());
        assertFalse(GenerationStatus.REJECTED.isReadyForReview());
        assertFalse(GenerationStatus.FAILED.isReadyForReview());
    }

    @Test
    void testToStringIsWireValue() {
        assertEquals("pending", GenerationStatus.PENDING.toString());
        assertEquals("failed", GenerationStatus.FAILED.wireValue());
    }
}
