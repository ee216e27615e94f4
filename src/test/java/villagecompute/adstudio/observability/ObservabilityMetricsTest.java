package villagecompute.adstudio.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * Unit tests for {@link ObservabilityMetrics} counters.
 */
class ObservabilityMetricsTest {

    private MeterRegistry meterRegistry;

    private ObservabilityMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new ObservabilityMetrics();
        metrics.registry = meterRegistry;
    }

    @Test
    void testJobCreatedCounterTagsPlatformAndOrigin() {
        metrics.incrementJobCreated("higgsfield", false);
        metrics.incrementJobCreated("higgsfield", false);
        metrics.incrementJobCreated("topview", true);

        assertEquals(2.0, meterRegistry.get("adstudio_generation_jobs_created_total").tag("platform", "higgsfield")
                .tag("origin", "request").counter().count());
        assertEquals(1.0, meterRegistry.get("adstudio_generation_jobs_created_total").tag("platform", "topview")
                .tag("origin", "regeneration").counter().count());
    }

    @Test
    void testWebhookCounterTagsProviderAndOutcome() {
        metrics.incrementWebhookReceived("higgsfield", "safety_rejected");
        metrics.incrementWebhookReceived("topview", "unrecognized");

        assertEquals(1.0, meterRegistry.get("adstudio_webhooks_received_total").tag("provider", "higgsfield")
                .tag("outcome", "safety_rejected").counter().count());
        assertEquals(1.0, meterRegistry.get("adstudio_webhooks_received_total").tag("provider", "topview")
                .tag("outcome", "unrecognized").counter().count());
    }

    @Test
    void testDispositionAndExpiryCounters() {
        metrics.incrementDisposition("approve");
        metrics.incrementJobsExpired(3);
        metrics.incrementJobsExpired(2);

        assertEquals(1.0,
                meterRegistry.get("adstudio_generation_dispositions_total").tag("action", "approve").counter().count());
        assertEquals(5.0, meterRegistry.get("adstudio_generation_jobs_expired_total").counter().count());
    }

    @Test
    void testQueueDepthGaugesRegisteredPerPlatform() {
        metrics.registerMetrics(new Object());

        assertNotNull(meterRegistry.find("adstudio_generation_queue_depth").tag("platform", "higgsfield").gauge());
        assertNotNull(meterRegistry.find("adstudio_generation_queue_depth").tag("platform", "topview").gauge());
    }
}
