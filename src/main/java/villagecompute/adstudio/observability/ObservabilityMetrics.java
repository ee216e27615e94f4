package villagecompute.adstudio.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.adstudio.data.models.GenerationQueueEntry;
import villagecompute.adstudio.integration.providers.PlatformSelector;

import java.util.List;

/**
 * Registers and updates the generation coordinator's custom metrics.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Gauges:</b> {@code adstudio_generation_queue_depth{platform}} - Jobs currently owed by each provider</li>
 * <li><b>Counters:</b> {@code adstudio_generation_jobs_created_total{platform,origin}} - Jobs created (origin is
 * {@code request} or {@code regeneration})</li>
 * <li><b>Counters:</b> {@code adstudio_webhooks_received_total{provider,outcome}} - Provider callbacks by normalized
 * outcome</li>
 * <li><b>Counters:</b> {@code adstudio_generation_dispositions_total{action}} - Human approve/reject decisions and
 * administrative overrides</li>
 * <li><b>Counters:</b> {@code adstudio_generation_jobs_expired_total} - Pending jobs failed by the stale sweep</li>
 * </ul>
 *
 * <p>
 * Exported in Prometheus format at {@code /q/metrics}. HTTP server metrics come from Quarkus automatically.
 *
 * @see LoggingConfig for structured logging field definitions
 */
@ApplicationScoped
public class ObservabilityMetrics {

    private static final Logger LOG = Logger.getLogger(ObservabilityMetrics.class);

    @Inject
    MeterRegistry registry;

    /**
     * Registers queue depth gauges at application startup.
     */
    public void registerMetrics(@Observes @Initialized(ApplicationScoped.class) Object init) {
        LOG.info("Registering generation metrics");

        for (String platform : List.of(PlatformSelector.HIGGSFIELD, PlatformSelector.TOPVIEW)) {
            Gauge.builder("adstudio_generation_queue_depth", this, m -> getQueueDepth(platform))
                    .description("Generation jobs awaiting a " + platform + " callback")
                    .tags(List.of(Tag.of("platform", platform))).register(registry);

            LOG.debugf("Registered gauge: adstudio_generation_queue_depth{platform=%s}", platform);
        }
    }

    /**
     * Counts queue entries for a provider in a short read-only transaction.
     *
     * @return queue depth, 0 if the query fails
     */
    private double getQueueDepth(String platform) {
        try {
            return QuarkusTransaction.requiringNew().call(() -> GenerationQueueEntry.countByPlatform(platform));
        } catch (Exception e) {
            // A failing scrape must not take the registry down
            LOG.warnf(e, "Failed to read generation queue depth for %s, returning 0", platform);
            return 0.0;
        }
    }

    /**
     * Increments the job created counter.
     *
     * @param platform
     *            provider tag of the new job
     * @param regeneration
     *            true when the job was created by rejecting and regenerating another job
     */
    public void incrementJobCreated(String platform, boolean regeneration) {
        String origin = regeneration ? "regeneration" : "request";
        Counter.builder("adstudio_generation_jobs_created_total").description("Total generation jobs created")
                .tags(List.of(Tag.of("platform", platform), Tag.of("origin", origin))).register(registry).increment();
    }

    /**
     * Increments the webhook received counter.
     *
     * @param provider
     *            provider tag
     * @param outcome
     *            normalized outcome tag, or {@code not_found} when no job matched
     */
    public void incrementWebhookReceived(String provider, String outcome) {
        Counter.builder("adstudio_webhooks_received_total").description("Total provider render callbacks received")
                .tags(List.of(Tag.of("provider", provider), Tag.of("outcome", outcome))).register(registry)
                .increment();
    }

    /**
     * Increments the disposition counter.
     *
     * @param action
     *            {@code approve}, {@code reject}, {@code regenerate} or {@code override}
     */
    public void incrementDisposition(String action) {
        Counter.builder("adstudio_generation_dispositions_total").description("Total human dispositions of jobs")
                .tag("action", action).register(registry).increment();
    }

    public void incrementJobsExpired(int count) {
        Counter.builder("adstudio_generation_jobs_expired_total")
                .description("Pending generation jobs failed after waiting too long for a callback").register(registry)
                .increment(count);
    }
}
