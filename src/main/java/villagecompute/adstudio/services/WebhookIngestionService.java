package villagecompute.adstudio.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.adstudio.api.types.WebhookResultType;
import villagecompute.adstudio.data.models.GenerationJob;
import villagecompute.adstudio.data.models.GenerationQueueEntry;
import villagecompute.adstudio.data.models.GenerationStatus;
import villagecompute.adstudio.exceptions.ResourceNotFoundException;
import villagecompute.adstudio.integration.providers.ProviderCallback;
import villagecompute.adstudio.integration.providers.WebhookNormalizer;
import villagecompute.adstudio.observability.LoggingConfig;
import villagecompute.adstudio.observability.ObservabilityMetrics;

import java.time.Instant;
import java.util.Optional;

/**
 * Applies provider render callbacks to generation jobs.
 *
 * <p>
 * <b>Processing Steps (one transaction):</b>
 * <ol>
 * <li>Normalize the payload (missing correlation id: 400)</li>
 * <li>Resolve the job by the provider's correlation field, falling back to the internal job id (logged with the
 * {@code correlation-fallback} marker); unresolved: 404, nothing written</li>
 * <li>For a terminal outcome, delete the queue entry, then set the new status and stamp {@code generatedAt} once</li>
 * <li>Refresh provided output fields (video URL, preview URL, error text, model)</li>
 * </ol>
 *
 * <p>
 * <b>Idempotency:</b> redelivering the same callback leaves the job unchanged; the queue delete is a no-op and
 * {@code generatedAt} is only written when unset. Callbacks arriving after a human approved or rejected the job refresh
 * fields but never move the status. Unrecognized provider statuses leave the status alone and are counted.
 */
@ApplicationScoped
public class WebhookIngestionService {

    private static final Logger LOG = Logger.getLogger(WebhookIngestionService.class);

    public static final String CORRELATION_FALLBACK_MARKER = "correlation-fallback";

    @Inject
    ObservabilityMetrics metrics;

    /**
     * Normalizes and applies one provider callback.
     *
     * @param normalizer
     *            provider normalizer
     * @param payload
     *            parsed provider payload
     * @return acknowledgement with the job's resulting status
     * @throws villagecompute.adstudio.exceptions.ValidationException
     *             if the payload has no correlation id
     * @throws ResourceNotFoundException
     *             if no job matches the correlation id
     */
    @Transactional
    public <P> WebhookResultType ingest(WebhookNormalizer<P> normalizer, P payload) {
        ProviderCallback callback = normalizer.normalize(payload);
        String provider = callback.provider();

        GenerationJob job = normalizer.findCorrelatedJob(callback.reference())
                .or(() -> findByInternalId(provider, callback.reference())).orElse(null);
        if (job == null) {
            metrics.incrementWebhookReceived(provider, "not_found");
            LOG.warnf("[%s Webhook] No job found for reference %s", provider, callback.reference());
            throw new ResourceNotFoundException("Job not found for " + provider + " reference " + callback.reference());
        }
        LoggingConfig.setGenerationJob(job.id, job.platform);

        GenerationStatus previous = job.status;
        Optional<GenerationStatus> target = callback.outcome().targetStatus();
        if (target.isEmpty()) {
            LOG.warnf("[%s Webhook] Unrecognized status '%s' for job %s, keeping status %s", provider,
                    callback.rawStatus(), job.id, previous);
        } else if (previous.isDisposed()) {
            LOG.infof("[%s Webhook] Ignoring late '%s' callback for job %s, already %s", provider, callback.rawStatus(),
                    job.id, previous);
        } else {
            applyTerminalStatus(job, target.get(), callback);
        }

        refreshFields(job, callback);

        metrics.incrementWebhookReceived(provider, callback.outcome().tag());
        LOG.infof("[%s Webhook] Job %s: %s -> %s", provider, job.id, previous, job.status);
        return new WebhookResultType(true, job.id, job.status);
    }

    private void applyTerminalStatus(GenerationJob job, GenerationStatus status, ProviderCallback callback) {
        long removed = GenerationQueueEntry.deleteByJobId(job.id);
        if (removed > 0) {
            LOG.debugf("Removed queue entry for job %s", job.id);
        }

        job.status = status;
        job.stampGeneratedAt(callback.completedAt() != null ? callback.completedAt() : Instant.now());
    }

    private void refreshFields(GenerationJob job, ProviderCallback callback) {
        if (callback.videoUrl() != null) {
            job.outputVideoUrl = callback.videoUrl();
        }
        if (callback.previewUrl() != null) {
            job.previewUrl = callback.previewUrl();
        }
        if (callback.errorMessage() != null) {
            job.errorMessage = callback.errorMessage();
        }
        if (callback.model() != null) {
            job.model = callback.model();
        }
    }

    private Optional<GenerationJob> findByInternalId(String provider, String reference) {
        Optional<GenerationJob> job = GenerationJob.findByIdForUpdate(reference);
        job.ifPresent(found -> LOG.warnf("[%s Webhook] %s: reference %s matched internal job id", provider,
                CORRELATION_FALLBACK_MARKER, reference));
        return job;
    }
}
