package villagecompute.adstudio.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.adstudio.api.types.CreateGenerationJobRequestType;
import villagecompute.adstudio.api.types.GenerationJobDetailType;
import villagecompute.adstudio.api.types.GenerationJobListType;
import villagecompute.adstudio.api.types.GenerationJobType;
import villagecompute.adstudio.api.types.JobCreatedType;
import villagecompute.adstudio.api.types.QueueEntryType;
import villagecompute.adstudio.api.types.SourceAdSummaryType;
import villagecompute.adstudio.api.types.UpdateGenerationJobRequestType;
import villagecompute.adstudio.data.models.Ad;
import villagecompute.adstudio.data.models.GenerationJob;
import villagecompute.adstudio.data.models.GenerationQueueEntry;
import villagecompute.adstudio.data.models.GenerationStatus;
import villagecompute.adstudio.exceptions.InvalidStateException;
import villagecompute.adstudio.exceptions.ResourceNotFoundException;
import villagecompute.adstudio.exceptions.ValidationException;
import villagecompute.adstudio.integration.providers.PlatformSelector;
import villagecompute.adstudio.observability.LoggingConfig;
import villagecompute.adstudio.observability.ObservabilityMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Lifecycle controller for generation jobs.
 *
 * <p>
 * <b>Workflows:</b>
 * <ol>
 * <li>Creation: resolve platform, snapshot inputs, insert the job and its queue entry in one transaction</li>
 * <li>Provider reference: record the provider's correlation id on a pending job</li>
 * <li>Approval: {@code review|completed -> approved}</li>
 * <li>Rejection: {@code review|completed -> rejected}, optionally regenerating a new pending job one step further
 * down the lineage</li>
 * <li>Administrative override: operator repair of any field, followed by queue reconciliation</li>
 * <li>Deletion: queue entry first, then the job</li>
 * <li>Stale sweep: fail pending jobs the provider never called back for</li>
 * </ol>
 *
 * <p>
 * Provider callbacks are applied by {@link WebhookIngestionService}.
 *
 * <p>
 * <b>Concurrency:</b> every mutation loads the job with a {@code PESSIMISTIC_WRITE} lock, so a disposition, a webhook
 * and the sweep acting on the same job serialize in the database. The loser of two concurrent dispositions re-reads
 * the winner's status and fails with {@link InvalidStateException}.
 *
 * @see GenerationJob
 * @see GenerationQueueEntry
 */
@ApplicationScoped
public class GenerationJobService {

    private static final Logger LOG = Logger.getLogger(GenerationJobService.class);

    public static final String TIMEOUT_MESSAGE = "Timed out waiting for provider callback";

    @Inject
    ObjectMapper objectMapper;

    @Inject
    ObservabilityMetrics metrics;

    @ConfigProperty(
            name = "adstudio.generation.default-aspect-ratio",
            defaultValue = "9:16")
    String defaultAspectRatio;

    @ConfigProperty(
            name = "adstudio.generation.default-priority",
            defaultValue = "0")
    int defaultPriority;

    @ConfigProperty(
            name = "adstudio.generation.regeneration-priority",
            defaultValue = "1")
    int regenerationPriority;

    @ConfigProperty(
            name = "adstudio.generation.pending-timeout",
            defaultValue = "PT6H")
    Duration pendingTimeout;

    @ConfigProperty(
            name = "adstudio.generation.sweep-batch-size",
            defaultValue = "100")
    int sweepBatchSize;

    @ConfigProperty(
            name = "adstudio.generation.default-page-size",
            defaultValue = "50")
    int defaultPageSize;

    @ConfigProperty(
            name = "adstudio.generation.max-page-size",
            defaultValue = "200")
    int maxPageSize;

    /**
     * Creates a pending job and its queue entry.
     *
     * @param request
     *            creation request
     * @return ids of the new job and queue entry with the resolved platform
     * @throws ValidationException
     *             if {@code inputType} is missing, or a provider reference is given for an unknown platform
     */
    @Transactional
    public JobCreatedType createJob(CreateGenerationJobRequestType request) {
        if (request == null || isBlank(request.inputType())) {
            throw new ValidationException("inputType is required");
        }

        String platform = PlatformSelector.select(request.platform(), request.inputType(), request.productUrl(),
                request.imageUrl(), request.avatarId());

        GenerationJob job = GenerationJob.newPending(blankToNull(request.sourceAdId()), platform,
                blankToNull(request.model()), request.inputType(), serializeInputData(request), 0);
        if (!isBlank(request.providerRequestId())) {
            assignProviderReference(job, request.providerRequestId());
        }
        job.persist();

        int priority = request.priority() != null ? request.priority() : defaultPriority;
        GenerationQueueEntry entry = GenerationQueueEntry.enqueue(job, priority);

        LoggingConfig.setGenerationJob(job.id, platform);
        metrics.incrementJobCreated(platform, false);
        LOG.infof("Created generation job %s: platform=%s, inputType=%s, priority=%d", job.id, platform,
                job.inputType, priority);

        return new JobCreatedType(job.id, entry.id, platform, job.status, "Job queued for generation");
    }

    /**
     * Lists jobs, newest first.
     *
     * @param status
     *            status filter (wire value) or null
     * @param platform
     *            platform filter or null
     * @param limit
     *            page size, defaults to the configured page size and is capped at the configured maximum
     * @param offset
     *            rows to skip, defaults to 0
     * @return page with the total match count
     * @throws ValidationException
     *             for an unknown status or a paging value out of range
     */
    @Transactional
    public GenerationJobListType listJobs(String status, String platform, Integer limit, Integer offset) {
        GenerationStatus statusFilter = null;
        if (!isBlank(status)) {
            statusFilter = GenerationStatus.fromWireValue(status)
                    .orElseThrow(() -> new ValidationException("Unknown status: " + status));
        }
        int effectiveLimit = limit != null ? limit : defaultPageSize;
        int effectiveOffset = offset != null ? offset : 0;
        if (effectiveLimit <= 0) {
            throw new ValidationException("limit must be positive");
        }
        if (effectiveOffset < 0) {
            throw new ValidationException("offset must not be negative");
        }
        effectiveLimit = Math.min(effectiveLimit, maxPageSize);
        if (effectiveOffset > Integer.MAX_VALUE - effectiveLimit) {
            throw new ValidationException("offset is too large");
        }

        String platformFilter = blankToNull(platform);
        List<GenerationJobType> jobs = GenerationJob
                .search(statusFilter, platformFilter, effectiveOffset, effectiveLimit).stream().map(this::toType)
                .toList();
        long total = GenerationJob.countMatching(statusFilter, platformFilter);

        return new GenerationJobListType(jobs, total, effectiveLimit, effectiveOffset);
    }

    /**
     * Loads a job with its source ad summary and queue entry.
     *
     * @throws ResourceNotFoundException
     *             if the job does not exist
     */
    @Transactional
    public GenerationJobDetailType getJobDetail(String id) {
        GenerationJob job = GenerationJob.<GenerationJob>findByIdOptional(id)
                .orElseThrow(() -> new ResourceNotFoundException("Job not found: " + id));

        SourceAdSummaryType sourceAd = null;
        if (job.sourceAdId != null) {
            Ad ad = Ad.findById(job.sourceAdId);
            if (ad != null) {
                sourceAd = SourceAdSummaryType.from(ad, parseMediaUrls(ad));
            }
        }
        QueueEntryType queue = GenerationQueueEntry.findByJobId(job.id).map(QueueEntryType::from).orElse(null);

        return new GenerationJobDetailType(toType(job), sourceAd, queue);
    }

    /**
     * Records the provider's correlation id on a pending job.
     *
     * @param id
     *            job id
     * @param providerRequestId
     *            Higgsfield request id or TopView task id
     * @return the updated job
     * @throws InvalidStateException
     *             if the job is not pending or already carries a different reference
     */
    @Transactional
    public GenerationJob attachProviderReference(String id, String providerRequestId) {
        if (isBlank(providerRequestId)) {
            throw new ValidationException("providerRequestId is required");
        }
        GenerationJob job = lockJob(id);

        if (job.status != GenerationStatus.PENDING) {
            throw new InvalidStateException(String.format(
                    "Cannot attach provider reference to job in %s status. Must be in pending status.", job.status),
                    job.status);
        }

        String existing = job.providerReference();
        if (providerRequestId.equals(existing)) {
            LOG.debugf("Provider reference %s already attached to job %s", providerRequestId, id);
            return job;
        }
        if (existing != null) {
            throw new InvalidStateException(String.format(
                    "Job in %s status already has provider reference %s", job.status, existing), job.status);
        }

        assignProviderReference(job, providerRequestId);
        LOG.infof("Attached %s reference %s to job %s", job.platform, providerRequestId, id);
        return job;
    }

    /**
     * Approves a rendered video.
     *
     * @param id
     *            job id
     * @param notes
     *            reviewer notes; existing notes are kept when null
     * @return the approved job
     * @throws ResourceNotFoundException
     *             if the job does not exist
     * @throws InvalidStateException
     *             if the job is not ready for review
     */
    @Transactional
    public GenerationJob approve(String id, String notes) {
        GenerationJob job = lockJob(id);

        if (!job.status.isReadyForReview()) {
            throw new InvalidStateException(String.format(
                    "Cannot approve job in %s status. Must be in review or completed status.", job.status),
                    job.status);
        }

        job.status = GenerationStatus.APPROVED;
        job.reviewedAt = Instant.now();
        if (notes != null) {
            job.reviewNotes = notes;
        }

        metrics.incrementDisposition("approve");
        LOG.infof("Approved generation job %s", id);
        return job;
    }

    /**
     * Rejects a rendered video, optionally regenerating it.
     *
     * <p>
     * The regenerated job copies source ad, platform, model, input type and input snapshot, starts at
     * {@code retryCount + 1} and is queued at the regeneration priority so it jumps ahead of fresh work.
     *
     * @param id
     *            job id
     * @param notes
     *            reviewer notes; existing notes are kept when null
     * @param regenerate
     *            whether to create a replacement job
     * @return id of the regenerated job, or null
     * @throws ResourceNotFoundException
     *             if the job does not exist
     * @throws InvalidStateException
     *             if the job is not ready for review
     */
    @Transactional
    public String reject(String id, String notes, boolean regenerate) {
        GenerationJob job = lockJob(id);

        if (!job.status.isReadyForReview()) {
            throw new InvalidStateException(String.format(
                    "Cannot reject job in %s status. Must be in review or completed status.", job.status),
                    job.status);
        }

        job.status = GenerationStatus.REJECTED;
        job.reviewedAt = Instant.now();
        if (notes != null) {
            job.reviewNotes = notes;
        }
        metrics.incrementDisposition("reject");

        if (!regenerate) {
            LOG.infof("Rejected generation job %s", id);
            return null;
        }

        GenerationJob retry = GenerationJob.newPending(job.sourceAdId, job.platform, job.model, job.inputType,
                job.inputData, job.retryCount + 1);
        retry.regeneratedFromJobId = job.id;
        retry.persist();
        GenerationQueueEntry.enqueue(retry, regenerationPriority);

        metrics.incrementDisposition("regenerate");
        metrics.incrementJobCreated(retry.platform, true);
        LOG.infof("Rejected generation job %s and regenerated as %s (retryCount=%d)", id, retry.id, retry.retryCount);
        return retry.id;
    }

    /**
     * Applies an operator override to any job field, then reconciles the queue with the resulting status.
     *
     * <p>
     * {@code completed} is stored as {@code review}. Moving into {@code review} or {@code failed} stamps
     * {@code generatedAt} when unset; moving into {@code approved} or {@code rejected} stamps {@code reviewedAt}. A job
     * left {@code pending} ends up with exactly one queue entry, any other status with none.
     *
     * @param id
     *            job id
     * @param request
     *            fields to overwrite
     * @return the updated job
     * @throws ValidationException
     *             for an unknown status
     */
    @Transactional
    public GenerationJob override(String id, UpdateGenerationJobRequestType request) {
        GenerationStatus newStatus = null;
        if (request != null && !isBlank(request.status())) {
            newStatus = GenerationStatus.fromWireValue(request.status())
                    .orElseThrow(() -> new ValidationException("Unknown status: " + request.status()));
            if (newStatus == GenerationStatus.COMPLETED) {
                newStatus = GenerationStatus.REVIEW;
            }
        }

        GenerationJob job = lockJob(id);
        GenerationStatus previous = job.status;
        Instant now = Instant.now();

        if (newStatus != null) {
            job.status = newStatus;
            if (newStatus == GenerationStatus.REVIEW || newStatus == GenerationStatus.FAILED) {
                job.stampGeneratedAt(now);
            }
            if (newStatus.isDisposed()) {
                job.reviewedAt = now;
            }
        }
        if (request != null) {
            if (request.reviewNotes() != null) {
                job.reviewNotes = request.reviewNotes();
            }
            if (request.outputVideoUrl() != null) {
                job.outputVideoUrl = request.outputVideoUrl();
            }
            if (request.previewUrl() != null) {
                job.previewUrl = request.previewUrl();
            }
            if (request.errorMessage() != null) {
                job.errorMessage = request.errorMessage();
            }
            if (request.creditsUsed() != null) {
                job.creditsUsed = request.creditsUsed();
            }
        }

        reconcileQueue(job);

        metrics.incrementDisposition("override");
        LOG.warnf("Administrative override of generation job %s: status %s -> %s", id, previous, job.status);
        return job;
    }

    /**
     * Deletes a job and its queue entry.
     *
     * @throws ResourceNotFoundException
     *             if the job does not exist
     */
    @Transactional
    public void delete(String id) {
        GenerationJob job = lockJob(id);

        long removed = GenerationQueueEntry.deleteByJobId(id);
        job.delete();

        LOG.infof("Deleted generation job %s (queue entries removed: %d)", id, removed);
    }

    /**
     * Fails pending jobs older than the configured timeout.
     *
     * @return number of jobs expired
     */
    public int expireStalePendingJobs() {
        return expireStalePendingJobs(pendingTimeout);
    }

    /**
     * Fails pending jobs older than {@code timeout}. Each job is expired in its own transaction so one bad row does
     * not roll back the batch.
     *
     * @param timeout
     *            maximum time a job may wait for its provider
     * @return number of jobs expired
     */
    public int expireStalePendingJobs(Duration timeout) {
        Instant cutoff = Instant.now().minus(timeout);
        List<String> candidateIds = QuarkusTransaction.requiringNew()
                .call(() -> GenerationJob.findStalePending(cutoff, sweepBatchSize).stream().map(job -> job.id)
                        .toList());

        if (candidateIds.isEmpty()) {
            LOG.debug("No stale pending generation jobs");
            return 0;
        }

        int expired = 0;
        for (String id : candidateIds) {
            try {
                boolean changed = QuarkusTransaction.requiringNew().call(() -> expireIfStillPending(id, cutoff));
                if (changed) {
                    expired++;
                }
            } catch (Exception e) {
                LOG.errorf(e, "Failed to expire stale pending generation job %s", id);
            } finally {
                LoggingConfig.clearGenerationJob();
            }
        }

        if (expired > 0) {
            metrics.incrementJobsExpired(expired);
        }
        LOG.infof("Expired %d of %d stale pending generation jobs (cutoff=%s)", expired, candidateIds.size(), cutoff);
        return expired;
    }

    /**
     * Converts a job to its API type, parsing the input snapshot.
     */
    public GenerationJobType toType(GenerationJob job) {
        return GenerationJobType.from(job, parseInputData(job));
    }

    private boolean expireIfStillPending(String id, Instant cutoff) {
        GenerationJob job = GenerationJob.findByIdForUpdate(id).orElse(null);
        if (job == null || job.status != GenerationStatus.PENDING || !job.createdAt.isBefore(cutoff)) {
            return false;
        }
        LoggingConfig.setGenerationJob(job.id, job.platform);

        GenerationQueueEntry.deleteByJobId(job.id);
        job.status = GenerationStatus.FAILED;
        job.errorMessage = TIMEOUT_MESSAGE;
        job.stampGeneratedAt(Instant.now());

        LOG.warnf("Generation job %s on %s timed out waiting for provider callback (created %s)", job.id, job.platform,
                job.createdAt);
        return true;
    }

    private GenerationJob lockJob(String id) {
        GenerationJob job = GenerationJob.findByIdForUpdate(id)
                .orElseThrow(() -> new ResourceNotFoundException("Job not found: " + id));
        LoggingConfig.setGenerationJob(job.id, job.platform);
        return job;
    }

    private void reconcileQueue(GenerationJob job) {
        if (job.status == GenerationStatus.PENDING) {
            if (GenerationQueueEntry.findByJobId(job.id).isEmpty()) {
                GenerationQueueEntry.enqueue(job, defaultPriority);
                LOG.infof("Re-queued generation job %s after override", job.id);
            }
        } else {
            GenerationQueueEntry.deleteByJobId(job.id);
        }
    }

    private void assignProviderReference(GenerationJob job, String providerRequestId) {
        if (!PlatformSelector.isKnown(job.platform)) {
            throw new ValidationException("Provider references are not supported for platform: " + job.platform);
        }
        if (PlatformSelector.HIGGSFIELD.equals(job.platform)) {
            job.higgsfieldRequestId = providerRequestId;
        } else {
            job.topviewTaskId = providerRequestId;
        }
    }

    private String serializeInputData(CreateGenerationJobRequestType request) {
        ObjectNode node = objectMapper.createObjectNode();
        putIfPresent(node, "productUrl", request.productUrl());
        putIfPresent(node, "imageUrl", request.imageUrl());
        putIfPresent(node, "avatarId", request.avatarId());
        putIfPresent(node, "script", request.script());
        putIfPresent(node, "prompt", request.prompt());
        putIfPresent(node, "offer", request.offer());
        node.put("aspectRatio", isBlank(request.aspectRatio()) ? defaultAspectRatio : request.aspectRatio());
        if (request.duration() != null) {
            node.put("duration", request.duration());
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize generation input data", e);
        }
    }

    private JsonNode parseInputData(GenerationJob job) {
        if (job.inputData == null) {
            return null;
        }
        try {
            return objectMapper.readTree(job.inputData);
        } catch (JsonProcessingException e) {
            LOG.warnf("Generation job %s has unparseable inputData, returning null", job.id);
            return null;
        }
    }

    private List<String> parseMediaUrls(Ad ad) {
        if (ad.mediaUrls == null || ad.mediaUrls.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(ad.mediaUrls, new TypeReference<List<String>>() {
            });
        } catch (JsonProcessingException e) {
            LOG.warnf("Ad %s has unparseable mediaUrls, returning empty list", ad.id);
            return List.of();
        }
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (!isBlank(value)) {
            node.put(field, value);
        }
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
