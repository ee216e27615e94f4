package villagecompute.adstudio.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Panache entity for one AI video render attempt (system of record for generation status).
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (TEXT, PK) - Opaque UUID string, immutable</li>
 * <li>{@code source_ad_id} (TEXT) - Optional back-reference to the scraped ad that inspired the render</li>
 * <li>{@code platform} (TEXT) - Provider tag ({@code higgsfield}, {@code topview})</li>
 * <li>{@code model} (TEXT) - Optional provider model variant</li>
 * <li>{@code status} (TEXT) - {@link GenerationStatus} name</li>
 * <li>{@code input_type} (TEXT) - Input mode (product-url, image, avatar, text-to-video, ...)</li>
 * <li>{@code input_data} (TEXT) - JSON snapshot of creation inputs, written once</li>
 * <li>{@code hf_request_id} / {@code tv_task_id} (TEXT) - Provider correlation ids, at most one populated</li>
 * <li>{@code output_video_url}, {@code preview_url} (TEXT) - Set by successful callbacks</li>
 * <li>{@code retry_count} (INT) - Position in a regeneration lineage</li>
 * <li>{@code regenerated_from_job_id} (TEXT) - Rejected job this one was regenerated from (lookup only)</li>
 * <li>{@code generated_at} (TIMESTAMPTZ) - First terminal provider outcome</li>
 * <li>{@code reviewed_at} (TIMESTAMPTZ) - Human disposition time</li>
 * </ul>
 *
 * @see GenerationQueueEntry for the matching queue index row
 * @see villagecompute.adstudio.services.GenerationJobService for lifecycle rules
 */
@Entity
@Table(
        name = "generation_jobs",
        indexes = {@Index(
                name = "idx_generation_jobs_status_created",
                columnList = "status, created_at"),
                @Index(
                        name = "idx_generation_jobs_hf_request",
                        columnList = "hf_request_id"),
                @Index(
                        name = "idx_generation_jobs_tv_task",
                        columnList = "tv_task_id")})
public class GenerationJob extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false,
            length = 64)
    public String id;

    @Column(
            name = "source_ad_id",
            length = 64)
    public String sourceAdId;

    @Column(
            nullable = false,
            length = 32)
    public String platform;

    @Column
    public String model;

    @Column(
            nullable = false,
            length = 16)
    @Enumerated(EnumType.STRING)
    public GenerationStatus status;

    @Column(
            name = "input_type",
            nullable = false,
            length = 64)
    public String inputType;

    @Column(
            name = "input_data",
            length = 16384,
            updatable = false)
    public String inputData;

    @Column(
            name = "hf_request_id")
    public String higgsfieldRequestId;

    @Column(
            name = "tv_task_id")
    public String topviewTaskId;

    @Column(
            name = "output_video_url",
            length = 2048)
    public String outputVideoUrl;

    @Column(
            name = "preview_url",
            length = 2048)
    public String previewUrl;

    @Column(
            name = "error_message",
            length = 2000)
    public String errorMessage;

    @Column(
            name = "review_notes",
            length = 4000)
    public String reviewNotes;

    @Column(
            name = "credits_used")
    public Integer creditsUsed;

    @Column(
            name = "retry_count",
            nullable = false)
    public int retryCount;

    @Column(
            name = "regenerated_from_job_id",
            length = 64)
    public String regeneratedFromJobId;

    @Column(
            name = "created_at",
            nullable = false,
            updatable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    @Column(
            name = "generated_at")
    public Instant generatedAt;

    @Column(
            name = "reviewed_at")
    public Instant reviewedAt;

    /**
     * Builds a new pending job with a fresh id. The caller persists it together with its queue entry.
     */
    public static GenerationJob newPending(String sourceAdId, String platform, String model, String inputType,
            String inputData, int retryCount) {
        Instant now = Instant.now();
        GenerationJob job = new GenerationJob();
        job.id = UUID.randomUUID().toString();
        job.sourceAdId = sourceAdId;
        job.platform = platform;
        job.model = model;
        job.inputType = inputType;
        job.inputData = inputData;
        job.retryCount = retryCount;
        job.status = GenerationStatus.PENDING;
        job.createdAt = now;
        job.updatedAt = now;
        return job;
    }

    /**
     * Loads a job and takes a row lock for the rest of the transaction.
     *
     * @param id
     *            job id
     * @return the locked job, or empty when absent
     */
    public static Optional<GenerationJob> findByIdForUpdate(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(findById(id, LockModeType.PESSIMISTIC_WRITE));
    }

    /**
     * Finds the job correlated with a Higgsfield request id, locking it.
     */
    public static Optional<GenerationJob> findByHiggsfieldRequestId(String requestId) {
        if (requestId == null) {
            return Optional.empty();
        }
        return find("higgsfieldRequestId", requestId).withLock(LockModeType.PESSIMISTIC_WRITE).firstResultOptional();
    }

    /**
     * Finds the job correlated with a TopView task id, locking it.
     */
    public static Optional<GenerationJob> findByTopviewTaskId(String taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        return find("topviewTaskId", taskId).withLock(LockModeType.PESSIMISTIC_WRITE).firstResultOptional();
    }

    /**
     * Lists jobs matching optional status and platform filters, newest first.
     *
     * @param status
     *            status filter or null
     * @param platform
     *            platform filter or null
     * @param offset
     *            rows to skip
     * @param limit
     *            max rows
     * @return page of jobs
     */
    public static List<GenerationJob> search(GenerationStatus status, String platform, int offset, int limit) {
        Filter filter = Filter.of(status, platform);
        return find(filter.query() + " ORDER BY createdAt DESC, id DESC", filter.parameters())
                .range(offset, offset + limit - 1).list();
    }

    /**
     * Counts jobs matching the same filters as {@link #search}.
     */
    public static long countMatching(GenerationStatus status, String platform) {
        Filter filter = Filter.of(status, platform);
        return count(filter.query(), filter.parameters());
    }

    /**
     * Finds pending jobs created before the cutoff, oldest first.
     */
    public static List<GenerationJob> findStalePending(Instant cutoff, int limit) {
        return find("status = ?1 AND createdAt < ?2 ORDER BY createdAt ASC", GenerationStatus.PENDING, cutoff)
                .range(0, limit - 1).list();
    }

    /**
     * Returns the provider correlation id populated for this job, if any.
     */
    public String providerReference() {
        return higgsfieldRequestId != null ? higgsfieldRequestId : topviewTaskId;
    }

    /**
     * Stamps {@code generatedAt} unless a previous terminal outcome already did.
     */
    public void stampGeneratedAt(Instant when) {
        if (this.generatedAt == null) {
            this.generatedAt = when;
        }
    }

    @PreUpdate
    public void preUpdate() {
        this.updatedAt = Instant.now();
    }

    private record Filter(String query, Parameters parameters) {

        static Filter of(GenerationStatus status, String platform) {
            List<String> clauses = new ArrayList<>();
            Parameters params = new Parameters();
            if (status != null) {
                clauses.add("status = :status");
                params = params.and("status", status);
            }
            if (platform != null && !platform.isBlank()) {
                clauses.add("platform = :platform");
                params = params.and("platform", platform);
            }
            String query = clauses.isEmpty() ? "1 = 1" : String.join(" AND ", clauses);
            return new Filter(query, params);
        }
    }
}
