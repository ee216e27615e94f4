package villagecompute.adstudio.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Panache entity indexing generation work currently owed by a provider.
 *
 * <p>
 * A row exists for a {@link GenerationJob} if and only if the job is {@link GenerationStatus#PENDING}. The unique
 * constraint on {@code job_id} backs the "at most one entry per job" rule even under concurrent writers.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (TEXT, PK) - UUID string</li>
 * <li>{@code job_id} (TEXT, UNIQUE) - Owning generation job</li>
 * <li>{@code platform} (TEXT) - Copy of the job's platform for per-provider depth</li>
 * <li>{@code priority} (INT) - Higher = more urgent</li>
 * <li>{@code created_at} (TIMESTAMPTZ) - Enqueue time</li>
 * </ul>
 */
@Entity
@Table(
        name = "generation_queue",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_generation_queue_job",
                columnNames = "job_id"))
public class GenerationQueueEntry extends PanacheEntityBase {

    private static final Logger LOG = Logger.getLogger(GenerationQueueEntry.class);

    @Id
    @Column(
            nullable = false,
            length = 64)
    public String id;

    @Column(
            name = "job_id",
            nullable = false,
            length = 64)
    public String jobId;

    @Column(
            nullable = false,
            length = 32)
    public String platform;

    @Column(
            nullable = false)
    public int priority;

    @Column(
            name = "created_at",
            nullable = false,
            updatable = false)
    public Instant createdAt;

    /**
     * Persists a queue entry for a freshly created pending job.
     *
     * @param job
     *            pending job, already persisted in the current transaction
     * @param priority
     *            queue priority
     * @return the persisted entry
     */
    public static GenerationQueueEntry enqueue(GenerationJob job, int priority) {
        GenerationQueueEntry entry = new GenerationQueueEntry();
        entry.id = UUID.randomUUID().toString();
        entry.jobId = job.id;
        entry.platform = job.platform;
        entry.priority = priority;
        entry.createdAt = Instant.now();
        entry.persist();

        LOG.debugf("Enqueued generation job %s on %s (priority=%d)", job.id, job.platform, priority);
        return entry;
    }

    public static Optional<GenerationQueueEntry> findByJobId(String jobId) {
        return find("jobId", jobId).firstResultOptional();
    }

    /**
     * Removes the entry for a job. A missing entry is not an error.
     *
     * <p>
     * Bulk HQL delete, so it is executed immediately rather than at flush time.
     *
     * @return rows removed (0 or 1)
     */
    public static long deleteByJobId(String jobId) {
        return delete("jobId", jobId);
    }

    public static long countByPlatform(String platform) {
        return count("platform", platform);
    }
}
