package villagecompute.adstudio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.adstudio.data.models.GenerationQueueEntry;

import java.time.Instant;

/**
 * API type for a generation queue entry.
 */
public record QueueEntryType(@JsonProperty("id") String id, @JsonProperty("jobId") String jobId,
        @JsonProperty("platform") String platform, @JsonProperty("priority") int priority,
        @JsonProperty("createdAt") Instant createdAt) {

    public static QueueEntryType from(GenerationQueueEntry entry) {
        return new QueueEntryType(entry.id, entry.jobId, entry.platform, entry.priority, entry.createdAt);
    }
}
