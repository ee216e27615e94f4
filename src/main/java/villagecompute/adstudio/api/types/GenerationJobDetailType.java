package villagecompute.adstudio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * Job detail: every job field at the top level plus the source ad summary and the queue entry (null when the job is
 * no longer pending).
 *
 * @param job
 *            job fields, serialized inline
 * @param sourceAd
 *            summary of the ad the job was generated from, null when unknown
 * @param queue
 *            queue entry, null unless pending
 */
public record GenerationJobDetailType(@JsonUnwrapped GenerationJobType job,

        @JsonProperty("sourceAd") SourceAdSummaryType sourceAd,

        @JsonProperty("queue") QueueEntryType queue) {
}
