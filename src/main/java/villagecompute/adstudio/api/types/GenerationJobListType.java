package villagecompute.adstudio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Page of generation jobs.
 *
 * @param jobs
 *            jobs on this page, newest first
 * @param total
 *            total jobs matching the filters
 * @param limit
 *            effective page size
 * @param offset
 *            rows skipped
 */
public record GenerationJobListType(@JsonProperty("jobs") List<GenerationJobType> jobs,
        @JsonProperty("total") long total, @JsonProperty("limit") int limit, @JsonProperty("offset") int offset) {
}
