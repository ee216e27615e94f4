package villagecompute.adstudio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import villagecompute.adstudio.data.models.GenerationJob;
import villagecompute.adstudio.data.models.GenerationStatus;

import java.time.Instant;

/**
 * API type for a generation job as returned by the list, approve and detail endpoints.
 *
 * <p>
 * {@code inputData} is the deserialized creation snapshot, not the stored JSON text.
 */
public record GenerationJobType(@JsonProperty("id") String id,

        @JsonProperty("sourceAdId") String sourceAdId,

        @JsonProperty("platform") String platform,

        @JsonProperty("model") String model,

        @JsonProperty("status") GenerationStatus status,

        @JsonProperty("inputType") String inputType,

        @JsonProperty("inputData") JsonNode inputData,

        @JsonProperty("outputVideoUrl") String outputVideoUrl,

        @JsonProperty("previewUrl") String previewUrl,

        @JsonProperty("errorMessage") String errorMessage,

        @JsonProperty("reviewNotes") String reviewNotes,

        @JsonProperty("creditsUsed") Integer creditsUsed,

        @JsonProperty("retryCount") int retryCount,

        @JsonProperty("higgsfieldRequestId") String higgsfieldRequestId,

        @JsonProperty("topviewTaskId") String topviewTaskId,

        @JsonProperty("regeneratedFromJobId") String regeneratedFromJobId,

        @JsonProperty("createdAt") Instant createdAt,

        @JsonProperty("updatedAt") Instant updatedAt,

        @JsonProperty("generatedAt") Instant generatedAt,

        @JsonProperty("reviewedAt") Instant reviewedAt) {

    /**
     * Converts an entity to its API type.
     *
     * @param job
     *            the job entity
     * @param inputData
     *            parsed {@link GenerationJob#inputData}, null when unparseable
     * @return job API type
     */
    public static GenerationJobType from(GenerationJob job, JsonNode inputData) {
        return new GenerationJobType(job.id, job.sourceAdId, job.platform, job.model, job.status, job.inputType,
                inputData, job.outputVideoUrl, job.previewUrl, job.errorMessage, job.reviewNotes, job.creditsUsed,
                job.retryCount, job.higgsfieldRequestId, job.topviewTaskId, job.regeneratedFromJobId, job.createdAt,
                job.updatedAt, job.generatedAt, job.reviewedAt);
    }
}
