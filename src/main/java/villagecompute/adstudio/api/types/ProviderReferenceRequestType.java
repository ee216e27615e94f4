package villagecompute.adstudio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request type for recording the provider's correlation id on a pending job.
 *
 * @param providerRequestId
 *            Higgsfield request id or TopView task id, depending on the job's platform
 */
public record ProviderReferenceRequestType(@JsonProperty("providerRequestId") String providerRequestId) {
}
