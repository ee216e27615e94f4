package villagecompute.adstudio.integration.providers;

import villagecompute.adstudio.data.models.GenerationJob;
import villagecompute.adstudio.exceptions.ValidationException;

import java.util.Optional;

/**
 * Translates one provider's callback payload into a {@link ProviderCallback}.
 *
 * <p>
 * Implementations are stateless CDI beans. Applying the callback to a job (queue removal, status write) is the job of
 * {@link villagecompute.adstudio.services.WebhookIngestionService} so both providers share one set of lifecycle rules.
 *
 * @param <P>
 *            provider payload type
 */
public interface WebhookNormalizer<P> {

    /**
     * Provider tag, also used as the metrics label.
     */
    String provider();

    /**
     * Payload class the webhook body is parsed into.
     */
    Class<P> payloadType();

    /**
     * Normalizes a parsed payload.
     *
     * @param payload
     *            provider payload
     * @return normalized callback
     * @throws ValidationException
     *             if the correlation id is missing
     */
    ProviderCallback normalize(P payload);

    /**
     * Finds the job carrying this provider's correlation id, taking a row lock.
     *
     * @param reference
     *            correlation id from {@link ProviderCallback#reference()}
     * @return matching job, empty when no job carries the id
     */
    Optional<GenerationJob> findCorrelatedJob(String reference);
}
