package villagecompute.adstudio.exceptions;

/**
 * Exception thrown when a requested resource is not found (e.g., generation job, queue entry, source ad).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 404 Not Found by
 * {@link villagecompute.adstudio.api.rest.ApiExceptionMappers}.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
