package villagecompute.adstudio.exceptions;

/**
 * Exception thrown when input validation fails (e.g., missing input type, malformed webhook payload).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 400 Bad Request.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
