package villagecompute.adstudio.exceptions;

import villagecompute.adstudio.data.models.GenerationStatus;

/**
 * Exception thrown when an operation is not legal for the current status of a generation job (e.g., approving a job
 * that is still pending).
 *
 * <p>
 * Carries the status observed at the time of the check so the caller can explain the rejection. Mapped to HTTP 400 Bad
 * Request.
 */
public class InvalidStateException extends RuntimeException {

    private final GenerationStatus currentStatus;

    public InvalidStateException(String message, GenerationStatus currentStatus) {
        super(message);
        this.currentStatus = currentStatus;
    }

    public GenerationStatus getCurrentStatus() {
        return currentStatus;
    }
}
