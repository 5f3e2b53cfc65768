package villagecompute.scheduler.exceptions;

/**
 * Exception thrown when a requested job definition or execution record does not exist.
 *
 * <p>
 * Mapped to HTTP 404 Not Found in REST resources.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
