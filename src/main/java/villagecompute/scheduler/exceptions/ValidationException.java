package villagecompute.scheduler.exceptions;

/**
 * Exception thrown when a job definition is rejected before persistence.
 *
 * <p>
 * Raised for an unknown {@code template_type}, parameters refused by the template's validator, or a malformed schedule.
 * The message is returned to the operator verbatim, so validator output is never wrapped or prefixed. Mapped to HTTP 400
 * Bad Request by the admin resources.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
