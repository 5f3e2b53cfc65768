package villagecompute.scheduler.exceptions;

/**
 * Exception thrown when an operation conflicts with the current state of a job definition.
 *
 * <p>
 * Covers duplicate job names, manual triggers of disabled jobs, and triggers of a job whose execution lease is held by
 * another run. Mapped to HTTP 409 Conflict.
 */
public class JobConflictException extends RuntimeException {

    public JobConflictException(String message) {
        super(message);
    }
}
