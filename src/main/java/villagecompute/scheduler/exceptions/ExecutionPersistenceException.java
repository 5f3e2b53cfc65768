package villagecompute.scheduler.exceptions;

/**
 * Exception thrown when an execution record cannot be written or finalized.
 *
 * <p>
 * This is the one execution-time failure that is not absorbed into a {@code JobResult}: if the audit trail itself cannot
 * be persisted the caller has to know. A record left in {@code running} because of this failure is reconciled as
 * {@code orphaned} on the next boot.
 */
public class ExecutionPersistenceException extends RuntimeException {

    public ExecutionPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
