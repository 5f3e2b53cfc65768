package villagecompute.scheduler.data;

import villagecompute.scheduler.data.models.ExecutionStatus;
import villagecompute.scheduler.data.models.JobDefinition;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence seam for job definitions.
 *
 * <p>
 * Every method is its own unit of work. Scheduling bookkeeping writes are last-write-wins; the lease methods are the
 * only conditional updates and are what guarantees at-most-one concurrent run per job.
 *
 * @see PanacheJobDefinitionStore
 */
public interface JobDefinitionStore {

    void insert(JobDefinition job);

    Optional<JobDefinition> findById(UUID id);

    Optional<JobDefinition> findByName(String name);

    /**
     * Applies an operator edit to the stored row in one unit of work, see {@link JobDefinition#applyOperatorEdit}.
     * The lease and run bookkeeping written concurrently by dispatch and the executor are preserved.
     *
     * @return the stored definition after the edit, empty if it no longer exists
     */
    Optional<JobDefinition> applyOperatorEdit(JobDefinition edited, boolean resetSchedule, boolean resetRetries);

    boolean delete(UUID id);

    Page<JobDefinition> list(JobFilter filter, PageRequest page);

    List<JobDefinition> listAll();

    /**
     * Returns enabled jobs with {@code next_run_at <= now}, oldest first.
     */
    List<JobDefinition> findReadyToRun(Instant now);

    /**
     * Writes the post-execution bookkeeping without touching operator-owned fields.
     *
     * @return true if the job still exists
     */
    boolean recordExecutionOutcome(UUID id, Instant lastRunAt, Instant nextRunAt, ExecutionStatus lastStatus,
            int retryAttempt, Instant updatedAt);

    /**
     * Claims the execution lease if it is free or expired.
     *
     * @return true if this caller now owns the lease
     */
    boolean tryAcquireLease(UUID id, String owner, Instant expiresAt, Instant now);

    /**
     * Releases the lease if {@code owner} still holds it.
     */
    void releaseLease(UUID id, String owner);

    long count(Boolean enabled);
}
