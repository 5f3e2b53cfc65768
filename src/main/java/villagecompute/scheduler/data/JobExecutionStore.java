package villagecompute.scheduler.data;

import villagecompute.scheduler.data.models.ExecutionStatus;
import villagecompute.scheduler.data.models.JobExecution;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence seam for the append-only execution history.
 *
 * @see PanacheJobExecutionStore
 */
public interface JobExecutionStore {

    void insert(JobExecution execution);

    /**
     * Writes the terminal state of a record that is still {@code RUNNING}.
     *
     * @return false if the record is missing or already terminal
     */
    boolean finalizeExecution(JobExecution execution);

    Optional<JobExecution> findById(UUID id);

    /**
     * Lists records matching the filter, newest {@code started_at} first.
     */
    Page<JobExecution> list(ExecutionFilter filter, int skip, int limit);

    List<JobExecution> findRunning();

    boolean delete(UUID id);

    /**
     * Deletes terminal records that completed before {@code cutoff}.
     *
     * @param statuses
     *            restrict to these statuses, all terminal statuses when empty
     * @return number of deleted rows
     */
    long deleteCompletedBefore(Instant cutoff, Collection<ExecutionStatus> statuses);

    long countCompletedBefore(Instant cutoff, Collection<ExecutionStatus> statuses);

    long count(ExecutionStatus status);
}
