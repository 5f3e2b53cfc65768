package villagecompute.scheduler.data;

import villagecompute.scheduler.data.models.ExecutionStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Filters for listing execution records. Null members are not applied.
 *
 * @param jobId
 *            owning job
 * @param status
 *            execution status
 * @param triggeredBy
 *            trigger source
 * @param startedFrom
 *            inclusive lower bound on started_at
 * @param startedTo
 *            exclusive upper bound on started_at
 */
public record ExecutionFilter(UUID jobId, ExecutionStatus status, String triggeredBy, Instant startedFrom,
        Instant startedTo) {

    public static ExecutionFilter all() {
        return new ExecutionFilter(null, null, null, null, null);
    }

    public static ExecutionFilter forJob(UUID jobId, ExecutionStatus status) {
        return new ExecutionFilter(jobId, status, null, null, null);
    }
}
