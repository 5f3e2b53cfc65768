package villagecompute.scheduler.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.scheduler.data.models.ExecutionLogEntry;
import villagecompute.scheduler.jobs.JobResult;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Execution record DTO for API responses.
 *
 * @param logs
 *            structured log lines captured during the run, in order
 */
public record JobExecutionType(UUID id, @JsonProperty("job_id") UUID jobId, @JsonProperty("job_name") String jobName,
        @JsonProperty("template_type") String templateType, String status,
        @JsonProperty("started_at") Instant startedAt, @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("duration_seconds") Double durationSeconds, JobResult result, String error,
        List<ExecutionLogEntry> logs, @JsonProperty("triggered_by") String triggeredBy, int attempt,
        @JsonProperty("execution_host") String executionHost) {
}
