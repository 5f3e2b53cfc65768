package villagecompute.scheduler.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Scheduler status DTO for API responses.
 */
public record SchedulerStatusType(boolean running, @JsonProperty("total_jobs") long totalJobs,
        @JsonProperty("enabled_jobs") long enabledJobs, @JsonProperty("disabled_jobs") long disabledJobs,
        @JsonProperty("executions_by_status") Map<String, Long> executionsByStatus,
        @JsonProperty("success_rate") double successRate,
        @JsonProperty("registered_templates") int registeredTemplates,
        @JsonProperty("worker_pool_size") int workerPoolSize, @JsonProperty("active_workers") int activeWorkers,
        @JsonProperty("queued_jobs") int queuedJobs) {
}
