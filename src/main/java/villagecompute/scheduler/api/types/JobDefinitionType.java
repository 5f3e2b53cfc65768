package villagecompute.scheduler.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.scheduler.data.models.JobSchedule;
import villagecompute.scheduler.data.models.NotificationTargets;
import villagecompute.scheduler.data.models.RetryPolicy;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Job definition DTO for API responses. Lease fields are internal and not exposed.
 */
public record JobDefinitionType(UUID id, String name, String description,
        @JsonProperty("template_type") String templateType, Map<String, Object> parameters, JobSchedule schedule,
        boolean enabled, @JsonProperty("timeout_seconds") long timeoutSeconds,
        @JsonProperty("retry_policy") RetryPolicy retryPolicy, NotificationTargets notifications,
        @JsonProperty("allow_concurrent_runs") boolean allowConcurrentRuns,
        @JsonProperty("created_by") String createdBy, @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt, @JsonProperty("last_run_at") Instant lastRunAt,
        @JsonProperty("next_run_at") Instant nextRunAt, @JsonProperty("last_status") String lastStatus,
        @JsonProperty("retry_attempt") int retryAttempt, long version) {
}
