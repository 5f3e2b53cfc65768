package villagecompute.scheduler.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.scheduler.data.models.JobSchedule;
import villagecompute.scheduler.data.models.NotificationTargets;
import villagecompute.scheduler.data.models.RetryPolicy;
import villagecompute.scheduler.services.JobPatch;

import java.util.Map;

/**
 * API request type for updating a job definition.
 *
 * <p>
 * All fields are optional to support partial updates via PATCH semantics. Null values indicate "no change". Identity,
 * audit and bookkeeping fields sent by clients that echo a full job document are ignored.
 */
@Schema(
        description = "Request to update a scheduled job (partial update)")
@JsonIgnoreProperties({ "id", "created_by", "created_at", "updated_at", "version", "last_run_at", "next_run_at",
        "last_status", "retry_attempt" })
public record UpdateJobRequestType(@Schema(
        nullable = true) @Size(
                max = 255) String name,

        @Schema(
                nullable = true) @Size(
                        max = 2000) String description,

        @Schema(
                nullable = true) @JsonProperty("template_type") String templateType,

        @Schema(
                nullable = true) Map<String, Object> parameters,

        @Schema(
                nullable = true) JobSchedule schedule,

        @Schema(
                nullable = true) Boolean enabled,

        @Schema(
                nullable = true) @JsonProperty("timeout_seconds") @Min(1) Long timeoutSeconds,

        @Schema(
                nullable = true) @JsonProperty("retry_policy") RetryPolicy retryPolicy,

        @Schema(
                nullable = true) NotificationTargets notifications,

        @Schema(
                nullable = true) @JsonProperty("allow_concurrent_runs") Boolean allowConcurrentRuns) {

    public JobPatch toPatch() {
        return new JobPatch(name, description, templateType, parameters, schedule, enabled, timeoutSeconds,
                retryPolicy, notifications, allowConcurrentRuns);
    }
}
