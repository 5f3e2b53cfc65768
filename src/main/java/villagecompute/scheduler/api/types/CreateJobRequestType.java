package villagecompute.scheduler.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.scheduler.data.models.JobSchedule;
import villagecompute.scheduler.data.models.NotificationTargets;
import villagecompute.scheduler.data.models.RetryPolicy;
import villagecompute.scheduler.services.JobDraft;

import java.util.Map;

/**
 * API request type for creating a job definition.
 *
 * <p>
 * Used in {@code POST /admin/api/scheduler/jobs}. Parameters are validated by the selected template, not here.
 *
 * @param name
 *            unique job name
 * @param description
 *            optional free text
 * @param templateType
 *            registered template key
 * @param parameters
 *            template specific parameters
 * @param schedule
 *            interval or cron schedule
 * @param enabled
 *            defaults to true
 * @param timeoutSeconds
 *            defaults to {@code scheduler.jobs.default-timeout-seconds}
 * @param retryPolicy
 *            defaults to the configured retry policy
 * @param notifications
 *            optional recipients
 * @param allowConcurrentRuns
 *            opt out of the single-run lease
 */
@Schema(
        description = "Request to create a scheduled job")
public record CreateJobRequestType(@Schema(
        description = "Unique job name",
        example = "nightly-history-cleanup") @NotBlank @Size(
                max = 255) String name,

        @Schema(
                description = "Free text description",
                nullable = true) @Size(
                        max = 2000) String description,

        @Schema(
                description = "Registered template key",
                example = "execution_history_cleanup") @JsonProperty("template_type") @NotBlank String templateType,

        @Schema(
                description = "Template specific parameters",
                nullable = true) Map<String, Object> parameters,

        @Schema(
                description = "Interval or cron schedule") @NotNull JobSchedule schedule,

        @Schema(
                description = "Whether the job is dispatched",
                nullable = true) Boolean enabled,

        @Schema(
                description = "Maximum run time in seconds",
                example = "3600",
                nullable = true) @JsonProperty("timeout_seconds") @Min(1) Long timeoutSeconds,

        @Schema(
                description = "Retry policy for scheduler-triggered runs",
                nullable = true) @JsonProperty("retry_policy") RetryPolicy retryPolicy,

        @Schema(
                description = "Notification recipients",
                nullable = true) NotificationTargets notifications,

        @Schema(
                description = "Allow overlapping runs of this job",
                nullable = true) @JsonProperty("allow_concurrent_runs") Boolean allowConcurrentRuns) {

    public JobDraft toDraft() {
        return new JobDraft(name, description, templateType, parameters, schedule, enabled, timeoutSeconds,
                retryPolicy, notifications, allowConcurrentRuns);
    }
}
