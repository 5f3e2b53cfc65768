package villagecompute.scheduler.jobs.templates;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.scheduler.data.JobExecutionStore;
import villagecompute.scheduler.data.models.ExecutionStatus;
import villagecompute.scheduler.jobs.JobExecutionContext;
import villagecompute.scheduler.jobs.JobResult;
import villagecompute.scheduler.jobs.ParameterValidation;
import villagecompute.scheduler.jobs.TypedJobTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Retention job for the execution history.
 *
 * <p>
 * Deletes finalized execution records whose {@code completed_at} is older than {@code retention_days}. Records still
 * {@code running} are never touched. Deleting a job definition leaves its history in place, so this template is the
 * only thing that shrinks {@code job_executions}.
 *
 * <p>
 * <b>Payload Structure:</b>
 *
 * <pre>
 * {
 *   "retention_days": 30,                 // 1..3650
 *   "statuses": ["success", "cancelled"], // Optional - all terminal statuses when empty
 *   "dry_run": false                      // Count only
 * }
 * </pre>
 */
@ApplicationScoped
public class ExecutionHistoryCleanupTemplate extends TypedJobTemplate<ExecutionHistoryCleanupTemplate.Params> {

    public static final String TYPE = "execution_history_cleanup";

    static final int MAX_RETENTION_DAYS = 3650;

    public record Params(@JsonProperty("retention_days") int retentionDays,
            @JsonProperty("statuses") List<String> statuses, @JsonProperty("dry_run") boolean dryRun) {
    }

    @Inject
    JobExecutionStore executionStore;

    @Inject
    Clock clock;

    public ExecutionHistoryCleanupTemplate() {
        super(Params.class);
    }

    @Override
    public String templateType() {
        return TYPE;
    }

    @Override
    public String displayName() {
        return "Execution history cleanup";
    }

    @Override
    public String description() {
        return "Deletes finalized execution records older than the retention window";
    }

    @Override
    public String category() {
        return "maintenance";
    }

    @Override
    public String estimatedDuration() {
        return "seconds to minutes";
    }

    @Override
    public String resourceUsage() {
        return "low";
    }

    @Override
    public String riskLevel() {
        return "medium";
    }

    @Override
    public Map<String, Object> getSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("retention_days", Map.of("type", "integer", "minimum", 1, "maximum", MAX_RETENTION_DAYS));
        properties.put("statuses", Map.of("type", "array", "items",
                Map.of("type", "string", "enum", List.of("success", "failed", "timeout", "cancelled", "orphaned"))));
        properties.put("dry_run", Map.of("type", "boolean"));
        return Map.of("type", "object", "properties", properties, "required", List.of("retention_days"));
    }

    @Override
    public Map<String, Object> getDefaultParams() {
        return Map.of("retention_days", 30, "statuses", List.of(), "dry_run", false);
    }

    @Override
    protected ParameterValidation validate(Params params) {
        if (params.retentionDays() < 1 || params.retentionDays() > MAX_RETENTION_DAYS) {
            return ParameterValidation.invalid("retention_days must be between 1 and " + MAX_RETENTION_DAYS);
        }
        if (params.statuses() != null) {
            for (String raw : params.statuses()) {
                ExecutionStatus status;
                try {
                    status = ExecutionStatus.fromValue(raw);
                } catch (IllegalArgumentException e) {
                    return ParameterValidation.invalid("Unknown status '" + raw + "'");
                }
                if (!status.isTerminal()) {
                    return ParameterValidation.invalid("statuses must only contain terminal statuses");
                }
            }
        }
        return ParameterValidation.ok();
    }

    @Override
    protected JobResult execute(JobExecutionContext context, Params params) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(params.retentionDays()));
        List<ExecutionStatus> statuses = new ArrayList<>();
        if (params.statuses() != null) {
            params.statuses().forEach(s -> statuses.add(ExecutionStatus.fromValue(s)));
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("cutoff", cutoff.toString());
        details.put("statuses", params.statuses() == null ? List.of() : params.statuses());
        details.put("dry_run", params.dryRun());

        long matching = executionStore.countCompletedBefore(cutoff, statuses);
        if (params.dryRun()) {
            context.info("Dry run: " + matching + " execution records completed before " + cutoff);
            return JobResult.success("Dry run found " + matching + " records to delete", matching, 0, details);
        }

        long deleted = executionStore.deleteCompletedBefore(cutoff, statuses);
        context.info("Deleted " + deleted + " execution records completed before " + cutoff);
        return JobResult.success("Deleted " + deleted + " execution records", matching, deleted, details);
    }
}
