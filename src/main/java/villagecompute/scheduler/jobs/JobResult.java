package villagecompute.scheduler.jobs;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.scheduler.data.models.ExecutionStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured outcome of one template run, embedded into the execution record as JSON.
 *
 * <p>
 * Produced by {@link JobTemplate#execute}, by {@link JobTemplate#onError}, or synthesized by the executor for timeouts,
 * cancellations and missing templates.
 *
 * @param status
 *            outcome; only terminal statuses are meaningful
 * @param message
 *            human readable summary
 * @param details
 *            template specific structured output
 * @param recordsProcessed
 *            items examined
 * @param recordsAffected
 *            items changed
 * @param errors
 *            error strings, first one is copied to {@code ExecutionRecord.error}
 * @param warnings
 *            non fatal issues
 * @param durationSeconds
 *            wall-clock time of {@code execute}, filled in by the executor
 */
public record JobResult(@JsonProperty("status") ExecutionStatus status, @JsonProperty("message") String message,
        @JsonProperty("details") Map<String, Object> details,
        @JsonProperty("records_processed") long recordsProcessed,
        @JsonProperty("records_affected") long recordsAffected, @JsonProperty("errors") List<String> errors,
        @JsonProperty("warnings") List<String> warnings, @JsonProperty("duration_seconds") double durationSeconds) {

    public JobResult {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        errors = errors == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(errors));
        warnings = warnings == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public static JobResult success(String message) {
        return new JobResult(ExecutionStatus.SUCCESS, message, Map.of(), 0, 0, List.of(), List.of(), 0);
    }

    public static JobResult success(String message, long recordsProcessed, long recordsAffected,
            Map<String, Object> details) {
        return new JobResult(ExecutionStatus.SUCCESS, message, details, recordsProcessed, recordsAffected, List.of(),
                List.of(), 0);
    }

    public static JobResult failed(String message, String error) {
        List<String> errors = error == null ? List.of() : List.of(error);
        return new JobResult(ExecutionStatus.FAILED, message, Map.of(), 0, 0, errors, List.of(), 0);
    }

    public static JobResult timeout(long timeoutSeconds) {
        return new JobResult(ExecutionStatus.TIMEOUT, "Job execution timed out after " + timeoutSeconds + " seconds",
                Map.of(), 0, 0, List.of("Timeout after " + timeoutSeconds + "s"), List.of(), 0);
    }

    public static JobResult cancelled(String message) {
        return new JobResult(ExecutionStatus.CANCELLED, message, Map.of(), 0, 0, List.of(), List.of(), 0);
    }

    public JobResult withDurationSeconds(double seconds) {
        return new JobResult(status, message, details, recordsProcessed, recordsAffected, errors, warnings, seconds);
    }

    public JobResult withStatus(ExecutionStatus newStatus) {
        return new JobResult(newStatus, message, details, recordsProcessed, recordsAffected, errors, warnings,
                durationSeconds);
    }

    /**
     * Returns this result as {@code failed} with {@code error} ahead of any errors it already carries.
     */
    public JobResult asFailure(String error) {
        List<String> combined = new ArrayList<>(errors.size() + 1);
        combined.add(error);
        combined.addAll(errors);
        return new JobResult(ExecutionStatus.FAILED, message != null ? message : error, details, recordsProcessed,
                recordsAffected, combined, warnings, durationSeconds);
    }

    /**
     * Returns the first error string or {@code null} when there are none.
     */
    @JsonIgnore
    public String firstError() {
        return errors.isEmpty() ? null : errors.get(0);
    }
}
