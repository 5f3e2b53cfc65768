package villagecompute.scheduler.jobs;

import org.jboss.logging.Logger;
import villagecompute.scheduler.data.models.ExecutionLogEntry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Per-run context handed to every {@link JobTemplate} hook.
 *
 * <p>
 * Carries the job identity, a read-only copy of the parameters, the trigger source and a log sink whose entries are
 * persisted with the execution record. Log lines are mirrored to JBoss Logging under the template's category.
 *
 * <p>
 * <b>Thread Safety:</b> the template body runs on a runner thread while the executor may snapshot the logs after a
 * timeout, so the sink is synchronized.
 */
public final class JobExecutionContext {

    private static final Logger LOG = Logger.getLogger(JobExecutionContext.class);

    private final UUID jobId;
    private final String jobName;
    private final Map<String, Object> parameters;
    private final String triggeredBy;
    private final UUID executionId;
    private final int attempt;
    private final Instant deadline;
    private final Clock clock;
    private final List<ExecutionLogEntry> logs = Collections.synchronizedList(new ArrayList<>());

    public JobExecutionContext(UUID jobId, String jobName, Map<String, Object> parameters, String triggeredBy,
            UUID executionId, int attempt, Instant deadline, Clock clock) {
        this.jobId = jobId;
        this.jobName = jobName;
        this.parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(parameters);
        this.triggeredBy = triggeredBy;
        this.executionId = executionId;
        this.attempt = attempt;
        this.deadline = deadline;
        this.clock = clock;
    }

    public UUID jobId() {
        return jobId;
    }

    public String jobName() {
        return jobName;
    }

    public Map<String, Object> parameters() {
        return parameters;
    }

    public String triggeredBy() {
        return triggeredBy;
    }

    public UUID executionId() {
        return executionId;
    }

    public int attempt() {
        return attempt;
    }

    /**
     * Instant after which the executor stops waiting for this run. Long-running templates should checkpoint against it;
     * the executor cannot stop work that ignores it.
     */
    public Instant deadline() {
        return deadline;
    }

    public boolean isPastDeadline() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public Duration remaining() {
        if (deadline == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Appends a log entry to the execution record and mirrors it to the application log.
     *
     * @param level
     *            INFO, WARN, ERROR or DEBUG
     * @param message
     *            log text
     */
    public void log(String level, String message) {
        String normalized = level == null ? "INFO" : level.toUpperCase(Locale.ROOT);
        logs.add(new ExecutionLogEntry(clock.instant(), normalized, message));
        switch (normalized) {
            case "ERROR" -> LOG.errorf("[Job: %s] %s", jobName, message);
            case "WARN", "WARNING" -> LOG.warnf("[Job: %s] %s", jobName, message);
            case "DEBUG" -> LOG.debugf("[Job: %s] %s", jobName, message);
            default -> LOG.infof("[Job: %s] %s", jobName, message);
        }
    }

    public void info(String message) {
        log("INFO", message);
    }

    public void warn(String message) {
        log("WARN", message);
    }

    public void error(String message) {
        log("ERROR", message);
    }

    /**
     * Returns a snapshot of the entries logged so far, in order.
     */
    public List<ExecutionLogEntry> logs() {
        synchronized (logs) {
            return List.copyOf(logs);
        }
    }
}
