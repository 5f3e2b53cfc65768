package villagecompute.scheduler.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import villagecompute.scheduler.jobs.JobResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Panache entity for the append-only execution history (one row per run).
 *
 * <p>
 * Created in {@link ExecutionStatus#RUNNING} the instant a run begins and finalized exactly once. {@code job_name} and
 * {@code template_type} are snapshots taken at start, so renaming or deleting the job later does not rewrite history.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK)</li>
 * <li>{@code job_id} (UUID) - Job definition reference, not a foreign key so history survives deletion</li>
 * <li>{@code status} (TEXT) - RUNNING, SUCCESS, FAILED, TIMEOUT, CANCELLED, ORPHANED</li>
 * <li>{@code result} (JSON) - Embedded {@link JobResult}</li>
 * <li>{@code error} (TEXT) - First error string</li>
 * <li>{@code logs} (JSON) - Ordered {@link ExecutionLogEntry} list</li>
 * <li>{@code triggered_by} (TEXT) - {@code scheduler}, {@code manual} or an operator identity</li>
 * <li>{@code attempt} (INT) - 1 for a regular run, n+1 for the n-th retry</li>
 * </ul>
 */
@Entity
@Table(
        name = "job_executions",
        indexes = { @Index(
                name = "idx_job_executions_job_started",
                columnList = "job_id, started_at"),
                @Index(
                        name = "idx_job_executions_status",
                        columnList = "status") })
public class JobExecution extends PanacheEntityBase {

    public static final int MAX_ERROR_LENGTH = 4000;

    /**
     * Trigger source of runs dispatched by the polling loop. Only these update the job's scheduling bookkeeping.
     */
    public static final String TRIGGER_SCHEDULER = "scheduler";

    public static final String TRIGGER_MANUAL = "manual";

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "job_id",
            nullable = false)
    public UUID jobId;

    @Column(
            name = "job_name",
            nullable = false)
    public String jobName;

    @Column(
            name = "template_type",
            nullable = false)
    public String templateType;

    @Column(
            nullable = false)
    @Enumerated(EnumType.STRING)
    public ExecutionStatus status;

    @Column(
            name = "started_at",
            nullable = false)
    public Instant startedAt;

    @Column(
            name = "completed_at")
    public Instant completedAt;

    @Column(
            name = "duration_seconds")
    public Double durationSeconds;

    @Column(
            name = "result")
    @JdbcTypeCode(SqlTypes.JSON)
    public JobResult result;

    @Column(
            name = "error",
            length = MAX_ERROR_LENGTH)
    public String error;

    @Column(
            name = "logs")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<ExecutionLogEntry> logs = new ArrayList<>();

    @Column(
            name = "triggered_by",
            nullable = false)
    public String triggeredBy;

    @Column(
            nullable = false)
    public int attempt = 1;

    @Column(
            name = "execution_host")
    public String executionHost;

    /**
     * Builds a new record in {@link ExecutionStatus#RUNNING}, snapshotting the job's name and template type.
     *
     * @param job
     *            the job being run
     * @param triggeredBy
     *            trigger source
     * @param attempt
     *            attempt number (1-indexed)
     * @param startedAt
     *            start instant
     * @param executionHost
     *            host identifier
     * @return unsaved record
     */
    public static JobExecution start(JobDefinition job, String triggeredBy, int attempt, Instant startedAt,
            String executionHost) {
        JobExecution execution = new JobExecution();
        execution.id = UUID.randomUUID();
        execution.jobId = job.id;
        execution.jobName = job.name;
        execution.templateType = job.templateType;
        execution.status = ExecutionStatus.RUNNING;
        execution.startedAt = startedAt;
        execution.triggeredBy = triggeredBy;
        execution.attempt = attempt;
        execution.executionHost = executionHost;
        return execution;
    }

    /**
     * Applies a terminal outcome to this (still unsaved or detached) record.
     *
     * @param jobResult
     *            final result
     * @param completedAt
     *            completion instant
     * @param collectedLogs
     *            log lines captured during the run
     */
    public void complete(JobResult jobResult, Instant completedAt, List<ExecutionLogEntry> collectedLogs) {
        this.status = jobResult.status();
        this.result = jobResult;
        this.completedAt = completedAt;
        this.durationSeconds = jobResult.durationSeconds();
        this.error = truncate(jobResult.firstError());
        this.logs = collectedLogs == null ? new ArrayList<>() : new ArrayList<>(collectedLogs);
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }
}
