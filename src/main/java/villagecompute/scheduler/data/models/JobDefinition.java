package villagecompute.scheduler.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Panache entity for a named, schedulable unit of configuration.
 *
 * <p>
 * Owned by {@code JobRegistryService}. The executor only touches the scheduling bookkeeping ({@code last_run_at},
 * {@code next_run_at}, {@code last_status}, {@code retry_attempt}) and the execution lease.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Assigned at creation</li>
 * <li>{@code name} (TEXT, unique) - Human-facing name</li>
 * <li>{@code template_type} (TEXT) - Key into the template registry</li>
 * <li>{@code parameters} (JSON) - Template specific parameter map</li>
 * <li>{@code schedule} (JSON) - Interval or cron variant</li>
 * <li>{@code retry_policy} / {@code notifications} (JSON) - Retry and recipient configuration</li>
 * <li>{@code next_run_at} (TIMESTAMPTZ) - Always derived from {@code schedule}, never set by callers</li>
 * <li>{@code lease_owner} / {@code lease_expires_at} - At-most-one-run lease, acquired by conditional update</li>
 * <li>{@code version} (BIGINT) - Incremented on every operator update, not used for optimistic locking</li>
 * </ul>
 */
@Entity
@Table(
        name = "job_definitions")
public class JobDefinition extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            nullable = false,
            unique = true)
    public String name;

    @Column(
            length = 2000)
    public String description;

    @Column(
            name = "template_type",
            nullable = false)
    public String templateType;

    @Column(
            nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> parameters = new HashMap<>();

    @Column(
            nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    public JobSchedule schedule;

    @Column(
            nullable = false)
    public boolean enabled = true;

    @Column(
            name = "timeout_seconds",
            nullable = false)
    public long timeoutSeconds;

    @Column(
            name = "retry_policy")
    @JdbcTypeCode(SqlTypes.JSON)
    public RetryPolicy retryPolicy;

    @Column(
            name = "notifications")
    @JdbcTypeCode(SqlTypes.JSON)
    public NotificationTargets notifications;

    @Column(
            name = "allow_concurrent_runs",
            nullable = false)
    public boolean allowConcurrentRuns = false;

    @Column(
            name = "created_by",
            nullable = false)
    public String createdBy;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    @Column(
            name = "last_run_at")
    public Instant lastRunAt;

    @Column(
            name = "next_run_at")
    public Instant nextRunAt;

    @Column(
            name = "last_status")
    @Enumerated(EnumType.STRING)
    public ExecutionStatus lastStatus;

    @Column(
            name = "retry_attempt",
            nullable = false)
    public int retryAttempt = 0;

    @Column(
            name = "lease_owner")
    public String leaseOwner;

    @Column(
            name = "lease_expires_at")
    public Instant leaseExpiresAt;

    @Column(
            nullable = false)
    public long version = 1;

    /**
     * Finds a job definition by its unique name.
     *
     * @param name
     *            the job name (case-sensitive)
     * @return Optional containing the job if found
     */
    public static Optional<JobDefinition> findByName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return find("name = ?1", name).firstResultOptional();
    }

    /**
     * Finds all enabled jobs whose {@code next_run_at} is at or before {@code now}.
     *
     * @param now
     *            evaluation instant
     * @return due jobs ordered by next_run_at ascending
     */
    public static List<JobDefinition> findReadyToRun(Instant now) {
        return find("enabled = true AND nextRunAt <= ?1 ORDER BY nextRunAt ASC", now).list();
    }

    /**
     * Returns the retry policy, never null.
     */
    public RetryPolicy effectiveRetryPolicy() {
        return retryPolicy == null ? RetryPolicy.none() : retryPolicy;
    }

    /**
     * Returns the notification targets, never null.
     */
    public NotificationTargets effectiveNotifications() {
        return notifications == null ? NotificationTargets.none() : notifications;
    }

    /**
     * Copies the operator-owned fields of {@code edited} onto this definition and bumps the version.
     *
     * <p>
     * The lease and the post-run bookkeeping ({@code last_run_at}, {@code last_status}, {@code retry_attempt},
     * {@code next_run_at}) are left as stored, except that {@code next_run_at} is taken from {@code edited} when the
     * schedule was reset or no next run is stored, and the retry counter is cleared when {@code resetRetries} is set.
     *
     * @param edited
     *            detached copy carrying the operator's changes
     * @param resetSchedule
     *            the schedule changed and {@code edited.nextRunAt} replaces the stored value
     * @param resetRetries
     *            the retry counter restarts at zero
     */
    public void applyOperatorEdit(JobDefinition edited, boolean resetSchedule, boolean resetRetries) {
        name = edited.name;
        description = edited.description;
        templateType = edited.templateType;
        parameters = edited.parameters;
        schedule = edited.schedule;
        enabled = edited.enabled;
        timeoutSeconds = edited.timeoutSeconds;
        retryPolicy = edited.retryPolicy;
        notifications = edited.notifications;
        allowConcurrentRuns = edited.allowConcurrentRuns;
        updatedAt = edited.updatedAt;
        if (resetSchedule || nextRunAt == null) {
            nextRunAt = edited.nextRunAt;
        }
        if (resetRetries) {
            retryAttempt = 0;
        }
        version++;
    }

    /**
     * Whether another run currently holds the execution lease.
     *
     * @param now
     *            evaluation instant
     * @return true if a lease owner is set and has not expired
     */
    public boolean isLeaseHeld(Instant now) {
        return leaseOwner != null && leaseExpiresAt != null && leaseExpiresAt.isAfter(now);
    }
}
