package villagecompute.scheduler.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.scheduler.data.ExecutionFilter;
import villagecompute.scheduler.data.JobDefinitionStore;
import villagecompute.scheduler.data.JobExecutionStore;
import villagecompute.scheduler.data.JobFilter;
import villagecompute.scheduler.data.Page;
import villagecompute.scheduler.data.PageRequest;
import villagecompute.scheduler.data.models.ExecutionStatus;
import villagecompute.scheduler.data.models.JobDefinition;
import villagecompute.scheduler.data.models.JobExecution;
import villagecompute.scheduler.data.models.JobSchedule;
import villagecompute.scheduler.data.models.RetryPolicy;
import villagecompute.scheduler.exceptions.JobConflictException;
import villagecompute.scheduler.exceptions.ResourceNotFoundException;
import villagecompute.scheduler.exceptions.ValidationException;
import villagecompute.scheduler.jobs.JobResult;
import villagecompute.scheduler.jobs.JobTemplate;
import villagecompute.scheduler.jobs.ParameterValidation;
import villagecompute.scheduler.jobs.TemplateRegistry;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the lifecycle of job definitions.
 *
 * <p>
 * <b>Responsibilities:</b>
 * <ul>
 * <li>Create/read/update/delete with template and parameter validation before any write</li>
 * <li>Deriving {@code next_run_at} from the schedule; callers can never set it</li>
 * <li>The "due jobs" query consumed by the scheduler loop</li>
 * <li>Post-run bookkeeping for scheduler-triggered runs, including in-engine retries</li>
 * </ul>
 *
 * <p>
 * <b>Retry Strategy:</b> a scheduler-triggered run that ends {@code failed} or {@code timeout} while
 * {@code retry_attempt < max_retries} is re-queued {@code retry_delay_seconds} later and the attempt counter grows. A
 * success, a cancellation or an exhausted budget resets the counter and resumes the regular schedule.
 *
 * <p>
 * Validation failures throw {@link ValidationException} carrying the template validator's message verbatim; nothing
 * is persisted in that case.
 */
@ApplicationScoped
public class JobRegistryService {

    private static final Logger LOG = Logger.getLogger(JobRegistryService.class);

    @Inject
    JobDefinitionStore jobStore;

    @Inject
    JobExecutionStore executionStore;

    @Inject
    TemplateRegistry templateRegistry;

    @Inject
    ScheduleCalculator scheduleCalculator;

    @Inject
    Clock clock;

    @ConfigProperty(
            name = "scheduler.jobs.default-timeout-seconds",
            defaultValue = "3600")
    long defaultTimeoutSeconds;

    @ConfigProperty(
            name = "scheduler.jobs.default-max-retries",
            defaultValue = "3")
    int defaultMaxRetries;

    @ConfigProperty(
            name = "scheduler.jobs.default-retry-delay-seconds",
            defaultValue = "300")
    long defaultRetryDelaySeconds;

    /**
     * Validates and persists a new job definition.
     *
     * @param draft
     *            operator input
     * @param createdBy
     *            operator identity recorded on the definition
     * @return the persisted definition with {@code next_run_at} computed
     * @throws ValidationException
     *             unknown template, invalid parameters, schedule or limits
     * @throws JobConflictException
     *             if the name is taken
     */
    public JobDefinition createJob(JobDraft draft, String createdBy) {
        if (draft == null) {
            throw new ValidationException("Job definition is required");
        }
        String name = requireName(draft.name());
        JobTemplate template = requireTemplate(draft.templateType());
        Map<String, Object> parameters = draft.parameters() == null ? new HashMap<>()
                : new HashMap<>(draft.parameters());
        validateParameters(template, parameters);
        scheduleCalculator.validate(draft.schedule());

        long timeoutSeconds = draft.timeoutSeconds() == null ? defaultTimeoutSeconds : draft.timeoutSeconds();
        validateTimeout(timeoutSeconds);
        RetryPolicy retryPolicy = draft.retryPolicy() == null
                ? new RetryPolicy(defaultMaxRetries, defaultRetryDelaySeconds)
                : draft.retryPolicy();
        validateRetryPolicy(retryPolicy);

        if (jobStore.findByName(name).isPresent()) {
            throw new JobConflictException("A job named '" + name + "' already exists");
        }

        Instant now = clock.instant();
        JobDefinition job = new JobDefinition();
        job.id = UUID.randomUUID();
        job.name = name;
        job.description = draft.description();
        job.templateType = template.templateType();
        job.parameters = parameters;
        job.schedule = draft.schedule();
        job.enabled = draft.enabled() == null || draft.enabled();
        job.timeoutSeconds = timeoutSeconds;
        job.retryPolicy = retryPolicy;
        job.notifications = draft.notifications();
        job.allowConcurrentRuns = Boolean.TRUE.equals(draft.allowConcurrentRuns());
        job.createdBy = createdBy;
        job.createdAt = now;
        job.updatedAt = now;
        job.nextRunAt = scheduleCalculator.nextRunAt(job.schedule, now);
        job.version = 1;

        jobStore.insert(job);
        LOG.infof("Created job %s (%s) using template %s, next run at %s", job.name, job.id, job.templateType,
                job.nextRunAt);
        return job;
    }

    public Optional<JobDefinition> getJob(UUID id) {
        return id == null ? Optional.empty() : jobStore.findById(id);
    }

    /**
     * @throws ResourceNotFoundException
     *             if no job has this id
     */
    public JobDefinition requireJob(UUID id) {
        return getJob(id).orElseThrow(() -> new ResourceNotFoundException("Job not found: " + id));
    }

    public Page<JobDefinition> listJobs(JobFilter filter, PageRequest page) {
        return jobStore.list(filter == null ? JobFilter.all() : filter, page);
    }

    /**
     * Applies a partial update.
     *
     * <p>
     * Parameters are re-validated when either {@code parameters} or {@code template_type} changes, and
     * {@code next_run_at} is recomputed from now when the schedule changes or a job without one is enabled. Every
     * update increments {@code version}. The lease and the run bookkeeping stored at write time are kept.
     *
     * @throws ResourceNotFoundException
     *             if the job does not exist
     * @throws ValidationException
     *             if the result would be invalid; nothing is written
     * @throws JobConflictException
     *             if the new name is taken
     */
    public JobDefinition updateJob(UUID id, JobPatch patch) {
        JobDefinition job = requireJob(id);
        if (patch == null || patch.isEmpty()) {
            return job;
        }
        Instant now = clock.instant();

        if (patch.name() != null && !patch.name().equals(job.name)) {
            String name = requireName(patch.name());
            Optional<JobDefinition> sameName = jobStore.findByName(name);
            if (sameName.isPresent() && !sameName.get().id.equals(job.id)) {
                throw new JobConflictException("A job named '" + name + "' already exists");
            }
            job.name = name;
        }
        if (patch.description() != null) {
            job.description = patch.description();
        }

        boolean templateChanged = patch.templateType() != null && !patch.templateType().equals(job.templateType);
        if (templateChanged || patch.parameters() != null) {
            JobTemplate template = requireTemplate(templateChanged ? patch.templateType() : job.templateType);
            Map<String, Object> parameters = patch.parameters() != null ? new HashMap<>(patch.parameters())
                    : new HashMap<>(job.parameters == null ? Map.of() : job.parameters);
            validateParameters(template, parameters);
            job.templateType = template.templateType();
            job.parameters = parameters;
        }

        if (patch.timeoutSeconds() != null) {
            validateTimeout(patch.timeoutSeconds());
            job.timeoutSeconds = patch.timeoutSeconds();
        }
        boolean resetRetries = false;
        if (patch.retryPolicy() != null) {
            validateRetryPolicy(patch.retryPolicy());
            job.retryPolicy = patch.retryPolicy();
            resetRetries = true;
        }
        if (patch.notifications() != null) {
            job.notifications = patch.notifications();
        }
        if (patch.allowConcurrentRuns() != null) {
            job.allowConcurrentRuns = patch.allowConcurrentRuns();
        }

        boolean scheduleChanged = patch.schedule() != null && !Objects.equals(patch.schedule(), job.schedule);
        if (scheduleChanged) {
            JobSchedule schedule = patch.schedule();
            job.nextRunAt = scheduleCalculator.nextRunAt(schedule, now);
            job.schedule = schedule;
            resetRetries = true;
        }
        if (patch.enabled() != null) {
            job.enabled = patch.enabled();
            if (job.enabled && job.nextRunAt == null) {
                job.nextRunAt = scheduleCalculator.nextRunAtOrFallback(job.schedule, now);
            }
        }

        job.updatedAt = now;
        JobDefinition updated = jobStore.applyOperatorEdit(job, scheduleChanged, resetRetries)
                .orElseThrow(() -> new ResourceNotFoundException("Job not found: " + id));
        LOG.infof("Updated job %s (%s) to version %d", updated.name, updated.id, updated.version);
        return updated;
    }

    /**
     * Enables or disables a job. Disabling takes effect for future dispatch only; a run already in flight finishes.
     */
    public JobDefinition setEnabled(UUID id, boolean enabled) {
        return updateJob(id, JobPatch.enabled(enabled));
    }

    /**
     * Deletes a job. Its execution history is kept.
     *
     * @throws ResourceNotFoundException
     *             if the job does not exist
     */
    public void deleteJob(UUID id) {
        if (!jobStore.delete(id)) {
            throw new ResourceNotFoundException("Job not found: " + id);
        }
        LOG.infof("Deleted job %s", id);
    }

    /**
     * Returns enabled jobs with {@code next_run_at <= now}.
     */
    public List<JobDefinition> getJobsReadyToRun() {
        return jobStore.findReadyToRun(clock.instant());
    }

    /**
     * Records the outcome of a scheduler-triggered run and computes the next run from now.
     *
     * @param jobId
     *            job that ran
     * @param result
     *            final result of the run
     * @return the new {@code next_run_at}, or empty if the job was deleted meanwhile
     */
    public Optional<Instant> updateJobAfterExecution(UUID jobId, JobResult result) {
        Optional<JobDefinition> found = jobStore.findById(jobId);
        if (found.isEmpty()) {
            LOG.warnf("Job %s was deleted before its run could be recorded", jobId);
            return Optional.empty();
        }
        JobDefinition job = found.get();
        Instant now = clock.instant();
        ExecutionStatus status = result.status();
        RetryPolicy policy = job.effectiveRetryPolicy();

        Instant nextRunAt;
        int retryAttempt;
        if (status.isFailure() && policy.allowsRetry(job.retryAttempt)) {
            retryAttempt = job.retryAttempt + 1;
            nextRunAt = now.plusSeconds(policy.retryDelaySeconds());
            LOG.infof("Job %s %s, retry %d of %d scheduled at %s", job.name, status.value(), retryAttempt,
                    policy.maxRetries(), nextRunAt);
        } else {
            if (status.isFailure() && policy.maxRetries() > 0) {
                LOG.warnf("Job %s %s after %d retries, resuming regular schedule", job.name, status.value(),
                        job.retryAttempt);
            }
            retryAttempt = 0;
            nextRunAt = scheduleCalculator.nextRunAtOrFallback(job.schedule, now);
        }

        jobStore.recordExecutionOutcome(jobId, now, nextRunAt, status, retryAttempt, now);
        LOG.debugf("Job %s next run at %s", job.name, nextRunAt);
        return Optional.of(nextRunAt);
    }

    /**
     * Returns the most recent runs of a job, newest first. History survives job deletion.
     */
    public List<JobExecution> getJobExecutions(UUID jobId, int limit, ExecutionStatus status) {
        int bounded = limit <= 0 ? PageRequest.DEFAULT_LIMIT : Math.min(limit, PageRequest.MAX_LIMIT);
        return executionStore.list(ExecutionFilter.forJob(jobId, status), 0, bounded).items();
    }

    /**
     * Logs every stored job whose template is not registered.
     *
     * @return names of the unresolvable jobs
     */
    public List<String> findJobsWithUnknownTemplates() {
        List<String> unresolved = jobStore.listAll().stream().filter(job -> !templateRegistry.exists(job.templateType))
                .map(job -> job.name).toList();
        for (String name : unresolved) {
            LOG.errorf("Job %s references a template that is not registered; its runs will fail", name);
        }
        return unresolved;
    }

    public long countJobs(Boolean enabled) {
        return jobStore.count(enabled);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name is required");
        }
        return name.trim();
    }

    private JobTemplate requireTemplate(String templateType) {
        if (templateType == null || templateType.isBlank()) {
            throw new ValidationException("template_type is required");
        }
        return templateRegistry.get(templateType)
                .orElseThrow(() -> new ValidationException("Unknown template type: " + templateType));
    }

    private static void validateParameters(JobTemplate template, Map<String, Object> parameters) {
        ParameterValidation validation = template.validateParams(parameters);
        if (!validation.valid()) {
            String error = validation.error();
            throw new ValidationException(error != null ? error : "Invalid parameters for " + template.templateType());
        }
    }

    private static void validateTimeout(long timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            throw new ValidationException("timeout_seconds must be positive");
        }
    }

    private static void validateRetryPolicy(RetryPolicy policy) {
        if (policy.maxRetries() < 0) {
            throw new ValidationException("retry_policy.max_retries must not be negative");
        }
        if (policy.retryDelaySeconds() < 0) {
            throw new ValidationException("retry_policy.retry_delay_seconds must not be negative");
        }
    }
}
