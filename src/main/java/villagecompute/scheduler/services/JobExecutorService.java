package villagecompute.scheduler.services;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.scheduler.config.SchedulerIdentity;
import villagecompute.scheduler.data.ExecutionFilter;
import villagecompute.scheduler.data.JobDefinitionStore;
import villagecompute.scheduler.data.JobExecutionStore;
import villagecompute.scheduler.data.Page;
import villagecompute.scheduler.data.PageRequest;
import villagecompute.scheduler.data.models.JobDefinition;
import villagecompute.scheduler.data.models.JobExecution;
import villagecompute.scheduler.exceptions.ExecutionPersistenceException;
import villagecompute.scheduler.exceptions.JobConflictException;
import villagecompute.scheduler.exceptions.ResourceNotFoundException;
import villagecompute.scheduler.jobs.JobExecutionContext;
import villagecompute.scheduler.jobs.JobResult;
import villagecompute.scheduler.jobs.JobTemplate;
import villagecompute.scheduler.jobs.TemplateRegistry;
import villagecompute.scheduler.observability.LoggingConfig;
import villagecompute.scheduler.observability.SchedulerMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one job definition end to end and owns the execution record lifecycle.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Insert an execution record in {@code running}</li>
 * <li>Resolve the template; a missing one finalizes the run as {@code failed}</li>
 * <li>Build the {@link JobExecutionContext}</li>
 * <li>{@code preExecute}; false finalizes as {@code cancelled} without calling {@code execute}</li>
 * <li>{@code execute} on a runner thread bounded by {@code timeout_seconds}; expiry finalizes as {@code timeout}</li>
 * <li>Exceptions and errors from any hook go through {@code onError}, itself guarded</li>
 * <li>A missing result, a missing status or a non-terminal status finalizes as {@code failed}</li>
 * <li>Duration from wall-clock start and finish</li>
 * <li>{@code postExecute}, failures logged only</li>
 * <li>Finalize the record (status, result, logs, error)</li>
 * <li>Notify recipients matching the final status</li>
 * <li>Scheduling bookkeeping, for scheduler-triggered runs only</li>
 * </ol>
 *
 * <p>
 * <b>Isolation:</b> nothing a template does can throw out of {@link #executeJob}. The only exception it raises is
 * {@link ExecutionPersistenceException}, when the execution record itself cannot be written.
 *
 * <p>
 * <b>Timeouts:</b> on expiry the runner is interrupted as a hint, but the executor only stops waiting. Work that
 * ignores interruption continues in the background after the run is reported as {@code timeout}.
 *
 * <p>
 * <b>Telemetry:</b> each run is wrapped in a {@code job.execute} span with attributes {@code job.id},
 * {@code job.name}, {@code job.template_type}, {@code job.triggered_by}, {@code job.execution_id} and
 * {@code job.status}.
 */
@ApplicationScoped
public class JobExecutorService {

    private static final Logger LOG = Logger.getLogger(JobExecutorService.class);

    @Inject
    TemplateRegistry templateRegistry;

    @Inject
    JobDefinitionStore jobStore;

    @Inject
    JobExecutionStore executionStore;

    @Inject
    JobRegistryService registryService;

    @Inject
    JobLeaseService leaseService;

    @Inject
    NotificationDispatchService notificationService;

    @Inject
    JobWorkerPool workerPool;

    @Inject
    SchedulerMetrics metrics;

    @Inject
    SchedulerIdentity identity;

    @Inject
    Tracer tracer;

    @Inject
    Clock clock;

    @ConfigProperty(
            name = "scheduler.jobs.default-timeout-seconds",
            defaultValue = "3600")
    long defaultTimeoutSeconds;

    /**
     * Runs a job on the calling thread and returns its finalized record.
     *
     * <p>
     * Does not take the job lease; {@link #submit} and {@link #executeJobById} do.
     *
     * @param job
     *            job to run
     * @param triggeredBy
     *            {@code scheduler}, {@code manual} or an operator identity
     * @return the execution record in its terminal state
     * @throws ExecutionPersistenceException
     *             if the execution record cannot be created or finalized
     */
    public JobExecution executeJob(JobDefinition job, String triggeredBy) {
        boolean scheduled = JobExecution.TRIGGER_SCHEDULER.equals(triggeredBy);
        int attempt = scheduled ? job.retryAttempt + 1 : 1;
        long timeoutSeconds = job.timeoutSeconds > 0 ? job.timeoutSeconds : defaultTimeoutSeconds;
        Instant startedAt = clock.instant();

        JobExecution execution = JobExecution.start(job, triggeredBy, attempt, startedAt, identity.hostId());
        try {
            executionStore.insert(execution);
        } catch (RuntimeException e) {
            throw new ExecutionPersistenceException("Failed to create execution record for job " + job.name, e);
        }

        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", job.id.toString())
                .setAttribute("job.name", job.name).setAttribute("job.template_type", job.templateType)
                .setAttribute("job.triggered_by", triggeredBy).setAttribute("job.execution_id", execution.id.toString())
                .setAttribute("job.attempt", attempt).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(job.id);
            LoggingConfig.setExecutionId(execution.id);
            LoggingConfig.setTemplateType(job.templateType);
            LoggingConfig.setTriggeredBy(triggeredBy);
            LOG.infof("Executing job %s (attempt %d, triggered by %s)", job.name, attempt, triggeredBy);

            JobExecutionContext context = new JobExecutionContext(job.id, job.name, job.parameters, triggeredBy,
                    execution.id, attempt, startedAt.plusSeconds(timeoutSeconds), clock);
            JobResult result = runTemplate(job, context, timeoutSeconds, startedAt);

            execution.complete(result, clock.instant(), context.logs());
            span.setAttribute("job.status", result.status().value());
            if (result.status().isFailure()) {
                span.setStatus(StatusCode.ERROR, result.message() != null ? result.message() : "");
            }

            RuntimeException persistenceFailure = null;
            boolean finalized = false;
            try {
                finalized = executionStore.finalizeExecution(execution);
            } catch (RuntimeException e) {
                persistenceFailure = e;
                span.recordException(e);
                LOG.errorf(e, "Failed to finalize execution %s of job %s", execution.id, job.name);
            }

            metrics.recordExecution(result.status().value(), job.templateType, triggeredBy,
                    Duration.ofMillis(Math.round(result.durationSeconds() * 1000)));
            if (finalized) {
                notificationService.dispatch(job, execution);
            }
            if (scheduled) {
                recordScheduledOutcome(job, result);
            }

            LOG.infof("Job %s finished with status %s in %.3fs", job.name, result.status().value(),
                    result.durationSeconds());
            if (persistenceFailure != null) {
                throw new ExecutionPersistenceException(
                        "Failed to finalize execution " + execution.id + " of job " + job.name, persistenceFailure);
            }
            return execution;
        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Takes the job lease and queues the run on the worker pool. The lease is released when the run finalizes.
     *
     * @return false if another run holds the lease or the pool refused the task
     */
    public boolean submit(JobDefinition job, String triggeredBy) {
        Optional<JobLease> acquired = leaseService.acquire(job);
        if (acquired.isEmpty()) {
            metrics.recordDispatchSkipped("lease_held");
            return false;
        }
        JobLease lease = acquired.get();
        try {
            workerPool.submit(() -> runLeased(job, triggeredBy, lease));
            return true;
        } catch (RejectedExecutionException e) {
            leaseService.release(lease);
            metrics.recordDispatchSkipped("pool_rejected");
            LOG.warnf("Worker pool rejected job %s: %s", job.name, e.getMessage());
            return false;
        }
    }

    /**
     * Runs a job on demand and waits for the outcome. Never touches {@code next_run_at} or {@code last_run_at}.
     *
     * @throws ResourceNotFoundException
     *             if the job does not exist
     * @throws JobConflictException
     *             if the job is disabled or already running
     */
    public JobExecution executeJobById(UUID jobId, String triggeredBy) {
        JobDefinition job = loadRunnable(jobId);
        JobLease lease = leaseService.acquire(job)
                .orElseThrow(() -> new JobConflictException("Job '" + job.name + "' is already running"));
        try {
            return executeJob(job, manualTrigger(triggeredBy));
        } finally {
            leaseService.release(lease);
        }
    }

    /**
     * Queues an on-demand run on the worker pool and returns immediately.
     *
     * @throws ResourceNotFoundException
     *             if the job does not exist
     * @throws JobConflictException
     *             if the job is disabled, already running, or the pool is shut down
     */
    public void triggerJobById(UUID jobId, String triggeredBy) {
        JobDefinition job = loadRunnable(jobId);
        if (!submit(job, manualTrigger(triggeredBy))) {
            throw new JobConflictException("Job '" + job.name + "' is already running");
        }
    }

    public Page<JobExecution> listExecutions(ExecutionFilter filter, PageRequest page) {
        return executionStore.list(filter == null ? ExecutionFilter.all() : filter, page.skip(), page.limit());
    }

    public Optional<JobExecution> getExecution(UUID id) {
        return executionStore.findById(id);
    }

    /**
     * Deletes a finalized execution record.
     *
     * @throws ResourceNotFoundException
     *             if it does not exist
     * @throws JobConflictException
     *             if it is still running
     */
    public void deleteExecution(UUID id) {
        JobExecution execution = getExecution(id)
                .orElseThrow(() -> new ResourceNotFoundException("Execution not found: " + id));
        if (!execution.status.isTerminal()) {
            throw new JobConflictException("Execution " + id + " is still running");
        }
        executionStore.delete(id);
        LOG.infof("Deleted execution %s of job %s", id, execution.jobName);
    }

    private JobDefinition loadRunnable(UUID jobId) {
        JobDefinition job = registryService.requireJob(jobId);
        if (!job.enabled) {
            throw new JobConflictException("Job '" + job.name + "' is disabled");
        }
        return job;
    }

    private void runLeased(JobDefinition job, String triggeredBy, JobLease lease) {
        try {
            executeJob(job, triggeredBy);
        } catch (RuntimeException | Error e) {
            LOG.errorf(e, "Run of job %s ended without a finalized record", job.name);
        } finally {
            leaseService.release(lease);
        }
    }

    private JobResult runTemplate(JobDefinition job, JobExecutionContext context, long timeoutSeconds,
            Instant startedAt) {
        Optional<JobTemplate> resolved = templateRegistry.get(job.templateType);
        if (resolved.isEmpty()) {
            String error = "Template not found: " + job.templateType;
            context.error(error);
            return JobResult.failed(error, error).withDurationSeconds(elapsedSeconds(startedAt));
        }
        JobTemplate template = resolved.get();

        JobResult result;
        try {
            if (!template.preExecute(context)) {
                context.warn("Execution cancelled by pre-execute check");
                result = JobResult.cancelled("Execution cancelled by pre-execute check");
            } else {
                result = executeWithTimeout(template, context, timeoutSeconds);
            }
        } catch (Throwable t) {
            Exception error = asException(t);
            LOG.warnf(error, "Template %s raised during job %s", template.templateType(), job.name);
            result = safeOnError(template, context, error);
        }
        result = terminalResult(result, context).withDurationSeconds(elapsedSeconds(startedAt));

        try {
            template.postExecute(context, result);
        } catch (Throwable t) {
            LOG.warnf(t, "postExecute of template %s failed for job %s", template.templateType(), job.name);
        }
        return result;
    }

    /**
     * Maps a missing result, a missing status or a non-terminal status to {@code failed}.
     */
    private static JobResult terminalResult(JobResult result, JobExecutionContext context) {
        String error;
        if (result == null) {
            error = "Template returned no result";
            context.error(error);
            return JobResult.failed(error, error);
        } else if (result.status() == null) {
            error = "Template returned no status";
        } else if (!result.status().isTerminal()) {
            error = "Template returned non-terminal status " + result.status().value();
        } else {
            return result;
        }
        context.error(error);
        return result.asFailure(error);
    }

    private static Exception asException(Throwable t) {
        if (t instanceof Exception exception) {
            return exception;
        }
        return new IllegalStateException("Template raised " + t, t);
    }

    private JobResult executeWithTimeout(JobTemplate template, JobExecutionContext context, long timeoutSeconds)
            throws Exception {
        Map<String, Object> mdc = LoggingConfig.snapshot();
        Callable<JobResult> body = Context.current().wrap(() -> {
            LoggingConfig.restore(mdc);
            try {
                return template.execute(context);
            } finally {
                LoggingConfig.clearMDC();
            }
        });

        Future<JobResult> future = workerPool.runTemplate(body);
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            context.error("Job execution timed out after " + timeoutSeconds + " seconds");
            return JobResult.timeout(timeoutSeconds);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            context.warn("Execution interrupted while waiting for the template");
            return JobResult.cancelled("Execution interrupted");
        } catch (ExecutionException e) {
            throw asException(e.getCause());
        }
    }

    private JobResult safeOnError(JobTemplate template, JobExecutionContext context, Exception error) {
        try {
            JobResult converted = template.onError(context, error);
            if (converted != null) {
                return converted;
            }
        } catch (Throwable handlerFailure) {
            LOG.errorf(handlerFailure, "onError of template %s failed", template.templateType());
        }
        String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
        return JobResult.failed("Job execution failed: " + reason, reason);
    }

    private void recordScheduledOutcome(JobDefinition job, JobResult result) {
        try {
            registryService.updateJobAfterExecution(job.id, result);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to update scheduling state of job %s", job.name);
        }
    }

    private double elapsedSeconds(Instant startedAt) {
        return Duration.between(startedAt, clock.instant()).toNanos() / 1_000_000_000.0;
    }

    private static String manualTrigger(String triggeredBy) {
        if (triggeredBy == null || triggeredBy.isBlank() || JobExecution.TRIGGER_SCHEDULER.equals(triggeredBy)) {
            return JobExecution.TRIGGER_MANUAL;
        }
        return triggeredBy;
    }
}
