package villagecompute.scheduler.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.scheduler.data.JobDefinitionStore;
import villagecompute.scheduler.data.JobExecutionStore;
import villagecompute.scheduler.data.models.ExecutionStatus;
import villagecompute.scheduler.data.models.JobDefinition;
import villagecompute.scheduler.data.models.JobExecution;
import villagecompute.scheduler.jobs.JobResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Reconciles execution records left in {@code running} by a process that died mid-run.
 *
 * <p>
 * Runs once at boot, before the polling loop starts. A {@code running} record older than its job's
 * {@code timeout_seconds} (or {@code scheduler.recovery.default-orphan-seconds} when the job no longer exists) is
 * finalized as {@code orphaned}. Younger records are left alone. Orphaned runs send no notifications. The job itself
 * is not touched: its {@code next_run_at} was never advanced, so it runs again once its lease lapses.
 */
@ApplicationScoped
public class ExecutionRecoveryService {

    private static final Logger LOG = Logger.getLogger(ExecutionRecoveryService.class);

    @Inject
    JobExecutionStore executionStore;

    @Inject
    JobDefinitionStore jobStore;

    @Inject
    Clock clock;

    @ConfigProperty(
            name = "scheduler.recovery.default-orphan-seconds",
            defaultValue = "3600")
    long defaultOrphanSeconds;

    /**
     * @return number of records finalized as {@code orphaned}
     */
    public int recoverOrphans() {
        Instant now = clock.instant();
        int recovered = 0;
        for (JobExecution execution : executionStore.findRunning()) {
            Optional<JobDefinition> job = jobStore.findById(execution.jobId);
            long threshold = job.map(j -> j.timeoutSeconds).filter(t -> t > 0).orElse(defaultOrphanSeconds);
            if (execution.startedAt.plusSeconds(threshold).isAfter(now)) {
                continue;
            }

            String message = "Execution abandoned: still running " + threshold + "s after start when recovered";
            JobResult result = JobResult.failed(message, "Orphaned after process restart")
                    .withStatus(ExecutionStatus.ORPHANED)
                    .withDurationSeconds(Duration.between(execution.startedAt, now).toMillis() / 1000.0);
            execution.complete(result, now, execution.logs);
            if (executionStore.finalizeExecution(execution)) {
                recovered++;
                LOG.warnf("Marked execution %s of job %s as orphaned (started %s)", execution.id, execution.jobName,
                        execution.startedAt);
            }
        }
        if (recovered > 0) {
            LOG.infof("Recovered %d orphaned executions", recovered);
        }
        return recovered;
    }
}
