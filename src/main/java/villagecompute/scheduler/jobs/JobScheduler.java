package villagecompute.scheduler.jobs;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.scheduler.data.models.JobDefinition;
import villagecompute.scheduler.data.models.JobExecution;
import villagecompute.scheduler.observability.SchedulerMetrics;
import villagecompute.scheduler.services.ExecutionRecoveryService;
import villagecompute.scheduler.services.JobExecutorService;
import villagecompute.scheduler.services.JobRegistryService;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polling loop that hands due jobs to the worker pool.
 *
 * <p>
 * <b>Schedule:</b> every {@code scheduler.poll-interval} (default 30s). A cycle that overruns the interval makes the
 * next tick skip instead of stacking.
 *
 * <p>
 * Each cycle queries the due jobs and submits them without waiting for earlier ones to finish. The job lease stops a
 * job that is still running from being dispatched again; such jobs are counted as skipped. One job failing to
 * dispatch never stops the others.
 *
 * <p>
 * <b>Lifecycle:</b> at startup the loop checks that every stored job resolves to a registered template, finalizes
 * orphaned executions, then starts if {@code scheduler.enabled} is true. {@link #stop()} pauses dispatch without
 * affecting runs already in flight.
 */
@ApplicationScoped
public class JobScheduler {

    private static final Logger LOG = Logger.getLogger(JobScheduler.class);

    @Inject
    JobRegistryService registryService;

    @Inject
    JobExecutorService executorService;

    @Inject
    ExecutionRecoveryService recoveryService;

    @Inject
    SchedulerMetrics metrics;

    @ConfigProperty(
            name = "scheduler.enabled",
            defaultValue = "true")
    boolean enabledAtStartup;

    private final AtomicBoolean running = new AtomicBoolean(false);

    void onStart(@Observes StartupEvent event) {
        registryService.findJobsWithUnknownTemplates();
        recoveryService.recoverOrphans();
        if (enabledAtStartup) {
            start();
        } else {
            LOG.info("Job scheduler loop disabled by configuration");
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            LOG.info("Job scheduler started");
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            LOG.info("Job scheduler stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Scheduled(
            identity = "job-scheduler-poll",
            every = "{scheduler.poll-interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void poll() {
        if (!running.get()) {
            return;
        }
        try {
            dispatchDueJobs();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Scheduler cycle failed, will retry next cycle");
        }
    }

    /**
     * Runs one dispatch cycle.
     *
     * @return number of jobs handed to the worker pool
     */
    public int dispatchDueJobs() {
        List<JobDefinition> due = registryService.getJobsReadyToRun();
        if (due.isEmpty()) {
            return 0;
        }
        LOG.debugf("Found %d due jobs", due.size());

        int dispatched = 0;
        for (JobDefinition job : due) {
            try {
                if (executorService.submit(job, JobExecution.TRIGGER_SCHEDULER)) {
                    dispatched++;
                } else {
                    LOG.debugf("Skipped job %s, a previous run is still in progress", job.name);
                }
            } catch (RuntimeException e) {
                metrics.recordDispatchSkipped("error");
                LOG.errorf(e, "Failed to dispatch job %s", job.name);
            }
        }
        if (dispatched > 0) {
            LOG.infof("Dispatched %d of %d due jobs", dispatched, due.size());
        }
        return dispatched;
    }
}
