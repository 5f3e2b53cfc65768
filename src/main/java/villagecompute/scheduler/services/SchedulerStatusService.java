package villagecompute.scheduler.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.scheduler.data.JobExecutionStore;
import villagecompute.scheduler.data.models.ExecutionStatus;
import villagecompute.scheduler.jobs.JobScheduler;
import villagecompute.scheduler.jobs.TemplateRegistry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds {@link SchedulerStatus} snapshots for the admin surface.
 */
@ApplicationScoped
public class SchedulerStatusService {

    @Inject
    JobRegistryService registryService;

    @Inject
    JobExecutionStore executionStore;

    @Inject
    TemplateRegistry templateRegistry;

    @Inject
    JobWorkerPool workerPool;

    @Inject
    JobScheduler scheduler;

    public SchedulerStatus getSchedulerStatus() {
        long total = registryService.countJobs(null);
        long enabled = registryService.countJobs(Boolean.TRUE);

        Map<String, Long> byStatus = new LinkedHashMap<>();
        long finished = 0;
        for (ExecutionStatus status : ExecutionStatus.values()) {
            long count = executionStore.count(status);
            byStatus.put(status.value(), count);
            if (status.isTerminal()) {
                finished += count;
            }
        }
        double successRate = finished == 0 ? 0.0 : (double) byStatus.get(ExecutionStatus.SUCCESS.value()) / finished;

        return new SchedulerStatus(scheduler.isRunning(), total, enabled, total - enabled, byStatus, successRate,
                templateRegistry.size(), workerPool.size(), workerPool.activeCount(), workerPool.queuedCount());
    }
}
