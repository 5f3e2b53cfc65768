package villagecompute.scheduler.services;

import java.util.Map;

/**
 * Point-in-time summary of the scheduling engine.
 *
 * @param successRate
 *            successes over finalized executions, 0 when nothing has finished
 */
public record SchedulerStatus(boolean running, long totalJobs, long enabledJobs, long disabledJobs,
        Map<String, Long> executionsByStatus, double successRate, int registeredTemplates, int workerPoolSize,
        int activeWorkers, int queuedJobs) {
}
