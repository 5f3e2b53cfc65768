package villagecompute.scheduler.services;

import villagecompute.scheduler.data.models.JobSchedule;
import villagecompute.scheduler.data.models.NotificationTargets;
import villagecompute.scheduler.data.models.RetryPolicy;

import java.util.Map;

/**
 * Operator input for {@link JobRegistryService#createJob}. Nullable fields take configured defaults.
 */
public record JobDraft(String name, String description, String templateType, Map<String, Object> parameters,
        JobSchedule schedule, Boolean enabled, Long timeoutSeconds, RetryPolicy retryPolicy,
        NotificationTargets notifications, Boolean allowConcurrentRuns) {
}
