package villagecompute.scheduler.services;

import villagecompute.scheduler.data.models.JobSchedule;
import villagecompute.scheduler.data.models.NotificationTargets;
import villagecompute.scheduler.data.models.RetryPolicy;

import java.util.Map;

/**
 * Partial update for {@link JobRegistryService#updateJob}. Null means "keep current".
 *
 * <p>
 * Identity and audit fields ({@code id}, {@code created_by}, {@code created_at}, {@code version}) and the scheduling
 * bookkeeping have no counterpart here and cannot be changed through an update.
 */
public record JobPatch(String name, String description, String templateType, Map<String, Object> parameters,
        JobSchedule schedule, Boolean enabled, Long timeoutSeconds, RetryPolicy retryPolicy,
        NotificationTargets notifications, Boolean allowConcurrentRuns) {

    public static JobPatch enabled(boolean enabled) {
        return new JobPatch(null, null, null, null, null, enabled, null, null, null, null);
    }

    public boolean isEmpty() {
        return name == null && description == null && templateType == null && parameters == null && schedule == null
                && enabled == null && timeoutSeconds == null && retryPolicy == null && notifications == null
                && allowConcurrentRuns == null;
    }
}
