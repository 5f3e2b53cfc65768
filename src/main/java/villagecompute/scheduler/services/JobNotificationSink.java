package villagecompute.scheduler.services;

import java.util.List;

/**
 * Delivery channel for execution notifications.
 *
 * <p>
 * Implementations may throw; {@link NotificationDispatchService} logs the failure and the execution outcome is
 * unaffected.
 */
public interface JobNotificationSink {

    void notify(List<String> recipients, String subject, String body);
}
