package villagecompute.scheduler.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.scheduler.data.models.ExecutionStatus;
import villagecompute.scheduler.data.models.JobDefinition;
import villagecompute.scheduler.data.models.JobExecution;

import java.util.List;
import java.util.Locale;

/**
 * Routes finalized executions to the configured recipients.
 *
 * <p>
 * {@code on_success} recipients hear about {@code success}; {@code on_failure} recipients hear about {@code failed}
 * and {@code timeout}. Cancelled and orphaned runs notify nobody. Sink failures are logged and never reach the
 * executor.
 */
@ApplicationScoped
public class NotificationDispatchService {

    private static final Logger LOG = Logger.getLogger(NotificationDispatchService.class);

    @Inject
    JobNotificationSink sink;

    @ConfigProperty(
            name = "scheduler.notifications.enabled",
            defaultValue = "true")
    boolean enabled;

    /**
     * Notifies the recipients matching the execution's final status.
     *
     * @param job
     *            job definition carrying the notification targets
     * @param execution
     *            finalized execution
     * @return number of recipients handed to the sink
     */
    public int dispatch(JobDefinition job, JobExecution execution) {
        if (!enabled) {
            return 0;
        }
        List<String> recipients = job.effectiveNotifications().recipientsFor(execution.status);
        if (recipients.isEmpty()) {
            return 0;
        }
        try {
            sink.notify(recipients, subject(execution), body(execution));
            LOG.debugf("Dispatched %s notification for job %s to %d recipients", execution.status.value(),
                    execution.jobName, recipients.size());
            return recipients.size();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Notification sink failed for execution %s of job %s", execution.id, execution.jobName);
            return 0;
        }
    }

    static String subject(JobExecution execution) {
        return String.format("[%s] Job '%s' %s", execution.status.value().toUpperCase(Locale.ROOT),
                execution.jobName, describe(execution.status));
    }

    static String body(JobExecution execution) {
        StringBuilder body = new StringBuilder();
        body.append("Job: ").append(execution.jobName).append('\n');
        body.append("Template: ").append(execution.templateType).append('\n');
        body.append("Status: ").append(execution.status.value()).append('\n');
        body.append("Triggered by: ").append(execution.triggeredBy).append('\n');
        body.append("Attempt: ").append(execution.attempt).append('\n');
        body.append("Started: ").append(execution.startedAt).append('\n');
        body.append("Completed: ").append(execution.completedAt).append('\n');
        if (execution.durationSeconds != null) {
            body.append(String.format(Locale.ROOT, "Duration: %.3fs%n", execution.durationSeconds));
        }
        if (execution.result != null && execution.result.message() != null) {
            body.append("Message: ").append(execution.result.message()).append('\n');
        }
        if (execution.error != null) {
            body.append("Error: ").append(execution.error).append('\n');
        }
        body.append("Execution id: ").append(execution.id).append('\n');
        return body.toString();
    }

    private static String describe(ExecutionStatus status) {
        return switch (status) {
            case SUCCESS -> "succeeded";
            case FAILED -> "failed";
            case TIMEOUT -> "timed out";
            default -> status.value();
        };
    }
}
