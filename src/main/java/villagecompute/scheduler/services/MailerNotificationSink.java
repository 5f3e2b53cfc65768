package villagecompute.scheduler.services;

import io.quarkus.mailer.Mail;
import io.quarkus.mailer.reactive.ReactiveMailer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;

/**
 * Sends execution notifications as plain-text email through the Quarkus reactive mailer.
 *
 * <p>
 * Delivery is asynchronous with a bounded retry and exponential backoff; the final failure is logged, never thrown.
 * SMTP settings come from the {@code quarkus.mailer.*} properties.
 */
@ApplicationScoped
public class MailerNotificationSink implements JobNotificationSink {

    private static final Logger LOG = Logger.getLogger(MailerNotificationSink.class);

    private static final int MAX_RETRY_ATTEMPTS = 3;

    private static final Duration INITIAL_BACKOFF = Duration.ofSeconds(1);

    private static final Duration MAX_BACKOFF = Duration.ofSeconds(10);

    @Inject
    ReactiveMailer reactiveMailer;

    @Override
    public void notify(List<String> recipients, String subject, String body) {
        for (String recipient : recipients) {
            Mail mail = Mail.withText(recipient, subject, body).addHeader("X-Mailer", "Village Job Scheduler");
            reactiveMailer.send(mail).onFailure().retry().withBackOff(INITIAL_BACKOFF, MAX_BACKOFF)
                    .atMost(MAX_RETRY_ATTEMPTS).subscribe()
                    .with(success -> LOG.debugf("Notification sent: to=%s, subject=%s", recipient, subject),
                            failure -> LOG.errorf(failure, "Notification failed after %d retries: to=%s, subject=%s",
                                    MAX_RETRY_ATTEMPTS, recipient, subject));
        }
    }
}
