package villagecompute.scheduler.services;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import villagecompute.scheduler.data.models.JobSchedule;
import villagecompute.scheduler.exceptions.ValidationException;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Next-run arithmetic for interval and cron schedules.
 *
 * <p>
 * Both variants are evaluated relative to the instant passed in, never relative to a previous {@code next_run_at}:
 * <ul>
 * <li>interval: {@code now + interval_seconds}, so a late run shifts every later run by the same delay</li>
 * <li>cron: the earliest match strictly after {@code now} in the schedule's timezone, so windows missed while the
 * process was down are not caught up</li>
 * </ul>
 *
 * <p>
 * Cron expressions use the five-field UNIX syntax ({@code minute hour day-of-month month day-of-week}).
 */
@ApplicationScoped
public class ScheduleCalculator {

    private static final Logger LOG = Logger.getLogger(ScheduleCalculator.class);

    /**
     * Used when a stored schedule can no longer be evaluated.
     */
    static final Duration FALLBACK_DELAY = Duration.ofHours(1);

    private static final CronParser CRON_PARSER = new CronParser(
            CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    /**
     * Checks that a schedule can be evaluated.
     *
     * @throws ValidationException
     *             with an operator-facing message when it cannot
     */
    public void validate(JobSchedule schedule) {
        if (schedule == null || schedule.type() == null) {
            throw new ValidationException("schedule.type is required (interval or cron)");
        }
        switch (schedule.type()) {
            case INTERVAL -> {
                if (schedule.intervalSeconds() == null || schedule.intervalSeconds() <= 0) {
                    throw new ValidationException("schedule.interval_seconds must be a positive number of seconds");
                }
            }
            case CRON -> {
                zoneOf(schedule);
                executionTimeOf(schedule);
            }
        }
    }

    /**
     * Computes the next run time.
     *
     * @param schedule
     *            interval or cron schedule
     * @param now
     *            evaluation instant
     * @return next run instant, strictly after {@code now}
     * @throws ValidationException
     *             if the schedule is invalid or a cron expression never fires again
     */
    public Instant nextRunAt(JobSchedule schedule, Instant now) {
        validate(schedule);
        return switch (schedule.type()) {
            case INTERVAL -> now.plusSeconds(schedule.intervalSeconds());
            case CRON -> nextCronMatch(schedule, now);
        };
    }

    /**
     * Like {@link #nextRunAt} but never throws. A schedule stored before it became unparseable (for example a
     * timezone dropped from the JDK) is pushed back by {@link #FALLBACK_DELAY} instead of stalling the loop.
     */
    public Instant nextRunAtOrFallback(JobSchedule schedule, Instant now) {
        try {
            return nextRunAt(schedule, now);
        } catch (ValidationException e) {
            Instant fallback = now.plus(FALLBACK_DELAY);
            LOG.warnf("Cannot evaluate stored schedule %s (%s), retrying at %s", schedule, e.getMessage(), fallback);
            return fallback;
        }
    }

    private Instant nextCronMatch(JobSchedule schedule, Instant now) {
        ZoneId zone = zoneOf(schedule);
        ExecutionTime executionTime = executionTimeOf(schedule);
        ZonedDateTime reference = now.atZone(zone);

        Optional<ZonedDateTime> next = executionTime.nextExecution(reference);
        while (next.isPresent() && !next.get().isAfter(reference)) {
            next = executionTime.nextExecution(next.get().plusSeconds(1));
        }
        return next.map(ZonedDateTime::toInstant).orElseThrow(
                () -> new ValidationException("Cron expression '" + schedule.expression() + "' has no future run"));
    }

    private static ZoneId zoneOf(JobSchedule schedule) {
        String timezone = schedule.effectiveTimezone();
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new ValidationException("Unknown timezone '" + timezone + "'");
        }
    }

    private static ExecutionTime executionTimeOf(JobSchedule schedule) {
        String expression = schedule.expression();
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("schedule.expression is required for cron schedules");
        }
        try {
            Cron cron = CRON_PARSER.parse(expression.trim()).validate();
            return ExecutionTime.forCron(cron);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid cron expression '" + expression + "': " + e.getMessage());
        }
    }
}
