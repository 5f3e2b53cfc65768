package villagecompute.scheduler.services;

import org.junit.jupiter.api.Test;
import villagecompute.scheduler.data.models.JobSchedule;
import villagecompute.scheduler.data.models.ScheduleKind;
import villagecompute.scheduler.exceptions.ValidationException;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleCalculatorTest {

    private static final Instant NOW = Instant.parse("2024-01-15T02:00:00Z");

    private final ScheduleCalculator calculator = new ScheduleCalculator();

    @Test
    void intervalScheduleRunsIntervalSecondsFromNow() {
        Instant next = calculator.nextRunAt(JobSchedule.interval(900), NOW);

        assertEquals(NOW.plusSeconds(900), next);
    }

    @Test
    void cronScheduleReturnsNextMatchAfterNow() {
        Instant next = calculator.nextRunAt(JobSchedule.cron("0 3 * * *", "UTC"), NOW);

        assertEquals(Instant.parse("2024-01-15T03:00:00Z"), next);
    }

    @Test
    void cronScheduleIsStrictlyAfterNowWhenNowMatches() {
        Instant matching = Instant.parse("2024-01-15T03:00:00Z");

        Instant next = calculator.nextRunAt(JobSchedule.cron("0 3 * * *", "UTC"), matching);

        assertEquals(Instant.parse("2024-01-16T03:00:00Z"), next);
    }

    @Test
    void cronScheduleDoesNotCatchUpMissedRuns() {
        Instant lateStart = Instant.parse("2024-01-20T12:00:00Z");

        Instant next = calculator.nextRunAt(JobSchedule.cron("0 3 * * *", "UTC"), lateStart);

        assertEquals(Instant.parse("2024-01-21T03:00:00Z"), next);
    }

    @Test
    void cronScheduleHonorsTimezone() {
        Instant next = calculator.nextRunAt(JobSchedule.cron("0 9 * * *", "America/New_York"), NOW);

        assertEquals(Instant.parse("2024-01-15T14:00:00Z"), next);
    }

    @Test
    void missingTimezoneDefaultsToUtc() {
        Instant next = calculator.nextRunAt(JobSchedule.cron("30 2 * * *", null), NOW);

        assertEquals(Instant.parse("2024-01-15T02:30:00Z"), next);
    }

    @Test
    void rejectsMissingType() {
        ValidationException error = assertThrows(ValidationException.class,
                () -> calculator.validate(new JobSchedule(null, 60L, null, null)));

        assertEquals("schedule.type is required (interval or cron)", error.getMessage());
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThrows(ValidationException.class, () -> calculator.validate(JobSchedule.interval(0)));
        assertThrows(ValidationException.class,
                () -> calculator.validate(new JobSchedule(ScheduleKind.INTERVAL, null, null, null)));
    }

    @Test
    void rejectsMalformedCron() {
        ValidationException error = assertThrows(ValidationException.class,
                () -> calculator.validate(JobSchedule.cron("not a cron", "UTC")));

        assertTrue(error.getMessage().startsWith("Invalid cron expression 'not a cron'"));
    }

    @Test
    void rejectsMissingCronExpression() {
        assertThrows(ValidationException.class, () -> calculator.validate(JobSchedule.cron(" ", "UTC")));
    }

    @Test
    void rejectsUnknownTimezone() {
        ValidationException error = assertThrows(ValidationException.class,
                () -> calculator.validate(JobSchedule.cron("0 3 * * *", "Mars/Olympus")));

        assertEquals("Unknown timezone 'Mars/Olympus'", error.getMessage());
    }

    @Test
    void fallbackIsOneHourOutForUnusableSchedules() {
        Instant next = calculator.nextRunAtOrFallback(JobSchedule.cron("bogus", "UTC"), NOW);

        assertEquals(NOW.plus(ScheduleCalculator.FALLBACK_DELAY), next);
    }
}
