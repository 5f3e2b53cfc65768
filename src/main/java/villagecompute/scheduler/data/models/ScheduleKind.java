package villagecompute.scheduler.data.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Discriminator of the {@link JobSchedule} tagged variant.
 */
public enum ScheduleKind {

    /**
     * Fixed cadence of {@code interval_seconds}, measured from the last computation time.
     */
    INTERVAL,

    /**
     * Five-field Unix cron expression evaluated in the schedule's timezone.
     */
    CRON;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ScheduleKind fromValue(String value) {
        if (value == null) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
