package villagecompute.scheduler.data.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Schedule of a job definition, stored as a JSON document.
 *
 * <p>
 * Either {@code {type: interval, interval_seconds}} or {@code {type: cron, expression, timezone}}. Fields that do not
 * belong to the selected variant are ignored.
 *
 * @param type
 *            schedule variant
 * @param intervalSeconds
 *            cadence in seconds (interval schedules)
 * @param expression
 *            five-field cron expression (cron schedules)
 * @param timezone
 *            IANA zone the cron expression is evaluated in, UTC when absent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobSchedule(@JsonProperty("type") ScheduleKind type,
        @JsonProperty("interval_seconds") Long intervalSeconds, @JsonProperty("expression") String expression,
        @JsonProperty("timezone") String timezone) {

    public static final String DEFAULT_TIMEZONE = "UTC";

    public static JobSchedule interval(long intervalSeconds) {
        return new JobSchedule(ScheduleKind.INTERVAL, intervalSeconds, null, null);
    }

    public static JobSchedule cron(String expression, String timezone) {
        return new JobSchedule(ScheduleKind.CRON, null, expression, timezone);
    }

    /**
     * Returns the configured timezone or {@value #DEFAULT_TIMEZONE}.
     */
    public String effectiveTimezone() {
        return timezone == null || timezone.isBlank() ? DEFAULT_TIMEZONE : timezone;
    }
}
