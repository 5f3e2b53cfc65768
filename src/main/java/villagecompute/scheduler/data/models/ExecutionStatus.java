package villagecompute.scheduler.data.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle states of a single job execution.
 *
 * <p>
 * A record is created in {@link #RUNNING} and moves exactly once to one of the terminal states. Terminal states are
 * final: the execution store only finalizes rows that are still {@code RUNNING}.
 *
 * <p>
 * {@link #ORPHANED} is assigned by boot-time recovery to records left in {@code RUNNING} by a crashed process.
 */
public enum ExecutionStatus {

    RUNNING,

    SUCCESS,

    FAILED,

    TIMEOUT,

    CANCELLED,

    ORPHANED;

    /**
     * Returns the lowercase wire value ({@code "success"}, {@code "timeout"}, ...).
     */
    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire value, case-insensitively.
     *
     * @param value
     *            lowercase or uppercase status name
     * @return matching status
     * @throws IllegalArgumentException
     *             if the value names no status
     */
    @JsonCreator
    public static ExecutionStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Execution status must not be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    /**
     * Whether this outcome counts as a failure for notification routing and retry purposes.
     */
    public boolean isFailure() {
        return this == FAILED || this == TIMEOUT;
    }
}
