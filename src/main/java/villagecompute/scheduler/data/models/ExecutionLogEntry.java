package villagecompute.scheduler.data.models;

import java.time.Instant;

/**
 * One structured log line captured during an execution.
 *
 * @param timestamp
 *            when the line was written
 * @param level
 *            INFO, WARN, ERROR or DEBUG
 * @param message
 *            log text
 */
public record ExecutionLogEntry(Instant timestamp, String level, String message) {
}
