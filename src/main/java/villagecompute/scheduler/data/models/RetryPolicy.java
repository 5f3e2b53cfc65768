package villagecompute.scheduler.data.models;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Retry policy for scheduler-triggered runs.
 *
 * <p>
 * After a failed or timed-out scheduled run the job is re-queued {@code retry_delay_seconds} later, up to
 * {@code max_retries} consecutive times, before the regular schedule resumes. Manual runs never retry.
 *
 * @param maxRetries
 *            consecutive retries allowed after a failure (0 disables retries)
 * @param retryDelaySeconds
 *            delay before each retry
 */
public record RetryPolicy(@JsonProperty("max_retries") int maxRetries,
        @JsonProperty("retry_delay_seconds") long retryDelaySeconds) {

    public static RetryPolicy none() {
        return new RetryPolicy(0, 0);
    }

    public boolean allowsRetry(int failedAttemptsSoFar) {
        return maxRetries > 0 && failedAttemptsSoFar < maxRetries;
    }
}
