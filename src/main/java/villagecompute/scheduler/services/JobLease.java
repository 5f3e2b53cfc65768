package villagecompute.scheduler.services;

import java.time.Instant;
import java.util.UUID;

/**
 * Claim on running a job, held from dispatch until the run finalizes.
 *
 * @param jobId
 *            leased job
 * @param owner
 *            unique owner token written to {@code lease_owner}; null for jobs that allow overlapping runs
 * @param expiresAt
 *            instant after which another dispatcher may take the lease
 */
public record JobLease(UUID jobId, String owner, Instant expiresAt) {

    static JobLease unguarded(UUID jobId) {
        return new JobLease(jobId, null, null);
    }

    public boolean guarded() {
        return owner != null;
    }
}
