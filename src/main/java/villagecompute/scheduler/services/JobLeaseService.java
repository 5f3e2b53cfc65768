package villagecompute.scheduler.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.scheduler.config.SchedulerIdentity;
import villagecompute.scheduler.data.JobDefinitionStore;
import villagecompute.scheduler.data.models.JobDefinition;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * At-most-one-run guard per job.
 *
 * <p>
 * A lease is taken with a conditional update ({@code lease_owner} free or {@code lease_expires_at} passed) before a
 * run is dispatched and released when it finalizes. It expires after the job's timeout plus a grace period, so a
 * process that dies mid-run blocks the job only until then. Jobs with {@code allow_concurrent_runs} skip the guard.
 */
@ApplicationScoped
public class JobLeaseService {

    private static final Logger LOG = Logger.getLogger(JobLeaseService.class);

    @Inject
    JobDefinitionStore jobStore;

    @Inject
    SchedulerIdentity identity;

    @Inject
    Clock clock;

    @ConfigProperty(
            name = "scheduler.lease.grace-seconds",
            defaultValue = "60")
    long graceSeconds;

    @ConfigProperty(
            name = "scheduler.jobs.default-timeout-seconds",
            defaultValue = "3600")
    long defaultTimeoutSeconds;

    /**
     * Tries to claim the run lease for a job.
     *
     * @param job
     *            job about to run
     * @return the lease, or empty if another run holds it
     */
    public Optional<JobLease> acquire(JobDefinition job) {
        if (job.allowConcurrentRuns) {
            return Optional.of(JobLease.unguarded(job.id));
        }
        Instant now = clock.instant();
        long timeout = job.timeoutSeconds > 0 ? job.timeoutSeconds : defaultTimeoutSeconds;
        Instant expiresAt = now.plusSeconds(timeout + graceSeconds);
        String owner = identity.hostId() + "/" + UUID.randomUUID();

        if (!jobStore.tryAcquireLease(job.id, owner, expiresAt, now)) {
            LOG.debugf("Lease for job %s (%s) is held by another run", job.name, job.id);
            return Optional.empty();
        }
        LOG.debugf("Acquired lease for job %s until %s", job.name, expiresAt);
        return Optional.of(new JobLease(job.id, owner, expiresAt));
    }

    /**
     * Releases a lease. A failed release is logged; the lease then simply lapses at its expiry.
     */
    public void release(JobLease lease) {
        if (lease == null || !lease.guarded()) {
            return;
        }
        try {
            jobStore.releaseLease(lease.jobId(), lease.owner());
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to release lease for job %s, it will expire at %s", lease.jobId(),
                    lease.expiresAt());
        }
    }
}
