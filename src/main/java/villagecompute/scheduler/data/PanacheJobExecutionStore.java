package villagecompute.scheduler.data;

import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.LockModeType;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.scheduler.data.models.ExecutionStatus;
import villagecompute.scheduler.data.models.JobExecution;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Hibernate ORM Panache implementation of {@link JobExecutionStore}.
 */
@ApplicationScoped
public class PanacheJobExecutionStore implements JobExecutionStore {

    private static final Logger LOG = Logger.getLogger(PanacheJobExecutionStore.class);

    @Override
    @Transactional
    public void insert(JobExecution execution) {
        execution.persist();
    }

    /**
     * Locks the row and copies the terminal fields onto it, unless it already left {@code RUNNING}.
     */
    @Override
    @Transactional
    public boolean finalizeExecution(JobExecution execution) {
        JobExecution managed = JobExecution.findById(execution.id, LockModeType.PESSIMISTIC_WRITE);
        if (managed == null) {
            LOG.warnf("Cannot finalize execution %s: record not found", execution.id);
            return false;
        }
        if (managed.status.isTerminal()) {
            LOG.warnf("Execution %s already finalized as %s, ignoring %s", execution.id, managed.status,
                    execution.status);
            return false;
        }
        managed.status = execution.status;
        managed.result = execution.result;
        managed.error = execution.error;
        managed.logs = execution.logs;
        managed.completedAt = execution.completedAt;
        managed.durationSeconds = execution.durationSeconds;
        return true;
    }

    @Override
    @Transactional
    public Optional<JobExecution> findById(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return JobExecution.findByIdOptional(id);
    }

    @Override
    @Transactional
    public Page<JobExecution> list(ExecutionFilter filter, int skip, int limit) {
        List<String> clauses = new ArrayList<>();
        Parameters params = new Parameters();
        if (filter.jobId() != null) {
            clauses.add("jobId = :jobId");
            params.and("jobId", filter.jobId());
        }
        if (filter.status() != null) {
            clauses.add("status = :status");
            params.and("status", filter.status());
        }
        if (filter.triggeredBy() != null) {
            clauses.add("triggeredBy = :triggeredBy");
            params.and("triggeredBy", filter.triggeredBy());
        }
        if (filter.startedFrom() != null) {
            clauses.add("startedAt >= :startedFrom");
            params.and("startedFrom", filter.startedFrom());
        }
        if (filter.startedTo() != null) {
            clauses.add("startedAt < :startedTo");
            params.and("startedTo", filter.startedTo());
        }
        PageRequest page = PageRequest.of(skip, limit, "startedAt", false);
        Sort sort = Sort.descending("startedAt");
        String query = String.join(" AND ", clauses);

        long total = clauses.isEmpty() ? JobExecution.count() : JobExecution.count(query, params);
        List<JobExecution> items = (clauses.isEmpty() ? JobExecution.<JobExecution> findAll(sort)
                : JobExecution.<JobExecution> find(query, sort, params))
                .range(page.skip(), page.skip() + page.limit() - 1).list();
        return new Page<>(items, total, page.skip(), page.limit());
    }

    @Override
    @Transactional
    public List<JobExecution> findRunning() {
        return JobExecution.list("status", Sort.ascending("startedAt"), ExecutionStatus.RUNNING);
    }

    @Override
    @Transactional
    public boolean delete(UUID id) {
        return JobExecution.deleteById(id);
    }

    @Override
    @Transactional
    public long deleteCompletedBefore(Instant cutoff, Collection<ExecutionStatus> statuses) {
        return JobExecution.delete("status IN ?1 AND completedAt < ?2", terminalStatuses(statuses), cutoff);
    }

    @Override
    @Transactional
    public long countCompletedBefore(Instant cutoff, Collection<ExecutionStatus> statuses) {
        return JobExecution.count("status IN ?1 AND completedAt < ?2", terminalStatuses(statuses), cutoff);
    }

    @Override
    @Transactional
    public long count(ExecutionStatus status) {
        return status == null ? JobExecution.count() : JobExecution.count("status", status);
    }

    private static List<ExecutionStatus> terminalStatuses(Collection<ExecutionStatus> requested) {
        Collection<ExecutionStatus> source = requested == null || requested.isEmpty()
                ? Arrays.asList(ExecutionStatus.values())
                : requested;
        return source.stream().filter(ExecutionStatus::isTerminal).toList();
    }
}
