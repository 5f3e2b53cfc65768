package villagecompute.scheduler.data;

import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.LockModeType;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.scheduler.data.models.ExecutionStatus;
import villagecompute.scheduler.data.models.JobDefinition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Hibernate ORM Panache implementation of {@link JobDefinitionStore}.
 *
 * <p>
 * Each method runs in its own transaction. Entities returned to callers are detached; operator edits are copied onto
 * the locked stored row field by field.
 */
@ApplicationScoped
public class PanacheJobDefinitionStore implements JobDefinitionStore {

    private static final Logger LOG = Logger.getLogger(PanacheJobDefinitionStore.class);

    /**
     * Sortable attributes, keyed by both their API (snake_case) and entity names.
     */
    private static final Map<String, String> SORT_FIELDS = Map.of("created_at", "createdAt", "createdAt", "createdAt",
            "updated_at", "updatedAt", "updatedAt", "updatedAt", "next_run_at", "nextRunAt", "nextRunAt", "nextRunAt",
            "last_run_at", "lastRunAt", "lastRunAt", "lastRunAt", "name", "name");

    @Override
    @Transactional
    public void insert(JobDefinition job) {
        job.persist();
        LOG.debugf("Inserted job definition %s (%s)", job.id, job.name);
    }

    @Override
    @Transactional
    public Optional<JobDefinition> findById(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return JobDefinition.findByIdOptional(id);
    }

    @Override
    @Transactional
    public Optional<JobDefinition> findByName(String name) {
        return JobDefinition.findByName(name);
    }

    @Override
    @Transactional
    public Optional<JobDefinition> applyOperatorEdit(JobDefinition edited, boolean resetSchedule,
            boolean resetRetries) {
        JobDefinition stored = JobDefinition.findById(edited.id, LockModeType.PESSIMISTIC_WRITE);
        if (stored == null) {
            return Optional.empty();
        }
        stored.applyOperatorEdit(edited, resetSchedule, resetRetries);
        return Optional.of(stored);
    }

    @Override
    @Transactional
    public boolean delete(UUID id) {
        return JobDefinition.deleteById(id);
    }

    @Override
    @Transactional
    public Page<JobDefinition> list(JobFilter filter, PageRequest page) {
        List<String> clauses = new ArrayList<>();
        Parameters params = new Parameters();
        if (filter.enabled() != null) {
            clauses.add("enabled = :enabled");
            params.and("enabled", filter.enabled());
        }
        if (!filter.templateTypes().isEmpty()) {
            clauses.add("templateType IN :templateTypes");
            params.and("templateTypes", filter.templateTypes());
        }
        String query = String.join(" AND ", clauses);
        String sortField = SORT_FIELDS.getOrDefault(page.sortBy(), "createdAt");
        Sort sort = page.ascending() ? Sort.ascending(sortField) : Sort.descending(sortField);

        long total = clauses.isEmpty() ? JobDefinition.count() : JobDefinition.count(query, params);
        List<JobDefinition> items = (clauses.isEmpty() ? JobDefinition.<JobDefinition> findAll(sort)
                : JobDefinition.<JobDefinition> find(query, sort, params))
                .range(page.skip(), page.skip() + page.limit() - 1).list();
        return new Page<>(items, total, page.skip(), page.limit());
    }

    @Override
    @Transactional
    public List<JobDefinition> listAll() {
        return JobDefinition.listAll(Sort.ascending("name"));
    }

    @Override
    @Transactional
    public List<JobDefinition> findReadyToRun(Instant now) {
        return JobDefinition.findReadyToRun(now);
    }

    @Override
    @Transactional
    public boolean recordExecutionOutcome(UUID id, Instant lastRunAt, Instant nextRunAt, ExecutionStatus lastStatus,
            int retryAttempt, Instant updatedAt) {
        int updated = JobDefinition.update(
                "lastRunAt = ?1, nextRunAt = ?2, lastStatus = ?3, retryAttempt = ?4, updatedAt = ?5 WHERE id = ?6",
                lastRunAt, nextRunAt, lastStatus, retryAttempt, updatedAt, id);
        return updated > 0;
    }

    @Override
    @Transactional
    public boolean tryAcquireLease(UUID id, String owner, Instant expiresAt, Instant now) {
        int updated = JobDefinition.update(
                "leaseOwner = ?1, leaseExpiresAt = ?2 WHERE id = ?3 AND (leaseExpiresAt IS NULL OR leaseExpiresAt <= ?4)",
                owner, expiresAt, id, now);
        return updated == 1;
    }

    @Override
    @Transactional
    public void releaseLease(UUID id, String owner) {
        JobDefinition.update("leaseOwner = NULL, leaseExpiresAt = NULL WHERE id = ?1 AND leaseOwner = ?2", id, owner);
    }

    @Override
    @Transactional
    public long count(Boolean enabled) {
        return enabled == null ? JobDefinition.count() : JobDefinition.count("enabled", enabled);
    }
}
