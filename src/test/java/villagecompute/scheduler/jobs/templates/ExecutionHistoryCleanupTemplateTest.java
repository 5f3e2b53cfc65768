package villagecompute.scheduler.jobs.templates;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.scheduler.data.models.ExecutionStatus;
import villagecompute.scheduler.data.models.JobDefinition;
import villagecompute.scheduler.data.models.JobExecution;
import villagecompute.scheduler.data.models.JobSchedule;
import villagecompute.scheduler.data.models.RetryPolicy;
import villagecompute.scheduler.jobs.JobResult;
import villagecompute.scheduler.services.JobDraft;
import villagecompute.scheduler.services.SchedulerHarness;
import villagecompute.scheduler.testing.TestClock;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionHistoryCleanupTemplateTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private TestClock clock;
    private ExecutionHistoryCleanupTemplate cleanup;
    private SchedulerHarness harness;
    private JobDefinition producer;

    @BeforeEach
    void setUp() {
        clock = new TestClock(NOW);
        cleanup = new ExecutionHistoryCleanupTemplate();
        harness = new SchedulerHarness(clock, 1, List.of(new NoopJobTemplate(), cleanup));
        cleanup.executionStore = harness.executionStore;
        cleanup.clock = clock;
        producer = harness.registry.createJob(new JobDraft("producer", null, NoopJobTemplate.TYPE, Map.of(),
                JobSchedule.interval(3600), null, null, RetryPolicy.none(), null, null), "tester");
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private void finishedRun(ExecutionStatus status, Duration age) {
        Instant at = NOW.minus(age);
        JobExecution execution = JobExecution.start(producer, JobExecution.TRIGGER_SCHEDULER, 1, at, "test-host");
        execution.complete(JobResult.success("done").withStatus(status), at, List.of());
        harness.executionStore.insert(execution);
    }

    @Test
    void validatesRetentionAndStatuses() {
        assertTrue(cleanup.validateParams(Map.of()).valid());
        assertEquals("retention_days must be between 1 and 3650",
                cleanup.validateParams(Map.of("retention_days", 0)).error());
        assertEquals("Unknown status 'weird'",
                cleanup.validateParams(Map.of("retention_days", 7, "statuses", List.of("weird"))).error());
        assertEquals("statuses must only contain terminal statuses",
                cleanup.validateParams(Map.of("retention_days", 7, "statuses", List.of("running"))).error());
    }

    @Test
    void deletesOnlyOldRecordsWithMatchingStatus() {
        finishedRun(ExecutionStatus.SUCCESS, Duration.ofDays(40));
        finishedRun(ExecutionStatus.SUCCESS, Duration.ofDays(35));
        finishedRun(ExecutionStatus.FAILED, Duration.ofDays(40));
        finishedRun(ExecutionStatus.SUCCESS, Duration.ofDays(2));
        JobDefinition job = harness.registry.createJob(new JobDraft("cleanup", null,
                ExecutionHistoryCleanupTemplate.TYPE, Map.of("retention_days", 30, "statuses", List.of("success")),
                JobSchedule.cron("0 3 * * *", "UTC"), null, null, RetryPolicy.none(), null, null), "tester");

        JobExecution execution = harness.executor.executeJobById(job.id, null);

        assertEquals(ExecutionStatus.SUCCESS, execution.status);
        assertEquals(2, execution.result.recordsAffected());
        assertEquals("Deleted 2 execution records", execution.result.message());
        List<JobExecution> remaining = harness.executionStore.all();
        assertEquals(3, remaining.size());
        assertTrue(remaining.stream().anyMatch(e -> e.status == ExecutionStatus.FAILED));
    }

    @Test
    void dryRunOnlyCounts() {
        finishedRun(ExecutionStatus.SUCCESS, Duration.ofDays(40));
        finishedRun(ExecutionStatus.TIMEOUT, Duration.ofDays(40));
        JobDefinition job = harness.registry.createJob(new JobDraft("cleanup", null,
                ExecutionHistoryCleanupTemplate.TYPE, Map.of("retention_days", 30, "dry_run", true),
                JobSchedule.interval(86400), null, null, RetryPolicy.none(), null, null), "tester");

        JobExecution execution = harness.executor.executeJobById(job.id, null);

        assertEquals(2, execution.result.recordsProcessed());
        assertEquals(0, execution.result.recordsAffected());
        assertEquals(3, harness.executionStore.all().size());
        assertFalse(execution.result.details().isEmpty());
    }
}
