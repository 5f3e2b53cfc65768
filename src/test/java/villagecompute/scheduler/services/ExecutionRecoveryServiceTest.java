package villagecompute.scheduler.services;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.scheduler.data.models.ExecutionStatus;
import villagecompute.scheduler.data.models.JobDefinition;
import villagecompute.scheduler.data.models.JobExecution;
import villagecompute.scheduler.data.models.JobSchedule;
import villagecompute.scheduler.data.models.NotificationTargets;
import villagecompute.scheduler.jobs.templates.NoopJobTemplate;
import villagecompute.scheduler.testing.TestClock;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionRecoveryServiceTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    private TestClock clock;
    private SchedulerHarness harness;
    private JobDefinition job;

    @BeforeEach
    void setUp() {
        clock = new TestClock(START);
        harness = new SchedulerHarness(clock, 1, List.of(new NoopJobTemplate()));
        job = harness.registry.createJob(new JobDraft("nightly", null, NoopJobTemplate.TYPE, Map.of(),
                JobSchedule.interval(600), null, 300L, null,
                new NotificationTargets(List.of("ops@example.com"), List.of("ops@example.com")), null), "tester");
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private JobExecution running(Instant startedAt) {
        JobExecution execution = JobExecution.start(job, JobExecution.TRIGGER_SCHEDULER, 1, startedAt, "dead-host");
        harness.executionStore.insert(execution);
        return execution;
    }

    @Test
    void marksRunsOlderThanTimeoutAsOrphaned() {
        JobExecution stale = running(START);
        clock.advance(Duration.ofSeconds(301));

        assertEquals(1, harness.recovery.recoverOrphans());

        JobExecution recovered = harness.executionStore.findById(stale.id).orElseThrow();
        assertEquals(ExecutionStatus.ORPHANED, recovered.status);
        assertEquals(START.plusSeconds(301), recovered.completedAt);
        assertEquals(301.0, recovered.durationSeconds, 0.001);
        assertEquals("Orphaned after process restart", recovered.error);
        assertTrue(harness.sink.sent().isEmpty());
    }

    @Test
    void leavesRecentRunsAlone() {
        JobExecution fresh = running(START);
        clock.advance(Duration.ofSeconds(100));

        assertEquals(0, harness.recovery.recoverOrphans());
        assertEquals(ExecutionStatus.RUNNING, harness.executionStore.findById(fresh.id).orElseThrow().status);
    }

    @Test
    void usesDefaultThresholdWhenJobWasDeleted() {
        JobExecution stale = running(START);
        harness.registry.deleteJob(job.id);

        clock.advance(Duration.ofSeconds(600));
        assertEquals(0, harness.recovery.recoverOrphans());

        clock.advance(Duration.ofSeconds(3000));
        assertEquals(1, harness.recovery.recoverOrphans());
        assertEquals(ExecutionStatus.ORPHANED, harness.executionStore.findById(stale.id).orElseThrow().status);
    }

    @Test
    void doesNotTouchJobSchedule() {
        running(START);
        clock.advance(Duration.ofSeconds(301));

        harness.recovery.recoverOrphans();

        JobDefinition after = harness.registry.requireJob(job.id);
        assertEquals(job.nextRunAt, after.nextRunAt);
        assertEquals(job.lastRunAt, after.lastRunAt);
    }
}
