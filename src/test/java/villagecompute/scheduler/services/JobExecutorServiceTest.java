package villagecompute.scheduler.services;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import villagecompute.scheduler.data.models.ExecutionStatus;
import villagecompute.scheduler.data.models.JobDefinition;
import villagecompute.scheduler.data.models.JobExecution;
import villagecompute.scheduler.data.models.JobSchedule;
import villagecompute.scheduler.data.models.NotificationTargets;
import villagecompute.scheduler.data.models.RetryPolicy;
import villagecompute.scheduler.exceptions.ExecutionPersistenceException;
import villagecompute.scheduler.exceptions.JobConflictException;
import villagecompute.scheduler.exceptions.ResourceNotFoundException;
import villagecompute.scheduler.jobs.JobTemplate;
import villagecompute.scheduler.jobs.templates.NoopJobTemplate;
import villagecompute.scheduler.testing.TestClock;
import villagecompute.scheduler.testing.TestTemplates;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobExecutorServiceTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    private final TestTemplates.Veto veto = new TestTemplates.Veto();
    private final TestTemplates.Sleeper sleeper = new TestTemplates.Sleeper();

    private SchedulerHarness harness;

    @AfterEach
    void tearDown() {
        if (harness != null) {
            harness.close();
        }
    }

    private SchedulerHarness harness(Clock clock) {
        List<JobTemplate> templates = List.of(new NoopJobTemplate(), new TestTemplates.RangeCheck(),
                new TestTemplates.AlwaysFails(), new TestTemplates.BrokenHandler(), veto, sleeper,
                new TestTemplates.StatusReporter("no_status", null),
                new TestTemplates.StatusReporter("still_running", ExecutionStatus.RUNNING),
                new TestTemplates.ErrorThrower("pre_error", true), new TestTemplates.ErrorThrower("handler_error", false));
        harness = new SchedulerHarness(clock, 2, templates);
        return harness;
    }

    private JobDefinition create(String name, String template, Map<String, Object> params, long timeoutSeconds,
            NotificationTargets notifications) {
        return harness.registry.createJob(new JobDraft(name, null, template, params, JobSchedule.interval(600), null,
                timeoutSeconds, RetryPolicy.none(), notifications, null), "tester");
    }

    private JobDefinition create(String name, String template, Map<String, Object> params) {
        return create(name, template, params, 60, null);
    }

    @Test
    void successfulRunIsFinalizedWithResultAndLogs() {
        harness(new TestClock(START));
        JobDefinition job = create("check", TestTemplates.RangeCheck.TYPE, Map.of("x", 3));

        JobExecution execution = harness.executor.executeJobById(job.id, null);

        assertEquals(ExecutionStatus.SUCCESS, execution.status);
        assertEquals("x=3", execution.result.message());
        assertEquals(1, execution.result.recordsProcessed());
        assertEquals(JobExecution.TRIGGER_MANUAL, execution.triggeredBy);
        assertEquals("test-host", execution.executionHost);
        assertEquals(1, execution.attempt);
        assertNotNull(execution.completedAt);
        assertNull(execution.error);
        assertTrue(execution.logs.stream().anyMatch(entry -> entry.message().equals("x is 3")));
        assertEquals(ExecutionStatus.SUCCESS, harness.executionStore.findById(execution.id).orElseThrow().status);
    }

    @Test
    void templateExceptionFinalizesAsFailedWithError() {
        harness(new TestClock(START));
        JobDefinition job = create("fails", TestTemplates.AlwaysFails.TYPE, Map.of());

        JobExecution execution = harness.executor.executeJobById(job.id, "alice");

        assertEquals(ExecutionStatus.FAILED, execution.status);
        assertEquals("boom", execution.error);
        assertEquals("Job execution failed: boom", execution.result.message());
        assertEquals("alice", execution.triggeredBy);
    }

    @Test
    void runExceedingTimeoutFinalizesAsTimeout() {
        harness(Clock.systemUTC());
        JobDefinition job = create("slow", TestTemplates.Sleeper.TYPE, Map.of("millis", 5000), 1, null);

        JobExecution execution = harness.executor.executeJobById(job.id, null);

        assertEquals(ExecutionStatus.TIMEOUT, execution.status);
        assertNotNull(execution.error);
        assertTrue(execution.durationSeconds >= 0.9 && execution.durationSeconds < 3.0,
                "duration was " + execution.durationSeconds);
    }

    @Test
    void preExecuteVetoCancelsWithoutExecuting() {
        harness(new TestClock(START));
        JobDefinition job = create("vetoed", TestTemplates.Veto.TYPE, Map.of());

        JobExecution execution = harness.executor.executeJobById(job.id, null);

        assertEquals(ExecutionStatus.CANCELLED, execution.status);
        assertEquals(0, veto.executions());
    }

    @Test
    void missingTemplateFinalizesAsFailed() {
        harness(new TestClock(START));
        JobDefinition job = create("noop", NoopJobTemplate.TYPE, Map.of());
        harness.templates.unregister(NoopJobTemplate.TYPE);

        JobExecution execution = harness.executor.executeJobById(job.id, null);

        assertEquals(ExecutionStatus.FAILED, execution.status);
        assertEquals("Template not found: noop", execution.error);
    }

    @Test
    void failingErrorHandlerStillProducesFailedRecord() {
        harness(new TestClock(START));
        JobDefinition job = create("broken", TestTemplates.BrokenHandler.TYPE, Map.of());

        JobExecution execution = harness.executor.executeJobById(job.id, null);

        assertEquals(ExecutionStatus.FAILED, execution.status);
        assertEquals("bad input", execution.error);
    }

    @Test
    void resultWithoutStatusIsFinalizedAsFailedAndAdvancesSchedule() {
        harness(new TestClock(START));
        JobDefinition job = create("silent", "no_status", Map.of());

        JobExecution execution = harness.executor.executeJob(job, JobExecution.TRIGGER_SCHEDULER);

        assertEquals(ExecutionStatus.FAILED, execution.status);
        assertEquals("Template returned no status", execution.error);
        assertEquals(ExecutionStatus.FAILED, harness.executionStore.findById(execution.id).orElseThrow().status);
        JobDefinition after = harness.registry.requireJob(job.id);
        assertEquals(ExecutionStatus.FAILED, after.lastStatus);
        assertEquals(START.plusSeconds(600), after.nextRunAt);
    }

    @Test
    void nonTerminalStatusIsFinalizedAsFailed() {
        harness(new TestClock(START));
        JobDefinition job = create("stuck", "still_running", Map.of());

        JobExecution execution = harness.executor.executeJobById(job.id, null);

        JobExecution stored = harness.executionStore.findById(execution.id).orElseThrow();
        assertTrue(stored.status.isTerminal());
        assertEquals(ExecutionStatus.FAILED, stored.status);
        assertEquals("Template returned non-terminal status running", stored.error);
        assertEquals("reported", stored.result.message());
    }

    @Test
    void errorThrownFromPreExecuteFinalizesAsFailed() {
        harness(new TestClock(START));
        JobDefinition job = create("pre", "pre_error", Map.of());

        JobExecution execution = harness.executor.executeJob(job, JobExecution.TRIGGER_SCHEDULER);

        assertEquals(ExecutionStatus.FAILED, execution.status);
        assertTrue(execution.error.contains("pre check blew up"), execution.error);
        assertEquals(ExecutionStatus.FAILED, harness.executionStore.findById(execution.id).orElseThrow().status);
        assertEquals(ExecutionStatus.FAILED, harness.registry.requireJob(job.id).lastStatus);
    }

    @Test
    void errorsThrownFromErrorHandlerAndPostExecuteAreContained() {
        harness(new TestClock(START));
        JobDefinition job = create("handler", "handler_error", Map.of());

        JobExecution execution = harness.executor.executeJobById(job.id, null);

        assertEquals(ExecutionStatus.FAILED, execution.status);
        assertEquals("bad state", execution.error);
        assertEquals(ExecutionStatus.FAILED, harness.executionStore.findById(execution.id).orElseThrow().status);
        assertTrue(harness.leases.acquire(harness.registry.requireJob(job.id)).isPresent());
    }

    @Test
    void manualRunLeavesScheduleUntouched() {
        harness(new TestClock(START));
        JobDefinition job = create("manual", NoopJobTemplate.TYPE, Map.of());

        harness.executor.executeJobById(job.id, "scheduler");

        JobDefinition after = harness.registry.requireJob(job.id);
        assertEquals(job.nextRunAt, after.nextRunAt);
        assertNull(after.lastRunAt);
        assertNull(after.lastStatus);
        assertEquals(JobExecution.TRIGGER_MANUAL,
                harness.executionStore.all().get(0).triggeredBy);
    }

    @Test
    void manualRunOfIntervalJobSucceedsAndKeepsNextRun() {
        harness(new TestClock(START));
        JobDefinition job = harness.registry.createJob(new JobDraft("cleanup", null, NoopJobTemplate.TYPE, Map.of(),
                JobSchedule.interval(60), null, null, null, null, null), "tester");
        assertEquals(START.plusSeconds(60), job.nextRunAt);

        JobExecution execution = harness.executor.executeJobById(job.id, JobExecution.TRIGGER_MANUAL);

        assertEquals(ExecutionStatus.SUCCESS, execution.status);
        assertTrue(execution.durationSeconds >= 0);
        assertEquals(START.plusSeconds(60), harness.registry.requireJob(job.id).nextRunAt);
    }

    @Test
    void scheduledRunUpdatesScheduleAndCountsAttempts() {
        TestClock clock = new TestClock(START);
        harness(clock);
        JobDefinition job = harness.registry.createJob(new JobDraft("retrying", null, TestTemplates.AlwaysFails.TYPE,
                Map.of(), JobSchedule.interval(600), null, 60L, new RetryPolicy(1, 30), null, null), "tester");

        JobExecution first = harness.executor.executeJob(job, JobExecution.TRIGGER_SCHEDULER);
        JobDefinition afterFirst = harness.registry.requireJob(job.id);
        JobExecution second = harness.executor.executeJob(afterFirst, JobExecution.TRIGGER_SCHEDULER);

        assertEquals(1, first.attempt);
        assertEquals(START.plusSeconds(30), afterFirst.nextRunAt);
        assertEquals(2, second.attempt);
        JobDefinition afterSecond = harness.registry.requireJob(job.id);
        assertEquals(START, afterSecond.lastRunAt);
        assertEquals(ExecutionStatus.FAILED, afterSecond.lastStatus);
        assertEquals(START.plusSeconds(600), afterSecond.nextRunAt);
        assertEquals(0, afterSecond.retryAttempt);
    }

    @Test
    void notifiesRecipientsMatchingFinalStatus() {
        harness(new TestClock(START));
        NotificationTargets targets = new NotificationTargets(List.of("ops@example.com"),
                List.of("oncall@example.com", "lead@example.com"));
        JobDefinition ok = create("ok", NoopJobTemplate.TYPE, Map.of(), 60, targets);
        JobDefinition bad = create("bad", TestTemplates.AlwaysFails.TYPE, Map.of(), 60, targets);

        harness.executor.executeJobById(ok.id, null);
        harness.executor.executeJobById(bad.id, null);

        assertEquals(2, harness.sink.sent().size());
        assertEquals(List.of("ops@example.com"), harness.sink.sent().get(0).recipients());
        assertEquals("[SUCCESS] Job 'ok' succeeded", harness.sink.sent().get(0).subject());
        assertEquals(List.of("oncall@example.com", "lead@example.com"), harness.sink.sent().get(1).recipients());
        assertEquals("[FAILED] Job 'bad' failed", harness.sink.sent().get(1).subject());
    }

    @Test
    void sinkFailureDoesNotAffectTheRun() {
        harness(new TestClock(START));
        harness.sink.failing(true);
        JobDefinition job = create("ok", NoopJobTemplate.TYPE, Map.of(), 60,
                new NotificationTargets(List.of("ops@example.com"), null));

        JobExecution execution = harness.executor.executeJobById(job.id, null);

        assertEquals(ExecutionStatus.SUCCESS, execution.status);
    }

    @Test
    void rejectsMissingDisabledAndAlreadyRunningJobs() {
        harness(new TestClock(START));
        JobDefinition disabled = create("off", NoopJobTemplate.TYPE, Map.of());
        harness.registry.setEnabled(disabled.id, false);
        JobDefinition busy = create("busy", NoopJobTemplate.TYPE, Map.of());
        assertTrue(harness.leases.acquire(busy).isPresent());

        assertThrows(ResourceNotFoundException.class, () -> harness.executor.executeJobById(UUID.randomUUID(), null));
        assertThrows(JobConflictException.class, () -> harness.executor.executeJobById(disabled.id, null));
        assertThrows(JobConflictException.class, () -> harness.executor.executeJobById(busy.id, null));
        assertTrue(harness.executionStore.all().isEmpty());
    }

    @Test
    void leaseIsReleasedAfterManualRun() {
        harness(new TestClock(START));
        JobDefinition job = create("twice", NoopJobTemplate.TYPE, Map.of());

        harness.executor.executeJobById(job.id, null);
        harness.executor.executeJobById(job.id, null);

        assertEquals(2, harness.executionStore.all().size());
        assertNull(harness.jobStore.findById(job.id).orElseThrow().leaseOwner);
    }

    @Test
    void finalizeFailureSurfacesAsPersistenceError() {
        harness(new TestClock(START));
        JobDefinition job = create("nodb", NoopJobTemplate.TYPE, Map.of());
        harness.executionStore.failFinalize(true);

        assertThrows(ExecutionPersistenceException.class, () -> harness.executor.executeJobById(job.id, null));
        assertNull(harness.jobStore.findById(job.id).orElseThrow().leaseOwner);
    }

    @Test
    void triggeredRunCompletesOnWorkerPool() throws InterruptedException {
        harness(Clock.systemUTC());
        JobDefinition job = create("async", NoopJobTemplate.TYPE, Map.of("delay_millis", 50));

        harness.executor.triggerJobById(job.id, "bob");

        JobExecution execution = awaitTerminal(1).get(0);
        assertEquals(ExecutionStatus.SUCCESS, execution.status);
        assertEquals("bob", execution.triggeredBy);
    }

    @Test
    void runningExecutionCannotBeDeleted() {
        harness(new TestClock(START));
        JobDefinition job = create("n", NoopJobTemplate.TYPE, Map.of());
        JobExecution running = JobExecution.start(job, "manual", 1, START, "test-host");
        harness.executionStore.insert(running);
        JobExecution done = harness.executor.executeJobById(job.id, null);

        assertThrows(JobConflictException.class, () -> harness.executor.deleteExecution(running.id));
        harness.executor.deleteExecution(done.id);
        assertFalse(harness.executor.getExecution(done.id).isPresent());
        assertThrows(ResourceNotFoundException.class, () -> harness.executor.deleteExecution(done.id));
    }

    private List<JobExecution> awaitTerminal(int count) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            List<JobExecution> done = harness.executionStore.all().stream().filter(e -> e.status.isTerminal())
                    .toList();
            if (done.size() >= count) {
                return done;
            }
            Thread.sleep(20);
        }
        throw new AssertionError("Timed out waiting for " + count + " finalized executions");
    }
}
