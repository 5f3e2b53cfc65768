package villagecompute.scheduler.services;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import villagecompute.scheduler.data.models.JobDefinition;
import villagecompute.scheduler.data.models.JobExecution;
import villagecompute.scheduler.data.models.JobSchedule;
import villagecompute.scheduler.data.models.RetryPolicy;
import villagecompute.scheduler.testing.TestTemplates;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobWorkerPoolTest {

    private final TestTemplates.Sleeper sleeper = new TestTemplates.Sleeper();

    private SchedulerHarness harness;

    @AfterEach
    void tearDown() {
        if (harness != null) {
            harness.close();
        }
    }

    private JobDefinition sleeperJob(String name) {
        return harness.registry.createJob(new JobDraft(name, null, TestTemplates.Sleeper.TYPE, Map.of("millis", 500),
                JobSchedule.interval(3600), null, 30L, RetryPolicy.none(), null, null), "tester");
    }

    private void submitTwoAndWait() throws InterruptedException {
        assertTrue(harness.executor.submit(sleeperJob("first"), JobExecution.TRIGGER_SCHEDULER));
        assertTrue(harness.executor.submit(sleeperJob("second"), JobExecution.TRIGGER_SCHEDULER));
        long deadline = System.currentTimeMillis() + 10_000;
        while (sleeper.completed() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(2, sleeper.completed());
    }

    @Test
    void singleWorkerRunsJobsOneAtATime() throws InterruptedException {
        harness = new SchedulerHarness(Clock.systemUTC(), 1, List.of(sleeper));

        submitTwoAndWait();

        assertEquals(1, sleeper.maxConcurrent());
        List<Instant[]> windows = sleeper.windows();
        Instant firstEnd = windows.get(0)[1];
        Instant secondStart = windows.get(1)[0];
        assertFalse(secondStart.isBefore(firstEnd));
    }

    @Test
    void twoWorkersRunJobsInParallel() throws InterruptedException {
        harness = new SchedulerHarness(Clock.systemUTC(), 2, List.of(sleeper));

        submitTwoAndWait();

        assertEquals(2, sleeper.maxConcurrent());
    }

    @Test
    void rejectsNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new JobWorkerPool(0));
    }

    @Test
    void reportsSizeAndShutdown() {
        JobWorkerPool pool = new JobWorkerPool(3);

        assertEquals(3, pool.size());
        assertEquals(0, pool.queuedCount());
        pool.shutdown();
        assertTrue(pool.isShutdown());
    }
}
