package villagecompute.scheduler.jobs;

import org.junit.jupiter.api.Test;
import villagecompute.scheduler.testing.TestClock;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobExecutionContextTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void collectsLogsInOrderWithNormalizedLevels() {
        TestClock clock = new TestClock(START);
        JobExecutionContext context = new JobExecutionContext(UUID.randomUUID(), "job", Map.of(), "manual",
                UUID.randomUUID(), 1, START.plusSeconds(60), clock);

        context.info("one");
        clock.advance(Duration.ofSeconds(1));
        context.log("warning", "two");
        context.error("three");

        assertEquals(3, context.logs().size());
        assertEquals("INFO", context.logs().get(0).level());
        assertEquals("WARNING", context.logs().get(1).level());
        assertEquals("three", context.logs().get(2).message());
        assertEquals(START.plusSeconds(1), context.logs().get(2).timestamp());
    }

    @Test
    void tracksDeadline() {
        TestClock clock = new TestClock(START);
        JobExecutionContext context = new JobExecutionContext(UUID.randomUUID(), "job", Map.of(), "manual",
                UUID.randomUUID(), 1, START.plusSeconds(60), clock);

        assertEquals(Duration.ofSeconds(60), context.remaining());
        assertFalse(context.isPastDeadline());

        clock.advance(Duration.ofSeconds(90));
        assertTrue(context.isPastDeadline());
        assertEquals(Duration.ZERO, context.remaining());
    }

    @Test
    void parametersAreReadOnly() {
        Map<String, Object> params = new HashMap<>();
        params.put("x", 1);
        JobExecutionContext context = new JobExecutionContext(UUID.randomUUID(), "job", params, "manual",
                UUID.randomUUID(), 1, null, new TestClock(START));

        assertThrows(UnsupportedOperationException.class, () -> context.parameters().put("y", 2));
    }
}
