package villagecompute.scheduler.jobs.templates;

import org.junit.jupiter.api.Test;
import villagecompute.scheduler.data.models.ExecutionStatus;
import villagecompute.scheduler.jobs.JobExecutionContext;
import villagecompute.scheduler.jobs.JobResult;
import villagecompute.scheduler.jobs.ParameterValidation;
import villagecompute.scheduler.testing.TestClock;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NoopJobTemplateTest {

    private final NoopJobTemplate template = new NoopJobTemplate();

    @Test
    void acceptsEmptyParametersUsingDefaults() {
        assertTrue(template.validateParams(Map.of()).valid());
        assertEquals(new NoopJobTemplate.Params("noop", 0), template.bind(Map.of()));
    }

    @Test
    void rejectsOutOfRangeDelay() {
        ParameterValidation validation = template.validateParams(Map.of("delay_millis", -5));

        assertFalse(validation.valid());
        assertEquals("delay_millis must be between 0 and 3600000", validation.error());
    }

    @Test
    void validationIsRepeatable() {
        Map<String, Object> params = Map.of("delay_millis", 5_000_000);

        assertEquals(template.validateParams(params), template.validateParams(params));
        assertEquals(template.validateParams(Map.of()), template.validateParams(Map.of()));
    }

    @Test
    void rejectsUnknownParameter() {
        ParameterValidation validation = template.validateParams(Map.of("bogus", 1));

        assertFalse(validation.valid());
        assertEquals("Unknown parameter 'bogus'", validation.error());
    }

    @Test
    void rejectsWronglyTypedParameter() {
        ParameterValidation validation = template.validateParams(Map.of("delay_millis", "soon"));

        assertFalse(validation.valid());
        assertEquals("Invalid value for parameter 'delay_millis'", validation.error());
    }

    @Test
    void executeLogsMessageAndSucceeds() throws Exception {
        Instant now = Instant.parse("2024-03-01T10:00:00Z");
        JobExecutionContext context = new JobExecutionContext(UUID.randomUUID(), "noop-job",
                Map.of("message", "hello"), "manual", UUID.randomUUID(), 1, now.plusSeconds(60), new TestClock(now));

        JobResult result = template.execute(context);

        assertEquals(ExecutionStatus.SUCCESS, result.status());
        assertEquals("No-op completed", result.message());
        assertEquals("hello", context.logs().get(0).message());
    }
}
