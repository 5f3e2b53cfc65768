package villagecompute.scheduler.jobs.templates;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.scheduler.jobs.JobExecutionContext;
import villagecompute.scheduler.jobs.JobResult;
import villagecompute.scheduler.jobs.ParameterValidation;
import villagecompute.scheduler.jobs.TypedJobTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Template that does nothing except log a message and optionally sleep.
 *
 * <p>
 * Used for smoke-testing schedules, worker pool sizing and notification routing without touching any data.
 *
 * <p>
 * <b>Payload Structure:</b>
 *
 * <pre>
 * {
 *   "message": "heartbeat",   // Optional - logged once per run
 *   "delay_millis": 250       // Optional - 0..3600000, honours interruption
 * }
 * </pre>
 */
@ApplicationScoped
public class NoopJobTemplate extends TypedJobTemplate<NoopJobTemplate.Params> {

    public static final String TYPE = "noop";

    static final long MAX_DELAY_MILLIS = 3_600_000L;

    public record Params(@JsonProperty("message") String message, @JsonProperty("delay_millis") long delayMillis) {
    }

    public NoopJobTemplate() {
        super(Params.class);
    }

    @Override
    public String templateType() {
        return TYPE;
    }

    @Override
    public String displayName() {
        return "No-op";
    }

    @Override
    public String description() {
        return "Logs a message and optionally waits; performs no work";
    }

    @Override
    public String category() {
        return "maintenance";
    }

    @Override
    public String estimatedDuration() {
        return "< 1 second";
    }

    @Override
    public String resourceUsage() {
        return "low";
    }

    @Override
    public Map<String, Object> getSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("message", Map.of("type", "string", "description", "Text logged by each run"));
        properties.put("delay_millis", Map.of("type", "integer", "minimum", 0, "maximum", MAX_DELAY_MILLIS,
                "description", "Milliseconds to wait before completing"));
        return Map.of("type", "object", "properties", properties);
    }

    @Override
    public Map<String, Object> getDefaultParams() {
        return Map.of("message", "noop", "delay_millis", 0);
    }

    @Override
    protected ParameterValidation validate(Params params) {
        if (params.delayMillis() < 0 || params.delayMillis() > MAX_DELAY_MILLIS) {
            return ParameterValidation.invalid("delay_millis must be between 0 and " + MAX_DELAY_MILLIS);
        }
        return ParameterValidation.ok();
    }

    @Override
    protected JobResult execute(JobExecutionContext context, Params params) throws InterruptedException {
        context.info(params.message() != null ? params.message() : "noop");
        if (params.delayMillis() > 0) {
            Thread.sleep(params.delayMillis());
        }
        return JobResult.success("No-op completed", 0, 0, Map.of("delay_millis", params.delayMillis()));
    }
}
