package villagecompute.scheduler.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Standard MDC field names and helpers for job execution logging.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code job_id} - Job definition primary key</li>
 * <li>{@code execution_id} - Execution record primary key</li>
 * <li>{@code template_type} - Template the job dispatches to</li>
 * <li>{@code triggered_by} - {@code scheduler}, {@code manual} or an operator identity</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the executor:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJobId(job.id);
 * LoggingConfig.setExecutionId(execution.id);
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Template bodies run on a
 * separate runner thread, so the executor hands the fields over with {@link #snapshot()} and {@link #restore(Map)}.
 * Every execution must call {@link #clearMDC()} when it finishes.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_EXECUTION_ID = "execution_id";

    public static final String MDC_TEMPLATE_TYPE = "template_type";

    public static final String MDC_TRIGGERED_BY = "triggered_by";

    private static final String[] FIELDS = {MDC_TRACE_ID, MDC_SPAN_ID, MDC_JOB_ID, MDC_EXECUTION_ID,
            MDC_TEMPLATE_TYPE, MDC_TRIGGERED_BY};

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. Empty strings are used when no span
     * is active.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setJobId(UUID jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
    }

    public static void setExecutionId(UUID executionId) {
        if (executionId != null) {
            MDC.put(MDC_EXECUTION_ID, executionId.toString());
        }
    }

    public static void setTemplateType(String templateType) {
        if (templateType != null) {
            MDC.put(MDC_TEMPLATE_TYPE, templateType);
        }
    }

    public static void setTriggeredBy(String triggeredBy) {
        if (triggeredBy != null) {
            MDC.put(MDC_TRIGGERED_BY, triggeredBy);
        }
    }

    /**
     * Captures the scheduler MDC fields of the current thread.
     *
     * @return field values, only those currently set
     */
    public static Map<String, Object> snapshot() {
        Map<String, Object> values = new HashMap<>();
        for (String field : FIELDS) {
            Object value = MDC.get(field);
            if (value != null) {
                values.put(field, value);
            }
        }
        return values;
    }

    /**
     * Installs fields captured by {@link #snapshot()} on the current thread.
     */
    public static void restore(Map<String, Object> values) {
        values.forEach(MDC::put);
    }

    /**
     * Clears all scheduler MDC fields. Pooled threads otherwise carry stale job ids into the next run.
     */
    public static void clearMDC() {
        for (String field : FIELDS) {
            MDC.remove(field);
        }
    }
}
