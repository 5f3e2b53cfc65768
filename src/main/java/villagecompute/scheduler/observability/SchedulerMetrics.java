package villagecompute.scheduler.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.scheduler.jobs.TemplateRegistry;
import villagecompute.scheduler.services.JobWorkerPool;

import java.time.Duration;

/**
 * Micrometer meters for the scheduling engine.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Counter:</b> {@code scheduler_executions_total{status,template_type,triggered_by}} - Finalized runs</li>
 * <li><b>Timer:</b> {@code scheduler_execution_duration{template_type,status}} - Run wall-clock time</li>
 * <li><b>Counter:</b> {@code scheduler_dispatch_skipped_total{reason}} - Due jobs not dispatched this cycle</li>
 * <li><b>Gauges:</b> {@code scheduler_worker_pool_active}, {@code scheduler_worker_pool_queued} - Worker occupancy</li>
 * <li><b>Gauge:</b> {@code scheduler_templates_registered} - Size of the template registry</li>
 * </ul>
 *
 * <p>
 * Exported in Prometheus format at {@code /q/metrics}.
 *
 * @see LoggingConfig for structured logging field definitions
 */
@ApplicationScoped
public class SchedulerMetrics {

    private static final Logger LOG = Logger.getLogger(SchedulerMetrics.class);

    private final MeterRegistry registry;

    @Inject
    public SchedulerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    void registerGauges(@Observes StartupEvent event, JobWorkerPool workerPool, TemplateRegistry templateRegistry) {
        bindGauges(workerPool, templateRegistry);
    }

    /**
     * Registers the occupancy gauges. Micrometer keeps weak references, so both sources must be long-lived beans.
     */
    public void bindGauges(JobWorkerPool workerPool, TemplateRegistry templateRegistry) {
        Gauge.builder("scheduler_worker_pool_active", workerPool, JobWorkerPool::activeCount)
                .description("Jobs currently executing on the worker pool").register(registry);
        Gauge.builder("scheduler_worker_pool_queued", workerPool, JobWorkerPool::queuedCount)
                .description("Jobs waiting for a free worker").register(registry);
        Gauge.builder("scheduler_templates_registered", templateRegistry, TemplateRegistry::size)
                .description("Number of registered job templates").register(registry);
        LOG.debug("Registered scheduler gauges");
    }

    /**
     * Records one finalized execution.
     *
     * @param status
     *            terminal status value
     * @param templateType
     *            template key snapshot
     * @param triggeredBy
     *            trigger source; operator identities collapse to {@code manual}
     * @param duration
     *            wall-clock duration
     */
    public void recordExecution(String status, String templateType, String triggeredBy, Duration duration) {
        String trigger = "scheduler".equals(triggeredBy) ? "scheduler" : "manual";
        Counter.builder("scheduler_executions_total").description("Finalized job executions")
                .tag("status", status).tag("template_type", safe(templateType)).tag("triggered_by", trigger)
                .register(registry).increment();
        Timer.builder("scheduler_execution_duration").description("Job execution wall-clock duration")
                .tag("template_type", safe(templateType)).tag("status", status).register(registry).record(duration);
    }

    public void recordDispatchSkipped(String reason) {
        Counter.builder("scheduler_dispatch_skipped_total").description("Due jobs skipped by the scheduler loop")
                .tag("reason", reason).register(registry).increment();
    }

    private static String safe(String value) {
        return value == null ? "unknown" : value;
    }
}
