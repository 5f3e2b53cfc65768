package villagecompute.scheduler.jobs;

import java.util.Map;

/**
 * Contract for pluggable job templates.
 *
 * <p>
 * Templates must be CDI-managed beans annotated with {@code @ApplicationScoped}. The {@link TemplateRegistry} discovers
 * them at startup and keys them by {@link #templateType()}; job definitions select one by that key and supply a
 * parameter map that only the template understands.
 *
 * <p>
 * <b>Execution Model:</b>
 * <ol>
 * <li>{@link #preExecute} may veto the run, which is then recorded as {@code cancelled}</li>
 * <li>{@link #execute} runs on a runner thread under the job's {@code timeout_seconds}</li>
 * <li>an exception from {@code execute} is converted by {@link #onError}</li>
 * <li>{@link #postExecute} always runs, even after a failure or timeout</li>
 * </ol>
 *
 * <p>
 * <b>Timeouts are not preemption.</b> When the timeout elapses the executor stops waiting and interrupts the runner
 * thread, but work that ignores interruption keeps going and its side effects may land after the run is reported as
 * {@code timeout}. Implementations must be idempotent and should checkpoint against
 * {@link JobExecutionContext#deadline()}.
 *
 * <p>
 * <b>Example Implementation:</b>
 *
 * <pre>{@code
 * @ApplicationScoped
 * public class ReportTemplate implements JobTemplate {
 *     @Override
 *     public String templateType() {
 *         return "report";
 *     }
 *
 *     @Override
 *     public JobResult execute(JobExecutionContext context) {
 *         context.info("Building report");
 *         return JobResult.success("Report built");
 *     }
 *     // schema and validation omitted
 * }
 * }</pre>
 *
 * @see TypedJobTemplate for templates with typed parameters
 */
public interface JobTemplate {

    /**
     * Registry key stored in {@code JobDefinition.template_type}.
     */
    String templateType();

    default String displayName() {
        return templateType();
    }

    default String description() {
        return "";
    }

    default String category() {
        return "general";
    }

    default String estimatedDuration() {
        return "unknown";
    }

    /**
     * low, medium or high.
     */
    default String resourceUsage() {
        return "medium";
    }

    /**
     * low, medium, high or critical.
     */
    default String riskLevel() {
        return "low";
    }

    /**
     * Returns a JSON-Schema style description of the parameters for UI and validation tooling.
     */
    Map<String, Object> getSchema();

    /**
     * Validates a parameter map.
     *
     * <p>
     * Must be pure: identical input always yields an identical result, and the method may be called any number of
     * times (at create, at update, and by tooling).
     *
     * @param params
     *            candidate parameters
     * @return validation outcome; the error text is shown to operators verbatim
     */
    ParameterValidation validateParams(Map<String, Object> params);

    default Map<String, Object> getDefaultParams() {
        return Map.of();
    }

    /**
     * Gate evaluated before {@link #execute}. Returning false records the run as {@code cancelled}.
     *
     * @throws Exception
     *             treated like an exception from {@code execute}
     */
    default boolean preExecute(JobExecutionContext context) throws Exception {
        context.info("Starting job execution: " + context.jobName());
        return true;
    }

    /**
     * Performs the unit of work.
     *
     * @param context
     *            run context
     * @return structured result
     * @throws Exception
     *             any failure; converted by {@link #onError}
     */
    JobResult execute(JobExecutionContext context) throws Exception;

    /**
     * Converts an unexpected exception into a failed result. Overrides should not throw; the executor still guards
     * against it.
     */
    default JobResult onError(JobExecutionContext context, Exception error) {
        String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
        context.error("Job execution failed: " + reason);
        return JobResult.failed("Job execution failed: " + reason, reason);
    }

    /**
     * Side-effecting hook invoked after every run, whatever its outcome. Failures are logged and ignored.
     */
    default void postExecute(JobExecutionContext context, JobResult result) throws Exception {
        context.info("Job execution completed: " + result.status().value());
    }

    default TemplateMetadata metadata() {
        return new TemplateMetadata(templateType(), displayName(), description(), category(), estimatedDuration(),
                resourceUsage(), riskLevel(), getSchema(), getDefaultParams());
    }
}
