package villagecompute.scheduler.api.rest.admin;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import villagecompute.scheduler.api.types.CreateJobRequestType;
import villagecompute.scheduler.api.types.JobDefinitionType;
import villagecompute.scheduler.api.types.JobExecutionType;
import villagecompute.scheduler.api.types.JobTemplateType;
import villagecompute.scheduler.api.types.JobTriggerType;
import villagecompute.scheduler.api.types.PageType;
import villagecompute.scheduler.api.types.SchedulerStatusType;
import villagecompute.scheduler.api.types.UpdateJobRequestType;
import villagecompute.scheduler.data.ExecutionFilter;
import villagecompute.scheduler.data.JobFilter;
import villagecompute.scheduler.data.Page;
import villagecompute.scheduler.data.PageRequest;
import villagecompute.scheduler.data.models.ExecutionStatus;
import villagecompute.scheduler.data.models.JobDefinition;
import villagecompute.scheduler.data.models.JobExecution;
import villagecompute.scheduler.exceptions.ExecutionPersistenceException;
import villagecompute.scheduler.exceptions.JobConflictException;
import villagecompute.scheduler.exceptions.ResourceNotFoundException;
import villagecompute.scheduler.exceptions.ValidationException;
import villagecompute.scheduler.jobs.TemplateMetadata;
import villagecompute.scheduler.jobs.TemplateRegistry;
import villagecompute.scheduler.services.JobExecutorService;
import villagecompute.scheduler.services.JobRegistryService;
import villagecompute.scheduler.services.SchedulerStatus;
import villagecompute.scheduler.services.SchedulerStatusService;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Admin REST endpoints for the job scheduler.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /admin/api/scheduler/templates} – template catalogue, optionally by category</li>
 * <li>{@code GET|POST /admin/api/scheduler/jobs} – list and create jobs</li>
 * <li>{@code GET|PATCH|DELETE /admin/api/scheduler/jobs/{id}} – read, update, delete one job</li>
 * <li>{@code POST /admin/api/scheduler/jobs/{id}/enable|disable|run} – toggle and run now</li>
 * <li>{@code GET /admin/api/scheduler/jobs/{id}/executions} – recent history of one job</li>
 * <li>{@code GET|DELETE /admin/api/scheduler/executions[/{id}]} – execution history</li>
 * <li>{@code GET /admin/api/scheduler/status} – engine summary</li>
 * </ul>
 *
 * <p>
 * <b>Security:</b> assumes deployment behind an authenticated admin gateway, which passes the operator identity in
 * {@code X-Operator}.
 */
@Path("/admin/api/scheduler")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SchedulerAdminResource {

    private static final Logger LOG = Logger.getLogger(SchedulerAdminResource.class);

    private static final String DEFAULT_OPERATOR = "admin";

    @Inject
    JobRegistryService registryService;

    @Inject
    JobExecutorService executorService;

    @Inject
    SchedulerStatusService statusService;

    @Inject
    TemplateRegistry templateRegistry;

    @GET
    @Path("/templates")
    public Response listTemplates(@QueryParam("category") String category) {
        List<TemplateMetadata> templates = category == null || category.isBlank() ? templateRegistry.list()
                : templateRegistry.listByCategory(category);
        return Response.ok(templates.stream().map(this::toTemplateType).toList()).build();
    }

    @GET
    @Path("/templates/{type}")
    public Response getTemplate(@PathParam("type") String type) {
        return templateRegistry.getMetadata(type).map(metadata -> Response.ok(toTemplateType(metadata)).build())
                .orElseGet(() -> Response.status(Response.Status.NOT_FOUND)
                        .entity(new ErrorResponse("Template not found: " + type)).build());
    }

    /**
     * Lists jobs.
     *
     * @param enabled
     *            filter on the enabled flag (optional)
     * @param templateTypes
     *            filter on template type, repeatable (optional)
     * @param sortBy
     *            created_at (default), name, next_run_at, updated_at or last_run_at
     * @param sortOrder
     *            asc or desc (default)
     */
    @GET
    @Path("/jobs")
    public Response listJobs(@QueryParam("enabled") Boolean enabled,
            @QueryParam("template_type") List<String> templateTypes, @QueryParam("skip") @DefaultValue("0") int skip,
            @QueryParam("limit") @DefaultValue("50") int limit,
            @QueryParam("sort_by") @DefaultValue("created_at") String sortBy,
            @QueryParam("sort_order") @DefaultValue("desc") String sortOrder) {
        return handle("list jobs", () -> {
            JobFilter filter = new JobFilter(enabled, templateTypes == null ? Set.of() : Set.copyOf(templateTypes));
            PageRequest page = PageRequest.of(skip, limit, sortBy, "asc".equalsIgnoreCase(sortOrder));
            return Response.ok(toPageType(registryService.listJobs(filter, page).map(this::toJobType))).build();
        });
    }

    @POST
    @Path("/jobs")
    public Response createJob(@Valid CreateJobRequestType request, @HeaderParam("X-Operator") String operator) {
        if (request == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Request body required"))
                    .build();
        }
        return handle("create job", () -> {
            JobDefinition job = registryService.createJob(request.toDraft(), operatorOrDefault(operator));
            LOG.infof("Job created: %s (%s) by %s", job.name, job.id, job.createdBy);
            return Response.status(Response.Status.CREATED).entity(toJobType(job)).build();
        });
    }

    @GET
    @Path("/jobs/{id}")
    public Response getJob(@PathParam("id") UUID id) {
        return handle("get job", () -> Response.ok(toJobType(registryService.requireJob(id))).build());
    }

    @PATCH
    @Path("/jobs/{id}")
    public Response updateJob(@PathParam("id") UUID id, @Valid UpdateJobRequestType request) {
        if (request == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Request body required"))
                    .build();
        }
        return handle("update job",
                () -> Response.ok(toJobType(registryService.updateJob(id, request.toPatch()))).build());
    }

    @DELETE
    @Path("/jobs/{id}")
    public Response deleteJob(@PathParam("id") UUID id) {
        return handle("delete job", () -> {
            registryService.deleteJob(id);
            return Response.noContent().build();
        });
    }

    @POST
    @Path("/jobs/{id}/enable")
    public Response enableJob(@PathParam("id") UUID id) {
        return handle("enable job", () -> Response.ok(toJobType(registryService.setEnabled(id, true))).build());
    }

    @POST
    @Path("/jobs/{id}/disable")
    public Response disableJob(@PathParam("id") UUID id) {
        return handle("disable job", () -> Response.ok(toJobType(registryService.setEnabled(id, false))).build());
    }

    /**
     * Runs a job now without touching its schedule.
     *
     * @param wait
     *            when true, blocks until the run finalizes and returns the execution record; otherwise queues the run
     *            and answers 202
     */
    @POST
    @Path("/jobs/{id}/run")
    public Response runJob(@PathParam("id") UUID id, @QueryParam("wait") @DefaultValue("false") boolean wait,
            @HeaderParam("X-Operator") String operator) {
        String triggeredBy = operator == null || operator.isBlank() ? JobExecution.TRIGGER_MANUAL : operator;
        return handle("run job", () -> {
            if (wait) {
                return Response.ok(toExecutionType(executorService.executeJobById(id, triggeredBy))).build();
            }
            executorService.triggerJobById(id, triggeredBy);
            return Response.accepted(new JobTriggerType(id, "queued", triggeredBy)).build();
        });
    }

    @GET
    @Path("/jobs/{id}/executions")
    public Response getJobExecutions(@PathParam("id") UUID id, @QueryParam("limit") @DefaultValue("50") int limit,
            @QueryParam("status") String status) {
        return handle("list job executions", () -> {
            List<JobExecution> executions = registryService.getJobExecutions(id, limit, parseStatus(status));
            return Response.ok(executions.stream().map(this::toExecutionType).toList()).build();
        });
    }

    @GET
    @Path("/executions")
    public Response listExecutions(@QueryParam("job_id") UUID jobId, @QueryParam("status") String status,
            @QueryParam("triggered_by") String triggeredBy, @QueryParam("skip") @DefaultValue("0") int skip,
            @QueryParam("limit") @DefaultValue("50") int limit) {
        return handle("list executions", () -> {
            ExecutionFilter filter = new ExecutionFilter(jobId, parseStatus(status), triggeredBy, null, null);
            PageRequest page = PageRequest.of(skip, limit, "started_at", false);
            Page<JobExecution> executions = executorService.listExecutions(filter, page);
            return Response.ok(toPageType(executions.map(this::toExecutionType))).build();
        });
    }

    @GET
    @Path("/executions/{id}")
    public Response getExecution(@PathParam("id") UUID id) {
        return executorService.getExecution(id).map(execution -> Response.ok(toExecutionType(execution)).build())
                .orElseGet(() -> Response.status(Response.Status.NOT_FOUND)
                        .entity(new ErrorResponse("Execution not found: " + id)).build());
    }

    @DELETE
    @Path("/executions/{id}")
    public Response deleteExecution(@PathParam("id") UUID id) {
        return handle("delete execution", () -> {
            executorService.deleteExecution(id);
            return Response.noContent().build();
        });
    }

    @GET
    @Path("/status")
    public Response getStatus() {
        return handle("get scheduler status",
                () -> Response.ok(toStatusType(statusService.getSchedulerStatus())).build());
    }

    /**
     * Runs an action and translates the scheduler exception taxonomy into HTTP responses.
     */
    private Response handle(String action, Supplier<Response> body) {
        try {
            return body.get();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        } catch (JobConflictException e) {
            return Response.status(Response.Status.CONFLICT).entity(new ErrorResponse(e.getMessage())).build();
        } catch (ExecutionPersistenceException e) {
            LOG.errorf(e, "Failed to %s", action);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR).entity(new ErrorResponse(e.getMessage()))
                    .build();
        } catch (Exception e) {
            LOG.errorf(e, "Failed to %s", action);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to " + action)).build();
        }
    }

    private static ExecutionStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return ExecutionStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown execution status: " + status);
        }
    }

    private static String operatorOrDefault(String operator) {
        return operator == null || operator.isBlank() ? DEFAULT_OPERATOR : operator;
    }

    private <T> PageType<T> toPageType(Page<T> page) {
        return new PageType<>(page.items(), page.total(), page.skip(), page.limit(), page.page(), page.pages());
    }

    private JobTemplateType toTemplateType(TemplateMetadata metadata) {
        return new JobTemplateType(metadata.type(), metadata.name(), metadata.description(), metadata.category(),
                metadata.estimatedDuration(), metadata.resourceUsage(), metadata.riskLevel(),
                metadata.parametersSchema(), metadata.defaultParameters());
    }

    private JobDefinitionType toJobType(JobDefinition job) {
        return new JobDefinitionType(job.id, job.name, job.description, job.templateType, job.parameters,
                job.schedule, job.enabled, job.timeoutSeconds, job.effectiveRetryPolicy(),
                job.effectiveNotifications(), job.allowConcurrentRuns, job.createdBy, job.createdAt, job.updatedAt,
                job.lastRunAt, job.nextRunAt, job.lastStatus == null ? null : job.lastStatus.value(), job.retryAttempt,
                job.version);
    }

    private JobExecutionType toExecutionType(JobExecution execution) {
        return new JobExecutionType(execution.id, execution.jobId, execution.jobName, execution.templateType,
                execution.status.value(), execution.startedAt, execution.completedAt, execution.durationSeconds,
                execution.result, execution.error, execution.logs, execution.triggeredBy, execution.attempt,
                execution.executionHost);
    }

    private SchedulerStatusType toStatusType(SchedulerStatus status) {
        return new SchedulerStatusType(status.running(), status.totalJobs(), status.enabledJobs(),
                status.disabledJobs(), status.executionsByStatus(), status.successRate(), status.registeredTemplates(),
                status.workerPoolSize(), status.activeWorkers(), status.queuedJobs());
    }

    /**
     * Simple error response record for API errors.
     */
    public record ErrorResponse(String error) {
    }
}
