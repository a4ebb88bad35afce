package io.ingestdesk.core.api;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.ingestdesk.client.api.RestJobDefinition;
import io.ingestdesk.client.api.RestJobStatus;
import io.ingestdesk.client.api.RestRun;
import io.ingestdesk.client.api.RestRunCollection;
import io.ingestdesk.client.api.RestRunMarkTimeoutRequest;
import io.ingestdesk.client.api.RestRunTimeoutResult;
import io.ingestdesk.client.api.RestSchedule;
import io.ingestdesk.client.api.RestSchedulePreview;
import io.ingestdesk.client.api.RestScheduleRequest;
import io.ingestdesk.client.api.RestScheduleUpdateRequest;
import io.ingestdesk.client.api.RestSimpleSchedule;
import io.ingestdesk.client.config.Config;
import io.ingestdesk.core.job.JobDefinitionRegistry;
import io.ingestdesk.core.job.JobStatusService;
import io.ingestdesk.core.repository.ResourceConflictException;
import io.ingestdesk.core.repository.ResourceNotFoundException;
import io.ingestdesk.core.repository.UpstreamUnavailableException;
import io.ingestdesk.core.run.IllegalRunTransitionException;
import io.ingestdesk.core.run.RunFilter;
import io.ingestdesk.core.run.RunService;
import io.ingestdesk.core.run.RunStatus;
import io.ingestdesk.core.run.StoredRun;
import io.ingestdesk.core.run.TriggerSource;
import io.ingestdesk.core.schedule.ScheduleService;
import io.ingestdesk.core.schedule.ScheduleTranslator;
import io.ingestdesk.core.schedule.SimpleSchedules;
import io.ingestdesk.core.schedule.StoredSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.collect.ImmutableList.toImmutableList;

/**
 * Operator-facing entry points of the dashboard, in terms of the client
 * models. Binding these to a transport is left to the embedding application.
 */
public class IngestResource
{
    // GET    /api/projects/{project}/schedules                     # list schedules
    // GET    /api/projects/{project}/schedules/{id}                # show a schedule
    // POST   /api/projects/{project}/schedules                     # create a schedule
    // PATCH  /api/projects/{project}/schedules/{id}                # update cron, timezone or enabled
    // POST   /api/projects/{project}/schedules/{id}/toggle         # flip enabled
    // DELETE /api/projects/{project}/schedules/{id}                # delete a schedule, keeping its runs
    // POST   /api/projects/{project}/schedules/{id}/run            # queue a run now
    // POST   /api/projects/{project}/jobs/{job}/run                # queue a run without schedule
    // GET    /api/projects/{project}/runs                          # list runs
    // GET    /api/projects/{project}/runs/{id}                     # show a run
    // POST   /api/projects/{project}/runs/{id}/mark_timeout        # force a run to timeout
    // GET    /api/jobs                                             # list job definitions
    // GET    /api/projects/{project}/marketplaces/{code}/jobs      # status of every job of a marketplace
    // POST   /api/schedules/preview                                # translate a schedule form

    private static final Logger logger = LoggerFactory.getLogger(IngestResource.class);

    private final ScheduleService scheduleService;
    private final RunService runService;
    private final JobStatusService jobStatusService;
    private final JobDefinitionRegistry jobs;
    private final ScheduleTranslator translator;
    private final Clock clock;

    @Inject
    public IngestResource(
            ScheduleService scheduleService,
            RunService runService,
            JobStatusService jobStatusService,
            JobDefinitionRegistry jobs,
            ScheduleTranslator translator,
            Clock clock)
    {
        this.scheduleService = scheduleService;
        this.runService = runService;
        this.jobStatusService = jobStatusService;
        this.jobs = jobs;
        this.translator = translator;
        this.clock = clock;
    }

    public List<RestSchedule> getSchedules(long projectId)
    {
        return withStore("list schedules", () ->
                RestModels.scheduleCollection(scheduleService.getSchedules(projectId), translator));
    }

    public RestSchedule getSchedule(long projectId, long id)
        throws ResourceNotFoundException
    {
        return withStore("get schedule", () ->
                RestModels.schedule(scheduleService.getSchedule(projectId, id), translator));
    }

    public RestSchedule createSchedule(long projectId, RestScheduleRequest request)
        throws ResourceNotFoundException, ResourceConflictException
    {
        return this.<RestSchedule, ResourceNotFoundException, ResourceConflictException>withStore("create schedule", () -> {
            StoredSchedule sched;
            if (request.getSimple().isPresent()) {
                sched = scheduleService.createSchedule(projectId, request.getJobCode(),
                        SimpleSchedules.fromRest(request.getSimple().get()),
                        request.getTimezone(), request.getEnabled());
            }
            else {
                sched = scheduleService.createSchedule(projectId, request.getJobCode(),
                        request.getCronExpr(), request.getTimezone(), request.getEnabled());
            }
            return RestModels.schedule(sched, translator);
        });
    }

    public RestSchedule updateSchedule(long projectId, long id, RestScheduleUpdateRequest request)
        throws ResourceNotFoundException, ResourceConflictException
    {
        return this.<RestSchedule, ResourceNotFoundException, ResourceConflictException>withStore("update schedule", () -> {
            StoredSchedule sched;
            if (request.getSimple().isPresent()) {
                sched = scheduleService.updateSchedule(projectId, id,
                        SimpleSchedules.fromRest(request.getSimple().get()),
                        request.getTimezone(), request.getEnabled());
            }
            else {
                sched = scheduleService.updateSchedule(projectId, id,
                        request.getCronExpr(), request.getTimezone(), request.getEnabled());
            }
            return RestModels.schedule(sched, translator);
        });
    }

    public RestSchedule toggleSchedule(long projectId, long id)
        throws ResourceNotFoundException, ResourceConflictException
    {
        return this.<RestSchedule, ResourceNotFoundException, ResourceConflictException>withStore("toggle schedule", () ->
                RestModels.schedule(scheduleService.toggleSchedule(projectId, id), translator));
    }

    public void deleteSchedule(long projectId, long id)
        throws ResourceNotFoundException
    {
        withStore("delete schedule", () -> {
            scheduleService.deleteSchedule(projectId, id);
            return true;
        });
    }

    public RestRun runScheduleNow(long projectId, long id)
        throws ResourceNotFoundException, ResourceConflictException
    {
        return this.<RestRun, ResourceNotFoundException, ResourceConflictException>withStore("run schedule", () ->
                RestModels.run(scheduleService.runNow(projectId, id), clock.instant()));
    }

    public RestRun startRun(long projectId, String jobCode, Optional<Config> params)
        throws ResourceNotFoundException, ResourceConflictException
    {
        return this.<RestRun, ResourceNotFoundException, ResourceConflictException>withStore("start run", () ->
                RestModels.run(runService.startManualRun(projectId, jobCode, TriggerSource.MANUAL, params), clock.instant()));
    }

    public RestRunCollection getRuns(
            long projectId,
            Optional<String> marketplaceCode,
            Optional<String> jobCode,
            Optional<String> status,
            Optional<Instant> startedFrom,
            Optional<Instant> startedTo,
            Optional<Integer> limit)
    {
        RunFilter filter = RunFilter.builder()
            .marketplaceCode(marketplaceCode)
            .jobCode(jobCode)
            .status(status.transform(RunStatus::fromName))
            .startedFrom(startedFrom)
            .startedTo(startedTo)
            .limit(limit)
            .build();
        return withStore("list runs", () ->
                RestModels.runCollection(runService.getRuns(projectId, filter), clock.instant()));
    }

    public RestRun getRun(long projectId, long id)
        throws ResourceNotFoundException
    {
        return withStore("get run", () ->
                RestModels.run(runService.getRun(projectId, id), clock.instant()));
    }

    /**
     * Forces an active run to timeout. The result carries a warning because
     * the worker of the run is not stopped.
     */
    public RestRunTimeoutResult markRunTimeout(long projectId, long id, RestRunMarkTimeoutRequest request, String actor)
        throws ResourceNotFoundException, IllegalRunTransitionException
    {
        return this.<RestRunTimeoutResult, ResourceNotFoundException, IllegalRunTransitionException>withStore("mark run timeout", () -> {
            StoredRun run = runService.markTimeout(projectId, id, request.getReasonCode(), request.getReasonText(), actor);
            return RestModels.timeoutResult(run, clock.instant(), RunService.TIMEOUT_WARNING);
        });
    }

    public List<RestJobDefinition> getJobDefinitions()
    {
        return jobs.getJobDefinitions().stream()
            .map(RestModels::jobDefinition)
            .collect(toImmutableList());
    }

    public List<RestJobStatus> getJobStatuses(long projectId, String marketplaceCode)
    {
        return withStore("get job statuses", () ->
                jobStatusService.getJobStatuses(projectId, marketplaceCode).stream()
                    .map(RestModels::jobStatus)
                    .collect(toImmutableList()));
    }

    public RestSchedulePreview previewSimpleSchedule(RestSimpleSchedule simple, Optional<String> timezone)
    {
        return RestModels.schedulePreview(translator.preview(SimpleSchedules.fromRest(simple), timezone));
    }

    public RestSchedulePreview previewCron(String cronExpr, Optional<String> timezone)
    {
        return RestModels.schedulePreview(translator.preview(cronExpr, timezone));
    }

    private interface StoreAction <T, E1 extends Exception, E2 extends Exception>
    {
        T call() throws E1, E2;
    }

    private <T, E1 extends Exception, E2 extends Exception> T withStore(String operation, StoreAction<T, E1, E2> action)
        throws E1, E2
    {
        try {
            return action.call();
        }
        catch (UpstreamUnavailableException ex) {
            logger.warn("Failed to {}: {}", operation, ex.getMessage());
            throw ex;
        }
    }
}
