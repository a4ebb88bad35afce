package io.ingestdesk.core.run;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.ingestdesk.client.config.Config;
import io.ingestdesk.client.config.ConfigException;
import io.ingestdesk.client.config.ConfigFactory;
import io.ingestdesk.core.IngestConfig;
import io.ingestdesk.core.job.JobDefinition;
import io.ingestdesk.core.job.JobDefinitionRegistry;
import io.ingestdesk.core.repository.ResourceConflictException;
import io.ingestdesk.core.repository.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RunService
{
    private static final Logger logger = LoggerFactory.getLogger(RunService.class);

    public static final String TIMEOUT_WARNING = "The run is marked as timed out, but the task may still be running in the background.";
    public static final String DEFAULT_TIMEOUT_REASON_CODE = "manual";
    public static final String DEFAULT_TIMEOUT_REASON_TEXT = "Marked timeout manually";
    public static final String ACTIVE_RUN_EXISTS = "active_run_exists";
    public static final String STUCK_REASON_CODE = "manual_stuck";
    public static final String SYSTEM_ACTOR = "system";

    private final RunStore runStore;
    private final JobDefinitionRegistry jobs;
    private final IngestConfig config;
    private final ConfigFactory cf;
    private final Clock clock;

    @Inject
    public RunService(RunStore runStore, JobDefinitionRegistry jobs, IngestConfig config, ConfigFactory cf, Clock clock)
    {
        this.runStore = runStore;
        this.jobs = jobs;
        this.config = config;
        this.cf = cf;
        this.clock = clock;
    }

    public List<StoredRun> getRuns(long projectId, RunFilter filter)
    {
        if (filter.getJobCode().isPresent() && !jobs.getJobDefinition(filter.getJobCode().get()).isPresent()) {
            throw new ConfigException("Unknown job_code: " + filter.getJobCode().get());
        }
        if (filter.getMarketplaceCode().isPresent() && !jobs.isKnownSource(filter.getMarketplaceCode().get())) {
            throw new ConfigException("Unknown marketplace_code: " + filter.getMarketplaceCode().get());
        }
        int limit = filter.getLimit().or(config.getRunsDefaultLimit());
        if (limit > config.getRunsMaxLimit()) {
            throw new ConfigException("limit must be less than or equal to " + config.getRunsMaxLimit() + " but got " + limit);
        }
        return runStore.getRuns(projectId, filter, limit);
    }

    public StoredRun getRun(long projectId, long runId)
        throws ResourceNotFoundException
    {
        return runStore.getRunById(projectId, runId);
    }

    /**
     * Creates a queued run unless the job already has an active one. An
     * active run that stopped reporting for longer than the stuck ttl is
     * marked as timed out first and doesn't block the new run.
     */
    public StoredRun enqueueRun(Run run)
        throws ResourceNotFoundException, ResourceConflictException
    {
        JobDefinition job = jobs.requireJobDefinition(run.getJobCode());
        if (!job.getSupportsManual() && run.getTriggeredBy() != TriggerSource.SCHEDULE) {
            throw new ResourceConflictException("Job " + job.getJobCode() + " can't be started manually");
        }
        Duration ttl = config.getStuckTtl(run.getMarketplaceCode(), run.getJobCode());

        try {
            return runStore.lockJob(run.getProjectId(), run.getMarketplaceCode(), run.getJobCode(), (store, activeRun) -> {
                Instant now = clock.instant();
                if (activeRun.isPresent()) {
                    StoredRun active = activeRun.get();
                    if (!RunActivity.isStuck(active, now, ttl)) {
                        logger.debug("Refused to enqueue {}/{}: run {} is {}",
                                run.getMarketplaceCode(), run.getJobCode(), active.getId(), active.getStatus());
                        throw new ResourceConflictException(ACTIVE_RUN_EXISTS);
                    }
                    new RunControl(store, cf, active).markTimeout(
                            STUCK_REASON_CODE,
                            "No heartbeat > " + ttl.getSeconds() + "s",
                            SYSTEM_ACTOR, now);
                    logger.warn("Marked stuck run {} of {}/{} as timeout (last activity {}). The task may still be running",
                            active.getId(), run.getMarketplaceCode(), run.getJobCode(), RunActivity.lastActivity(active));
                }
                StoredRun queued = store.insertRun(run);
                logger.info("Enqueued run {} of {}/{} triggered by {}",
                        queued.getId(), queued.getMarketplaceCode(), queued.getJobCode(), queued.getTriggeredBy());
                return queued;
            });
        }
        catch (IllegalRunTransitionException ex) {
            // the active run finished while we were looking at it
            throw new ResourceConflictException(ex.getMessage(), ex);
        }
    }

    /**
     * Starts a run that is not bound to a schedule.
     */
    public StoredRun startManualRun(long projectId, String jobCode, TriggerSource triggeredBy, Optional<Config> params)
        throws ResourceNotFoundException, ResourceConflictException
    {
        JobDefinition job = jobs.requireJobDefinition(jobCode);
        return enqueueRun(Run.builder()
                .projectId(projectId)
                .marketplaceCode(job.getSourceCode())
                .jobCode(jobCode)
                .triggeredBy(triggeredBy)
                .params(params)
                .build());
    }

    public StoredRun markTimeout(long projectId, long runId, Optional<String> reasonCode, Optional<String> reasonText, String actor)
        throws ResourceNotFoundException, IllegalRunTransitionException
    {
        String code = reasonCode.or(DEFAULT_TIMEOUT_REASON_CODE);
        String text = reasonText.or(DEFAULT_TIMEOUT_REASON_TEXT);
        StoredRun run = runStore.lockRunById(projectId, runId, (store, storedRun) ->
                new RunControl(store, cf, storedRun).markTimeout(code, text, actor, clock.instant()));
        logger.info("Run {} of {}/{} marked as timeout by {} ({}). The task may still be running",
                run.getId(), run.getMarketplaceCode(), run.getJobCode(), actor, code);
        return run;
    }

    public StoredRun markSkipped(long projectId, long runId, String reasonCode, String reasonText, String actor)
        throws ResourceNotFoundException, IllegalRunTransitionException
    {
        StoredRun run = runStore.lockRunById(projectId, runId, (store, storedRun) ->
                new RunControl(store, cf, storedRun).markSkipped(reasonCode, reasonText, actor, clock.instant()));
        logger.info("Run {} of {}/{} skipped by {} ({})",
                run.getId(), run.getMarketplaceCode(), run.getJobCode(), actor, reasonCode);
        return run;
    }

    public StoredRun startRun(long projectId, long runId)
        throws ResourceNotFoundException, IllegalRunTransitionException
    {
        return runStore.lockRunById(projectId, runId, (store, storedRun) ->
                new RunControl(store, cf, storedRun).start(clock.instant()));
    }

    public boolean heartbeat(long projectId, long runId)
        throws ResourceNotFoundException, IllegalRunTransitionException
    {
        return runStore.lockRunById(projectId, runId, (store, storedRun) ->
                new RunControl(store, cf, storedRun).heartbeat(clock.instant()));
    }

    public boolean reportProgress(long projectId, long runId, Config stats)
        throws ResourceNotFoundException, IllegalRunTransitionException
    {
        return runStore.lockRunById(projectId, runId, (store, storedRun) ->
                new RunControl(store, cf, storedRun).reportProgress(stats, clock.instant()));
    }

    public StoredRun finishSuccess(long projectId, long runId, Optional<Config> stats)
        throws ResourceNotFoundException, IllegalRunTransitionException
    {
        return runStore.lockRunById(projectId, runId, (store, storedRun) ->
                new RunControl(store, cf, storedRun).finishSuccess(stats, clock.instant()));
    }

    public StoredRun finishFailed(long projectId, long runId, String errorMessage, Optional<String> errorTrace, Optional<Config> stats)
        throws ResourceNotFoundException, IllegalRunTransitionException
    {
        StoredRun run = runStore.lockRunById(projectId, runId, (store, storedRun) ->
                new RunControl(store, cf, storedRun).finishFailed(errorMessage, errorTrace, stats, clock.instant()));
        logger.info("Run {} of {}/{} failed: {}", run.getId(), run.getMarketplaceCode(), run.getJobCode(), run.getErrorMessage().or(""));
        return run;
    }

    public boolean isStuck(StoredRun run)
    {
        return RunActivity.isStuck(run, clock.instant(), config.getStuckTtl(run.getMarketplaceCode(), run.getJobCode()));
    }
}
