package io.ingestdesk.core.schedule;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.ingestdesk.core.job.JobDefinition;
import io.ingestdesk.core.job.JobDefinitionRegistry;
import io.ingestdesk.core.repository.ResourceConflictException;
import io.ingestdesk.core.repository.ResourceNotFoundException;
import io.ingestdesk.core.run.Run;
import io.ingestdesk.core.run.RunService;
import io.ingestdesk.core.run.StoredRun;
import io.ingestdesk.core.run.TriggerSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operator actions on schedules.
 *
 * Input is validated before the store is touched, so a rejected request
 * changes nothing.
 */
public class ScheduleService
{
    private static final Logger logger = LoggerFactory.getLogger(ScheduleService.class);

    private static final Comparator<StoredSchedule> BY_JOB = Comparator
        .comparing(StoredSchedule::getMarketplaceCode)
        .thenComparing(StoredSchedule::getJobCode)
        .thenComparing(StoredSchedule::getId);

    private final ScheduleStore scheduleStore;
    private final RunService runService;
    private final JobDefinitionRegistry jobs;
    private final ScheduleTranslator translator;

    @Inject
    public ScheduleService(ScheduleStore scheduleStore, RunService runService, JobDefinitionRegistry jobs, ScheduleTranslator translator)
    {
        this.scheduleStore = scheduleStore;
        this.runService = runService;
        this.jobs = jobs;
        this.translator = translator;
    }

    /**
     * Returns schedules of a project ordered by marketplace code and job code.
     */
    public List<StoredSchedule> getSchedules(long projectId)
    {
        return scheduleStore.getSchedulesByProjectId(projectId).stream()
            .sorted(BY_JOB)
            .collect(Collectors.toList());
    }

    public StoredSchedule getSchedule(long projectId, long schedId)
        throws ResourceNotFoundException
    {
        return scheduleStore.getScheduleById(projectId, schedId);
    }

    public StoredSchedule createSchedule(long projectId, String jobCode, SimpleSchedule simple, Optional<String> timezone, boolean enabled)
        throws ResourceNotFoundException, ResourceConflictException
    {
        return createSchedule(projectId, jobCode, Optional.of(translator.toCron(simple).toString()), Optional.of(simple), timezone, enabled);
    }

    /**
     * Creates a schedule of a job. The marketplace code comes from the job
     * definition. Absent cron or timezone fall back to the configured defaults.
     */
    public StoredSchedule createSchedule(long projectId, String jobCode, Optional<String> cronExpr, Optional<String> timezone, boolean enabled)
        throws ResourceNotFoundException, ResourceConflictException
    {
        return createSchedule(projectId, jobCode, cronExpr, Optional.absent(), timezone, enabled);
    }

    private StoredSchedule createSchedule(long projectId, String jobCode, Optional<String> cronExpr, Optional<SimpleSchedule> simple, Optional<String> timezone, boolean enabled)
        throws ResourceNotFoundException, ResourceConflictException
    {
        JobDefinition job = jobs.requireJobDefinition(jobCode);
        if (!job.getSupportsSchedule()) {
            throw new ResourceConflictException("Job " + jobCode + " doesn't support schedules");
        }
        CronExpression cron;
        String tz;
        try {
            cron = translator.resolveCron(cronExpr);
            tz = translator.resolveTimezone(timezone);
        }
        catch (ScheduleValidationException ex) {
            logger.debug("Rejected schedule of job {}: {}", jobCode, ex.getMessage());
            throw ex;
        }

        StoredSchedule schedule = scheduleStore.putSchedule(projectId,
                Schedule.of(job.getSourceCode(), jobCode, cron, simple, tz, enabled));
        logger.info("Created schedule {} of {}/{}: cron '{}' timezone {} enabled={}",
                schedule.getId(), schedule.getMarketplaceCode(), schedule.getJobCode(),
                schedule.getCronExpr(), schedule.getTimezone(), schedule.getEnabled());
        return schedule;
    }

    /**
     * Partial update. Only the given fields are validated and changed.
     * Disabling a schedule clears its next run time. A new cron expression
     * drops the simple form the schedule was created from.
     */
    public StoredSchedule updateSchedule(long projectId, long schedId, Optional<String> cronExpr, Optional<String> timezone, Optional<Boolean> enabled)
        throws ResourceNotFoundException, ResourceConflictException
    {
        return updateSchedule(projectId, schedId, cronExpr, Optional.absent(), timezone, enabled);
    }

    public StoredSchedule updateSchedule(long projectId, long schedId, SimpleSchedule simple, Optional<String> timezone, Optional<Boolean> enabled)
        throws ResourceNotFoundException, ResourceConflictException
    {
        return updateSchedule(projectId, schedId, Optional.of(translator.toCron(simple).toString()), Optional.of(simple), timezone, enabled);
    }

    private StoredSchedule updateSchedule(long projectId, long schedId, Optional<String> cronExpr, Optional<SimpleSchedule> simple, Optional<String> timezone, Optional<Boolean> enabled)
        throws ResourceNotFoundException, ResourceConflictException
    {
        Optional<CronExpression> cron;
        Optional<String> tz;
        try {
            cron = cronExpr.isPresent() ? Optional.of(CronExpression.parse(cronExpr.get())) : Optional.absent();
            tz = timezone.isPresent() ? Optional.of(translator.resolveTimezone(timezone)) : Optional.absent();
        }
        catch (ScheduleValidationException ex) {
            logger.debug("Rejected update of schedule {}: {}", schedId, ex.getMessage());
            throw ex;
        }

        StoredSchedule updated = scheduleStore.updateScheduleById(projectId, schedId, (store, storedSched) -> {
            ScheduleControl lc = new ScheduleControl(store, storedSched);
            lc.updateDefinition(
                    cron.or(storedSched.getCronExpr()),
                    cron.isPresent() ? simple : storedSched.getSimple(),
                    tz.or(storedSched.getTimezone()));
            if (enabled.isPresent() && enabled.get() != storedSched.getEnabled()) {
                lc.setEnabled(enabled.get());
            }
            return lc.get();
        });
        logger.info("Updated schedule {} of {}/{}: cron '{}' timezone {} enabled={}",
                updated.getId(), updated.getMarketplaceCode(), updated.getJobCode(),
                updated.getCronExpr(), updated.getTimezone(), updated.getEnabled());
        return updated;
    }

    public StoredSchedule toggleSchedule(long projectId, long schedId)
        throws ResourceNotFoundException, ResourceConflictException
    {
        StoredSchedule toggled = scheduleStore.updateScheduleById(projectId, schedId, (store, storedSched) -> {
            ScheduleControl lc = new ScheduleControl(store, storedSched);
            lc.setEnabled(!storedSched.getEnabled());
            return lc.get();
        });
        logger.info("{} schedule {} of {}/{}", toggled.getEnabled() ? "Enabled" : "Disabled",
                toggled.getId(), toggled.getMarketplaceCode(), toggled.getJobCode());
        return toggled;
    }

    /**
     * Deletes a schedule. Its runs stay listed.
     */
    public void deleteSchedule(long projectId, long schedId)
        throws ResourceNotFoundException
    {
        scheduleStore.deleteScheduleById(projectId, schedId);
        logger.info("Deleted schedule {} of project {}", schedId, projectId);
    }

    /**
     * Records the next fire time computed by the cron evaluator.
     */
    public StoredSchedule updateNextRunAt(long projectId, long schedId, Optional<Instant> nextRunAt)
        throws ResourceNotFoundException, ResourceConflictException
    {
        return scheduleStore.updateScheduleById(projectId, schedId, (store, storedSched) -> {
            ScheduleControl lc = new ScheduleControl(store, storedSched);
            lc.updateNextRunAt(storedSched.getEnabled() ? nextRunAt : Optional.absent());
            return lc.get();
        });
    }

    /**
     * Queues a run of the schedule's job right away. The schedule itself is
     * not changed.
     */
    public StoredRun runNow(long projectId, long schedId)
        throws ResourceNotFoundException, ResourceConflictException
    {
        StoredSchedule schedule = scheduleStore.getScheduleById(projectId, schedId);
        JobDefinition job = jobs.requireJobDefinition(schedule.getJobCode());
        if (!job.getSupportsManual()) {
            throw new ResourceConflictException("Job " + job.getJobCode() + " can't be started manually");
        }
        logger.info("Run now requested for schedule {} of {}/{}", schedId, schedule.getMarketplaceCode(), schedule.getJobCode());
        return runService.enqueueRun(Run.builder()
                .scheduleId(schedule.getId())
                .projectId(projectId)
                .marketplaceCode(schedule.getMarketplaceCode())
                .jobCode(schedule.getJobCode())
                .triggeredBy(TriggerSource.SCHEDULE)
                .build());
    }
}
