package io.ingestdesk.core.job;

import java.time.Instant;
import java.util.List;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.ingestdesk.client.config.ConfigException;
import io.ingestdesk.core.run.RunStore;
import io.ingestdesk.core.run.StoredRun;
import io.ingestdesk.core.schedule.ScheduleStore;
import io.ingestdesk.core.schedule.ScheduleTranslator;
import io.ingestdesk.core.schedule.StoredSchedule;

/**
 * Per-job overview of one marketplace: schedule, last run and whether a run
 * is in progress.
 */
public class JobStatusService
{
    private final JobDefinitionRegistry jobs;
    private final ScheduleStore scheduleStore;
    private final RunStore runStore;
    private final ScheduleTranslator translator;

    @Inject
    public JobStatusService(JobDefinitionRegistry jobs, ScheduleStore scheduleStore, RunStore runStore, ScheduleTranslator translator)
    {
        this.jobs = jobs;
        this.scheduleStore = scheduleStore;
        this.runStore = runStore;
        this.translator = translator;
    }

    public List<JobStatus> getJobStatuses(long projectId, String marketplaceCode)
    {
        if (!jobs.isKnownSource(marketplaceCode)) {
            throw new ConfigException("Unknown marketplace_code: " + marketplaceCode);
        }

        ImmutableList.Builder<JobStatus> builder = ImmutableList.builder();
        for (JobDefinition job : jobs.getJobDefinitionsOfSource(marketplaceCode)) {
            Optional<StoredSchedule> schedule = firstEnabledSchedule(
                    scheduleStore.getSchedulesByJob(projectId, marketplaceCode, job.getJobCode()));
            Optional<StoredRun> lastRun = runStore.getLastRun(projectId, marketplaceCode, job.getJobCode());
            Optional<StoredRun> activeRun = runStore.getActiveRun(projectId, marketplaceCode, job.getJobCode());
            Optional<Instant> lastRunAt = lastRun.isPresent()
                ? lastRun.get().getFinishedAt().or(lastRun.get().getStartedAt())
                : Optional.<Instant>absent();

            builder.add(JobStatus.builder()
                    .job(job)
                    .hasSchedule(schedule.isPresent())
                    .scheduleDescription(schedule.transform(translator::describe))
                    .lastRunAt(lastRunAt)
                    .lastStatus(lastRun.transform(StoredRun::getStatus))
                    .running(activeRun.isPresent())
                    .build());
        }
        return builder.build();
    }

    private static Optional<StoredSchedule> firstEnabledSchedule(List<StoredSchedule> schedules)
    {
        for (StoredSchedule schedule : schedules) {
            if (schedule.getEnabled()) {
                return Optional.of(schedule);
            }
        }
        return Optional.absent();
    }
}
