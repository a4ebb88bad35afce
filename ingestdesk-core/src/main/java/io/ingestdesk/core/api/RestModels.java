package io.ingestdesk.core.api;

import java.time.Instant;
import java.util.List;
import com.google.common.collect.ImmutableList;
import io.ingestdesk.client.api.RestJobDefinition;
import io.ingestdesk.client.api.RestJobStatus;
import io.ingestdesk.client.api.RestRun;
import io.ingestdesk.client.api.RestRunCollection;
import io.ingestdesk.client.api.RestRunTimeoutResult;
import io.ingestdesk.client.api.RestSchedule;
import io.ingestdesk.client.api.RestSchedulePreview;
import io.ingestdesk.core.job.JobDefinition;
import io.ingestdesk.core.job.JobStatus;
import io.ingestdesk.core.run.RunActivity;
import io.ingestdesk.core.run.RunStatsSummarizer;
import io.ingestdesk.core.run.StoredRun;
import io.ingestdesk.core.schedule.SchedulePreview;
import io.ingestdesk.core.schedule.ScheduleTranslator;
import io.ingestdesk.core.schedule.StoredSchedule;

import static com.google.common.collect.ImmutableList.toImmutableList;

public final class RestModels
{
    private RestModels()
    { }

    public static RestSchedule schedule(StoredSchedule sched, ScheduleTranslator translator)
    {
        return RestSchedule.builder()
            .id(sched.getId())
            .projectId(sched.getProjectId())
            .marketplaceCode(sched.getMarketplaceCode())
            .jobCode(sched.getJobCode())
            .cronExpr(sched.getCronExpr().toString())
            .timezone(sched.getTimezone())
            .enabled(sched.getEnabled())
            .nextRunAt(sched.getNextRunAt())
            .description(translator.describe(sched))
            .createdAt(sched.getCreatedAt())
            .updatedAt(sched.getUpdatedAt())
            .build();
    }

    public static List<RestSchedule> scheduleCollection(List<StoredSchedule> scheds, ScheduleTranslator translator)
    {
        return scheds.stream()
            .map(sched -> schedule(sched, translator))
            .collect(toImmutableList());
    }

    public static RestRun run(StoredRun run, Instant now)
    {
        return RestRun.builder()
            .id(run.getId())
            .scheduleId(run.getScheduleId())
            .projectId(run.getProjectId())
            .marketplaceCode(run.getMarketplaceCode())
            .jobCode(run.getJobCode())
            .triggeredBy(run.getTriggeredBy().getName())
            .status(run.getStatus().getName())
            .active(run.isActive())
            .startedAt(run.getStartedAt())
            .finishedAt(run.getFinishedAt())
            .durationMs(run.getDurationMs())
            .duration(RunActivity.formatDuration(run.getDurationMs()))
            .heartbeatAt(run.getHeartbeatAt())
            .lastActivity(RunActivity.formatLastActivity(run, now))
            .errorMessage(run.getErrorMessage())
            .errorTrace(run.getErrorTrace())
            .stats(run.getStats())
            .statsSummary(RunStatsSummarizer.summarize(run.getStats()))
            .params(run.getParams())
            .meta(run.getMeta())
            .createdAt(run.getCreatedAt())
            .updatedAt(run.getUpdatedAt())
            .build();
    }

    public static RestRunCollection runCollection(List<StoredRun> runs, Instant now)
    {
        ImmutableList.Builder<RestRun> builder = ImmutableList.builder();
        for (StoredRun run : runs) {
            builder.add(run(run, now));
        }
        return RestRunCollection.builder()
            .runs(builder.build())
            .build();
    }

    public static RestRunTimeoutResult timeoutResult(StoredRun run, Instant now, String warning)
    {
        return RestRunTimeoutResult.builder()
            .run(run(run, now))
            .warning(warning)
            .build();
    }

    public static RestJobDefinition jobDefinition(JobDefinition job)
    {
        return RestJobDefinition.builder()
            .jobCode(job.getJobCode())
            .title(job.getTitle())
            .sourceCode(job.getSourceCode())
            .supportsSchedule(job.getSupportsSchedule())
            .supportsManual(job.getSupportsManual())
            .build();
    }

    public static RestJobStatus jobStatus(JobStatus status)
    {
        return RestJobStatus.builder()
            .jobCode(status.getJob().getJobCode())
            .title(status.getJob().getTitle())
            .hasSchedule(status.getHasSchedule())
            .scheduleSummary(status.getScheduleDescription())
            .lastRunAt(status.getLastRunAt())
            .lastStatus(status.getLastStatus().transform(s -> s.getName()))
            .running(status.getRunning())
            .build();
    }

    public static RestSchedulePreview schedulePreview(SchedulePreview preview)
    {
        return RestSchedulePreview.builder()
            .cronExpr(preview.getCronExpr().toString())
            .timezone(preview.getTimezone())
            .summary(preview.getSummary())
            .description(preview.getDescription())
            .build();
    }
}
