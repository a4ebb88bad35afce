package io.ingestdesk.core.api;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.ingestdesk.client.api.RestRun;
import io.ingestdesk.client.api.RestRunCollection;
import io.ingestdesk.client.api.RestRunMarkTimeoutRequest;
import io.ingestdesk.client.api.RestRunTimeoutResult;
import io.ingestdesk.client.api.RestSchedule;
import io.ingestdesk.client.api.RestSchedulePreview;
import io.ingestdesk.client.api.RestScheduleRequest;
import io.ingestdesk.client.api.RestSimpleSchedule;
import io.ingestdesk.core.IngestConfig;
import io.ingestdesk.core.job.JobDefinitionRegistry;
import io.ingestdesk.core.job.JobStatusService;
import io.ingestdesk.core.repository.UpstreamUnavailableException;
import io.ingestdesk.core.run.ImmutableStoredRun;
import io.ingestdesk.core.run.RunFilter;
import io.ingestdesk.core.run.RunService;
import io.ingestdesk.core.run.RunStatus;
import io.ingestdesk.core.run.StoredRun;
import io.ingestdesk.core.run.TriggerSource;
import io.ingestdesk.core.schedule.CronExpression;
import io.ingestdesk.core.schedule.ImmutableStoredSchedule;
import io.ingestdesk.core.schedule.ScheduleService;
import io.ingestdesk.core.schedule.ScheduleTranslator;
import io.ingestdesk.core.schedule.SimpleSchedule;
import io.ingestdesk.core.schedule.StoredSchedule;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@RunWith(MockitoJUnitRunner.class)
public class IngestResourceTest
{
    private static final long PROJECT_ID = 5;
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock ScheduleService scheduleService;
    @Mock RunService runService;
    @Mock JobStatusService jobStatusService;

    private IngestResource resource;

    @Before
    public void setUp()
    {
        ScheduleTranslator translator = new ScheduleTranslator(IngestConfig.defaultConfig());
        resource = new IngestResource(scheduleService, runService, jobStatusService,
                new JobDefinitionRegistry(), translator, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    public void runIsRenderedWithActivity()
            throws Exception
    {
        when(runService.getRun(PROJECT_ID, 7)).thenReturn(finishedRun(7));

        RestRun run = resource.getRun(PROJECT_ID, 7);
        assertThat(run.getStatus(), is("success"));
        assertThat(run.getTriggeredBy(), is("api"));
        assertThat(run.getActive(), is(false));
        assertThat(run.getDuration(), is("1 min 15 sec"));
        assertThat(run.getLastActivity(), is("3 min ago"));
        assertThat(run.getStatsSummary(), is("-"));
    }

    @Test
    public void runFilterIsPassedThrough()
    {
        when(runService.getRuns(eq(PROJECT_ID), any(RunFilter.class))).thenReturn(ImmutableList.of(finishedRun(1), finishedRun(2)));

        RestRunCollection runs = resource.getRuns(PROJECT_ID,
                Optional.of("wildberries"), Optional.of("stocks"), Optional.of("success"),
                Optional.absent(), Optional.absent(), Optional.of(10));
        assertThat(runs.getRuns().size(), is(2));

        ArgumentCaptor<RunFilter> filter = ArgumentCaptor.forClass(RunFilter.class);
        verify(runService).getRuns(eq(PROJECT_ID), filter.capture());
        assertThat(filter.getValue().getJobCode(), is(Optional.of("stocks")));
        assertThat(filter.getValue().getStatus(), is(Optional.of(RunStatus.SUCCESS)));
        assertThat(filter.getValue().getLimit(), is(Optional.of(10)));
    }

    @Test
    public void markTimeoutCarriesWarning()
            throws Exception
    {
        StoredRun timedOut = ImmutableStoredRun.builder()
            .from(finishedRun(9))
            .status(RunStatus.TIMEOUT)
            .build();
        when(runService.markTimeout(PROJECT_ID, 9, Optional.of("manual"), Optional.absent(), "alice")).thenReturn(timedOut);

        RestRunTimeoutResult result = resource.markRunTimeout(PROJECT_ID, 9,
                RestRunMarkTimeoutRequest.builder().reasonCode("manual").build(), "alice");
        assertThat(result.getRun().getStatus(), is("timeout"));
        assertThat(result.getWarning(), is(RunService.TIMEOUT_WARNING));
    }

    @Test
    public void simpleScheduleIsTranslatedBeforeCreate()
            throws Exception
    {
        when(scheduleService.createSchedule(eq(PROJECT_ID), eq("stocks"), eq(SimpleSchedule.everyHours(4)), eq(Optional.of("UTC")), eq(true)))
            .thenReturn(ImmutableStoredSchedule.builder()
                    .from(storedSchedule("0 */4 * * *"))
                    .simple(SimpleSchedule.everyHours(4))
                    .build());

        RestSchedule sched = resource.createSchedule(PROJECT_ID, RestScheduleRequest.builder()
                .jobCode("stocks")
                .simple(RestSimpleSchedule.builder().mode("every_hours").every("4").build())
                .timezone("UTC")
                .build());
        assertThat(sched.getCronExpr(), is("0 */4 * * *"));
        assertThat(sched.getDescription(), is("every 4 h (UTC)"));
    }

    @Test
    public void rawCronScheduleIsHumanized()
            throws Exception
    {
        when(scheduleService.getSchedule(PROJECT_ID, 1)).thenReturn(storedSchedule("0 */4 * * *"));

        assertThat(resource.getSchedule(PROJECT_ID, 1).getDescription(), is("every 4 hours"));
    }

    @Test
    public void upstreamFailureIsRethrown()
    {
        UpstreamUnavailableException failure = new UpstreamUnavailableException("connection refused");
        when(scheduleService.getSchedules(PROJECT_ID)).thenThrow(failure);

        try {
            resource.getSchedules(PROJECT_ID);
            fail();
        }
        catch (UpstreamUnavailableException ex) {
            assertThat(ex, is(sameInstance(failure)));
            assertThat(ex.isRetryable(), is(true));
        }
    }

    @Test
    public void manualRunUsesManualTrigger()
            throws Exception
    {
        StoredRun queued = ImmutableStoredRun.builder()
            .projectId(PROJECT_ID)
            .id(11)
            .marketplaceCode("wildberries")
            .jobCode("prices")
            .triggeredBy(TriggerSource.MANUAL)
            .status(RunStatus.QUEUED)
            .createdAt(NOW)
            .updatedAt(NOW)
            .build();
        when(runService.startManualRun(PROJECT_ID, "prices", TriggerSource.MANUAL, Optional.absent())).thenReturn(queued);

        RestRun run = resource.startRun(PROJECT_ID, "prices", Optional.absent());
        assertThat(run.getStatus(), is("queued"));
        assertThat(run.getActive(), is(true));
        assertThat(run.getDuration(), is("-"));
        assertThat(run.getLastActivity(), is("just now"));
    }

    @Test
    public void previewsNeedNoStore()
    {
        RestSchedulePreview preview = resource.previewSimpleSchedule(
                RestSimpleSchedule.builder().mode("daily").at("03:00").build(), Optional.absent());
        assertThat(preview.getCronExpr(), is("0 3 * * *"));
        assertThat(preview.getTimezone(), is("Europe/Istanbul"));
        assertThat(preview.getDescription(), is("daily at 03:00"));

        assertThat(resource.previewCron("*/15 * * * *", Optional.of("UTC")).getDescription(), is("every 15 minutes"));
        assertThat(resource.getJobDefinitions().size(), is(9));
    }

    private static StoredRun finishedRun(long id)
    {
        Instant finishedAt = NOW.minus(Duration.ofMinutes(3));
        return ImmutableStoredRun.builder()
            .projectId(PROJECT_ID)
            .id(id)
            .marketplaceCode("wildberries")
            .jobCode("stocks")
            .triggeredBy(TriggerSource.API)
            .status(RunStatus.SUCCESS)
            .startedAt(finishedAt.minus(Duration.ofSeconds(75)))
            .finishedAt(finishedAt)
            .durationMs(75000L)
            .createdAt(finishedAt.minus(Duration.ofMinutes(5)))
            .updatedAt(finishedAt)
            .build();
    }

    private static StoredSchedule storedSchedule(String cron)
    {
        return ImmutableStoredSchedule.builder()
            .id(1)
            .projectId(PROJECT_ID)
            .marketplaceCode("wildberries")
            .jobCode("stocks")
            .cronExpr(CronExpression.parse(cron))
            .timezone("UTC")
            .enabled(true)
            .createdAt(NOW)
            .updatedAt(NOW)
            .build();
    }
}
