package io.ingestdesk.core.run;

import java.time.Duration;
import java.time.Instant;
import com.google.common.base.Optional;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class RunActivityTest
{
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    public void relativeAgeRoundsDown()
    {
        assertThat(RunActivity.formatRelativeAge(NOW.minusSeconds(30), NOW), is("just now"));
        assertThat(RunActivity.formatRelativeAge(NOW.minusSeconds(60), NOW), is("1 min ago"));
        assertThat(RunActivity.formatRelativeAge(NOW.minusSeconds(90), NOW), is("1 min ago"));
        assertThat(RunActivity.formatRelativeAge(NOW.minusSeconds(150), NOW), is("2 min ago"));
        assertThat(RunActivity.formatRelativeAge(NOW.minus(Duration.ofHours(3)), NOW), is("180 min ago"));
    }

    @Test
    public void futureTimestampIsJustNow()
    {
        assertThat(RunActivity.formatRelativeAge(NOW.plusSeconds(600), NOW), is("just now"));
    }

    @Test
    public void duration()
    {
        assertThat(RunActivity.formatDuration(Optional.absent()), is("-"));
        assertThat(RunActivity.formatDuration(Optional.of(0L)), is("-"));
        assertThat(RunActivity.formatDuration(Optional.of(-5L)), is("-"));
        assertThat(RunActivity.formatDuration(Optional.of(45000L)), is("45 sec"));
        assertThat(RunActivity.formatDuration(Optional.of(44600L)), is("45 sec"));
        assertThat(RunActivity.formatDuration(Optional.of(125000L)), is("2 min 5 sec"));
        assertThat(RunActivity.formatDuration(Optional.of(59700L)), is("1 min 0 sec"));
    }

    @Test
    public void lastActivityPrefersHeartbeat()
    {
        StoredRun run = running(NOW.minusSeconds(600))
            .updatedAt(NOW.minusSeconds(300))
            .build();
        assertThat(RunActivity.lastActivity(run), is(NOW.minusSeconds(300)));

        StoredRun beating = ImmutableStoredRun.builder()
            .from(run)
            .heartbeatAt(NOW.minusSeconds(120))
            .build();
        assertThat(RunActivity.lastActivity(beating), is(NOW.minusSeconds(120)));
        assertThat(RunActivity.formatLastActivity(beating, NOW), is("2 min ago"));
    }

    @Test
    public void stuckAfterTtl()
    {
        Duration ttl = Duration.ofMinutes(30);
        StoredRun run = running(NOW.minus(Duration.ofHours(1)))
            .heartbeatAt(NOW.minus(Duration.ofMinutes(30)))
            .build();
        assertThat(RunActivity.isStuck(run, NOW, ttl), is(false));
        assertThat(RunActivity.isStuck(run, NOW.plusSeconds(1), ttl), is(true));
    }

    @Test
    public void finishedRunIsNeverStuck()
    {
        StoredRun run = running(NOW.minus(Duration.ofDays(1)))
            .status(RunStatus.SUCCESS)
            .finishedAt(NOW.minus(Duration.ofDays(1)))
            .build();
        assertThat(RunActivity.isStuck(run, NOW, Duration.ofMinutes(1)), is(false));
    }

    private static ImmutableStoredRun.Builder running(Instant startedAt)
    {
        return ImmutableStoredRun.builder()
            .id(1L)
            .projectId(1L)
            .marketplaceCode("wildberries")
            .jobCode("stocks")
            .triggeredBy(TriggerSource.MANUAL)
            .status(RunStatus.RUNNING)
            .startedAt(startedAt)
            .createdAt(startedAt)
            .updatedAt(startedAt);
    }
}
