package io.ingestdesk.core.memory;

import java.time.Duration;
import java.time.Instant;
import com.google.common.base.Optional;
import io.ingestdesk.core.IngestTestingUtils.TestingClock;
import io.ingestdesk.core.repository.ResourceNotFoundException;
import io.ingestdesk.core.schedule.CronExpression;
import io.ingestdesk.core.schedule.Schedule;
import io.ingestdesk.core.schedule.ScheduleControl;
import io.ingestdesk.core.schedule.StoredSchedule;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class MemoryScheduleStoreTest
{
    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    private TestingClock clock;
    private MemoryScheduleStore store;

    @Before
    public void setUp()
    {
        clock = new TestingClock(NOW);
        store = new MemoryScheduleStore(clock);
    }

    @Test
    public void idsAreAssignedInOrder()
    {
        StoredSchedule first = store.putSchedule(1, schedule("stocks"));
        StoredSchedule second = store.putSchedule(2, schedule("stocks"));
        assertThat(second.getId(), is(first.getId() + 1));
        assertThat(store.getSchedulesByProjectId(1).size(), is(1));
        assertThat(store.getSchedulesByJob(2, "wildberries", "stocks").size(), is(1));
        assertThat(store.getSchedulesByJob(2, "wildberries", "prices").isEmpty(), is(true));
    }

    @Test
    public void controlStoreUpdatesTimestamps()
            throws Exception
    {
        StoredSchedule sched = store.putSchedule(1, schedule("stocks"));
        clock.advance(Duration.ofMinutes(2));

        StoredSchedule updated = store.updateScheduleById(1, sched.getId(), (controlStore, storedSched) -> {
            ScheduleControl lc = new ScheduleControl(controlStore, storedSched);
            lc.updateDefinition(CronExpression.parse("*/5 * * * *"), Optional.absent(), "UTC");
            return lc.get();
        });
        assertThat(updated.getCronExpr().toString(), is("*/5 * * * *"));
        assertThat(updated.getCreatedAt(), is(NOW));
        assertThat(updated.getUpdatedAt(), is(NOW.plus(Duration.ofMinutes(2))));
    }

    @Test
    public void unchangedDefinitionIsNotWritten()
            throws Exception
    {
        StoredSchedule sched = store.putSchedule(1, schedule("stocks"));
        clock.advance(Duration.ofMinutes(2));

        StoredSchedule same = store.updateScheduleById(1, sched.getId(), (controlStore, storedSched) -> {
            ScheduleControl lc = new ScheduleControl(controlStore, storedSched);
            lc.updateDefinition(storedSched.getCronExpr(), storedSched.getSimple(), storedSched.getTimezone());
            return lc.get();
        });
        assertThat(same, is(sched));
    }

    @Test
    public void disableClearsNextRunAt()
            throws Exception
    {
        StoredSchedule sched = store.putSchedule(1, schedule("stocks"));
        StoredSchedule disabled = store.updateScheduleById(1, sched.getId(), (controlStore, storedSched) -> {
            ScheduleControl lc = new ScheduleControl(controlStore, storedSched);
            lc.updateNextRunAt(Optional.of(NOW.plus(Duration.ofDays(1))));
            lc.disableSchedule();
            return lc.get();
        });
        assertThat(disabled.getEnabled(), is(false));
        assertThat(disabled.getNextRunAt().isPresent(), is(false));
    }

    @Test(expected = ResourceNotFoundException.class)
    public void updateOfAnotherProject()
            throws Exception
    {
        StoredSchedule sched = store.putSchedule(1, schedule("stocks"));
        store.updateScheduleById(2, sched.getId(), (controlStore, storedSched) -> storedSched);
    }

    @Test(expected = ResourceNotFoundException.class)
    public void deletedScheduleIsGone()
            throws Exception
    {
        StoredSchedule sched = store.putSchedule(1, schedule("stocks"));
        store.deleteScheduleById(1, sched.getId());
        store.getScheduleById(1, sched.getId());
    }

    private static Schedule schedule(String jobCode)
    {
        return Schedule.of("wildberries", jobCode, CronExpression.parse("0 3 * * *"), "Europe/Istanbul", true);
    }
}
