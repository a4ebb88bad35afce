package io.ingestdesk.core.schedule;

import java.time.Instant;
import com.google.common.base.Optional;
import io.ingestdesk.core.repository.ResourceNotFoundException;

public class ScheduleControl
{
    private final ScheduleControlStore store;
    private StoredSchedule schedule;

    public ScheduleControl(ScheduleControlStore store, StoredSchedule schedule)
    {
        this.store = store;
        this.schedule = schedule;
    }

    public StoredSchedule get()
    {
        return schedule;
    }

    public void updateDefinition(CronExpression cronExpr, Optional<SimpleSchedule> simple, String timezone)
        throws ResourceNotFoundException
    {
        if (cronExpr.equals(schedule.getCronExpr())
                && simple.equals(schedule.getSimple())
                && timezone.equals(schedule.getTimezone())) {
            return;
        }
        store.updateDefinition(schedule.getId(), cronExpr, simple, timezone);
        schedule = store.getScheduleById(schedule.getId());
    }

    public void setEnabled(boolean enabled)
        throws ResourceNotFoundException
    {
        if (enabled) {
            enableSchedule();
        }
        else {
            disableSchedule();
        }
    }

    public void enableSchedule()
        throws ResourceNotFoundException
    {
        store.enableSchedule(schedule.getId());
        schedule = store.getScheduleById(schedule.getId());
    }

    public void disableSchedule()
        throws ResourceNotFoundException
    {
        store.disableSchedule(schedule.getId());
        schedule = store.getScheduleById(schedule.getId());
    }

    public void updateNextRunAt(Optional<Instant> nextRunAt)
        throws ResourceNotFoundException
    {
        store.updateNextRunAt(schedule.getId(), nextRunAt);
        schedule = store.getScheduleById(schedule.getId());
    }
}
