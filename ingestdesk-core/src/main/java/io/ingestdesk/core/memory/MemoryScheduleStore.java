package io.ingestdesk.core.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.ingestdesk.core.repository.ResourceConflictException;
import io.ingestdesk.core.repository.ResourceNotFoundException;
import io.ingestdesk.core.schedule.CronExpression;
import io.ingestdesk.core.schedule.ImmutableStoredSchedule;
import io.ingestdesk.core.schedule.Schedule;
import io.ingestdesk.core.schedule.ScheduleControlStore;
import io.ingestdesk.core.schedule.ScheduleStore;
import io.ingestdesk.core.schedule.SimpleSchedule;
import io.ingestdesk.core.schedule.StoredSchedule;

/**
 * Schedule store kept in process memory. Every operation holds the store's
 * monitor, so an update action sees no concurrent writes.
 */
public class MemoryScheduleStore
        implements ScheduleStore
{
    private final Clock clock;
    private final Map<Long, StoredSchedule> schedules = new TreeMap<>();
    private long lastId = 0L;

    @Inject
    public MemoryScheduleStore(Clock clock)
    {
        this.clock = clock;
    }

    @Override
    public synchronized List<StoredSchedule> getSchedulesByProjectId(long projectId)
    {
        return schedules.values().stream()
            .filter(sched -> sched.getProjectId() == projectId)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized List<StoredSchedule> getSchedulesByJob(long projectId, String marketplaceCode, String jobCode)
    {
        return schedules.values().stream()
            .filter(sched -> sched.getProjectId() == projectId)
            .filter(sched -> sched.getMarketplaceCode().equals(marketplaceCode) && sched.getJobCode().equals(jobCode))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized StoredSchedule getScheduleById(long projectId, long schedId)
        throws ResourceNotFoundException
    {
        StoredSchedule sched = schedules.get(schedId);
        if (sched == null || sched.getProjectId() != projectId) {
            throw new ResourceNotFoundException(String.format("schedule id=%d", schedId));
        }
        return sched;
    }

    @Override
    public synchronized StoredSchedule putSchedule(long projectId, Schedule schedule)
    {
        Instant now = clock.instant();
        StoredSchedule stored = ImmutableStoredSchedule.builder()
            .from(schedule)
            .id(++lastId)
            .projectId(projectId)
            .createdAt(now)
            .updatedAt(now)
            .build();
        schedules.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public synchronized void deleteScheduleById(long projectId, long schedId)
        throws ResourceNotFoundException
    {
        getScheduleById(projectId, schedId);
        schedules.remove(schedId);
    }

    @Override
    public synchronized <T> T updateScheduleById(long projectId, long schedId, ScheduleUpdateAction<T> func)
        throws ResourceNotFoundException, ResourceConflictException
    {
        StoredSchedule sched = getScheduleById(projectId, schedId);
        return func.call(new MemoryScheduleControlStore(), sched);
    }

    private class MemoryScheduleControlStore
            implements ScheduleControlStore
    {
        @Override
        public StoredSchedule getScheduleById(long schedId)
            throws ResourceNotFoundException
        {
            return require(schedId);
        }

        @Override
        public void updateDefinition(long schedId, CronExpression cronExpr, Optional<SimpleSchedule> simple, String timezone)
            throws ResourceNotFoundException
        {
            replace(ImmutableStoredSchedule.builder()
                    .from(require(schedId))
                    .cronExpr(cronExpr)
                    .simple(simple)
                    .timezone(timezone)
                    .updatedAt(clock.instant())
                    .build());
        }

        @Override
        public void enableSchedule(long schedId)
            throws ResourceNotFoundException
        {
            replace(ImmutableStoredSchedule.builder()
                    .from(require(schedId))
                    .enabled(true)
                    .updatedAt(clock.instant())
                    .build());
        }

        @Override
        public void disableSchedule(long schedId)
            throws ResourceNotFoundException
        {
            replace(ImmutableStoredSchedule.builder()
                    .from(require(schedId))
                    .enabled(false)
                    .nextRunAt(Optional.absent())
                    .updatedAt(clock.instant())
                    .build());
        }

        @Override
        public void updateNextRunAt(long schedId, Optional<Instant> nextRunAt)
            throws ResourceNotFoundException
        {
            replace(ImmutableStoredSchedule.builder()
                    .from(require(schedId))
                    .nextRunAt(nextRunAt)
                    .updatedAt(clock.instant())
                    .build());
        }

        private StoredSchedule require(long schedId)
            throws ResourceNotFoundException
        {
            synchronized (MemoryScheduleStore.this) {
                StoredSchedule sched = schedules.get(schedId);
                if (sched == null) {
                    throw new ResourceNotFoundException(String.format("schedule id=%d", schedId));
                }
                return sched;
            }
        }

        private void replace(StoredSchedule sched)
        {
            synchronized (MemoryScheduleStore.this) {
                schedules.put(sched.getId(), sched);
            }
        }
    }
}
