package io.ingestdesk.core.schedule;

import java.util.List;
import io.ingestdesk.core.repository.ResourceConflictException;
import io.ingestdesk.core.repository.ResourceNotFoundException;

public interface ScheduleStore
{
    List<StoredSchedule> getSchedulesByProjectId(long projectId);

    List<StoredSchedule> getSchedulesByJob(long projectId, String marketplaceCode, String jobCode);

    StoredSchedule getScheduleById(long projectId, long schedId)
        throws ResourceNotFoundException;

    StoredSchedule putSchedule(long projectId, Schedule schedule);

    /**
     * Deletes a schedule. Runs that reference it are kept.
     */
    void deleteScheduleById(long projectId, long schedId)
        throws ResourceNotFoundException;

    interface ScheduleUpdateAction <T>
    {
        T call(ScheduleControlStore store, StoredSchedule storedSched)
            throws ResourceNotFoundException, ResourceConflictException;
    }

    <T> T updateScheduleById(long projectId, long schedId, ScheduleUpdateAction<T> func)
        throws ResourceNotFoundException, ResourceConflictException;
}
