package io.ingestdesk.core.schedule;

import java.time.Instant;
import com.google.common.base.Optional;
import io.ingestdesk.core.repository.ResourceNotFoundException;

public interface ScheduleControlStore
{
    StoredSchedule getScheduleById(long schedId)
        throws ResourceNotFoundException;

    void updateDefinition(long schedId, CronExpression cronExpr, Optional<SimpleSchedule> simple, String timezone)
        throws ResourceNotFoundException;

    void enableSchedule(long schedId)
        throws ResourceNotFoundException;

    // also clears next_run_at
    void disableSchedule(long schedId)
        throws ResourceNotFoundException;

    void updateNextRunAt(long schedId, Optional<Instant> nextRunAt)
        throws ResourceNotFoundException;
}
