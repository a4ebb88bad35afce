package io.ingestdesk.core.schedule;

import java.time.Instant;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableStoredSchedule.class)
@JsonDeserialize(as = ImmutableStoredSchedule.class)
public abstract class StoredSchedule
        extends Schedule
{
    public abstract long getId();

    public abstract long getProjectId();

    // written by the external cron evaluator
    public abstract Optional<Instant> getNextRunAt();

    public abstract Instant getCreatedAt();

    public abstract Instant getUpdatedAt();
}
