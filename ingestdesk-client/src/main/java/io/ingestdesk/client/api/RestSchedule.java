package io.ingestdesk.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import java.time.Instant;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestSchedule.class)
public interface RestSchedule
{
    long getId();

    long getProjectId();

    String getMarketplaceCode();

    String getJobCode();

    String getCronExpr();

    String getTimezone();

    boolean getEnabled();

    Optional<Instant> getNextRunAt();

    String getDescription();

    Instant getCreatedAt();

    Instant getUpdatedAt();

    static ImmutableRestSchedule.Builder builder()
    {
        return ImmutableRestSchedule.builder();
    }
}
