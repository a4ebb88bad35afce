package io.ingestdesk.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestScheduleRequest.class)
public interface RestScheduleRequest
{
    String getJobCode();

    Optional<String> getCronExpr();

    Optional<RestSimpleSchedule> getSimple();

    Optional<String> getTimezone();

    @Value.Default
    default boolean getEnabled()
    {
        return true;
    }

    static ImmutableRestScheduleRequest.Builder builder()
    {
        return ImmutableRestScheduleRequest.builder();
    }
}
