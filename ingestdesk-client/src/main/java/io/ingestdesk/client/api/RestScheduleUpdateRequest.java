package io.ingestdesk.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestScheduleUpdateRequest.class)
public interface RestScheduleUpdateRequest
{
    Optional<String> getCronExpr();

    Optional<RestSimpleSchedule> getSimple();

    Optional<String> getTimezone();

    Optional<Boolean> getEnabled();

    static ImmutableRestScheduleUpdateRequest.Builder builder()
    {
        return ImmutableRestScheduleUpdateRequest.builder();
    }
}
