package io.ingestdesk.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestSchedulePreview.class)
public interface RestSchedulePreview
{
    String getCronExpr();

    String getTimezone();

    // present only when the schedule was built in simple mode
    Optional<String> getSummary();

    String getDescription();

    static ImmutableRestSchedulePreview.Builder builder()
    {
        return ImmutableRestSchedulePreview.builder();
    }
}
