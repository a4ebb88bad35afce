package io.ingestdesk.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestJobDefinition.class)
public interface RestJobDefinition
{
    String getJobCode();

    String getTitle();

    String getSourceCode();

    boolean getSupportsSchedule();

    boolean getSupportsManual();

    static ImmutableRestJobDefinition.Builder builder()
    {
        return ImmutableRestJobDefinition.builder();
    }
}
