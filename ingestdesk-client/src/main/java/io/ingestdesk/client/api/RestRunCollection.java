package io.ingestdesk.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.List;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestRunCollection.class)
public interface RestRunCollection
{
    List<RestRun> getRuns();

    static ImmutableRestRunCollection.Builder builder()
    {
        return ImmutableRestRunCollection.builder();
    }
}
