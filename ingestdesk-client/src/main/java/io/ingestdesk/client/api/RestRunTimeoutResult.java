package io.ingestdesk.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestRunTimeoutResult.class)
public interface RestRunTimeoutResult
{
    RestRun getRun();

    // the worker is not stopped, only the bookkeeping is
    String getWarning();

    static ImmutableRestRunTimeoutResult.Builder builder()
    {
        return ImmutableRestRunTimeoutResult.builder();
    }
}
