package io.ingestdesk.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestRunMarkTimeoutRequest.class)
public interface RestRunMarkTimeoutRequest
{
    Optional<String> getReasonCode();

    Optional<String> getReasonText();

    static ImmutableRestRunMarkTimeoutRequest.Builder builder()
    {
        return ImmutableRestRunMarkTimeoutRequest.builder();
    }
}
