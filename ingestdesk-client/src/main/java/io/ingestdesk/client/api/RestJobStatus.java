package io.ingestdesk.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import java.time.Instant;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestJobStatus.class)
public interface RestJobStatus
{
    String getJobCode();

    String getTitle();

    boolean getHasSchedule();

    Optional<String> getScheduleSummary();

    Optional<Instant> getLastRunAt();

    Optional<String> getLastStatus();

    boolean getRunning();

    static ImmutableRestJobStatus.Builder builder()
    {
        return ImmutableRestJobStatus.builder();
    }
}
