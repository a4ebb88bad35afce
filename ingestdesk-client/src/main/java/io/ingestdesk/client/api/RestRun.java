package io.ingestdesk.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import io.ingestdesk.client.config.Config;
import java.time.Instant;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestRun.class)
public interface RestRun
{
    long getId();

    Optional<Long> getScheduleId();

    long getProjectId();

    String getMarketplaceCode();

    String getJobCode();

    String getTriggeredBy();

    String getStatus();

    boolean getActive();

    Optional<Instant> getStartedAt();

    Optional<Instant> getFinishedAt();

    Optional<Long> getDurationMs();

    String getDuration();

    Optional<Instant> getHeartbeatAt();

    String getLastActivity();

    Optional<String> getErrorMessage();

    Optional<String> getErrorTrace();

    Optional<Config> getStats();

    String getStatsSummary();

    Optional<Config> getParams();

    Optional<Config> getMeta();

    Instant getCreatedAt();

    Instant getUpdatedAt();

    static ImmutableRestRun.Builder builder()
    {
        return ImmutableRestRun.builder();
    }
}
