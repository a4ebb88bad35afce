package io.ingestdesk.core.run;

import java.time.Instant;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import io.ingestdesk.client.config.Config;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkState;

@Value.Immutable
@JsonSerialize(as = ImmutableStoredRun.class)
@JsonDeserialize(as = ImmutableStoredRun.class)
public abstract class StoredRun
        extends Run
{
    public abstract long getId();

    public abstract RunStatus getStatus();

    public abstract Optional<Instant> getStartedAt();

    public abstract Optional<Instant> getFinishedAt();

    public abstract Optional<Long> getDurationMs();

    public abstract Optional<Instant> getHeartbeatAt();

    public abstract Optional<String> getErrorMessage();

    public abstract Optional<String> getErrorTrace();

    public abstract Optional<Config> getStats();

    // system_action audit record of administrative transitions
    public abstract Optional<Config> getMeta();

    public abstract Instant getCreatedAt();

    public abstract Instant getUpdatedAt();

    @JsonIgnore
    public boolean isActive()
    {
        return getStatus().isActive();
    }

    @Value.Check
    protected void check()
    {
        checkState(getFinishedAt().isPresent() == getStatus().isTerminal(),
                "finished_at must be set if and only if the run is in a terminal state (run %s, status %s)", getId(), getStatus());
        checkState(getStatus() == RunStatus.QUEUED || getStartedAt().isPresent(),
                "started_at must be set once the run leaves queued (run %s, status %s)", getId(), getStatus());
    }
}
