package io.ingestdesk.core.run;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import io.ingestdesk.client.config.Config;
import org.immutables.value.Value;

/**
 * A run request as created by a trigger, before the store assigns identity
 * and lifecycle state.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableRun.class)
@JsonDeserialize(as = ImmutableRun.class)
public abstract class Run
{
    // absent for manual and api runs not bound to a schedule
    public abstract Optional<Long> getScheduleId();

    public abstract long getProjectId();

    public abstract String getMarketplaceCode();

    public abstract String getJobCode();

    public abstract TriggerSource getTriggeredBy();

    public abstract Optional<Config> getParams();

    public static ImmutableRun.Builder builder()
    {
        return ImmutableRun.builder();
    }
}
