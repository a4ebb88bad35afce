package io.ingestdesk.core.run;

import java.time.Instant;
import com.google.common.base.Optional;
import io.ingestdesk.client.config.ConfigException;
import org.immutables.value.Value;

/**
 * Conditions of a run listing. Time bounds apply to started_at and are
 * inclusive. Runs that never started don't match a bounded range.
 */
@Value.Immutable
public abstract class RunFilter
{
    public abstract Optional<String> getMarketplaceCode();

    public abstract Optional<String> getJobCode();

    public abstract Optional<RunStatus> getStatus();

    public abstract Optional<Instant> getStartedFrom();

    public abstract Optional<Instant> getStartedTo();

    public abstract Optional<Integer> getLimit();

    @Value.Check
    protected void check()
    {
        if (getLimit().isPresent() && getLimit().get() < 1) {
            throw new ConfigException("limit must be a positive number but got " + getLimit().get());
        }
    }

    public boolean matches(StoredRun run)
    {
        if (getMarketplaceCode().isPresent() && !getMarketplaceCode().get().equals(run.getMarketplaceCode())) {
            return false;
        }
        if (getJobCode().isPresent() && !getJobCode().get().equals(run.getJobCode())) {
            return false;
        }
        if (getStatus().isPresent() && getStatus().get() != run.getStatus()) {
            return false;
        }
        if (getStartedFrom().isPresent() || getStartedTo().isPresent()) {
            if (!run.getStartedAt().isPresent()) {
                return false;
            }
            Instant startedAt = run.getStartedAt().get();
            if (getStartedFrom().isPresent() && startedAt.isBefore(getStartedFrom().get())) {
                return false;
            }
            if (getStartedTo().isPresent() && startedAt.isAfter(getStartedTo().get())) {
                return false;
            }
        }
        return true;
    }

    public static ImmutableRunFilter.Builder builder()
    {
        return ImmutableRunFilter.builder();
    }

    public static RunFilter all()
    {
        return builder().build();
    }
}
