package io.ingestdesk.core.job;

import java.time.Instant;
import com.google.common.base.Optional;
import io.ingestdesk.core.run.RunStatus;
import org.immutables.value.Value;

@Value.Immutable
public interface JobStatus
{
    JobDefinition getJob();

    // an enabled schedule exists
    boolean getHasSchedule();

    Optional<String> getScheduleDescription();

    Optional<Instant> getLastRunAt();

    Optional<RunStatus> getLastStatus();

    boolean getRunning();

    static ImmutableJobStatus.Builder builder()
    {
        return ImmutableJobStatus.builder();
    }
}
