package io.ingestdesk.core.job;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableJobDefinition.class)
@JsonDeserialize(as = ImmutableJobDefinition.class)
public interface JobDefinition
{
    String getJobCode();

    String getTitle();

    // marketplace code of the runs and schedules of this job
    String getSourceCode();

    boolean getSupportsSchedule();

    boolean getSupportsManual();

    static JobDefinition of(String jobCode, String title, String sourceCode, boolean supportsSchedule, boolean supportsManual)
    {
        return ImmutableJobDefinition.builder()
            .jobCode(jobCode)
            .title(title)
            .sourceCode(sourceCode)
            .supportsSchedule(supportsSchedule)
            .supportsManual(supportsManual)
            .build();
    }
}
