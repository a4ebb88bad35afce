package io.ingestdesk.core.schedule;

import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
public interface SchedulePreview
{
    CronExpression getCronExpr();

    String getTimezone();

    Optional<String> getSummary();

    String getDescription();

    static ImmutableSchedulePreview.Builder builder()
    {
        return ImmutableSchedulePreview.builder();
    }
}
