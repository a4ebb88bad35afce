package io.ingestdesk.core.schedule;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableSchedule.class)
@JsonDeserialize(as = ImmutableSchedule.class)
public abstract class Schedule
{
    public abstract String getMarketplaceCode();

    public abstract String getJobCode();

    public abstract CronExpression getCronExpr();

    public abstract String getTimezone();

    public abstract boolean getEnabled();

    // the form the operator filled in; absent for schedules entered as raw cron
    public abstract Optional<SimpleSchedule> getSimple();

    public static Schedule of(String marketplaceCode, String jobCode, CronExpression cronExpr, String timezone, boolean enabled)
    {
        return of(marketplaceCode, jobCode, cronExpr, Optional.absent(), timezone, enabled);
    }

    public static Schedule of(String marketplaceCode, String jobCode, CronExpression cronExpr, Optional<SimpleSchedule> simple, String timezone, boolean enabled)
    {
        return ImmutableSchedule.builder()
            .marketplaceCode(marketplaceCode)
            .jobCode(jobCode)
            .cronExpr(cronExpr)
            .simple(simple)
            .timezone(timezone)
            .enabled(enabled)
            .build();
    }
}
