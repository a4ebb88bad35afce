package io.ingestdesk.core.schedule;

import com.google.common.collect.ImmutableList;

public enum SchedulePreset
{
    DAILY_3("daily_3", SimpleSchedule.daily(3, 0)),
    HOURLY("hourly", SimpleSchedule.everyHours(1)),
    EVERY_15("every_15", SimpleSchedule.everyMinutes(15)),
    MON_FRI_9("mon_fri_9", SimpleSchedule.weekly(ImmutableList.of(1, 2, 3, 4, 5), 9, 0));

    private final String name;
    private final SimpleSchedule schedule;

    SchedulePreset(String name, SimpleSchedule schedule)
    {
        this.name = name;
        this.schedule = schedule;
    }

    public String getName()
    {
        return name;
    }

    public SimpleSchedule getSchedule()
    {
        return schedule;
    }

    public static SchedulePreset fromName(String name)
    {
        for (SchedulePreset preset : values()) {
            if (preset.name.equals(name)) {
                return preset;
            }
        }
        throw new ScheduleValidationException("Unknown preset '" + name + "'");
    }
}
