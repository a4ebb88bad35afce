package io.ingestdesk.core.schedule;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import io.ingestdesk.client.api.RestSimpleSchedule;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class SimpleSchedulesTest
{
    @Test
    public void dailyParsesTime()
    {
        assertThat(SimpleSchedules.of("daily", Optional.of("04:30"), Optional.absent(), Optional.absent(), false),
                is(SimpleSchedule.daily(4, 30)));
    }

    @Test
    public void dailyDefaultsToThreeAm()
    {
        assertThat(SimpleSchedules.of("daily", Optional.absent(), Optional.absent(), Optional.absent(), false),
                is(SimpleSchedule.daily(3, 0)));
    }

    @Test
    public void outOfRangeTimeIsClamped()
    {
        assertThat(SimpleSchedules.of("daily", Optional.of("25:75"), Optional.absent(), Optional.absent(), false),
                is(SimpleSchedule.daily(23, 59)));
        assertThat(SimpleSchedules.of("daily", Optional.of("-1:xx"), Optional.absent(), Optional.absent(), false),
                is(SimpleSchedule.daily(0, 0)));
    }

    @Test
    public void intervalsAreClamped()
    {
        assertThat(SimpleSchedules.of("every_hours", Optional.absent(), Optional.of("0"), Optional.absent(), false),
                is(SimpleSchedule.everyHours(1)));
        assertThat(SimpleSchedules.of("every_hours", Optional.absent(), Optional.of("48"), Optional.absent(), false),
                is(SimpleSchedule.everyHours(24)));
        assertThat(SimpleSchedules.of("every_minutes", Optional.absent(), Optional.of("abc"), Optional.absent(), false),
                is(SimpleSchedule.everyMinutes(1)));
        assertThat(SimpleSchedules.of("every_minutes", Optional.absent(), Optional.of("90"), Optional.absent(), false),
                is(SimpleSchedule.everyMinutes(60)));
    }

    @Test
    public void hugeIntervalsClampToUpperBound()
    {
        assertThat(SimpleSchedules.of("every_hours", Optional.absent(), Optional.of("99999999999"), Optional.absent(), false),
                is(SimpleSchedule.everyHours(24)));
        assertThat(SimpleSchedules.of("every_minutes", Optional.absent(), Optional.of("5000000000"), Optional.absent(), false),
                is(SimpleSchedule.everyMinutes(60)));
        assertThat(SimpleSchedules.of("every_minutes", Optional.absent(), Optional.of("123456789012345678901234567890"), Optional.absent(), false),
                is(SimpleSchedule.everyMinutes(60)));
        assertThat(SimpleSchedules.of("every_hours", Optional.absent(), Optional.of("-99999999999"), Optional.absent(), false),
                is(SimpleSchedule.everyHours(1)));
    }

    @Test
    public void trailingTextAfterNumberIsIgnored()
    {
        assertThat(SimpleSchedules.of("every_minutes", Optional.absent(), Optional.of("15abc"), Optional.absent(), false),
                is(SimpleSchedule.everyMinutes(15)));
        assertThat(SimpleSchedules.of("every_hours", Optional.absent(), Optional.of("6 hours"), Optional.absent(), true),
                is(SimpleSchedule.everyHours(6)));
    }

    @Test
    public void intervalDefaults()
    {
        assertThat(SimpleSchedules.of("every_hours", Optional.absent(), Optional.absent(), Optional.absent(), false),
                is(SimpleSchedule.everyHours(3)));
        assertThat(SimpleSchedules.of("every_minutes", Optional.absent(), Optional.absent(), Optional.absent(), false),
                is(SimpleSchedule.everyMinutes(15)));
    }

    @Test
    public void strictRejectsOutOfRangeInterval()
    {
        try {
            SimpleSchedules.of("every_hours", Optional.absent(), Optional.of("25"), Optional.absent(), true);
            fail();
        }
        catch (InvalidIntervalException ex) {
            assertThat(ex.getMessage(), is("interval in hours must be between 1 and 24 but got 25"));
        }
        try {
            SimpleSchedules.of("every_minutes", Optional.absent(), Optional.of("0"), Optional.absent(), true);
            fail();
        }
        catch (InvalidIntervalException ex) {
            assertThat(ex.getMessage(), is("interval in minutes must be between 1 and 60 but got 0"));
        }
    }

    @Test
    public void weeklyDays()
    {
        SimpleSchedule weekly = SimpleSchedules.of("weekly", Optional.of("09:00"), Optional.absent(), Optional.of("5, 1,0,9,x"), false);
        assertThat(weekly, instanceOf(SimpleSchedule.Weekly.class));
        assertThat(((SimpleSchedule.Weekly) weekly).getDays(), is(ImmutableSortedSet.of(1, 5, 7)));
    }

    @Test
    public void weeklyWithoutDaysIsEmpty()
    {
        SimpleSchedule.Weekly weekly = (SimpleSchedule.Weekly) SimpleSchedules.of("weekly", Optional.absent(), Optional.absent(), Optional.absent(), false);
        assertThat(weekly.getDays().isEmpty(), is(true));
    }

    @Test
    public void unknownMode()
    {
        try {
            SimpleSchedules.of("monthly", Optional.absent(), Optional.absent(), Optional.absent(), false);
            fail();
        }
        catch (ScheduleValidationException ex) {
            assertThat(ex.getMessage(), is("Unknown schedule mode 'monthly'. Available modes are daily, every_hours, every_minutes and weekly"));
        }
    }

    @Test
    public void fromRest()
    {
        RestSimpleSchedule rest = RestSimpleSchedule.builder()
            .mode("every_minutes")
            .every("30")
            .build();
        assertThat(SimpleSchedules.fromRest(rest), is(SimpleSchedule.everyMinutes(30)));
    }

    @Test
    public void parseHelpers()
    {
        assertThat(SimpleSchedules.parseNumber(" 12 "), is(12));
        assertThat(SimpleSchedules.parseNumber("1.5"), is(1));
        assertThat(SimpleSchedules.parseNumber("15abc"), is(15));
        assertThat(SimpleSchedules.parseNumber("-7"), is(-7));
        assertThat(SimpleSchedules.parseNumber("abc"), is(0));
        assertThat(SimpleSchedules.parseNumber("-"), is(0));
        assertThat(SimpleSchedules.parseNumber(null), is(0));
        assertThat(SimpleSchedules.parseTime("7"), is(new int[] {7, 0}));
        assertThat(SimpleSchedules.parseDays("1,3,5"), is(ImmutableList.of(1, 3, 5)));
    }

    @Test
    public void presets()
    {
        assertThat(SchedulePreset.fromName("daily_3").getSchedule(), is(SimpleSchedule.daily(3, 0)));
        assertThat(SchedulePreset.fromName("hourly").getSchedule(), is(SimpleSchedule.everyHours(1)));
        assertThat(SchedulePreset.fromName("every_15").getSchedule(), is(SimpleSchedule.everyMinutes(15)));
        assertThat(SchedulePreset.fromName("mon_fri_9").getSchedule(), is(SimpleSchedule.weekly(ImmutableList.of(1, 2, 3, 4, 5), 9, 0)));
    }
}
