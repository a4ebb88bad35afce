package io.ingestdesk.core.schedule;

import java.util.Collection;
import java.util.Objects;
import java.util.SortedSet;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Restricted schedule shape edited in simple mode.
 *
 * Factory methods clamp every numeric field into its range, so an instance
 * never holds out-of-range values and always translates to a cron
 * expression.
 */
public abstract class SimpleSchedule
{
    public static final int MIN_EVERY_HOURS = 1;
    public static final int MAX_EVERY_HOURS = 24;
    public static final int MIN_EVERY_MINUTES = 1;
    public static final int MAX_EVERY_MINUTES = 60;

    public interface Visitor<T>
    {
        T visitDaily(Daily daily);

        T visitEveryHours(EveryHours everyHours);

        T visitEveryMinutes(EveryMinutes everyMinutes);

        T visitWeekly(Weekly weekly);
    }

    private SimpleSchedule()
    { }

    public abstract Kind getKind();

    public abstract <T> T accept(Visitor<T> visitor);

    public static Daily daily(int hour, int minute)
    {
        return new Daily(clamp(hour, 0, 23), clamp(minute, 0, 59));
    }

    public static EveryHours everyHours(int hours)
    {
        return new EveryHours(clamp(hours, MIN_EVERY_HOURS, MAX_EVERY_HOURS));
    }

    public static EveryMinutes everyMinutes(int minutes)
    {
        return new EveryMinutes(clamp(minutes, MIN_EVERY_MINUTES, MAX_EVERY_MINUTES));
    }

    /**
     * Day numbers are 1=Mon..7=Sun. 0 is accepted as Sunday as cron does and
     * other values are dropped. An empty set means Mon-Fri when rendered.
     */
    public static Weekly weekly(Collection<Integer> days, int hour, int minute)
    {
        ImmutableSortedSet.Builder<Integer> builder = ImmutableSortedSet.naturalOrder();
        for (Integer day : days) {
            if (day == null) {
                continue;
            }
            if (day == 0) {
                builder.add(7);
            }
            else if (day >= 1 && day <= 7) {
                builder.add(day);
            }
        }
        return new Weekly(builder.build(), clamp(hour, 0, 23), clamp(minute, 0, 59));
    }

    static int clamp(int value, int min, int max)
    {
        return Math.max(min, Math.min(max, value));
    }

    public enum Kind
    {
        DAILY("daily"),
        EVERY_HOURS("every_hours"),
        EVERY_MINUTES("every_minutes"),
        WEEKLY("weekly");

        private final String name;

        Kind(String name)
        {
            this.name = name;
        }

        public String getName()
        {
            return name;
        }

        public static Kind fromName(String name)
        {
            for (Kind kind : values()) {
                if (kind.name.equals(name)) {
                    return kind;
                }
            }
            throw new ScheduleValidationException("Unknown schedule mode '" + name + "'. Available modes are daily, every_hours, every_minutes and weekly");
        }
    }

    public static final class Daily
            extends SimpleSchedule
    {
        private final int hour;
        private final int minute;

        private Daily(int hour, int minute)
        {
            this.hour = hour;
            this.minute = minute;
        }

        public int getHour()
        {
            return hour;
        }

        public int getMinute()
        {
            return minute;
        }

        @Override
        public Kind getKind()
        {
            return Kind.DAILY;
        }

        @Override
        public <T> T accept(Visitor<T> visitor)
        {
            return visitor.visitDaily(this);
        }

        @Override
        public boolean equals(Object other)
        {
            if (!(other instanceof Daily)) {
                return false;
            }
            Daily o = (Daily) other;
            return hour == o.hour && minute == o.minute;
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(getKind(), hour, minute);
        }

        @Override
        public String toString()
        {
            return "Daily{" + hour + ":" + minute + "}";
        }
    }

    public static final class EveryHours
            extends SimpleSchedule
    {
        private final int hours;

        private EveryHours(int hours)
        {
            this.hours = hours;
        }

        public int getHours()
        {
            return hours;
        }

        @Override
        public Kind getKind()
        {
            return Kind.EVERY_HOURS;
        }

        @Override
        public <T> T accept(Visitor<T> visitor)
        {
            return visitor.visitEveryHours(this);
        }

        @Override
        public boolean equals(Object other)
        {
            return other instanceof EveryHours && ((EveryHours) other).hours == hours;
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(getKind(), hours);
        }

        @Override
        public String toString()
        {
            return "EveryHours{" + hours + "}";
        }
    }

    public static final class EveryMinutes
            extends SimpleSchedule
    {
        private final int minutes;

        private EveryMinutes(int minutes)
        {
            this.minutes = minutes;
        }

        public int getMinutes()
        {
            return minutes;
        }

        @Override
        public Kind getKind()
        {
            return Kind.EVERY_MINUTES;
        }

        @Override
        public <T> T accept(Visitor<T> visitor)
        {
            return visitor.visitEveryMinutes(this);
        }

        @Override
        public boolean equals(Object other)
        {
            return other instanceof EveryMinutes && ((EveryMinutes) other).minutes == minutes;
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(getKind(), minutes);
        }

        @Override
        public String toString()
        {
            return "EveryMinutes{" + minutes + "}";
        }
    }

    public static final class Weekly
            extends SimpleSchedule
    {
        private final SortedSet<Integer> days;
        private final int hour;
        private final int minute;

        private Weekly(SortedSet<Integer> days, int hour, int minute)
        {
            this.days = days;
            this.hour = hour;
            this.minute = minute;
        }

        // may be empty
        public SortedSet<Integer> getDays()
        {
            return days;
        }

        public int getHour()
        {
            return hour;
        }

        public int getMinute()
        {
            return minute;
        }

        @Override
        public Kind getKind()
        {
            return Kind.WEEKLY;
        }

        @Override
        public <T> T accept(Visitor<T> visitor)
        {
            return visitor.visitWeekly(this);
        }

        @Override
        public boolean equals(Object other)
        {
            if (!(other instanceof Weekly)) {
                return false;
            }
            Weekly o = (Weekly) other;
            return days.equals(o.days) && hour == o.hour && minute == o.minute;
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(getKind(), days, hour, minute);
        }

        @Override
        public String toString()
        {
            return "Weekly{" + days + " " + hour + ":" + minute + "}";
        }
    }
}
