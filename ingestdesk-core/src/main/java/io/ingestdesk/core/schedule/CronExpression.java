package io.ingestdesk.core.schedule;

import java.util.List;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Five-field cron expression: minute, hour, day-of-month, month, day-of-week.
 *
 * Only the number of fields is checked. Field ranges and step syntax are
 * left to the executor that evaluates the expression, so "99 99 * * *" is
 * accepted here.
 */
public final class CronExpression
{
    public static final int FIELD_COUNT = 5;

    private static final Splitter FIELD_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private final List<String> fields;

    private CronExpression(List<String> fields)
    {
        this.fields = fields;
    }

    @JsonCreator
    public static CronExpression parse(String raw)
    {
        if (raw == null) {
            throw new InvalidCronException("cron must have " + FIELD_COUNT + " parts");
        }
        List<String> fields = ImmutableList.copyOf(FIELD_SPLITTER.split(raw));
        if (fields.size() != FIELD_COUNT) {
            throw new InvalidCronException("cron must have " + FIELD_COUNT + " parts");
        }
        return new CronExpression(fields);
    }

    public static boolean isValid(String raw)
    {
        return raw != null && FIELD_SPLITTER.splitToList(raw).size() == FIELD_COUNT;
    }

    public static CronExpression of(String minute, String hour, String dayOfMonth, String month, String dayOfWeek)
    {
        return parse(Joiner.on(' ').join(minute, hour, dayOfMonth, month, dayOfWeek));
    }

    public List<String> getFields()
    {
        return fields;
    }

    public String getMinute()
    {
        return fields.get(0);
    }

    public String getHour()
    {
        return fields.get(1);
    }

    public String getDayOfMonth()
    {
        return fields.get(2);
    }

    public String getMonth()
    {
        return fields.get(3);
    }

    public String getDayOfWeek()
    {
        return fields.get(4);
    }

    @JsonValue
    @Override
    public String toString()
    {
        return Joiner.on(' ').join(fields);
    }

    @Override
    public boolean equals(Object other)
    {
        return this == other ||
            (other instanceof CronExpression && ((CronExpression) other).fields.equals(fields));
    }

    @Override
    public int hashCode()
    {
        return fields.hashCode();
    }
}
