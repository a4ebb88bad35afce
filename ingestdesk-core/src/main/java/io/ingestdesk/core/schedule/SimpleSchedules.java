package io.ingestdesk.core.schedule;

import java.util.List;
import com.google.common.base.CharMatcher;
import com.google.common.base.Optional;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import io.ingestdesk.client.api.RestSimpleSchedule;

/**
 * Builds {@link SimpleSchedule}s from raw form input.
 *
 * Numbers are read the lenient way form fields are: the leading integer
 * counts and non-numeric text is 0. The result is then clamped like any
 * other out-of-range value. Strict parsing rejects out-of-range intervals with
 * {@link InvalidIntervalException} instead.
 */
public class SimpleSchedules
{
    private static final Splitter TIME_SPLITTER = Splitter.on(':').trimResults();
    private static final CharMatcher DIGIT = CharMatcher.inRange('0', '9');
    private static final Splitter DAYS_SPLITTER = Splitter.on(CharMatcher.anyOf(", ")).trimResults().omitEmptyStrings();

    private SimpleSchedules()
    { }

    public static SimpleSchedule fromRest(RestSimpleSchedule simple)
    {
        return of(simple.getMode(), simple.getAt(), simple.getEvery(), simple.getDays(), false);
    }

    public static SimpleSchedule of(String mode, Optional<String> at, Optional<String> every, Optional<String> days, boolean strict)
    {
        int[] time = parseTime(at.or("03:00"));
        switch (SimpleSchedule.Kind.fromName(mode)) {
        case DAILY:
            return SimpleSchedule.daily(time[0], time[1]);
        case EVERY_HOURS:
            {
                int hours = parseNumber(every.or("3"));
                if (strict) {
                    checkInterval("hours", hours, SimpleSchedule.MIN_EVERY_HOURS, SimpleSchedule.MAX_EVERY_HOURS);
                }
                return SimpleSchedule.everyHours(hours);
            }
        case EVERY_MINUTES:
            {
                int minutes = parseNumber(every.or("15"));
                if (strict) {
                    checkInterval("minutes", minutes, SimpleSchedule.MIN_EVERY_MINUTES, SimpleSchedule.MAX_EVERY_MINUTES);
                }
                return SimpleSchedule.everyMinutes(minutes);
            }
        case WEEKLY:
            return SimpleSchedule.weekly(parseDays(days.or("")), time[0], time[1]);
        default:
            throw new AssertionError("Unknown schedule mode: " + mode);
        }
    }

    /**
     * Reads the leading integer of the text, ignoring anything after it, so
     * "15abc" is 15. Values beyond the int range saturate. Text without a
     * leading integer reads as 0.
     */
    public static int parseNumber(String raw)
    {
        if (raw == null) {
            return 0;
        }
        String text = raw.trim();
        int start = (text.startsWith("-") || text.startsWith("+")) ? 1 : 0;
        int end = start;
        while (end < text.length() && DIGIT.matches(text.charAt(end))) {
            end++;
        }
        if (end == start) {
            return 0;
        }
        String digits = text.substring(start, end);
        Long n = Longs.tryParse(digits);
        long value = n != null ? n : Long.MAX_VALUE;
        return Ints.saturatedCast(text.charAt(0) == '-' ? -value : value);
    }

    /**
     * Parses HH:MM into {hour, minute}. Missing or broken parts read as 0.
     */
    public static int[] parseTime(String raw)
    {
        List<String> parts = TIME_SPLITTER.splitToList(raw == null ? "" : raw);
        int hour = parseNumber(parts.get(0));
        int minute = parts.size() > 1 ? parseNumber(parts.get(1)) : 0;
        return new int[] { hour, minute };
    }

    public static List<Integer> parseDays(String raw)
    {
        ImmutableList.Builder<Integer> days = ImmutableList.builder();
        for (String day : DAYS_SPLITTER.split(raw == null ? "" : raw)) {
            Integer n = Ints.tryParse(day);
            if (n != null) {
                days.add(n);
            }
        }
        return days.build();
    }

    private static void checkInterval(String unit, int value, int min, int max)
    {
        if (value < min || value > max) {
            throw new InvalidIntervalException(String.format("interval in %s must be between %d and %d but got %d", unit, min, max, value));
        }
    }
}
