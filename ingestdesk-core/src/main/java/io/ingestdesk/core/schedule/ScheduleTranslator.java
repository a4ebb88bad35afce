package io.ingestdesk.core.schedule;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Ints;
import com.google.inject.Inject;
import io.ingestdesk.core.IngestConfig;

/**
 * Translates between {@link SimpleSchedule} and {@link CronExpression}.
 *
 * Translation to cron is total. The way back is {@link #humanize(CronExpression)},
 * which recognizes only the shapes that {@link #toCron(SimpleSchedule)} produces
 * and labels anything else generically. Summaries of a simple schedule are
 * rendered from the schedule itself and don't go through cron.
 */
public class ScheduleTranslator
{
    public static final String GENERIC_DESCRIPTION = "by cron schedule";

    static final String WEEKDAYS = "1-5";

    private static final List<String> DAY_NAMES = ImmutableList.of("Sun", "Mon", "Tue", "Wed", "Thu", "Fri", "Sat", "Sun");
    private static final Set<Integer> MON_TO_FRI = ImmutableSet.of(1, 2, 3, 4, 5);
    private static final Set<String> WORKDAY_FIELDS = ImmutableSet.of("1", "2", "3", "4", "5");
    private static final Splitter LIST_SPLITTER = Splitter.on(',');
    private static final Splitter RANGE_SPLITTER = Splitter.on('-').limit(2);

    private final IngestConfig config;

    @Inject
    public ScheduleTranslator(IngestConfig config)
    {
        this.config = config;
    }

    public CronExpression toCron(SimpleSchedule schedule)
    {
        return schedule.accept(new SimpleSchedule.Visitor<CronExpression>()
        {
            @Override
            public CronExpression visitDaily(SimpleSchedule.Daily daily)
            {
                return CronExpression.of(
                        Integer.toString(daily.getMinute()), Integer.toString(daily.getHour()),
                        "*", "*", "*");
            }

            @Override
            public CronExpression visitEveryHours(SimpleSchedule.EveryHours everyHours)
            {
                return CronExpression.of("0", "*/" + everyHours.getHours(), "*", "*", "*");
            }

            @Override
            public CronExpression visitEveryMinutes(SimpleSchedule.EveryMinutes everyMinutes)
            {
                return CronExpression.of("*/" + everyMinutes.getMinutes(), "*", "*", "*", "*");
            }

            @Override
            public CronExpression visitWeekly(SimpleSchedule.Weekly weekly)
            {
                return CronExpression.of(
                        Integer.toString(weekly.getMinute()), Integer.toString(weekly.getHour()),
                        "*", "*", dayOfWeekField(weekly.getDays()));
            }
        });
    }

    private static String dayOfWeekField(SortedSet<Integer> days)
    {
        if (days.isEmpty()) {
            return WEEKDAYS;
        }
        return Joiner.on(',').join(days);
    }

    /**
     * Full-fidelity description of a simple schedule, e.g.
     * "weekly (Mon, Wed) at 09:30 (Europe/Istanbul)".
     */
    public String summarize(SimpleSchedule schedule, String timezone)
    {
        String tz = (timezone == null || timezone.trim().isEmpty()) ? config.getDefaultTimezone() : timezone.trim();
        String body = schedule.accept(new SimpleSchedule.Visitor<String>()
        {
            @Override
            public String visitDaily(SimpleSchedule.Daily daily)
            {
                return "daily at " + formatTime(daily.getHour(), daily.getMinute());
            }

            @Override
            public String visitEveryHours(SimpleSchedule.EveryHours everyHours)
            {
                return "every " + everyHours.getHours() + " h";
            }

            @Override
            public String visitEveryMinutes(SimpleSchedule.EveryMinutes everyMinutes)
            {
                return "every " + everyMinutes.getMinutes() + " min";
            }

            @Override
            public String visitWeekly(SimpleSchedule.Weekly weekly)
            {
                Set<Integer> days = weekly.getDays().isEmpty() ? MON_TO_FRI : weekly.getDays();
                return "weekly (" + dayNames(days) + ") at " + formatTime(weekly.getHour(), weekly.getMinute());
            }
        });
        return body + " (" + tz + ")";
    }

    /**
     * Best-effort description of an arbitrary cron string. Never throws.
     */
    public String humanize(String cron)
    {
        if (!CronExpression.isValid(cron)) {
            return GENERIC_DESCRIPTION;
        }
        return humanize(CronExpression.parse(cron));
    }

    /**
     * Describes a stored schedule: the summary of its simple form if it has
     * one, the humanized cron otherwise.
     */
    public String describe(Schedule schedule)
    {
        if (schedule.getSimple().isPresent()) {
            return summarize(schedule.getSimple().get(), schedule.getTimezone());
        }
        return humanize(schedule.getCronExpr());
    }

    public String humanize(CronExpression cron)
    {
        String min = cron.getMinute();
        String hour = cron.getHour();
        String dow = cron.getDayOfWeek();
        boolean everyDayOfMonth = cron.getDayOfMonth().equals("*") && cron.getMonth().equals("*");
        if (!everyDayOfMonth) {
            return GENERIC_DESCRIPTION;
        }
        boolean anyDayOfWeek = dow.equals("*") || dow.equals("?");

        if (anyDayOfWeek) {
            Integer h = Ints.tryParse(hour);
            Integer m = Ints.tryParse(min);
            if (h != null && m != null) {
                return "daily at " + formatTime(h, m);
            }

            Integer everyMinutes = stepOf(min);
            if (everyMinutes != null && hour.equals("*")) {
                return everyMinutes == 1 ? "every minute" : "every " + everyMinutes + " minutes";
            }

            Integer everyHours = stepOf(hour);
            if (everyHours != null && min.equals("0")) {
                return everyHours == 1 ? "every hour" : "every " + everyHours + " hours";
            }
            return GENERIC_DESCRIPTION;
        }

        Integer h = Ints.tryParse(hour);
        Integer m = Ints.tryParse(min);
        if (h == null || m == null) {
            return GENERIC_DESCRIPTION;
        }

        if (min.equals("0") && (dow.equals(WEEKDAYS) || isWorkdayList(dow))) {
            return "Mon–Fri at " + formatTime(h, 0);
        }

        Optional<SortedSet<Integer>> days = parseDayOfWeek(dow);
        if (days.isPresent()) {
            return "weekly (" + dayNames(days.get()) + ") at " + formatTime(h, m);
        }
        return GENERIC_DESCRIPTION;
    }

    // five list items, each one of 1..5 in any order
    private static boolean isWorkdayList(String field)
    {
        List<String> items = LIST_SPLITTER.splitToList(field);
        return items.size() == 5 && WORKDAY_FIELDS.containsAll(items);
    }

    // "*/N" with N > 0
    private static Integer stepOf(String field)
    {
        if (!field.startsWith("*/")) {
            return null;
        }
        Integer n = Ints.tryParse(field.substring(2));
        return (n != null && n > 0) ? n : null;
    }

    // comma-separated days or day ranges within 0..7, 0 and 7 both being Sunday
    private static Optional<SortedSet<Integer>> parseDayOfWeek(String field)
    {
        SortedSet<Integer> days = new TreeSet<>();
        for (String item : LIST_SPLITTER.split(field)) {
            List<String> range = RANGE_SPLITTER.splitToList(item);
            Integer from = Ints.tryParse(range.get(0));
            Integer to = range.size() > 1 ? Ints.tryParse(range.get(1)) : from;
            if (from == null || to == null || from < 0 || to > 7 || from > to) {
                return Optional.absent();
            }
            for (int day = from; day <= to; day++) {
                days.add(day == 0 ? 7 : day);
            }
        }
        return Optional.of(days);
    }

    /**
     * Resolves the timezone of a schedule being submitted. Absent means the
     * configured default. Blank or unknown names are rejected.
     */
    public String resolveTimezone(Optional<String> timezone)
    {
        if (!timezone.isPresent()) {
            return config.getDefaultTimezone();
        }
        String tz = timezone.get().trim();
        if (tz.isEmpty()) {
            throw new InvalidTimezoneException("timezone must not be empty");
        }
        try {
            return ZoneId.of(tz).getId();
        }
        catch (DateTimeException ex) {
            throw new InvalidTimezoneException("Unknown time zone name: " + tz, ex);
        }
    }

    public CronExpression resolveCron(Optional<String> cron)
    {
        if (!cron.isPresent()) {
            return CronExpression.parse(config.getDefaultCron());
        }
        return CronExpression.parse(cron.get());
    }

    public SchedulePreview preview(SimpleSchedule schedule, Optional<String> timezone)
    {
        String tz = resolveTimezone(timezone);
        CronExpression cron = toCron(schedule);
        return SchedulePreview.builder()
            .cronExpr(cron)
            .timezone(tz)
            .summary(summarize(schedule, tz))
            .description(humanize(cron))
            .build();
    }

    public SchedulePreview preview(String cron, Optional<String> timezone)
    {
        String tz = resolveTimezone(timezone);
        CronExpression parsed = CronExpression.parse(cron);
        return SchedulePreview.builder()
            .cronExpr(parsed)
            .timezone(tz)
            .description(humanize(parsed))
            .build();
    }

    static String formatTime(int hour, int minute)
    {
        return String.format(Locale.ENGLISH, "%02d:%02d", hour, minute);
    }

    static String dayNames(Set<Integer> days)
    {
        ImmutableList.Builder<String> names = ImmutableList.builder();
        for (int day : days) {
            names.add(DAY_NAMES.get(day));
        }
        return Joiner.on(", ").join(names.build());
    }
}
