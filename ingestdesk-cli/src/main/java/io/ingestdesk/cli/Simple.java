package io.ingestdesk.cli;

import com.beust.jcommander.Parameter;
import com.google.common.base.Optional;
import io.ingestdesk.core.schedule.SchedulePreset;
import io.ingestdesk.core.schedule.SchedulePreview;
import io.ingestdesk.core.schedule.ScheduleTranslator;
import io.ingestdesk.core.schedule.SimpleSchedule;
import io.ingestdesk.core.schedule.SimpleSchedules;

import static io.ingestdesk.cli.SystemExitException.systemExit;

public class Simple
        extends Command
{
    @Parameter(names = {"-m", "--mode"})
    String mode = "daily";

    @Parameter(names = {"--at"})
    String at = null;

    @Parameter(names = {"--every"})
    String every = null;

    @Parameter(names = {"--days"})
    String days = null;

    @Parameter(names = {"-t", "--timezone"})
    String timezone = null;

    @Parameter(names = {"-p", "--preset"})
    String preset = null;

    @Parameter(names = {"--strict"})
    boolean strict = false;

    @Override
    public void main()
            throws Exception
    {
        if (!args.isEmpty()) {
            throw usage(null);
        }

        SimpleSchedule schedule;
        if (preset != null) {
            schedule = SchedulePreset.fromName(preset).getSchedule();
        }
        else {
            schedule = SimpleSchedules.of(mode,
                    Optional.fromNullable(at), Optional.fromNullable(every), Optional.fromNullable(days),
                    strict);
        }

        ScheduleTranslator translator = buildEmbed().getInjector().getInstance(ScheduleTranslator.class);
        SchedulePreview preview = translator.preview(schedule, Optional.fromNullable(timezone));

        ln("cron: %s", preview.getCronExpr());
        ln("timezone: %s", preview.getTimezone());
        ln("summary: %s", preview.getSummary().or(""));
        ln("description: %s", preview.getDescription());
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " simple [options...]");
        err.println("  Options:");
        err.println("    -m, --mode MODE                  daily, every_hours, every_minutes or weekly (default: daily)");
        err.println("        --at HH:MM                   time of day for daily and weekly (default: 03:00)");
        err.println("        --every N                    interval for every_hours and every_minutes");
        err.println("        --days 1,2,...               days of week for weekly, 1=Mon..7=Sun (default: Mon-Fri)");
        err.println("    -t, --timezone ZONE              time zone of the schedule (default: ingest.default_timezone)");
        err.println("    -p, --preset NAME                daily_3, hourly, every_15 or mon_fri_9");
        err.println("        --strict                     reject out-of-range intervals instead of clamping them");
        showCommonOptions();
        return systemExit(error);
    }
}
