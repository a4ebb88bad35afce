package io.ingestdesk.cli;

import com.beust.jcommander.Parameter;
import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import io.ingestdesk.core.schedule.SchedulePreview;
import io.ingestdesk.core.schedule.ScheduleTranslator;

import static io.ingestdesk.cli.SystemExitException.systemExit;

public class Cron
        extends Command
{
    @Parameter(names = {"-t", "--timezone"})
    String timezone = null;

    @Override
    public void main()
            throws Exception
    {
        if (args.isEmpty()) {
            throw usage(null);
        }
        // accepts both "0 3 * * *" and 0 3 '*' '*' '*'
        String expr = Joiner.on(' ').join(args);

        ScheduleTranslator translator = buildEmbed().getInjector().getInstance(ScheduleTranslator.class);
        SchedulePreview preview = translator.preview(expr, Optional.fromNullable(timezone));

        ln("cron: %s", preview.getCronExpr());
        ln("timezone: %s", preview.getTimezone());
        ln("description: %s", preview.getDescription());
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " cron <expression>");
        err.println("  Options:");
        err.println("    -t, --timezone ZONE              time zone of the schedule (default: ingest.default_timezone)");
        showCommonOptions();
        return systemExit(error);
    }
}
