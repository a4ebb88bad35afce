package io.ingestdesk.cli;

import java.io.InputStreamReader;
import com.google.common.io.CharStreams;
import io.ingestdesk.client.config.Config;
import io.ingestdesk.client.config.ConfigFactory;
import io.ingestdesk.core.run.RunStatsSummarizer;

import static io.ingestdesk.cli.SystemExitException.systemExit;
import static java.nio.charset.StandardCharsets.UTF_8;

public class Stats
        extends Command
{
    @Override
    public void main()
            throws Exception
    {
        if (args.size() > 1) {
            throw usage(null);
        }

        String json;
        if (args.isEmpty() || args.get(0).equals("-")) {
            json = CharStreams.toString(new InputStreamReader(in, UTF_8));
        }
        else {
            json = args.get(0);
        }

        ConfigFactory cf = buildEmbed().getInjector().getInstance(ConfigFactory.class);
        Config stats = cf.fromJsonString(json);
        out.println(RunStatsSummarizer.summarize(stats));
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " stats [<json>]");
        err.println("  Arguments:");
        err.println("    <json>                           stats object of a run (reads stdin if omitted or -)");
        err.println("  Options:");
        showCommonOptions();
        return systemExit(error);
    }
}
