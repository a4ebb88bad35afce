package io.ingestdesk.cli;

import java.util.List;
import com.beust.jcommander.Parameter;
import io.ingestdesk.core.job.JobDefinition;
import io.ingestdesk.core.job.JobDefinitionRegistry;

import static io.ingestdesk.cli.SystemExitException.systemExit;

public class Jobs
        extends Command
{
    @Parameter(names = {"-s", "--source"})
    String source = null;

    @Override
    public void main()
            throws Exception
    {
        if (!args.isEmpty()) {
            throw usage(null);
        }

        JobDefinitionRegistry registry = buildEmbed().getInjector().getInstance(JobDefinitionRegistry.class);
        List<JobDefinition> jobs;
        if (source != null) {
            if (!registry.isKnownSource(source)) {
                throw systemExit("Unknown source '" + source + "'");
            }
            jobs = registry.getJobDefinitionsOfSource(source);
        }
        else {
            jobs = registry.getJobDefinitions();
        }

        TablePrinter table = new TablePrinter(out);
        table.row("JOB", "SOURCE", "SCHEDULE", "MANUAL", "TITLE");
        for (JobDefinition job : jobs) {
            table.row(job.getJobCode(), job.getSourceCode(),
                    yesNo(job.getSupportsSchedule()), yesNo(job.getSupportsManual()),
                    job.getTitle());
        }
        table.print();
        err.println(jobs.size() + " jobs.");
    }

    private static String yesNo(boolean value)
    {
        return value ? "yes" : "no";
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " jobs");
        err.println("  Options:");
        err.println("    -s, --source CODE                show jobs of a marketplace only");
        showCommonOptions();
        return systemExit(error);
    }
}
