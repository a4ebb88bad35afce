package io.ingestdesk.cli;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Map;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;

public class MainTest
{
    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    private int run(String... args)
            throws Exception
    {
        return run(ImmutableMap.of(), "", args);
    }

    private int run(Map<String, String> env, String stdin, String... args)
            throws Exception
    {
        InputStream in = new ByteArrayInputStream(stdin.getBytes(UTF_8));
        Main main = new Main(env,
                new PrintStream(stdout, true, "UTF-8"),
                new PrintStream(stderr, true, "UTF-8"),
                in);
        return main.cli(args);
    }

    private String out()
    {
        return new String(stdout.toByteArray(), UTF_8);
    }

    private String err()
    {
        return new String(stderr.toByteArray(), UTF_8);
    }

    @Test
    public void cronIsDescribed()
            throws Exception
    {
        assertThat(run("cron", "0 3 * * *"), is(0));
        assertThat(out(), containsString("cron: 0 3 * * *"));
        assertThat(out(), containsString("timezone: Europe/Istanbul"));
        assertThat(out(), containsString("description: daily at 03:00"));
    }

    @Test
    public void cronFieldsMayBeSeparateArguments()
            throws Exception
    {
        assertThat(run("cron", "*/15", "*", "*", "*", "*", "--timezone", "UTC"), is(0));
        assertThat(out(), containsString("timezone: UTC"));
        assertThat(out(), containsString("description: every 15 minutes"));
    }

    @Test
    public void malformedCronIsRejected()
            throws Exception
    {
        assertThat(run("cron", "0 3 * *"), is(1));
        assertThat(err(), containsString("error: cron must have 5 parts"));
    }

    @Test
    public void unknownTimezoneIsRejected()
            throws Exception
    {
        assertThat(run("cron", "0 3 * * *", "-t", "Nowhere/City"), is(1));
        assertThat(err(), containsString("error: Unknown time zone name: Nowhere/City"));
    }

    @Test
    public void simpleScheduleIsTranslated()
            throws Exception
    {
        assertThat(run("simple", "--mode", "every_hours", "--every", "4", "-t", "UTC"), is(0));
        assertThat(out(), containsString("cron: 0 */4 * * *"));
        assertThat(out(), containsString("summary: every 4 h (UTC)"));
        assertThat(out(), containsString("description: every 4 hours"));
    }

    @Test
    public void presetIsTranslated()
            throws Exception
    {
        assertThat(run("simple", "--preset", "mon_fri_9"), is(0));
        assertThat(out(), containsString("cron: 0 9 * * 1,2,3,4,5"));
        assertThat(out(), containsString("description: Mon–Fri at 09:00"));
    }

    @Test
    public void strictModeRejectsOutOfRangeInterval()
            throws Exception
    {
        assertThat(run("simple", "--mode", "every_hours", "--every", "30", "--strict"), is(1));
        assertThat(err(), containsString("error: interval in hours must be between 1 and 24 but got 30"));
    }

    @Test
    public void outOfRangeIntervalIsClampedByDefault()
            throws Exception
    {
        assertThat(run("simple", "--mode", "every_hours", "--every", "30", "-t", "UTC"), is(0));
        assertThat(out(), containsString("cron: 0 */24 * * *"));
    }

    @Test
    public void environmentConfigOverridesDefaults()
            throws Exception
    {
        Map<String, String> env = ImmutableMap.of("INGESTDESK_CONFIG", "ingest.default_timezone=UTC");
        assertThat(run(env, "", "simple"), is(0));
        assertThat(out(), containsString("timezone: UTC"));
        assertThat(out(), containsString("summary: daily at 03:00 (UTC)"));
    }

    @Test
    public void statsAreSummarized()
            throws Exception
    {
        assertThat(run("stats", "{\"inserted\":5,\"updated\":3}"), is(0));
        assertThat(out().trim(), is("ins:5 upd:3"));
    }

    @Test
    public void statsAreReadFromStdin()
            throws Exception
    {
        assertThat(run(ImmutableMap.of(), "{\"ok\":false,\"error\":\"HTTP 401\"}", "stats"), is(0));
        assertThat(out().trim(), is("error:HTTP 401"));
    }

    @Test
    public void statsMustBeAnObject()
            throws Exception
    {
        assertThat(run("stats", "[1,2]"), is(1));
        assertThat(err(), startsWith("error: Expected object"));
    }

    @Test
    public void jobsAreListed()
            throws Exception
    {
        assertThat(run("jobs"), is(0));
        assertThat(out(), startsWith("JOB"));
        assertThat(out(), containsString("supplier_stocks"));
        assertThat(out(), containsString("build_tax_statement"));
        assertThat(err(), containsString("9 jobs."));
    }

    @Test
    public void jobsOfUnknownSource()
            throws Exception
    {
        assertThat(run("jobs", "--source", "nowhere"), is(1));
        assertThat(err(), containsString("error: Unknown source 'nowhere'"));
    }

    @Test
    public void unknownCommand()
            throws Exception
    {
        assertThat(run("deploy"), is(1));
        assertThat(err(), containsString("available commands are"));
    }

    @Test
    public void usageWithoutArguments()
            throws Exception
    {
        assertThat(run(), is(0));
        assertThat(err(), containsString("Usage: ingestdesk <command> [options...]"));
    }

    @Test
    public void causesAreJoined()
    {
        Exception ex = new IllegalStateException("failed to load jobs", new IOException("disk full"));
        assertThat(Main.formatExceptionMessage(ex), is("failed to load jobs\n> disk full"));
        assertThat(Main.formatExceptionMessage(new RuntimeException(new IOException("disk full"))),
                is("java.io.IOException: disk full"));
    }
}
