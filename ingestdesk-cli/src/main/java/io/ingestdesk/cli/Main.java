package io.ingestdesk.cli;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.MissingCommandException;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableSet;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.TypeLiteral;
import io.ingestdesk.client.config.ConfigException;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Strings.isNullOrEmpty;
import static io.ingestdesk.cli.SystemExitException.systemExit;
import static java.util.Locale.ENGLISH;

public class Main
{
    private static final String DEFAULT_PROGRAM_NAME = "ingestdesk";
    private static final Set<String> LOG_LEVELS = ImmutableSet.of("error", "warn", "info", "debug", "trace");
    private static final Set<String> VERBOSE_LOG_LEVELS = ImmutableSet.of("debug", "trace");

    private final Map<String, String> env;
    private final PrintStream out;
    private final PrintStream err;
    private final InputStream in;
    private final String programName;

    public Main(Map<String, String> env, PrintStream out, PrintStream err, InputStream in)
    {
        this.env = env;
        this.out = out;
        this.err = err;
        this.in = in;
        this.programName = System.getProperty("io.ingestdesk.cli.programName", DEFAULT_PROGRAM_NAME);
    }

    public static class MainOptions
    {
        @Parameter(names = {"-c", "--config"})
        protected String configPath = null;

        @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
        boolean help;
    }

    public static void main(String... args)
    {
        int code = new Main(System.getenv(), System.out, System.err, System.in).cli(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    protected void addCommands(final JCommander jc, final Injector injector)
    {
        jc.addCommand("cron", injector.getInstance(Cron.class));
        jc.addCommand("simple", injector.getInstance(Simple.class));
        jc.addCommand("stats", injector.getInstance(Stats.class));
        jc.addCommand("jobs", injector.getInstance(Jobs.class), "job");
    }

    public int cli(String... args)
    {
        if (args.length == 0) {
            usage(null);
            return 0;
        }

        Command command = null;
        try {
            command = parseCommand(args);
            prepare(command);
            command.main();
            return 0;
        }
        catch (Exception ex) {
            boolean verbose = command != null && VERBOSE_LOG_LEVELS.contains(command.logLevel);
            return handleError(ex, verbose);
        }
    }

    private Command parseCommand(String... args)
            throws SystemExitException
    {
        MainOptions mainOpts = new MainOptions();
        JCommander jc = new JCommander(mainOpts);
        jc.setProgramName(programName);

        Injector injector = Guice.createInjector(new AbstractModule()
        {
            @Override
            protected void configure()
            {
                bind(new TypeLiteral<Map<String, String>>() {}).annotatedWith(Environment.class).toInstance(env);
                bind(String.class).annotatedWith(ProgramName.class).toInstance(programName);
                bind(InputStream.class).annotatedWith(StdIn.class).toInstance(in);
                bind(PrintStream.class).annotatedWith(StdOut.class).toInstance(out);
                bind(PrintStream.class).annotatedWith(StdErr.class).toInstance(err);
            }
        });

        addCommands(jc, injector);

        // "@" starts no file reference
        jc.setExpandAtSign(false);
        jc.getCommands().values().forEach(c -> c.setExpandAtSign(false));

        try {
            jc.parse(args);
        }
        catch (MissingCommandException ex) {
            throw usage("available commands are: " + jc.getCommands().keySet());
        }

        String commandName = jc.getParsedCommand();
        if (mainOpts.help || commandName == null) {
            throw usage(null);
        }
        Command command = (Command) jc.getCommands().get(commandName).getObjects().get(0);
        if (command.configPath == null) {
            command.configPath = mainOpts.configPath;
        }
        return command;
    }

    private void prepare(Command command)
            throws SystemExitException
    {
        if (command.help) {
            throw command.usage(null);
        }
        if (!LOG_LEVELS.contains(command.logLevel)) {
            throw usage("Unknown log level '" + command.logLevel + "'");
        }
        configureLogging(command.logLevel);
    }

    private int handleError(Exception ex, boolean verbose)
    {
        if (ex instanceof SystemExitException) {
            SystemExitException exit = (SystemExitException) ex;
            if (exit.getMessage() != null) {
                err.println("error: " + exit.getMessage());
            }
            return exit.getCode();
        }

        String message;
        if (ex instanceof ParameterException || ex instanceof ConfigException) {
            // already written for the operator
            message = ex.getMessage();
        }
        else {
            message = formatExceptionMessage(ex);
        }

        if (isNullOrEmpty(message)) {
            // prevent silent crash
            ex.printStackTrace(err);
        }
        else {
            err.println("error: " + message);
            if (verbose) {
                ex.printStackTrace(err);
            }
        }
        return 1;
    }

    private static void configureLogging(String level)
    {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();

        // read by logback-console.xml
        System.setProperty("ingestdesk.log.level", Level.toLevel(level.toUpperCase(ENGLISH), Level.WARN).toString());

        try {
            configurator.doConfigure(Main.class.getResource("/io/ingestdesk/cli/logback-console.xml"));
        }
        catch (JoranException ex) {
            throw new RuntimeException(ex);
        }
    }

    /**
     * Joins the distinct messages of the causal chain, outermost first.
     */
    static String formatExceptionMessage(Throwable ex)
    {
        Set<String> messages = new LinkedHashSet<>();
        for (Throwable cause : Throwables.getCausalChain(ex)) {
            String message = isNullOrEmpty(cause.getMessage()) ? cause.getClass().getSimpleName() : cause.getMessage();
            if (messages.stream().noneMatch(seen -> seen.contains(message))) {
                messages.add(message);
            }
        }
        return String.join("\n> ", messages);
    }

    private SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " <command> [options...]");
        err.println("  Commands:");
        err.println("    cron <expression>                  validate and describe a cron expression");
        err.println("    simple --mode MODE                 translate a simple schedule into cron");
        err.println("    stats [<json>]                     summarize run stats (stdin if omitted)");
        err.println("    jobs                               show job definitions");
        err.println("");
        err.println("  Options:");
        showCommonOptions(err);
        if (error == null) {
            err.println("Use `<command> --help` to see detailed usage of a command.");
            return systemExit(null);
        }
        else {
            return systemExit(error);
        }
    }

    public static void showCommonOptions(PrintStream err)
    {
        err.println("    -l, --log-level LEVEL            log level (error, warn, info, debug or trace)");
        err.println("    -X KEY=VALUE                     add a system config");
        err.println("    -c, --config PATH.properties     configuration file");
        err.println("");
    }
}
