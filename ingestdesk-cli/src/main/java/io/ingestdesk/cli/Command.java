package io.ingestdesk.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.google.inject.Inject;
import io.ingestdesk.core.IngestdeskEmbed;
import io.ingestdesk.core.config.PropertyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class Command
{
    private static final Logger log = LoggerFactory.getLogger(Command.class);

    static final String DEFAULT_PROPERTIES_RESOURCE = "/io/ingestdesk/cli/ingestdesk.properties";
    static final String CONFIG_ENV_NAME = "INGESTDESK_CONFIG";

    @Inject @Environment protected Map<String, String> env;
    @Inject @ProgramName protected String programName;
    @Inject @StdIn protected InputStream in;
    @Inject @StdOut protected PrintStream out;
    @Inject @StdErr protected PrintStream err;

    @Parameter()
    protected List<String> args = new ArrayList<>();

    @Parameter(names = {"-c", "--config"})
    protected String configPath = null;

    @Parameter(names = {"-l", "--log-level"})
    protected String logLevel = "warn";

    @DynamicParameter(names = "-X")
    protected Map<String, String> systemProperties = new HashMap<>();

    @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
    protected boolean help;

    public abstract void main() throws Exception;

    public abstract SystemExitException usage(String error);

    protected Properties loadSystemProperties()
        throws IOException
    {
        // Later sources take precedence:
        // 1. ingestdesk.properties bundled with the cli
        // 2. INGESTDESK_CONFIG env var
        // 3. explicit configuration file (--config)
        // 4. -X KEY=VALUE
        Properties props = new Properties();

        try (InputStream defaults = Command.class.getResourceAsStream(DEFAULT_PROPERTIES_RESOURCE)) {
            if (defaults != null) {
                props.load(defaults);
            }
            else {
                log.trace("default properties not found: {}", DEFAULT_PROPERTIES_RESOURCE);
            }
        }

        props.load(new StringReader(env.getOrDefault(CONFIG_ENV_NAME, "")));

        if (configPath != null) {
            props.putAll(PropertyUtils.loadFile(Paths.get(configPath)));
        }

        props.putAll(systemProperties);

        return props;
    }

    protected IngestdeskEmbed buildEmbed()
        throws IOException
    {
        Properties props = loadSystemProperties();
        log.debug("Using system properties: {}", props);
        return new IngestdeskEmbed.Bootstrap()
            .setSystemProperties(props)
            .initialize();
    }

    protected void ln(String format, Object... args)
    {
        out.println(String.format(format, args));
    }

    protected void showCommonOptions()
    {
        Main.showCommonOptions(err);
    }
}
