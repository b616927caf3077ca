package org.ndlkit.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.util.ContextInitializer;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.ndlkit.cli.commands.DescribeCommand;
import org.ndlkit.cli.commands.EditCommand;
import org.ndlkit.config.ConfigLoader;
import org.ndlkit.config.LoggingConfigurator;
import org.ndlkit.config.ScriptSettings;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

/**
 * Root of the {@code ndlkit} command line. Subcommands ask it for the configuration, which is
 * loaded on first use together with the logging setup.
 */
@Command(
    name = "ndlkit",
    mixinStandardHelpOptions = true,
    version = "ndlkit 1.0",
    description = "Expands NDL network descriptions and runs MEL model editing scripts.",
    subcommands = {
        EditCommand.class,
        DescribeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "HOCON configuration file (default: ./" + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(new CommandLine(new CommandLineInterface()).execute(args));
    }

    /**
     * @return The resolved configuration; loaded, and logging set up, on the first call.
     * @throws CommandLine.ParameterException if the configuration cannot be read.
     */
    public Config getConfig() {
        if (config == null) {
            config = loadConfig();
            setUpLogging(config);
        }
        return config;
    }

    /**
     * @return The script settings read from the configuration.
     */
    public ScriptSettings getSettings() {
        try {
            return ScriptSettings.fromConfig(getConfig());
        } catch (ConfigException | IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid ndlkit settings: " + e.getMessage(), e);
        }
    }

    private Config loadConfig() {
        try {
            return ConfigLoader.load(configFile);
        } catch (ConfigException | IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot load configuration: " + e.getMessage(), e);
        }
    }

    private static void setUpLogging(final Config loaded) {
        if (loaded.hasPath("logging.format")) {
            // logback.xml picks the appender from this property, so it must be set before reloading
            final boolean verbose = "VERBOSE".equalsIgnoreCase(loaded.getString("logging.format"));
            System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, verbose ? "STDOUT_VERBOSE" : "STDOUT_PLAIN");
            reloadLogback();
        }
        LoggingConfigurator.configure(loaded);
    }

    private static void reloadLogback() {
        final ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            return;
        }
        context.reset();
        try {
            new ContextInitializer(context).autoConfig();
        } catch (JoranException e) {
            // the logging system itself is unavailable here
            System.err.println("Cannot reload the Logback configuration: " + e.getMessage());
        }
    }
}
