package org.retroscript.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.retroscript.cli.commands.CheckCommand;
import org.retroscript.cli.commands.FormatCommand;
import org.retroscript.cli.commands.IrCommand;
import org.retroscript.cli.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "retroscript",
    mixinStandardHelpOptions = true,
    version = "RetroScript 1.0",
    description = "RetroScript - format, check and inspect automation scripts",
    subcommands = {
        FormatCommand.class,
        CheckCommand.class,
        IrCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    static final String LOGGING_FORMAT_PROPERTY = "retroscript.logging.format";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/retroscript.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // Without a subcommand, show the usage.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("retroscript");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.debug(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(new CommandLine(this), e.getMessage(), e);
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                    "Failed to load or parse configuration: " + e.getMessage(), e);
        }

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty(LOGGING_FORMAT_PROPERTY, "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }
        initialized = true;
    }

    private void reconfigureLogback() {
        try {
            ch.qos.logback.classic.LoggerContext context = (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (ch.qos.logback.core.joran.spi.JoranException | ClassCastException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * @return the resolved configuration, loading it on first use
     * @throws CommandLine.ParameterException if the configuration cannot be found or parsed
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
