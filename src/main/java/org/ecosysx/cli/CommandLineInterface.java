package org.ecosysx.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import org.ecosysx.cli.commands.RunCommand;
import org.ecosysx.cli.config.ConfigLoader;
import org.ecosysx.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "ecosysx",
    mixinStandardHelpOptions = true,
    version = "EcoSysX 1.0",
    description = "EcoSysX - agent-based ecosystem simulation with social agents and epidemic spread",
    subcommands = {
        RunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: config/ecosysx.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Creates the command line used by {@link #main(String[])}. Tests use it to run commands the
     * same way.
     */
    public static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("ecosysx");
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging section.
     *
     * @throws IllegalArgumentException if {@code --config} names a missing file.
     * @throws com.typesafe.config.ConfigException if the configuration is invalid.
     */
    public Config getConfig() {
        if (config == null) {
            Config loaded = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> LOG.info(message);
                    case WARN -> LOG.warn(message);
                }
            });
            applyLogging(loaded);
            config = loaded;
        }
        return config;
    }

    private static void applyLogging(Config loaded) {
        if (loaded.hasPath("logging.format")) {
            String appender = LoggingConfigurator.appenderFor(loaded.getConfig("logging"));
            if (!appender.equals(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY))) {
                System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, appender);
                reconfigureLogback();
            }
        }
        LoggingConfigurator.configure(loaded);
    }

    private static void reconfigureLogback() {
        URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null || !(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
