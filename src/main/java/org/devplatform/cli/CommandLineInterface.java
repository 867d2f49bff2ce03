package org.devplatform.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.devplatform.cli.commands.HealthCommand;
import org.devplatform.cli.commands.LogsCommand;
import org.devplatform.cli.commands.UpCommand;
import org.devplatform.config.ConfigLoader;
import org.devplatform.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "devplatform",
    mixinStandardHelpOptions = true,
    version = "devplatform 1.0",
    description = "Runs and watches the services of a local development workspace",
    subcommands = {
        UpCommand.class,
        LogsCommand.class,
        HealthCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "devplatform.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to the workspace configuration file (default: " + CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("devplatform");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        final File file = configFile != null ? configFile : new File(CONFIG_FILE_NAME);
        if (configFile != null && !configFile.isFile()) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
        }
        try {
            this.config = ConfigLoader.load(file);
        } catch (final ConfigException e) {
            logger.error("Failed to load or parse configuration: {}", e.getMessage());
            throw e;
        }

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * Relative manifest paths resolve against the directory of the configuration file.
     */
    public Path getWorkspaceRoot() {
        if (configFile != null) {
            final File parent = configFile.getAbsoluteFile().getParentFile();
            if (parent != null) {
                return parent.toPath();
            }
        }
        return Path.of("").toAbsolutePath();
    }
}
