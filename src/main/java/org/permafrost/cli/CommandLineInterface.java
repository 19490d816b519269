package org.permafrost.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.permafrost.cli.commands.InspectCommand;
import org.permafrost.config.LoggingConfigurator;
import org.permafrost.config.PermafrostSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "permafrost",
    mixinStandardHelpOptions = true,
    version = "Permafrost 1.0",
    description = "Permafrost - persistent simulation regions",
    subcommands = {
        InspectCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    static final String CONFIG_FILE_NAME = "permafrost.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: permafrost.conf)"
    )
    private File configFile;

    private Config config;
    private PermafrostSettings settings;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("permafrost");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            // 1) Highest precedence: explicit CLI option --config
            if (this.configFile != null) {
                if (!this.configFile.exists()) {
                    throw new IllegalStateException("Configuration file specified via --config was not found: "
                        + this.configFile.getAbsolutePath());
                }
                logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
                this.config = loadWithFile(this.configFile);
            } else {
                // 2) Next: standard Typesafe Config system property -Dconfig.file
                final String systemConfigPath = System.getProperty("config.file");
                if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                    final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
                    if (!systemConfigFile.exists()) {
                        throw new IllegalStateException("Configuration file specified via -Dconfig.file was not found: "
                            + systemConfigFile.getAbsolutePath());
                    }
                    logger.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile.getAbsolutePath());
                    this.config = loadWithFile(systemConfigFile);
                } else {
                    // 3) Then: permafrost.conf in the current working directory
                    final File cwdConfigFile = new File(CONFIG_FILE_NAME);
                    if (cwdConfigFile.exists()) {
                        logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                        this.config = loadWithFile(cwdConfigFile);
                    } else {
                        // 4) Finally: classpath defaults only
                        logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
                        this.config = ConfigFactory.systemProperties()
                            .withFallback(ConfigFactory.systemEnvironment())
                            .withFallback(ConfigFactory.load())
                            .resolve();
                    }
                }
            }
        } catch (ConfigException e) {
            throw new IllegalStateException("Failed to load or parse configuration: " + e.getMessage(), e);
        }

        LoggingConfigurator.configure(config);
        this.settings = PermafrostSettings.fromConfig(config);
        initialized = true;
    }

    // Config load order: System Props > Env Vars > File > Classpath defaults
    private static Config loadWithFile(final File file) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(file))
            .withFallback(ConfigFactory.load())
            .resolve();
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    public PermafrostSettings getSettings() {
        if (!initialized) {
            initialize();
        }
        return settings;
    }
}
