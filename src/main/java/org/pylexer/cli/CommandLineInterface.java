package org.pylexer.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.pylexer.cli.commands.TokenizeCommand;
import org.pylexer.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "pylexer",
    mixinStandardHelpOptions = true,
    version = "pylexer 1.0",
    description = "Tokenizes Python-family source files",
    subcommands = {
        TokenizeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);
    private static final String CONFIG_FILE_NAME = "pylexer.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("pylexer");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * <p>
     * Load order: system properties, environment, then the first file found among
     * {@code --config}, {@code -Dconfig.file} and {@code pylexer.conf} in the working
     * directory, then the classpath defaults.
     *
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if an explicitly named file is missing or unparsable.
     */
    public Config getConfig() {
        if (config == null) {
            config = loadConfig();
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    private Config loadConfig() {
        final File file = locateConfigFile();
        try {
            Config fileConfig = ConfigFactory.empty();
            if (file != null) {
                LOGGER.info("Using configuration file: {}", file.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(file);
            } else {
                LOGGER.debug("No '{}' found, using default configuration from classpath.", CONFIG_FILE_NAME);
            }
            return ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment())
                    .withFallback(fileConfig)
                    .withFallback(ConfigFactory.load())
                    .resolve();
        } catch (ConfigException e) {
            LOGGER.error("Failed to load or parse configuration: {}", e.getMessage());
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Invalid configuration: " + e.getMessage(), e);
        }
    }

    private File locateConfigFile() {
        if (configFile != null) {
            if (!configFile.exists()) {
                LOGGER.error("Configuration file specified via --config was not found: {}", configFile.getAbsolutePath());
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file not found: " + configFile.getAbsolutePath());
            }
            return configFile;
        }
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                LOGGER.error("Configuration file specified via -Dconfig.file was not found: {}", systemConfigFile);
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file not found: " + systemConfigFile);
            }
            return systemConfigFile;
        }
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        return cwdConfigFile.exists() ? cwdConfigFile : null;
    }
}
