package org.corvid.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.corvid.cli.commands.NormalizeCommand;
import org.corvid.cli.commands.WarnCommand;
import org.corvid.compiler.diagnostics.DiagnosticsSettings;
import org.corvid.config.ConfigLoader;
import org.corvid.config.LoggingConfigurator;
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
    name = "corvid",
    mixinStandardHelpOptions = true,
    version = "Corvid diagnostics 1.0",
    description = "Normalizes compiler front-end failures into user-facing diagnostics.",
    subcommands = {
        NormalizeCommand.class,
        WarnCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.DEFAULT_CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = new CommandLine(new CommandLineInterface()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (config == null) {
            if (configFile != null && !configFile.exists()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
            }
            final String fileName = configFile != null ? configFile.getPath() : ConfigLoader.DEFAULT_CONFIG_FILE_NAME;
            try {
                config = ConfigLoader.load(fileName);
            } catch (ConfigException e) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Failed to load or parse configuration: " + e.getMessage(), e);
            }
            LoggingConfigurator.configure(config);
            LOGGER.debug("Configuration loaded from {}", fileName);
        }
        return config;
    }

    /**
     * @return The diagnostics settings of the loaded configuration.
     */
    public DiagnosticsSettings getDiagnosticsSettings() {
        return DiagnosticsSettings.fromConfig(getConfig());
    }
}
