package org.corvid.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** The configuration file looked up in the working directory by default. */
    public static final String DEFAULT_CONFIG_FILE_NAME = "corvid.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. CLI Arguments (as Java System Properties, e.g., -Dkey=value)
     * 2. Environment Variables
     * 3. Configuration File (a file on disk, or else a classpath resource of that name)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFileName Path of the configuration file.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String configFileName) {
        final Config cliConfig = ConfigFactory.systemProperties();
        final Config envConfig = ConfigFactory.systemEnvironment();

        final File configFile = new File(configFileName);
        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            final Config resourceConfig = ConfigFactory.parseResources(configFileName);
            if (resourceConfig.isEmpty()) {
                LOG.debug("Configuration file '{}' not found. Skipping file-based configuration.", configFileName);
            } else {
                LOG.debug("Loading configuration from classpath resource: {}", configFileName);
            }
            fileConfig = resourceConfig;
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // Chain the configs together. The one provided first wins.
        return cliConfig
            .withFallback(envConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
