package org.minipy.node.config;

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
    static final String CONFIG_FILE_NAME = "minipy.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@code minipy.conf} in the working directory, if present.
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (e.g., -Dminipy.http.network.port=9090)
     * 3. Configuration File (the given file, or minipy.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile A configuration file chosen by the user, or null.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws IllegalArgumentException if an explicit file was given but does not exist.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or a substitution cannot be resolved.
     */
    public static Config load(final File explicitFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config sysPropsConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            LOG.info("Loading configuration from file: {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile);
        } else {
            final File configFile = new File(CONFIG_FILE_NAME);
            if (configFile.isFile()) {
                LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(configFile);
            } else {
                LOG.debug("Configuration file '{}' not found. Using defaults.", configFile.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
            .withFallback(sysPropsConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
