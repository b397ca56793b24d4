package org.cataphract.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the engine configuration from layered sources.
 * Earlier sources win over later ones.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "cataphract.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@value #CONFIG_FILE_NAME} from the working directory.
     *
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(CONFIG_FILE_NAME);
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (-Dkey=value)
     * 3. The given configuration file, or a classpath resource of that name
     * 4. Default values (reference.conf on the classpath)
     *
     * @param fileName Path of the host configuration file.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String fileName) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertyConfig = ConfigFactory.systemProperties();

        final File configFile = new File(fileName);
        Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            fileConfig = ConfigFactory.parseResources(fileName);
            if (fileConfig.isEmpty()) {
                LOG.debug("Configuration file '{}' not found or is empty. Using defaults.", fileName);
            }
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        return envConfig
            .withFallback(propertyConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
