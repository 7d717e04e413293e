package org.demangler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the demangler configuration from its layered sources.
 * The first source that defines a key wins.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "demangler.conf";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment variables
     * 2. Java system properties ({@code -Dkey=value})
     * 3. {@code demangler.conf} in the working directory
     * 4. Defaults from {@code reference.conf} on the classpath
     *
     * @return The resolved configuration.
     */
    public static Config load() {
        final File configFile = new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found. Using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }
        return layer(fileConfig);
    }

    /**
     * Loads the configuration with a classpath resource in place of the working directory file.
     *
     * @param resource The name of the classpath resource, e.g. {@code test-demangler.conf}.
     * @return The resolved configuration.
     */
    public static Config load(final String resource) {
        LOG.debug("Loading configuration from classpath resource: {}", resource);
        return layer(ConfigFactory.parseResources(resource));
    }

    private static Config layer(final Config fileConfig) {
        return ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }
}
