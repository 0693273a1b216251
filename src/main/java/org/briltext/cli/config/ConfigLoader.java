package org.briltext.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the tool configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "bril.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@code bril.conf} from the working directory if it exists.
     *
     * @return A resolved {@link Config}.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Dbril.modules.directory=lib)
     * 2. Environment Variables
     * 3. Configuration File (the given file, or bril.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile An explicit configuration file, or null to look for {@code bril.conf}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws com.typesafe.config.ConfigException if an explicit file is missing or a file does not parse.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile != null) {
            LOG.debug("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile, ConfigParseOptions.defaults().setAllowMissing(false));
        } else {
            final File cwdConfigFile = new File(CONFIG_FILE_NAME);
            if (cwdConfigFile.isFile()) {
                LOG.debug("Loading configuration from file: {}", cwdConfigFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdConfigFile);
            } else {
                LOG.debug("Configuration file '{}' not found. Using defaults.", cwdConfigFile.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }

        // Chain the configs together. The one provided first wins.
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }
}
