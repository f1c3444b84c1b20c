package org.hdlscore.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;

/**
 * Central configuration loader for compilation sessions.
 * <p>
 * Composes HOCON configuration from multiple sources with the following precedence
 * (highest to lowest):
 * <ol>
 *   <li>Java system properties ({@code -Dkey=value})</li>
 *   <li>Environment variables</li>
 *   <li>An optional user configuration file</li>
 *   <li>Default reference configuration ({@code reference.conf} on the classpath)</li>
 * </ol>
 * <p>
 * Uses {@link ConfigFactory#defaultReferenceUnresolved()} to defer substitution resolution
 * until after all layers are composed.
 */
public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a file, merged with classpath defaults.
     *
     * @param configFile the configuration file to load.
     * @return the fully resolved application {@link Config}.
     * @throws IllegalArgumentException            if the file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config loadFromFile(final File configFile) {
        if (!configFile.exists()) {
            throw new IllegalArgumentException(
                    "Configuration file not found: " + configFile.getAbsolutePath());
        }
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads configuration from classpath defaults only (no user config file).
     *
     * @return the fully resolved application {@link Config}.
     */
    public static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads the session options, from {@code configFile} when given, otherwise from the
     * classpath defaults.
     *
     * @param configFile the configuration file, or {@code null}.
     * @return the session options.
     */
    public static SessionOptions loadSessionOptions(final File configFile) {
        Config config = configFile != null ? loadFromFile(configFile) : loadDefaults();
        return SessionOptions.fromConfig(config);
    }
}
