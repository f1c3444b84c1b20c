package org.hdlscore.compiler.config;

import com.typesafe.config.Config;

/**
 * Session-wide options consulted by the scoreboard.
 *
 * @param traceScoreboard     Log every definition as it is declared.
 * @param ignoreDuplicateDefs Report duplicate design unit names in a library as warnings
 *                            instead of failing the library's definitions; the first
 *                            declaration wins.
 */
public record SessionOptions(boolean traceScoreboard, boolean ignoreDuplicateDefs) {

    /** The configuration path holding the session block. */
    public static final String CONFIG_PATH = "hdlscore.session";

    /**
     * Options with every flag disabled.
     */
    public static SessionOptions defaults() {
        return new SessionOptions(false, false);
    }

    /**
     * Reads the options from an application configuration.
     *
     * @param config The resolved application configuration containing {@value #CONFIG_PATH}.
     * @return The session options.
     * @throws com.typesafe.config.ConfigException if the block is missing or malformed.
     */
    public static SessionOptions fromConfig(Config config) {
        Config session = config.getConfig(CONFIG_PATH);
        return new SessionOptions(
                session.getBoolean("trace-scoreboard"),
                session.getBoolean("ignore-duplicate-defs"));
    }
}
