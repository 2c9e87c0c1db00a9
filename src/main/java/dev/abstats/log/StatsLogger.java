package dev.abstats.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized logging for the stats engine. Lets hosts route or silence all engine output through a
 * single logger name.
 */
public final class StatsLogger {
    private static final String LOGGER_NAME = "abstats";

    /**
     * Get or create the abstats logger
     *
     * <p>Note: this calls LoggerFactory which may initialize a global logger. Set your desired
     * logging globals before calling this method.
     */
    public static Logger get() {
        return LoggerFactory.getLogger(LOGGER_NAME);
    }

    private StatsLogger() {}
}
