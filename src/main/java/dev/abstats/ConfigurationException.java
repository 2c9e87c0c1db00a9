package dev.abstats;

/**
 * Thrown when metric, analysis or engine settings cannot be interpreted, e.g. an unknown statistic
 * type or a quantile metric without a quantile level. Fatal to the enclosing experiment.
 */
public class ConfigurationException extends StatsEngineException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
