package dev.abstats.model;

import dev.abstats.ConfigurationException;
import javax.annotation.Nullable;

/** Distribution family of a single metric component. */
public enum MetricType {
    BINOMIAL("binomial"),
    COUNT("count");

    private final String value;

    MetricType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static MetricType fromValue(@Nullable String value) {
        if (value == null) {
            throw new ConfigurationException("Unexpectedly metric_type was null");
        }
        for (var type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new ConfigurationException("Unexpected metric_type: " + value);
    }
}
