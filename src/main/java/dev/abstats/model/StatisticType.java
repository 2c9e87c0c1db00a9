package dev.abstats.model;

import dev.abstats.ConfigurationException;
import javax.annotation.Nullable;

/** How a metric's per-variation columns are turned into a sufficient statistic. */
public enum StatisticType {
    MEAN("mean"),
    MEAN_RA("mean_ra"),
    RATIO("ratio"),
    QUANTILE_EVENT("quantile_event"),
    QUANTILE_UNIT("quantile_unit");

    private final String value;

    StatisticType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isQuantile() {
        return this == QUANTILE_EVENT || this == QUANTILE_UNIT;
    }

    public static StatisticType fromValue(@Nullable String value) {
        for (var type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new ConfigurationException("Unexpected statistic_type: " + value);
    }
}
