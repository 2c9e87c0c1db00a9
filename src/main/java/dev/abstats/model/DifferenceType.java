package dev.abstats.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.abstats.ConfigurationException;

/** Scale on which the variation-vs-baseline effect is reported. */
public enum DifferenceType {
    /** (variation - baseline) / baseline */
    RELATIVE("relative"),
    /** variation - baseline */
    ABSOLUTE("absolute"),
    /** absolute difference projected to total daily impact */
    SCALED("scaled");

    private final String value;

    DifferenceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static DifferenceType fromValue(String value) {
        for (var type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new ConfigurationException("Unexpected difference_type: " + value);
    }
}
