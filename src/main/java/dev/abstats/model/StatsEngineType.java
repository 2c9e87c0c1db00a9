package dev.abstats.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum StatsEngineType {
    BAYESIAN("bayesian"),
    FREQUENTIST("frequentist");

    private final String value;

    StatsEngineType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Anything other than {@code frequentist} selects the Bayesian engine. */
    @JsonCreator
    public static StatsEngineType fromValue(String value) {
        return FREQUENTIST.value.equals(value) ? FREQUENTIST : BAYESIAN;
    }
}
