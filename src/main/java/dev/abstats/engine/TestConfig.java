package dev.abstats.engine;

import dev.abstats.model.DifferenceType;

/** Settings shared by every test engine. */
public interface TestConfig {
    /** Configured traffic share of the variation under test. */
    double trafficProportionB();

    double phaseLengthDays();

    DifferenceType differenceType();

    double alpha();
}
