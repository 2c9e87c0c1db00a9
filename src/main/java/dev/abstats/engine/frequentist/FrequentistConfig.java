package dev.abstats.engine.frequentist;

import dev.abstats.engine.TestConfig;
import dev.abstats.model.DifferenceType;

public record FrequentistConfig(
        double trafficProportionB,
        double phaseLengthDays,
        DifferenceType differenceType,
        double alpha)
        implements TestConfig {}
