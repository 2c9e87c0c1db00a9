package dev.abstats.engine.frequentist;

import dev.abstats.engine.TestConfig;
import dev.abstats.model.DifferenceType;

/**
 * @param sequentialTuningParameter sample size at which the mixture boundary is tightest
 */
public record SequentialConfig(
        double trafficProportionB,
        double phaseLengthDays,
        DifferenceType differenceType,
        double alpha,
        double sequentialTuningParameter)
        implements TestConfig {}
