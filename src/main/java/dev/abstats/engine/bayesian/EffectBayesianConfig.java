package dev.abstats.engine.bayesian;

import dev.abstats.engine.TestConfig;
import dev.abstats.model.DifferenceType;

/**
 * @param inverse lower values are better; flips chance to win and risk
 * @param priorEffect prior on the effect
 * @param priorType scale the prior is expressed on, {@code relative} or {@code absolute}
 */
public record EffectBayesianConfig(
        double trafficProportionB,
        double phaseLengthDays,
        DifferenceType differenceType,
        double alpha,
        boolean inverse,
        GaussianPrior priorEffect,
        DifferenceType priorType)
        implements TestConfig {}
