package dev.abstats.engine.bandit;

import dev.abstats.engine.bayesian.GaussianPrior;
import javax.annotation.Nullable;

/**
 * @param priorDistribution prior of every arm's mean
 * @param banditWeightsSeed sampler seed; drawn at random when null
 * @param weightByPeriod reweight period aggregates so allocation changes do not bias arm means
 * @param topTwo use top-two Thompson sampling weights instead of best-arm probabilities
 * @param alpha significance level of the per-arm intervals
 * @param inverse lower values are better
 * @param draws Monte Carlo draws used for best-arm probabilities
 * @param minWeight floor applied to every arm weight before renormalising
 */
public record BanditConfig(
        GaussianPrior priorDistribution,
        @Nullable Long banditWeightsSeed,
        boolean weightByPeriod,
        boolean topTwo,
        double alpha,
        boolean inverse,
        int draws,
        double minWeight) {}
