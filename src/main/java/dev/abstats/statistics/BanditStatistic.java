package dev.abstats.statistics;

/** Statistics whose sums can be reweighted and pooled across bandit periods. */
public sealed interface BanditStatistic extends TestStatistic
        permits BaseStatistic, RatioStatistic, RegressionAdjustedStatistic {}
