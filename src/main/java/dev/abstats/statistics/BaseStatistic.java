package dev.abstats.statistics;

/** A single-component statistic; the building block of ratio and regression-adjusted statistics. */
public sealed interface BaseStatistic extends BanditStatistic
        permits ProportionStatistic, SampleMeanStatistic {

    double sum();

    double sumSquares();

    /** Same variant with sums multiplied by {@code factor} and sample size {@code newN}. */
    BaseStatistic rescaled(double factor, double newN);

    /** Pools the sums of two statistics of the same variant. */
    BaseStatistic plus(BaseStatistic other);
}
