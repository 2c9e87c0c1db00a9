package dev.abstats.statistics;

/**
 * Sufficient statistic of one variation's metric, as consumed by a test engine. Instances are
 * immutable and built fresh for every (dimension, variation) pair.
 */
public sealed interface TestStatistic
        permits BanditStatistic, QuantileStatistic, QuantileClusteredStatistic {

    /** Sample size the engine divides the variance by. */
    double n();

    /** Point estimate, after any regression adjustment. */
    double mean();

    /** Per-unit variance, so that {@code variance() / n()} is the variance of {@link #mean()}. */
    double variance();

    /** Point estimate before any regression adjustment. */
    default double unadjustedMean() {
        return mean();
    }

    default double stddev() {
        var variance = variance();
        return variance <= 0 ? 0 : Math.sqrt(variance);
    }
}
