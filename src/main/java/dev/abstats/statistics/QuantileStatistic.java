package dev.abstats.statistics;

import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Quantile estimate where the unit of analysis is also the unit of randomization.
 *
 * @param n number of observations
 * @param nStar effective sample size used when the query computed the bounds
 * @param nu quantile level, e.g. 0.9
 * @param quantileHat point estimate of the quantile
 * @param quantileLower lower bound of the 95% order-statistic interval
 * @param quantileUpper upper bound of the 95% order-statistic interval
 */
public record QuantileStatistic(
        double n,
        double nStar,
        double nu,
        double quantileHat,
        double quantileLower,
        double quantileUpper)
        implements TestStatistic {

    static final double BOUNDS_Z = new NormalDistribution().inverseCumulativeProbability(0.975);

    @Override
    public double mean() {
        return quantileHat;
    }

    @Override
    public double variance() {
        return quantileVariance(n, quantileLower, quantileUpper);
    }

    /** Per-unit variance recovered from the width of the 95% bounds. */
    static double quantileVariance(double n, double lower, double upper) {
        if (n <= 1) {
            return 0;
        }
        var standardError = (upper - lower) / (2 * BOUNDS_Z);
        return n * standardError * standardError;
    }
}
