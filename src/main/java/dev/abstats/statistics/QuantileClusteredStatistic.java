package dev.abstats.statistics;

/**
 * Quantile estimate of events clustered within randomization units (e.g. page-load time per
 * user). The unclustered variance is inflated by the design effect measured from the per-cluster
 * share of events below the quantile: {@code mainSum} counts those events and {@code
 * denominatorSum} counts all events.
 */
public record QuantileClusteredStatistic(
        double n,
        double nStar,
        double nu,
        double quantileHat,
        double quantileLower,
        double quantileUpper,
        double mainSum,
        double mainSumSquares,
        double denominatorSum,
        double denominatorSumSquares,
        double mainDenominatorSumProduct,
        double nClusters)
        implements TestStatistic {

    @Override
    public double mean() {
        return quantileHat;
    }

    @Override
    public double variance() {
        var unclustered = QuantileStatistic.quantileVariance(n, quantileLower, quantileUpper);
        return unclustered * designEffect();
    }

    /** Ratio of clustered to independent-events variance of the below-quantile share; at least 1. */
    public double designEffect() {
        if (nClusters <= 1 || n <= 0 || nu <= 0 || nu >= 1) {
            return 1;
        }
        var share =
                new RatioStatistic(
                        new SampleMeanStatistic(mainSum, mainSumSquares, nClusters),
                        new SampleMeanStatistic(denominatorSum, denominatorSumSquares, nClusters),
                        mainDenominatorSumProduct,
                        nClusters);
        var clusteredVariance = share.variance() / nClusters;
        var independentVariance = nu * (1 - nu) / n;
        if (!(clusteredVariance > 0)) {
            return 1;
        }
        return Math.max(1, clusteredVariance / independentVariance);
    }
}
