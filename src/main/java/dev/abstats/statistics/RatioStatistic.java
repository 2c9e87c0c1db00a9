package dev.abstats.statistics;

/**
 * Ratio of two per-unit sums (e.g. revenue per order). The variance follows from the delta method
 * over the numerator/denominator covariance.
 */
public record RatioStatistic(
        BaseStatistic mStatistic, BaseStatistic dStatistic, double mDSumOfProducts, double n)
        implements BanditStatistic {

    @Override
    public double mean() {
        return dStatistic.sum() == 0 ? 0 : mStatistic.sum() / dStatistic.sum();
    }

    public double covariance() {
        if (n <= 1) {
            return 0;
        }
        return (mDSumOfProducts - mStatistic.sum() * dStatistic.sum() / n) / (n - 1);
    }

    @Override
    public double variance() {
        var dMean = dStatistic.mean();
        if (dMean == 0) {
            return 0;
        }
        var mMean = mStatistic.mean();
        return mStatistic.variance() / Math.pow(dMean, 2)
                - 2 * covariance() * mMean / Math.pow(dMean, 3)
                + Math.pow(mMean, 2) * dStatistic.variance() / Math.pow(dMean, 4);
    }
}
