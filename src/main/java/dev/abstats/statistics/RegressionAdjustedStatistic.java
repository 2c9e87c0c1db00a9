package dev.abstats.statistics;

import java.util.List;

/**
 * CUPED statistic: the post-exposure metric adjusted by {@code theta} times a pre-exposure
 * covariate. {@code theta} starts as a placeholder and is solved by the test engine from the pooled
 * baseline and variation data.
 */
public record RegressionAdjustedStatistic(
        BaseStatistic postStatistic,
        BaseStatistic preStatistic,
        double postPreSumOfProducts,
        double n,
        double theta)
        implements BanditStatistic {

    @Override
    public double mean() {
        return postStatistic.mean() - theta * preStatistic.mean();
    }

    @Override
    public double unadjustedMean() {
        return postStatistic.mean();
    }

    public double covariance() {
        if (n <= 1) {
            return 0;
        }
        return (postPreSumOfProducts - postStatistic.sum() * preStatistic.sum() / n) / (n - 1);
    }

    @Override
    public double variance() {
        return postStatistic.variance()
                + Math.pow(theta, 2) * preStatistic.variance()
                - 2 * theta * covariance();
    }

    public RegressionAdjustedStatistic withTheta(double newTheta) {
        return new RegressionAdjustedStatistic(
                postStatistic, preStatistic, postPreSumOfProducts, n, newTheta);
    }

    /**
     * Variance-minimising theta for the pooled statistics. 0 when either pooled component has no
     * variance.
     */
    public static double computeTheta(List<RegressionAdjustedStatistic> statistics) {
        if (statistics.isEmpty()) {
            return 0;
        }
        var post = statistics.get(0).postStatistic();
        var pre = statistics.get(0).preStatistic();
        var products = statistics.get(0).postPreSumOfProducts();
        var n = statistics.get(0).n();
        for (var stat : statistics.subList(1, statistics.size())) {
            post = post.plus(stat.postStatistic());
            pre = pre.plus(stat.preStatistic());
            products += stat.postPreSumOfProducts();
            n += stat.n();
        }
        if (post.variance() <= 0 || pre.variance() <= 0) {
            return 0;
        }
        var joint = new RegressionAdjustedStatistic(post, pre, products, n, 0);
        return joint.covariance() / pre.variance();
    }
}
