package dev.abstats.statistics;

import dev.abstats.ConfigurationException;
import dev.abstats.model.MetricSettings;
import dev.abstats.model.MetricType;
import dev.abstats.model.RowColumns;
import dev.abstats.model.VariationColumns;
import javax.annotation.Nullable;

/** Builds the sufficient statistic of one variation's column group for a metric. */
public final class StatisticFactory {

    /** Which sum/sum-of-squares pair a base statistic reads. */
    public enum Component {
        MAIN,
        DENOMINATOR,
        COVARIATE
    }

    /**
     * @throws ConfigurationException when the statistic or component metric type is unknown, or a
     *     quantile statistic has no quantile level
     */
    public static TestStatistic variationStatistic(
            VariationColumns variation, MetricSettings metric) {
        var cols = variation.columns();
        return switch (metric.statistic()) {
            case QUANTILE_EVENT -> new QuantileClusteredStatistic(
                    cols.quantileN(),
                    cols.quantileNstar(),
                    requireQuantile(metric),
                    cols.quantile(),
                    cols.quantileLower(),
                    cols.quantileUpper(),
                    cols.mainSum(),
                    cols.mainSumSquares(),
                    cols.denominatorSum(),
                    cols.denominatorSumSquares(),
                    cols.mainDenominatorSumProduct(),
                    cols.users());
            case QUANTILE_UNIT -> new QuantileStatistic(
                    cols.quantileN(),
                    cols.quantileNstar(),
                    requireQuantile(metric),
                    cols.quantile(),
                    cols.quantileLower(),
                    cols.quantileUpper());
            case RATIO -> new RatioStatistic(
                    baseStatistic(cols, Component.MAIN, metric.mainMetricType()),
                    baseStatistic(cols, Component.DENOMINATOR, metric.denominatorMetricType()),
                    cols.mainDenominatorSumProduct(),
                    cols.users());
            case MEAN -> baseStatistic(cols, Component.MAIN, metric.mainMetricType());
            case MEAN_RA -> new RegressionAdjustedStatistic(
                    baseStatistic(cols, Component.MAIN, metric.mainMetricType()),
                    baseStatistic(cols, Component.COVARIATE, metric.covariateMetricType()),
                    cols.mainCovariateSumProduct(),
                    cols.users(),
                    // solved later by the test engine
                    0);
        };
    }

    public static BaseStatistic baseStatistic(
            RowColumns cols, Component component, @Nullable String metricType) {
        var sum =
                switch (component) {
                    case MAIN -> cols.mainSum();
                    case DENOMINATOR -> cols.denominatorSum();
                    case COVARIATE -> cols.covariateSum();
                };
        var sumSquares =
                switch (component) {
                    case MAIN -> cols.mainSumSquares();
                    case DENOMINATOR -> cols.denominatorSumSquares();
                    case COVARIATE -> cols.covariateSumSquares();
                };
        return switch (MetricType.fromValue(metricType)) {
            case BINOMIAL -> new ProportionStatistic(sum, cols.count());
            case COUNT -> new SampleMeanStatistic(sum, sumSquares, cols.count());
        };
    }

    private static double requireQuantile(MetricSettings metric) {
        if (metric.quantileValue() == null) {
            throw new ConfigurationException(
                    "quantile_value must be set for %s metric".formatted(metric.statisticType()));
        }
        return metric.quantileValue();
    }

    private StatisticFactory() {}
}
