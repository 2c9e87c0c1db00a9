package dev.abstats.model;

import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Per-metric analysis settings.
 *
 * <p>Statistic and metric types are kept as the raw strings supplied by the caller so that an
 * unknown type fails the experiment that uses it, not the parsing of a whole batch. Use {@link
 * #statistic()} and the component accessors to resolve them.
 *
 * @param id metric identifier
 * @param name display name
 * @param inverse true when lower values are better
 * @param statisticType one of {@code mean, mean_ra, ratio, quantile_event, quantile_unit}
 * @param mainMetricType {@code binomial} or {@code count}
 * @param denominatorMetricType component type of a ratio denominator
 * @param covariateMetricType component type of a CUPED covariate
 * @param quantileValue quantile level, required for quantile statistics
 * @param priorProper whether the Bayesian effect prior is proper
 * @param priorMean mean of the Bayesian effect prior
 * @param priorStddev standard deviation of the Bayesian effect prior
 */
public record MetricSettings(
        String id,
        @Nullable String name,
        Boolean inverse,
        String statisticType,
        @Nullable String mainMetricType,
        @Nullable String denominatorMetricType,
        @Nullable String covariateMetricType,
        @Nullable Double quantileValue,
        Boolean priorProper,
        Double priorMean,
        Double priorStddev) {

    public static final double DEFAULT_PRIOR_STDDEV = 0.3;

    public MetricSettings {
        inverse = Objects.requireNonNullElse(inverse, false);
        statisticType = Objects.requireNonNullElse(statisticType, StatisticType.MEAN.value());
        priorProper = Objects.requireNonNullElse(priorProper, false);
        priorMean = Objects.requireNonNullElse(priorMean, 0.0);
        priorStddev = Objects.requireNonNullElse(priorStddev, DEFAULT_PRIOR_STDDEV);
    }

    /** A plain {@code mean} metric over one component. */
    public static MetricSettings mean(String id, MetricType mainMetricType) {
        return new MetricSettings(
                id,
                id,
                false,
                StatisticType.MEAN.value(),
                mainMetricType.value(),
                null,
                null,
                null,
                false,
                0.0,
                DEFAULT_PRIOR_STDDEV);
    }

    public StatisticType statistic() {
        return StatisticType.fromValue(statisticType);
    }

    /** True for quantile statistics. Never throws, even for unknown statistic types. */
    public boolean isQuantile() {
        return StatisticType.QUANTILE_EVENT.value().equals(statisticType)
                || StatisticType.QUANTILE_UNIT.value().equals(statisticType);
    }

    public MetricSettings withStatisticType(String type) {
        return new MetricSettings(
                id,
                name,
                inverse,
                type,
                mainMetricType,
                denominatorMetricType,
                covariateMetricType,
                quantileValue,
                priorProper,
                priorMean,
                priorStddev);
    }

    public MetricSettings withComponents(
            @Nullable String denominatorType, @Nullable String covariateType) {
        return new MetricSettings(
                id,
                name,
                inverse,
                statisticType,
                mainMetricType,
                denominatorType,
                covariateType,
                quantileValue,
                priorProper,
                priorMean,
                priorStddev);
    }

    public MetricSettings withQuantile(@Nullable Double quantile) {
        return new MetricSettings(
                id,
                name,
                inverse,
                statisticType,
                mainMetricType,
                denominatorMetricType,
                covariateMetricType,
                quantile,
                priorProper,
                priorMean,
                priorStddev);
    }

    public MetricSettings withPrior(boolean proper, double mean, double stddev) {
        return new MetricSettings(
                id,
                name,
                inverse,
                statisticType,
                mainMetricType,
                denominatorMetricType,
                covariateMetricType,
                quantileValue,
                proper,
                mean,
                stddev);
    }

    public MetricSettings withInverse(boolean isInverse) {
        return new MetricSettings(
                id,
                name,
                isInverse,
                statisticType,
                mainMetricType,
                denominatorMetricType,
                covariateMetricType,
                quantileValue,
                priorProper,
                priorMean,
                priorStddev);
    }
}
