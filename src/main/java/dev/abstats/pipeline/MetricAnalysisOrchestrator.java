package dev.abstats.pipeline;

import dev.abstats.engine.ABTest;
import dev.abstats.engine.ABTestFactory;
import dev.abstats.engine.TestResult;
import dev.abstats.model.AnalysisSettings;
import dev.abstats.model.DimensionRecord;
import dev.abstats.model.MetricSettings;
import dev.abstats.model.RawAggregateRow;
import dev.abstats.statistics.StatisticFactory;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one analysis of one metric: aggregate rows into dimensions, cap the dimension count, then
 * test every variation against the baseline in every dimension.
 */
@Slf4j
public final class MetricAnalysisOrchestrator {
    private final ABTestFactory testFactory;

    public MetricAnalysisOrchestrator() {
        this(new TestEngineSelector());
    }

    public MetricAnalysisOrchestrator(ABTestFactory testFactory) {
        this.testFactory = testFactory;
    }

    public List<AnalyzedDimension> processAnalysis(
            List<RawAggregateRow> rows,
            MetricSettings metric,
            AnalysisSettings analysis,
            int defaultMaxDimensions) {
        var source = analysis.isDailyTimeSeries() ? DimensionAggregator.diffDailyTimeSeries(rows) : rows;
        var records =
                DimensionAggregator.aggregate(
                        source,
                        analysis.varIdMap(),
                        analysis.varNames(),
                        DimensionAggregator.Keying.DIMENSION);
        // quantile estimates cannot be summed into an "(other)" bucket
        var reduced =
                DimensionReducer.reduce(
                        records, analysis.maxDimensionsOr(defaultMaxDimensions), !metric.isQuantile());
        return analyze(reduced, metric, analysis);
    }

    public List<AnalyzedDimension> analyze(
            List<DimensionRecord> records, MetricSettings metric, AnalysisSettings analysis) {
        var analyzed = new ArrayList<AnalyzedDimension>(records.size());
        for (var record : records) {
            analyzed.add(analyzeDimension(record, metric, analysis));
        }
        return analyzed;
    }

    /**
     * @throws dev.abstats.ConfigurationException when the metric's statistic cannot be built
     */
    AnalyzedDimension analyzeDimension(
            DimensionRecord record, MetricSettings metric, AnalysisSettings analysis) {
        var baselineColumns = record.baseline();
        var baselineStat = StatisticFactory.variationStatistic(baselineColumns, metric);
        var baseline =
                AnalyzedVariation.baseline(
                        baselineColumns,
                        baselineStat.unadjustedMean(),
                        baselineStat.stddev(),
                        baselineColumns.columns().count());

        var variations = new ArrayList<AnalyzedVariation>(record.variationCount() - 1);
        for (int i = 1; i < record.variationCount(); i++) {
            var columns = record.variation(i);
            var test =
                    testFactory.create(
                            baselineStat,
                            StatisticFactory.variationStatistic(columns, metric),
                            i,
                            analysis,
                            metric);
            var result = computeResult(test, record.key(), i);
            // the test's view of the baseline, CUPED theta applied
            baseline =
                    AnalyzedVariation.baseline(
                            baselineColumns,
                            test.statA().unadjustedMean(),
                            test.statA().stddev(),
                            baselineColumns.columns().count());
            variations.add(
                    new AnalyzedVariation(
                            columns,
                            test.statB().unadjustedMean(),
                            test.statB().stddev(),
                            columns.columns().count(),
                            result,
                            expectedEffect(test, result)));
        }

        if (metric.isQuantile()) {
            baseline = baseline.withCount(baselineColumns.columns().quantileN());
            variations.replaceAll(v -> v.withCount(v.columns().columns().quantileN()));
        }

        var users = new ArrayList<Double>(record.variationCount());
        for (var variation : record.variations()) {
            users.add(variation.columns().users());
        }
        return new AnalyzedDimension(
                record.key(), SrmCheck.check(users, analysis.weights()), baseline, variations);
    }

    /**
     * A relative effect is undefined for a non-positive baseline, so it is reported as 0. An engine
     * expectation of exactly 0 means none was computed and the raw relative difference is used.
     */
    static double expectedEffect(ABTest test, TestResult result) {
        var baselineMean = test.statA().unadjustedMean();
        if (baselineMean <= 0) {
            return 0;
        }
        if (result.expected() == 0) {
            return (test.statB().mean() - test.statA().mean()) / baselineMean;
        }
        return result.expected();
    }

    private static TestResult computeResult(ABTest test, String dimension, int variation) {
        try {
            return test.computeResult();
        } catch (RuntimeException e) {
            log.warn(
                    "test of variation {} in dimension '{}' failed: {}",
                    variation,
                    dimension,
                    e.getMessage());
            return test.defaultResult(String.valueOf(e.getMessage()));
        }
    }
}
