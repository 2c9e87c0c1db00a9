package dev.abstats.pipeline;

import static org.assertj.core.api.Assertions.*;

import dev.abstats.engine.ABTest;
import dev.abstats.engine.ABTestFactory;
import dev.abstats.engine.FrequentistTestResult;
import dev.abstats.engine.TestResult;
import dev.abstats.engine.Uplift;
import dev.abstats.engine.frequentist.TwoSidedTTest;
import dev.abstats.engine.bayesian.EffectBayesianABTest;
import dev.abstats.engine.frequentist.SequentialTwoSidedTTest;
import dev.abstats.model.AnalysisSettings;
import dev.abstats.model.DimensionRecord;
import dev.abstats.model.MetricSettings;
import dev.abstats.model.MetricType;
import dev.abstats.model.RawAggregateRow;
import dev.abstats.model.RowColumns;
import dev.abstats.model.StatsEngineType;
import dev.abstats.model.VariationColumns;
import dev.abstats.statistics.TestStatistic;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetricAnalysisOrchestratorTest {
    private static final MetricSettings BINOMIAL = MetricSettings.mean("m", MetricType.BINOMIAL);
    private static final AnalysisSettings THREE_WAY =
            AnalysisSettings.builder()
                    .variations(List.of("0", "1", "2"), List.of("A", "B", "C"))
                    .statsEngine(StatsEngineType.FREQUENTIST)
                    .build();

    /** Engine stand-in that reports a fixed expectation, or throws for one variation. */
    private record StubTest(TestStatistic statA, TestStatistic statB, double expected, boolean fail)
            implements ABTest {
        @Override
        public TestResult computeResult() {
            if (fail) {
                throw new IllegalStateException("solver diverged");
            }
            return new FrequentistTestResult(
                    expected, List.of(-1.0, 1.0), Uplift.normal(expected, 1), null, 0.2);
        }

        @Override
        public TestResult defaultResult(String errorMessage) {
            return FrequentistTestResult.defaultResult(errorMessage);
        }
    }

    private static ABTestFactory stub(double expected) {
        return (statA, statB, index, analysis, metric) ->
                new StubTest(statA, statB, expected, false);
    }

    private static VariationColumns binomial(String id, double users, double conversions) {
        return new VariationColumns(
                id, id, RowColumns.builder().users(users).main(conversions, conversions).build());
    }

    private static DimensionRecord record(VariationColumns... variations) {
        var total = 0.0;
        for (var variation : variations) {
            total += variation.columns().users();
        }
        return new DimensionRecord("all", total, List.of(variations));
    }

    @Test
    void zeroBaselineMeanForcesZeroExpected() {
        // Given
        var orchestrator = new MetricAnalysisOrchestrator(stub(0.7));
        var dimension =
                record(binomial("0", 1000, 0), binomial("1", 1000, 50), binomial("2", 1000, 80));

        // When
        var analyzed = orchestrator.analyze(List.of(dimension), BINOMIAL, THREE_WAY);

        // Then
        assertThat(analyzed.get(0).variations())
                .extracting(AnalyzedVariation::expected)
                .containsExactly(0.0, 0.0);
        assertThat(analyzed.get(0).variations())
                .allSatisfy(v -> assertThat(v.result().expected()).isEqualTo(0.7));
    }

    @Test
    void zeroEngineExpectationFallsBackToRawDifference() {
        var orchestrator = new MetricAnalysisOrchestrator(stub(0));
        var dimension = record(binomial("0", 1000, 100), binomial("1", 1000, 120));

        var analyzed =
                orchestrator.analyze(
                        List.of(dimension),
                        BINOMIAL,
                        AnalysisSettings.builder()
                                .variations(List.of("0", "1"), List.of("A", "B"))
                                .build());

        assertThat(analyzed.get(0).variations().get(0).expected()).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void engineExpectationIsUsedOtherwise() {
        var orchestrator = new MetricAnalysisOrchestrator(stub(0.42));
        var dimension = record(binomial("0", 1000, 100), binomial("1", 1000, 120));

        var analyzed =
                orchestrator.analyze(
                        List.of(dimension),
                        BINOMIAL,
                        AnalysisSettings.builder()
                                .variations(List.of("0", "1"), List.of("A", "B"))
                                .build());

        var variation = analyzed.get(0).variations().get(0);
        assertThat(variation.expected()).isEqualTo(0.42);
        assertThat(variation.mean()).isCloseTo(0.12, within(1e-12));
        assertThat(analyzed.get(0).baseline().mean()).isCloseTo(0.1, within(1e-12));
        assertThat(analyzed.get(0).baseline().stddev()).isCloseTo(0.3, within(1e-12));
        assertThat(analyzed.get(0).baseline().result()).isNull();
    }

    @Test
    void failingVariationDoesNotStopItsSiblings() {
        ABTestFactory factory =
                (statA, statB, index, analysis, metric) ->
                        new StubTest(statA, statB, 0.3, index == 1);
        var orchestrator = new MetricAnalysisOrchestrator(factory);
        var dimension =
                record(binomial("0", 1000, 100), binomial("1", 1000, 120), binomial("2", 1000, 90));

        var variations =
                orchestrator.analyze(List.of(dimension), BINOMIAL, THREE_WAY).get(0).variations();

        assertThat(variations.get(0).result().errorMessage()).isEqualTo("solver diverged");
        assertThat(variations.get(1).result().errorMessage()).isNull();
        assertThat(variations.get(1).expected()).isEqualTo(0.3);
    }

    @Test
    void quantileMetricsReportQuantileSampleSizeAsCount() {
        // Given
        var metric =
                MetricSettings.mean("p90", MetricType.COUNT)
                        .withStatisticType("quantile_unit")
                        .withQuantile(0.9);
        var dimension =
                record(
                        new VariationColumns(
                                "0",
                                "A",
                                RowColumns.builder()
                                        .users(1000)
                                        .quantile(640, 640, 12, 11, 13)
                                        .build()),
                        new VariationColumns(
                                "1",
                                "B",
                                RowColumns.builder()
                                        .users(1000)
                                        .quantile(655, 655, 13, 12, 14)
                                        .build()));

        // When
        var analyzed =
                new MetricAnalysisOrchestrator()
                        .analyze(
                                List.of(dimension),
                                metric,
                                AnalysisSettings.builder()
                                        .variations(List.of("0", "1"), List.of("A", "B"))
                                        .statsEngine(StatsEngineType.FREQUENTIST)
                                        .build())
                        .get(0);

        // Then
        assertThat(analyzed.baseline().count()).isEqualTo(640);
        assertThat(analyzed.variations().get(0).count()).isEqualTo(655);
        assertThat(analyzed.variations().get(0).mean()).isEqualTo(13);
    }

    @Test
    void srmIsComputedFromUsersAndWeights() {
        var orchestrator = new MetricAnalysisOrchestrator(stub(0.1));
        var analysis =
                AnalysisSettings.builder().variations(List.of("0", "1"), List.of("A", "B")).build();

        var balanced =
                orchestrator.analyze(
                        List.of(record(binomial("0", 5000, 500), binomial("1", 5000, 520))),
                        BINOMIAL,
                        analysis);
        var skewed =
                orchestrator.analyze(
                        List.of(record(binomial("0", 9000, 900), binomial("1", 1000, 100))),
                        BINOMIAL,
                        analysis);

        assertThat(balanced.get(0).srmP()).isGreaterThan(0.5);
        assertThat(skewed.get(0).srmP()).isLessThan(0.01);
    }

    @Test
    void processAnalysisCapsDimensionsAndSkipsOtherForQuantiles() {
        // Given four dimensions
        var rows = new ArrayList<RawAggregateRow>();
        var users = 100;
        for (var dimension : List.of("a", "b", "c", "d")) {
            for (var variation : List.of("0", "1")) {
                rows.add(
                        RawAggregateRow.of(
                                variation,
                                dimension,
                                RowColumns.builder()
                                        .users(users)
                                        .main(users / 10.0, users / 10.0)
                                        .quantile(users, users, 5, 4, 6)
                                        .build()));
            }
            users += 100;
        }
        var analysis =
                AnalysisSettings.builder()
                        .variations(List.of("0", "1"), List.of("A", "B"))
                        .statsEngine(StatsEngineType.FREQUENTIST)
                        .maxDimensions(2)
                        .build();
        var quantile = BINOMIAL.withStatisticType("quantile_unit").withQuantile(0.5);
        var orchestrator = new MetricAnalysisOrchestrator();

        // When
        var mean = orchestrator.processAnalysis(rows, BINOMIAL, analysis, 20);
        var quantiles = orchestrator.processAnalysis(rows, quantile, analysis, 20);

        // Then
        assertThat(mean).extracting(AnalyzedDimension::dimension).containsExactly("d", "(other)");
        assertThat(quantiles).extracting(AnalyzedDimension::dimension).containsExactly("d", "c");
    }

    @Test
    void defaultSelectorPicksTheConfiguredEngine() {
        var selector = new TestEngineSelector();
        var stat = new dev.abstats.statistics.ProportionStatistic(10, 100);
        var builder = AnalysisSettings.builder().variations(List.of("0", "1"), List.of("A", "B"));

        assertThat(selector.create(stat, stat, 1, builder.build(), BINOMIAL))
                .isInstanceOf(EffectBayesianABTest.class);
        assertThat(
                        selector.create(
                                stat,
                                stat,
                                1,
                                builder.statsEngine(StatsEngineType.FREQUENTIST).build(),
                                BINOMIAL))
                .isInstanceOf(TwoSidedTTest.class);
        assertThat(selector.create(stat, stat, 1, builder.sequential(5000).build(), BINOMIAL))
                .isInstanceOf(SequentialTwoSidedTTest.class);
    }
}
