package dev.abstats.runner;

import static org.assertj.core.api.Assertions.*;

import dev.abstats.DuplicateBanditDecisionMetricException;
import dev.abstats.config.StatsEngineConfig;
import dev.abstats.model.AnalysisSettings;
import dev.abstats.model.BanditSettings;
import dev.abstats.model.ExperimentData;
import dev.abstats.model.ExperimentInput;
import dev.abstats.model.MetricSettings;
import dev.abstats.model.MetricType;
import dev.abstats.model.QueryResult;
import dev.abstats.model.RawAggregateRow;
import dev.abstats.model.RowColumns;
import dev.abstats.model.StatsEngineType;
import dev.abstats.model.results.BaselineResponse;
import dev.abstats.model.results.FrequentistVariationResponse;
import dev.abstats.pipeline.BanditPipeline;
import dev.abstats.pipeline.MetricAnalysisOrchestrator;
import dev.abstats.trace.StatsTracing;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.testing.junit5.OpenTelemetryExtension;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

public class ExperimentRunnerTest {
    @RegisterExtension
    static final OpenTelemetryExtension otelTesting = OpenTelemetryExtension.create();

    private static final MetricSettings CONVERSION = MetricSettings.mean("conv", MetricType.BINOMIAL);
    private static final AnalysisSettings FREQUENTIST =
            AnalysisSettings.builder()
                    .variations(List.of("0", "1"), List.of("Control", "Treatment"))
                    .statsEngine(StatsEngineType.FREQUENTIST)
                    .build();

    private StatsEngineConfig config;
    private ExperimentRunner runner;

    @BeforeEach
    void beforeEach() {
        config = StatsEngineConfig.of();
        runner =
                new ExperimentRunner(
                        config,
                        new MetricAnalysisOrchestrator(),
                        BanditPipeline.of(config),
                        otelTesting.getOpenTelemetry().getTracer("test"));
    }

    private static Map<String, Object> queryRow(
            String variation, String dimension, double users, double conversions) {
        return Map.of(
                "variation", variation,
                "dimension", dimension,
                "m0_users", users,
                "m0_main_sum", conversions,
                "m0_main_sum_squares", conversions);
    }

    private static ExperimentData conversionExperiment(MetricSettings metric) {
        return new ExperimentData(
                Map.of(metric.id(), metric),
                List.of(FREQUENTIST),
                List.of(
                        new QueryResult(
                                List.of(metric.id()),
                                List.of(
                                        queryRow("0", "", 1000, 100),
                                        queryRow("1", "", 1000, 150)))),
                null);
    }

    @Test
    void analysesAFrequentistConversionMetric() {
        // When
        var results = runner.processExperimentResults(conversionExperiment(CONVERSION));

        // Then
        assertThat(results.banditResult()).isNull();
        assertThat(results.results()).hasSize(1);
        var analysis = results.results().get(0);
        assertThat(analysis.metric()).isEqualTo("conv");
        var dimension = analysis.analyses().get(0).dimensions().get(0);
        assertThat(dimension.variations().get(0)).isInstanceOf(BaselineResponse.class);
        assertThat(dimension.variations().get(0).cr()).isCloseTo(0.1, within(1e-12));
        var treatment = (FrequentistVariationResponse) dimension.variations().get(1);
        assertThat(treatment.expected()).isCloseTo(0.5, within(1e-9));
        assertThat(treatment.pValue()).isLessThan(0.01);
        assertThat(treatment.ci().get(0)).isLessThan(0.5);
        assertThat(treatment.ci().get(1)).isGreaterThan(0.5);
        assertThat(treatment.errorMessage()).isNull();
    }

    @Test
    void unknownVariationsAreReported() {
        var rows =
                List.of(
                        RawAggregateRow.of("0", "", RowColumns.builder().users(100).main(10, 10).build()),
                        RawAggregateRow.of("1", "", RowColumns.builder().users(100).main(12, 12).build()),
                        RawAggregateRow.of("zzz", "", RowColumns.builder().users(3).build()),
                        RawAggregateRow.of(
                                "__multiple__", "", RowColumns.builder().users(2).build()));

        var analysis = runner.processSingleMetric(rows, CONVERSION, List.of(FREQUENTIST));

        assertThat(analysis.analyses().get(0).unknownVariations()).containsExactly("zzz");
        assertThat(analysis.analyses().get(0).multipleExposures()).isZero();
    }

    @Test
    void emptyRowsGiveBlankAnalyses() {
        var analysis =
                runner.processSingleMetric(List.of(), CONVERSION, List.of(FREQUENTIST, FREQUENTIST));

        assertThat(analysis.analyses()).hasSize(2);
        assertThat(analysis.analyses())
                .allSatisfy(
                        result -> {
                            assertThat(result.dimensions()).isEmpty();
                            assertThat(result.unknownVariations()).isEmpty();
                        });
    }

    @Test
    void metricsWithoutSettingsAreSkipped() {
        var data =
                new ExperimentData(
                        Map.of("conv", CONVERSION),
                        List.of(FREQUENTIST),
                        List.of(
                                new QueryResult(
                                        List.of("other", "conv"),
                                        List.of(
                                                Map.of(
                                                        "variation", "0",
                                                        "dimension", "",
                                                        "m1_users", 100,
                                                        "m1_main_sum", 10)))),
                        null);

        var results = runner.processExperimentResults(data);

        assertThat(results.results()).extracting(r -> r.metric()).containsExactly("conv");
    }

    @Test
    void batchKeepsOrderAndIsolatesFailures() {
        // Given
        var broken = CONVERSION.withStatisticType("percentile_of_something_that_does_not_exist_at_all");
        var inputs =
                List.of(
                        new ExperimentInput("exp-1", conversionExperiment(CONVERSION)),
                        new ExperimentInput("exp-2", conversionExperiment(broken)),
                        new ExperimentInput("exp-3", conversionExperiment(CONVERSION)));

        // When
        var results = runner.processMultipleExperimentResults(inputs);

        // Then
        assertThat(results).extracting(r -> r.id()).containsExactly("exp-1", "exp-2", "exp-3");
        assertThat(results.get(0).error()).isNull();
        assertThat(results.get(0).results()).hasSize(1);
        assertThat(results.get(1).results()).isEmpty();
        assertThat(results.get(1).banditResult()).isNull();
        assertThat(results.get(1).error())
                .startsWith("Unexpected statistic_type: ")
                .hasSize(config.errorMessageLimit());
        assertThat(results.get(2).results()).isEqualTo(results.get(0).results());
    }

    @Test
    void parallelBatchMatchesSequentialBatch() {
        var parallelConfig = StatsEngineConfig.of("ABSTATS_PARALLEL", "true");
        var parallel =
                new ExperimentRunner(
                        parallelConfig,
                        new MetricAnalysisOrchestrator(),
                        BanditPipeline.of(parallelConfig),
                        otelTesting.getOpenTelemetry().getTracer("test"));
        var inputs = new ArrayList<ExperimentInput>();
        for (int i = 0; i < 8; i++) {
            inputs.add(new ExperimentInput("exp-" + i, conversionExperiment(CONVERSION)));
        }

        assertThat(parallel.processMultipleExperimentResults(inputs))
                .isEqualTo(runner.processMultipleExperimentResults(inputs));
    }

    @Test
    void asyncBatchCompletes() throws Exception {
        var inputs = List.of(new ExperimentInput("exp-1", conversionExperiment(CONVERSION)));

        var results =
                runner.processMultipleExperimentResultsAsync(inputs).get(30, TimeUnit.SECONDS);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).error()).isNull();
    }

    @Test
    void experimentSpanIsRecorded() {
        runner.processMultipleExperimentResults(
                List.of(new ExperimentInput("exp-1", conversionExperiment(CONVERSION))));

        var spans = otelTesting.getSpans();
        assertThat(spans).hasSize(1);
        var span = spans.get(0);
        assertThat(span.getName()).isEqualTo(StatsTracing.EXPERIMENT_SPAN);
        assertThat(span.getAttributes().get(StatsTracing.EXPERIMENT_ID)).isEqualTo("exp-1");
        assertThat(span.getAttributes().get(StatsTracing.METRIC_COUNT)).isEqualTo(1L);
        assertThat(span.getStatus().getStatusCode()).isNotEqualTo(StatusCode.ERROR);
    }

    @Test
    void failedExperimentSpanHasErrorStatus() {
        var results =
                runner.processMultipleExperimentResults(
                        List.of(new ExperimentInput("exp-1", null)));

        assertThat(results.get(0).error()).isEqualTo("experiment has no data");
        var span = otelTesting.getSpans().get(0);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(span.getEvents()).extracting(e -> e.getName()).contains("exception");
    }

    private static Map<String, Object> periodRow(
            String variation, String period, double users, double conversions) {
        return Map.of(
                "variation", variation,
                "dimension", "",
                "bandit_period", period,
                "m0_users", users,
                "m0_main_sum", conversions,
                "m0_main_sum_squares", conversions);
    }

    private static ExperimentData banditExperiment(int decisionQueries) {
        var queryResults = new ArrayList<QueryResult>();
        for (int i = 0; i < decisionQueries; i++) {
            queryResults.add(
                    new QueryResult(
                            List.of("conv"),
                            List.of(
                                    periodRow("0", "0", 100, 10),
                                    periodRow("1", "0", 100, 20),
                                    periodRow("0", "1", 100, 10),
                                    periodRow("1", "1", 300, 90))));
        }
        var bandit =
                new BanditSettings(
                        "conv",
                        List.of("Control", "Treatment"),
                        List.of("0", "1"),
                        List.of(0.5, 0.5),
                        true,
                        false,
                        0.05,
                        7L);
        return new ExperimentData(
                Map.of("conv", CONVERSION),
                List.of(
                        AnalysisSettings.builder()
                                .variations(List.of("0", "1"), List.of("Control", "Treatment"))
                                .build()),
                queryResults,
                bandit);
    }

    @Test
    void banditExperimentUpdatesWeightsAndAnalysesWeightedRows() {
        // When
        var results = runner.processExperimentResults(banditExperiment(1));

        // Then
        assertThat(results.banditResult()).isNotNull();
        assertThat(results.banditResult().banditUpdateMessage()).isEqualTo("successfully_updated");
        assertThat(results.banditResult().seed()).isEqualTo(7);
        var variations = results.results().get(0).analyses().get(0).dimensions().get(0).variations();
        assertThat(variations.get(0).users()).isEqualTo(200);
        assertThat(variations.get(1).users()).isEqualTo(400);
        assertThat(variations.get(1).value()).isCloseTo(320.0 / 3, within(1e-9));
    }

    @Test
    void secondDecisionMetricIsRejected() {
        assertThatThrownBy(() -> runner.processExperimentResults(banditExperiment(2)))
                .isInstanceOf(DuplicateBanditDecisionMetricException.class)
                .hasMessageContaining("conv");

        var results =
                runner.processMultipleExperimentResults(
                        List.of(new ExperimentInput("bandit", banditExperiment(2))));
        assertThat(results.get(0).error()).startsWith("Bandit weights already computed");
        assertThat(results.get(0).results()).isEmpty();
    }
}
