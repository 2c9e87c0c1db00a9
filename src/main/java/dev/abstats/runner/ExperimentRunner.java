package dev.abstats.runner;

import dev.abstats.DuplicateBanditDecisionMetricException;
import dev.abstats.config.StatsEngineConfig;
import dev.abstats.log.StatsLogger;
import dev.abstats.model.AnalysisSettings;
import dev.abstats.model.ExperimentData;
import dev.abstats.model.ExperimentInput;
import dev.abstats.model.MetricSettings;
import dev.abstats.model.RawAggregateRow;
import dev.abstats.model.results.BanditResult;
import dev.abstats.model.results.ExperimentMetricAnalysis;
import dev.abstats.model.results.ExperimentMetricAnalysisResult;
import dev.abstats.model.results.MultipleExperimentMetricAnalysis;
import dev.abstats.pipeline.BanditPipeline;
import dev.abstats.pipeline.MetricAnalysisOrchestrator;
import dev.abstats.pipeline.QueryRows;
import dev.abstats.pipeline.ResultFormatter;
import dev.abstats.trace.StatsTracing;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the engine. Fans out over an experiment's query results, metrics and analyses;
 * in a batch every experiment is analysed independently and a failing experiment yields an error
 * slot instead of aborting the batch.
 */
@Slf4j
public final class ExperimentRunner {
    private final StatsEngineConfig config;
    private final MetricAnalysisOrchestrator orchestrator;
    private final BanditPipeline banditPipeline;
    private final Tracer tracer;

    public ExperimentRunner(
            StatsEngineConfig config,
            MetricAnalysisOrchestrator orchestrator,
            BanditPipeline banditPipeline,
            Tracer tracer) {
        this.config = config;
        this.orchestrator = orchestrator;
        this.banditPipeline = banditPipeline;
        this.tracer = tracer;
    }

    public static ExperimentRunner of(StatsEngineConfig config) {
        return new ExperimentRunner(
                config,
                new MetricAnalysisOrchestrator(),
                BanditPipeline.of(config),
                StatsTracing.getTracer());
    }

    /** Analyses one metric's rows under every analysis. No rows gives blank analyses. */
    public ExperimentMetricAnalysis processSingleMetric(
            List<RawAggregateRow> rows, MetricSettings metric, List<AnalysisSettings> analyses) {
        if (rows.isEmpty()) {
            return new ExperimentMetricAnalysis(
                    metric.id(),
                    analyses.stream().map(a -> ExperimentMetricAnalysisResult.blank()).toList());
        }
        var knownIds = new HashSet<String>();
        for (var analysis : analyses) {
            analysis.validate();
            knownIds.addAll(analysis.varIds());
        }
        var unknownVariations = QueryRows.detectUnknownVariations(rows, knownIds);

        var results = new ArrayList<ExperimentMetricAnalysisResult>(analyses.size());
        for (var analysis : analyses) {
            var analyzed =
                    orchestrator.processAnalysis(
                            rows, metric, analysis, config.defaultMaxDimensions());
            results.add(
                    new ExperimentMetricAnalysisResult(
                            unknownVariations,
                            ResultFormatter.format(analyzed, analysis.baselineIndex()),
                            0));
        }
        return new ExperimentMetricAnalysis(metric.id(), results);
    }

    /**
     * Analyses every metric of every query result that has settings. With bandit settings the
     * decision metric also updates the arm weights, and all metrics are analysed on the bandit's
     * period-weighted rows.
     *
     * @throws DuplicateBanditDecisionMetricException when a second decision metric is found
     */
    public ExperimentResults processExperimentResults(ExperimentData data) {
        var results = new ArrayList<ExperimentMetricAnalysis>();
        BanditResult banditResult = null;
        for (var queryResult : data.queryResults()) {
            for (int i = 0; i < queryResult.metrics().size(); i++) {
                var metricId = queryResult.metrics().get(i);
                var metric = data.metrics().get(metricId);
                if (metric == null) {
                    continue;
                }
                var rows = QueryRows.forMetric(queryResult.rows(), i);
                if (rows.isEmpty()) {
                    continue;
                }
                var bandit = data.banditSettings();
                if (bandit == null) {
                    results.add(processSingleMetric(rows, metric, data.analyses()));
                    continue;
                }
                if (metricId.equals(bandit.decisionMetric())) {
                    if (banditResult != null) {
                        throw new DuplicateBanditDecisionMetricException(metricId);
                    }
                    banditResult = banditPipeline.banditResponse(rows, metric, bandit);
                }
                var weightedRows =
                        banditPipeline.weightedRows(rows, metric, data.analyses(), bandit);
                results.add(processSingleMetric(weightedRows, metric, data.analyses()));
            }
        }
        return new ExperimentResults(results, banditResult);
    }

    /** One result per input, in input order. */
    public List<MultipleExperimentMetricAnalysis> processMultipleExperimentResults(
            List<ExperimentInput> inputs) {
        return processBatch(
                inputs.stream()
                        .map(input -> new PendingExperiment(input.id(), input::data))
                        .toList());
    }

    /**
     * One result per JSON experiment, in input order. Each payload is mapped inside its own
     * experiment, so a malformed one only fills its own slot with an error.
     */
    public List<MultipleExperimentMetricAnalysis> processJsonExperiments(
            List<JsonExperiment> experiments) {
        return processBatch(
                experiments.stream()
                        .map(
                                experiment ->
                                        new PendingExperiment(
                                                experiment.id(),
                                                () ->
                                                        StatsEngineJson.toExperimentData(
                                                                experiment.data())))
                        .toList());
    }

    /** Reads a JSON batch, analyses it and writes the results as JSON. */
    public String processJson(String json) {
        var results = processJsonExperiments(StatsEngineJson.readBatch(json));
        return StatsEngineJson.writeResults(results);
    }

    private List<MultipleExperimentMetricAnalysis> processBatch(List<PendingExperiment> pending) {
        StatsLogger.get().info("analysing {} experiments", pending.size());
        var stream = config.parallel() ? pending.parallelStream() : pending.stream();
        // parallel streams keep encounter order when collected
        var results =
                stream.map(this::runExperiment)
                        .map(ExperimentOutcome::toAnalysis)
                        .collect(Collectors.toList());
        StatsLogger.get()
                .info(
                        "analysed {} experiments, {} failed",
                        results.size(),
                        results.stream().filter(r -> r.error() != null).count());
        return results;
    }

    /** Runs the batch on {@code executor}. */
    public CompletableFuture<List<MultipleExperimentMetricAnalysis>> processMultipleExperimentResultsAsync(
            List<ExperimentInput> inputs, Executor executor) {
        return CompletableFuture.supplyAsync(() -> processMultipleExperimentResults(inputs), executor);
    }

    public CompletableFuture<List<MultipleExperimentMetricAnalysis>> processMultipleExperimentResultsAsync(
            List<ExperimentInput> inputs) {
        return processMultipleExperimentResultsAsync(inputs, ForkJoinPool.commonPool());
    }

    ExperimentOutcome runExperiment(ExperimentInput input) {
        return runExperiment(new PendingExperiment(input.id(), input::data));
    }

    private ExperimentOutcome runExperiment(PendingExperiment experiment) {
        var id = String.valueOf(experiment.id());
        var span =
                tracer.spanBuilder(StatsTracing.EXPERIMENT_SPAN)
                        .setAttribute(StatsTracing.EXPERIMENT_ID, id)
                        .startSpan();
        try (var scope = span.makeCurrent()) {
            var data = experiment.data().get();
            if (data == null) {
                throw new IllegalArgumentException("experiment has no data");
            }
            span.setAttribute(StatsTracing.METRIC_COUNT, (long) data.metrics().size());
            return new ExperimentOutcome.Success(id, processExperimentResults(data));
        } catch (RuntimeException e) {
            log.warn("experiment {} failed: {}", id, e.getMessage(), e);
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            return ExperimentOutcome.Failure.of(id, e, config.errorMessageLimit());
        } finally {
            span.end();
        }
    }

    /** An experiment whose data is produced inside its failure boundary. */
    private record PendingExperiment(String id, Supplier<ExperimentData> data) {}
}
