package dev.abstats.pipeline;

import dev.abstats.config.StatsEngineConfig;
import dev.abstats.engine.bandit.BanditConfig;
import dev.abstats.engine.bandit.Bandits;
import dev.abstats.engine.bayesian.GaussianPrior;
import dev.abstats.model.AnalysisSettings;
import dev.abstats.model.BanditSettings;
import dev.abstats.model.DimensionRecord;
import dev.abstats.model.MetricSettings;
import dev.abstats.model.RawAggregateRow;
import dev.abstats.model.results.BanditResult;
import dev.abstats.model.results.SingleVariationResult;
import dev.abstats.statistics.BanditStatistic;
import dev.abstats.statistics.StatisticFactory;
import dev.abstats.statistics.TestStatistic;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Adaptive experiment support: turns per-period rows into bandit arm statistics, updates arm
 * weights for the decision metric and synthesizes period-weighted rows for the regular analyses.
 */
@Slf4j
public final class BanditPipeline {
    public static final String NO_ROWS = "no rows";
    public static final String INCOMPATIBLE_STATISTICS =
            "not all statistics are instance of type BanditStatistic";

    private final GaussianPrior prior;
    private final int draws;
    private final double minWeight;

    public BanditPipeline(GaussianPrior prior, StatsEngineConfig config) {
        this.prior = prior;
        this.draws = config.banditDraws();
        this.minWeight = config.banditMinWeight();
    }

    public static BanditPipeline of(StatsEngineConfig config) {
        return new BanditPipeline(config.banditPrior(), config);
    }

    public GaussianPrior prior() {
        return prior;
    }

    /**
     * Arm statistics of every period, keyed by period position. A period whose arms are not all
     * bandit statistics of one variant maps to an empty optional.
     */
    public static Map<Integer, Optional<List<BanditStatistic>>> periodStatistics(
            List<DimensionRecord> periods, MetricSettings metric) {
        var stats = new LinkedHashMap<Integer, Optional<List<BanditStatistic>>>();
        for (int p = 0; p < periods.size(); p++) {
            var arms = new ArrayList<TestStatistic>();
            for (var variation : periods.get(p).variations()) {
                arms.add(StatisticFactory.variationStatistic(variation, metric));
            }
            stats.put(p, compatibleArms(arms));
        }
        return stats;
    }

    public static Optional<List<BanditStatistic>> compatibleArms(List<TestStatistic> arms) {
        if (arms.isEmpty()) {
            return Optional.empty();
        }
        var variant = arms.get(0).getClass();
        var bandit = new ArrayList<BanditStatistic>(arms.size());
        for (var arm : arms) {
            if (!(arm instanceof BanditStatistic stat) || arm.getClass() != variant) {
                return Optional.empty();
            }
            bandit.add(stat);
        }
        return Optional.of(List.copyOf(bandit));
    }

    /** The bandit over the rows of one analysis dimension, periods keyed by bandit period. */
    public Bandits banditFor(
            List<RawAggregateRow> rows,
            MetricSettings metric,
            BanditSettings settings,
            String dimension) {
        var inDimension = rows.stream().filter(row -> dimension.equals(row.dimension())).toList();
        var varIdMap = new LinkedHashMap<String, Integer>();
        for (int i = 0; i < settings.varIds().size(); i++) {
            varIdMap.put(settings.varIds().get(i), i);
        }
        var periods =
                DimensionAggregator.aggregate(
                        inDimension,
                        varIdMap,
                        settings.varNames(),
                        DimensionAggregator.Keying.BANDIT_PERIOD);
        var config =
                new BanditConfig(
                        prior,
                        settings.banditWeightsSeed(),
                        settings.weightByPeriod(),
                        settings.topTwo(),
                        settings.alpha(),
                        metric.inverse(),
                        draws,
                        minWeight);
        return Bandits.of(metric.statistic(), periodStatistics(periods, metric), config);
    }

    /**
     * One period-weighted row per (analysis dimension, arm). Dimensions without usable bandit
     * periods contribute no rows.
     */
    public List<RawAggregateRow> weightedRows(
            List<RawAggregateRow> rows,
            MetricSettings metric,
            List<AnalysisSettings> analyses,
            BanditSettings settings) {
        var dimensions = new LinkedHashSet<String>();
        for (var analysis : analyses) {
            dimensions.add(analysis.dimension());
        }
        var weighted = new ArrayList<RawAggregateRow>();
        for (var dimension : dimensions) {
            var bandits = banditFor(rows, metric, settings, dimension);
            if (!bandits.hasUsablePeriods()) {
                log.debug("no usable bandit periods for dimension '{}'", dimension);
                continue;
            }
            for (int arm = 0; arm < settings.varIds().size(); arm++) {
                weighted.add(bandits.makeRow(dimension, arm, settings.varIds().get(arm)));
            }
        }
        return weighted;
    }

    /** Updates the arm weights from the decision metric's rows in the overall dimension. */
    public BanditResult banditResponse(
            List<RawAggregateRow> rows, MetricSettings metric, BanditSettings settings) {
        return respond(banditFor(rows, metric, settings, ""));
    }

    public BanditResult respond(Bandits bandits) {
        if (bandits.stats().isEmpty()) {
            return BanditResult.notUpdated(NO_ROWS);
        }
        if (!bandits.allPeriodsUsable()) {
            return BanditResult.notUpdated(INCOMPATIBLE_STATISTICS);
        }
        var response = bandits.computeResult();
        List<SingleVariationResult> singleVariationResults = null;
        if (response.isUpdated() && response.ci() != null) {
            var counts = bandits.variationCounts();
            var means = bandits.variationMeans();
            singleVariationResults = new ArrayList<>(counts.size());
            for (int arm = 0; arm < counts.size(); arm++) {
                singleVariationResults.add(
                        new SingleVariationResult(
                                counts.get(arm), means.get(arm), response.ci().get(arm)));
            }
        }
        log.debug("bandit update: {}", response.banditUpdateMessage());
        return new BanditResult(
                singleVariationResults,
                response.banditWeights(),
                response.bestArmProbabilities(),
                response.additionalReward(),
                response.seed(),
                response.banditUpdateMessage());
    }
}
