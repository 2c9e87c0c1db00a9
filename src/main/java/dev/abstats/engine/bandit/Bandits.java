package dev.abstats.engine.bandit;

import dev.abstats.model.RawAggregateRow;
import dev.abstats.model.RowColumns;
import dev.abstats.model.StatisticType;
import dev.abstats.statistics.BanditStatistic;
import dev.abstats.statistics.BaseStatistic;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.Well19937c;

/**
 * Multi-armed bandit over per-period arm statistics. Periods whose arms were not all compatible
 * bandit statistics are kept as empty entries and ignored by every computation.
 *
 * <p>Subclasses know how to pool one statistic variant across periods and how to write a pooled
 * statistic back out as an aggregate row.
 */
public abstract class Bandits {
    private final Map<Integer, Optional<List<BanditStatistic>>> stats;
    protected final BanditConfig config;

    protected Bandits(Map<Integer, Optional<List<BanditStatistic>>> stats, BanditConfig config) {
        this.stats = Collections.unmodifiableMap(new LinkedHashMap<>(stats));
        this.config = config;
    }

    /** Picks the variant matching how the metric's statistics pool. */
    public static Bandits of(
            StatisticType statisticType,
            Map<Integer, Optional<List<BanditStatistic>>> stats,
            BanditConfig config) {
        return switch (statisticType) {
            case RATIO -> new RatioBandits(stats, config);
            case MEAN_RA -> new CupedBandits(stats, config);
            default -> new MeanBandits(stats, config);
        };
    }

    public Map<Integer, Optional<List<BanditStatistic>>> stats() {
        return stats;
    }

    public boolean hasUsablePeriods() {
        return stats.values().stream().anyMatch(Optional::isPresent);
    }

    public boolean allPeriodsUsable() {
        return !stats.isEmpty() && stats.values().stream().allMatch(Optional::isPresent);
    }

    protected List<List<BanditStatistic>> usablePeriods() {
        return stats.values().stream().flatMap(Optional::stream).toList();
    }

    /** Pools one arm's period statistics; {@code scales[p]} reweights period p's sums. */
    protected abstract BanditStatistic pool(List<BanditStatistic> periodStats, double[] scales);

    /** Writes a pooled arm statistic as aggregate columns. */
    protected abstract RowColumns toColumns(BanditStatistic armStatistic);

    /** One pooled statistic per arm, in arm order. */
    public List<BanditStatistic> armStatistics() {
        var periods = usablePeriods();
        if (periods.isEmpty()) {
            return List.of();
        }
        var arms = periods.get(0).size();
        var result = new ArrayList<BanditStatistic>(arms);
        for (int arm = 0; arm < arms; arm++) {
            var armPeriods = new ArrayList<BanditStatistic>(periods.size());
            for (var period : periods) {
                armPeriods.add(period.get(arm));
            }
            result.add(pool(armPeriods, periodScales(periods, arm)));
        }
        return result;
    }

    public List<Double> variationCounts() {
        return armStatistics().stream().map(BanditStatistic::n).toList();
    }

    public List<Double> variationMeans() {
        return armStatistics().stream().map(BanditStatistic::mean).toList();
    }

    /** The reweighted aggregate row of one arm within one analysis dimension. */
    public RawAggregateRow makeRow(String dimension, int armIndex, String variation) {
        return RawAggregateRow.of(variation, dimension, toColumns(armStatistics().get(armIndex)));
    }

    /**
     * Scale of each period's sums for one arm. With period weighting, period p contributes in
     * proportion to its share of all traffic rather than to the arm's allocation in that period.
     */
    private double[] periodScales(List<List<BanditStatistic>> periods, int arm) {
        var scales = new double[periods.size()];
        if (!config.weightByPeriod()) {
            Arrays.fill(scales, 1);
            return scales;
        }
        var periodTotals = new double[periods.size()];
        var total = 0.0;
        var armTotal = 0.0;
        for (int p = 0; p < periods.size(); p++) {
            for (var stat : periods.get(p)) {
                periodTotals[p] += stat.n();
            }
            total += periodTotals[p];
            armTotal += periods.get(p).get(arm).n();
        }
        for (int p = 0; p < periods.size(); p++) {
            var armN = periods.get(p).get(arm).n();
            scales[p] = total <= 0 || armN <= 0 ? 0 : (periodTotals[p] / total) * armTotal / armN;
        }
        return scales;
    }

    /** Updates arm weights from the pooled statistics. */
    public BanditResponse computeResult() {
        var seed =
                config.banditWeightsSeed() != null
                        ? config.banditWeightsSeed()
                        : ThreadLocalRandom.current().nextInt(0, Integer.MAX_VALUE);
        var arms = armStatistics();
        if (arms.isEmpty() || arms.stream().anyMatch(arm -> arm.n() <= 0)) {
            return BanditResponse.notUpdated(seed, BanditResponse.ZERO_USERS);
        }

        var prior = config.priorDistribution();
        var postMeans = new double[arms.size()];
        var postStddevs = new double[arms.size()];
        for (int k = 0; k < arms.size(); k++) {
            var arm = arms.get(k);
            var dataVariance = Math.max(arm.variance(), 0) / arm.n();
            if (dataVariance <= 0) {
                postMeans[k] = arm.mean();
                postStddevs[k] = 0;
            } else if (prior.proper() && prior.variance() > 0) {
                var precision = 1 / dataVariance + 1 / prior.variance();
                postMeans[k] =
                        (arm.mean() / dataVariance + prior.mean() / prior.variance()) / precision;
                postStddevs[k] = Math.sqrt(1 / precision);
            } else {
                postMeans[k] = arm.mean();
                postStddevs[k] = Math.sqrt(dataVariance);
            }
        }

        var bestArmProbabilities = bestArmProbabilities(postMeans, postStddevs, seed);
        var weights =
                applyMinimumWeight(
                        config.topTwo()
                                ? topTwoWeights(bestArmProbabilities)
                                : bestArmProbabilities.clone());

        var z = new NormalDistribution().inverseCumulativeProbability(1 - config.alpha() / 2);
        var intervals = new ArrayList<List<Double>>(arms.size());
        for (int k = 0; k < arms.size(); k++) {
            intervals.add(
                    List.of(postMeans[k] - z * postStddevs[k], postMeans[k] + z * postStddevs[k]));
        }
        return new BanditResponse(
                toList(weights),
                toList(bestArmProbabilities),
                additionalReward(),
                seed,
                BanditResponse.SUCCESSFULLY_UPDATED,
                intervals);
    }

    private double[] bestArmProbabilities(double[] means, double[] stddevs, long seed) {
        var rng = new Well19937c(seed);
        var wins = new double[means.length];
        for (int draw = 0; draw < config.draws(); draw++) {
            var best = 0;
            var bestValue = Double.NaN;
            for (int k = 0; k < means.length; k++) {
                var value = means[k] + stddevs[k] * rng.nextGaussian();
                var better =
                        Double.isNaN(bestValue)
                                || (config.inverse() ? value < bestValue : value > bestValue);
                if (better) {
                    best = k;
                    bestValue = value;
                }
            }
            wins[best]++;
        }
        for (int k = 0; k < wins.length; k++) {
            wins[k] /= config.draws();
        }
        return wins;
    }

    /** Top-two Thompson sampling: half the weight follows the best arm, half the runner-up. */
    static double[] topTwoWeights(double[] probabilities) {
        var weights = new double[probabilities.length];
        for (int k = 0; k < probabilities.length; k++) {
            var runnerUp = 0.0;
            for (int j = 0; j < probabilities.length; j++) {
                if (j != k && probabilities[j] < 1) {
                    runnerUp += probabilities[j] / (1 - probabilities[j]);
                }
            }
            weights[k] = probabilities[k] / 2 * (1 + runnerUp);
        }
        return normalize(weights);
    }

    private double[] applyMinimumWeight(double[] weights) {
        for (int k = 0; k < weights.length; k++) {
            weights[k] = Math.max(weights[k], config.minWeight());
        }
        return normalize(weights);
    }

    private static double[] normalize(double[] weights) {
        var sum = 0.0;
        for (var weight : weights) {
            sum += weight;
        }
        if (sum <= 0) {
            Arrays.fill(weights, 1.0 / weights.length);
            return weights;
        }
        for (int k = 0; k < weights.length; k++) {
            weights[k] /= sum;
        }
        return weights;
    }

    /** Metric gained over splitting every period's traffic equally between arms. */
    private double additionalReward() {
        var reward = 0.0;
        for (var period : usablePeriods()) {
            var periodUsers = 0.0;
            var actual = 0.0;
            var meanOfMeans = 0.0;
            for (var stat : period) {
                periodUsers += stat.n();
                actual += stat.n() * stat.mean();
                meanOfMeans += stat.mean() / period.size();
            }
            reward += actual - periodUsers * meanOfMeans;
        }
        return config.inverse() ? -reward : reward;
    }

    /** Pools base statistics after scaling each period's sums. */
    protected static BaseStatistic poolBase(List<BaseStatistic> periodStats, double[] scales) {
        BaseStatistic pooled = null;
        for (int p = 0; p < periodStats.size(); p++) {
            var stat = periodStats.get(p);
            var scaled = stat.rescaled(scales[p], stat.n());
            pooled = pooled == null ? scaled : pooled.plus(scaled);
        }
        return pooled;
    }

    private static List<Double> toList(double[] values) {
        var list = new ArrayList<Double>(values.length);
        for (var value : values) {
            list.add(value);
        }
        return List.copyOf(list);
    }
}
