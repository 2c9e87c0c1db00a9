package dev.abstats.engine.bandit;

import dev.abstats.model.RowColumns;
import dev.abstats.statistics.BanditStatistic;
import dev.abstats.statistics.RegressionAdjustedStatistic;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bandit over regression-adjusted metrics. After pooling, every arm shares one theta solved from all
 * arms together.
 */
public final class CupedBandits extends Bandits {

    public CupedBandits(Map<Integer, Optional<List<BanditStatistic>>> stats, BanditConfig config) {
        super(stats, config);
    }

    @Override
    public List<BanditStatistic> armStatistics() {
        var pooled = super.armStatistics().stream().map(CupedBandits::asAdjusted).toList();
        var theta = RegressionAdjustedStatistic.computeTheta(pooled);
        var result = new ArrayList<BanditStatistic>(pooled.size());
        for (var arm : pooled) {
            result.add(arm.withTheta(theta));
        }
        return result;
    }

    @Override
    protected BanditStatistic pool(List<BanditStatistic> periodStats, double[] scales) {
        var adjusted = periodStats.stream().map(CupedBandits::asAdjusted).toList();
        var products = 0.0;
        var n = 0.0;
        for (int p = 0; p < adjusted.size(); p++) {
            products += adjusted.get(p).postPreSumOfProducts() * scales[p];
            n += adjusted.get(p).n();
        }
        return new RegressionAdjustedStatistic(
                poolBase(
                        adjusted.stream().map(RegressionAdjustedStatistic::postStatistic).toList(),
                        scales),
                poolBase(
                        adjusted.stream().map(RegressionAdjustedStatistic::preStatistic).toList(),
                        scales),
                products,
                n,
                0);
    }

    @Override
    protected RowColumns toColumns(BanditStatistic armStatistic) {
        var stat = asAdjusted(armStatistic);
        return RowColumns.builder()
                .users(stat.n())
                .count(stat.postStatistic().n())
                .main(stat.postStatistic().sum(), stat.postStatistic().sumSquares())
                .covariate(
                        stat.preStatistic().sum(),
                        stat.preStatistic().sumSquares(),
                        stat.postPreSumOfProducts())
                .build();
    }

    private static RegressionAdjustedStatistic asAdjusted(BanditStatistic stat) {
        if (stat instanceof RegressionAdjustedStatistic adjusted) {
            return adjusted;
        }
        throw new IllegalStateException(
                "expected a regression adjusted statistic, got " + stat.getClass().getSimpleName());
    }
}
