package dev.abstats.engine.bandit;

import dev.abstats.model.RowColumns;
import dev.abstats.statistics.BanditStatistic;
import dev.abstats.statistics.RatioStatistic;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Bandit over ratio metrics; numerator, denominator and cross products are pooled together. */
public final class RatioBandits extends Bandits {

    public RatioBandits(Map<Integer, Optional<List<BanditStatistic>>> stats, BanditConfig config) {
        super(stats, config);
    }

    @Override
    protected BanditStatistic pool(List<BanditStatistic> periodStats, double[] scales) {
        var ratios = periodStats.stream().map(RatioBandits::asRatio).toList();
        var products = 0.0;
        var n = 0.0;
        for (int p = 0; p < ratios.size(); p++) {
            products += ratios.get(p).mDSumOfProducts() * scales[p];
            n += ratios.get(p).n();
        }
        return new RatioStatistic(
                poolBase(ratios.stream().map(RatioStatistic::mStatistic).toList(), scales),
                poolBase(ratios.stream().map(RatioStatistic::dStatistic).toList(), scales),
                products,
                n);
    }

    @Override
    protected RowColumns toColumns(BanditStatistic armStatistic) {
        var stat = asRatio(armStatistic);
        return RowColumns.builder()
                .users(stat.n())
                .count(stat.mStatistic().n())
                .main(stat.mStatistic().sum(), stat.mStatistic().sumSquares())
                .denominator(
                        stat.dStatistic().sum(),
                        stat.dStatistic().sumSquares(),
                        stat.mDSumOfProducts())
                .build();
    }

    private static RatioStatistic asRatio(BanditStatistic stat) {
        if (stat instanceof RatioStatistic ratio) {
            return ratio;
        }
        throw new IllegalStateException(
                "expected a ratio statistic, got " + stat.getClass().getSimpleName());
    }
}
