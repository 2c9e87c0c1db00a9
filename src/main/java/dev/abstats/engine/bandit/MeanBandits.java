package dev.abstats.engine.bandit;

import dev.abstats.model.RowColumns;
import dev.abstats.statistics.BanditStatistic;
import dev.abstats.statistics.BaseStatistic;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Bandit over plain mean and proportion metrics. */
public final class MeanBandits extends Bandits {

    public MeanBandits(Map<Integer, Optional<List<BanditStatistic>>> stats, BanditConfig config) {
        super(stats, config);
    }

    @Override
    protected BanditStatistic pool(List<BanditStatistic> periodStats, double[] scales) {
        return poolBase(periodStats.stream().map(MeanBandits::asBase).toList(), scales);
    }

    @Override
    protected RowColumns toColumns(BanditStatistic armStatistic) {
        var stat = asBase(armStatistic);
        return RowColumns.builder()
                .users(stat.n())
                .main(stat.sum(), stat.sumSquares())
                .build();
    }

    private static BaseStatistic asBase(BanditStatistic stat) {
        if (stat instanceof BaseStatistic base) {
            return base;
        }
        throw new IllegalStateException(
                "expected a mean statistic, got " + stat.getClass().getSimpleName());
    }
}
