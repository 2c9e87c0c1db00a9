package dev.abstats.statistics;

/** Count/amount metric described by its sum, sum of squares and unit count. */
public record SampleMeanStatistic(double sum, double sumSquares, double n) implements BaseStatistic {

    @Override
    public double mean() {
        return n == 0 ? 0 : sum / n;
    }

    @Override
    public double variance() {
        if (n <= 1) {
            return 0;
        }
        return (sumSquares - sum * sum / n) / (n - 1);
    }

    @Override
    public SampleMeanStatistic rescaled(double factor, double newN) {
        return new SampleMeanStatistic(sum * factor, sumSquares * factor, newN);
    }

    @Override
    public SampleMeanStatistic plus(BaseStatistic other) {
        return new SampleMeanStatistic(sum + other.sum(), sumSquares + other.sumSquares(), n + other.n());
    }
}
