package dev.abstats.statistics;

/** Binomial metric: {@code sum} successes out of {@code n} trials. */
public record ProportionStatistic(double sum, double n) implements BaseStatistic {

    @Override
    public double mean() {
        return n == 0 ? 0 : sum / n;
    }

    @Override
    public double variance() {
        var p = mean();
        return p * (1 - p);
    }

    /** Successes are 0/1, so the sum of squares equals the sum. */
    @Override
    public double sumSquares() {
        return sum;
    }

    @Override
    public ProportionStatistic rescaled(double factor, double newN) {
        return new ProportionStatistic(sum * factor, newN);
    }

    @Override
    public ProportionStatistic plus(BaseStatistic other) {
        return new ProportionStatistic(sum + other.sum(), n + other.n());
    }
}
