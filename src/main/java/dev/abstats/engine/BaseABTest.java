package dev.abstats.engine;

import dev.abstats.model.DifferenceType;
import dev.abstats.statistics.RegressionAdjustedStatistic;
import dev.abstats.statistics.TestStatistic;
import java.util.List;
import java.util.Optional;

/**
 * Effect estimation shared by the frequentist and Bayesian engines: the point estimate and its
 * variance on the configured difference scale.
 */
public abstract class BaseABTest implements ABTest {
    protected final TestStatistic statA;
    protected final TestStatistic statB;
    private final TestConfig config;

    protected BaseABTest(TestStatistic statA, TestStatistic statB, TestConfig config) {
        if (statA instanceof RegressionAdjustedStatistic a
                && statB instanceof RegressionAdjustedStatistic b) {
            var theta = RegressionAdjustedStatistic.computeTheta(List.of(a, b));
            statA = a.withTheta(theta);
            statB = b.withTheta(theta);
        }
        this.statA = statA;
        this.statB = statB;
        this.config = config;
    }

    @Override
    public TestStatistic statA() {
        return statA;
    }

    @Override
    public TestStatistic statB() {
        return statB;
    }

    protected DifferenceType differenceType() {
        return config.differenceType();
    }

    protected double alpha() {
        return config.alpha();
    }

    /** Why the effect cannot be estimated, if it cannot. */
    protected Optional<String> degenerateReason() {
        if (statA.n() <= 0 || statB.n() <= 0) {
            return Optional.of("Not enough data in baseline or variation");
        }
        if (statA.variance() <= 0 && statB.variance() <= 0) {
            return Optional.of("Zero variance in baseline and variation");
        }
        if (differenceType() == DifferenceType.RELATIVE && statA.unadjustedMean() == 0) {
            return Optional.of("Baseline mean is zero; relative effect undefined");
        }
        return Optional.empty();
    }

    protected double pointEstimate() {
        var diff = statB.mean() - statA.mean();
        return switch (differenceType()) {
            case RELATIVE -> diff / statA.unadjustedMean();
            case ABSOLUTE -> diff;
            case SCALED -> diff * scaleFactor();
        };
    }

    /** Variance of {@link #pointEstimate()}; delta method on the relative scale. */
    protected double pointEstimateVariance() {
        var varA = meanVariance(statA);
        var varB = meanVariance(statB);
        return switch (differenceType()) {
            case RELATIVE -> {
                var meanA = statA.unadjustedMean();
                var meanB = statB.unadjustedMean();
                yield varB / Math.pow(meanA, 2) + varA * Math.pow(meanB, 2) / Math.pow(meanA, 4);
            }
            case ABSOLUTE -> varA + varB;
            case SCALED -> (varA + varB) * Math.pow(scaleFactor(), 2);
        };
    }

    /** Welch-Satterthwaite degrees of freedom. */
    protected double degreesOfFreedom() {
        var varA = meanVariance(statA);
        var varB = meanVariance(statB);
        var denominator =
                (statA.n() > 1 ? varA * varA / (statA.n() - 1) : 0)
                        + (statB.n() > 1 ? varB * varB / (statB.n() - 1) : 0);
        if (denominator <= 0) {
            return statA.n() + statB.n() - 2;
        }
        return Math.pow(varA + varB, 2) / denominator;
    }

    /** Projects a per-unit difference to the variation's total daily impact. */
    private double scaleFactor() {
        var traffic = config.trafficProportionB();
        var days = config.phaseLengthDays();
        if (traffic <= 0 || days <= 0) {
            return 0;
        }
        return statB.n() / traffic / days;
    }

    private static double meanVariance(TestStatistic stat) {
        return stat.n() <= 0 ? 0 : Math.max(stat.variance(), 0) / stat.n();
    }
}
