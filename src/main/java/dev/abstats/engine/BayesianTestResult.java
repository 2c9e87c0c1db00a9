package dev.abstats.engine;

import java.util.List;
import javax.annotation.Nullable;

/**
 * @param chanceToWin posterior probability that the variation beats the baseline
 * @param risk expected loss of choosing the baseline and of choosing the variation
 * @param riskType {@code relative} or {@code absolute}
 */
public record BayesianTestResult(
        double expected,
        List<Double> ci,
        Uplift uplift,
        @Nullable String errorMessage,
        double chanceToWin,
        List<Double> risk,
        String riskType)
        implements TestResult {

    public BayesianTestResult {
        ci = List.copyOf(ci);
        risk = List.copyOf(risk);
    }

    public static BayesianTestResult defaultResult(
            @Nullable String errorMessage, String riskType) {
        return new BayesianTestResult(
                0,
                List.of(0.0, 0.0),
                Uplift.normal(0, 0),
                errorMessage,
                0.5,
                List.of(0.0, 0.0),
                riskType);
    }
}
