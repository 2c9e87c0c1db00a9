package dev.abstats.engine;

import java.util.List;
import javax.annotation.Nullable;

public record FrequentistTestResult(
        double expected,
        List<Double> ci,
        Uplift uplift,
        @Nullable String errorMessage,
        double pValue)
        implements TestResult {

    public FrequentistTestResult {
        ci = List.copyOf(ci);
    }

    public static FrequentistTestResult defaultResult(@Nullable String errorMessage) {
        return new FrequentistTestResult(0, List.of(0.0, 0.0), Uplift.normal(0, 0), errorMessage, 1);
    }
}
