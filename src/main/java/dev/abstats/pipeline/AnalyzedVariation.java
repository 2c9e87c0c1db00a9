package dev.abstats.pipeline;

import dev.abstats.engine.TestResult;
import dev.abstats.model.VariationColumns;
import javax.annotation.Nullable;

/**
 * One variation of an analysed dimension.
 *
 * @param mean unadjusted mean, also reported as the conversion rate
 * @param count unit count, or the quantile sample size for quantile metrics
 * @param result the engine result; null for the baseline
 * @param expected the reported effect after the zero and negative baseline policy
 */
public record AnalyzedVariation(
        VariationColumns columns,
        double mean,
        double stddev,
        double count,
        @Nullable TestResult result,
        double expected) {

    public static AnalyzedVariation baseline(
            VariationColumns columns, double mean, double stddev, double count) {
        return new AnalyzedVariation(columns, mean, stddev, count, null, 0);
    }

    public AnalyzedVariation withCount(double newCount) {
        return new AnalyzedVariation(columns, mean, stddev, newCount, result, expected);
    }
}
