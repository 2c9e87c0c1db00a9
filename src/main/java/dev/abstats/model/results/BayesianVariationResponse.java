package dev.abstats.model.results;

import dev.abstats.engine.Uplift;
import java.util.List;
import javax.annotation.Nullable;

public record BayesianVariationResponse(
        double cr,
        double value,
        double users,
        double denominator,
        MetricStats stats,
        double expected,
        Uplift uplift,
        List<Double> ci,
        @Nullable String errorMessage,
        double chanceToWin,
        List<Double> risk,
        String riskType)
        implements VariationResponse {

    public BayesianVariationResponse {
        ci = List.copyOf(ci);
        risk = List.copyOf(risk);
    }
}
