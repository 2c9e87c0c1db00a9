package dev.abstats.model.results;

import dev.abstats.engine.Uplift;
import java.util.List;
import javax.annotation.Nullable;

public record FrequentistVariationResponse(
        double cr,
        double value,
        double users,
        double denominator,
        MetricStats stats,
        double expected,
        Uplift uplift,
        List<Double> ci,
        @Nullable String errorMessage,
        double pValue)
        implements VariationResponse {

    public FrequentistVariationResponse {
        ci = List.copyOf(ci);
    }
}
