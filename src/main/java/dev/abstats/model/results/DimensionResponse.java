package dev.abstats.model.results;

import java.util.List;

/**
 * @param dimension the dimension value, {@code (other)} for the merged overflow bucket
 * @param srm sample ratio mismatch p-value
 * @param variations results in display order, the baseline at its configured index
 */
public record DimensionResponse(String dimension, double srm, List<VariationResponse> variations) {

    public DimensionResponse {
        variations = List.copyOf(variations);
    }
}
