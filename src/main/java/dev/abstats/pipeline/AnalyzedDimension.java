package dev.abstats.pipeline;

import java.util.List;

/** A dimension after analysis; {@code variations} excludes the baseline. */
public record AnalyzedDimension(
        String dimension, double srmP, AnalyzedVariation baseline, List<AnalyzedVariation> variations) {

    public AnalyzedDimension {
        variations = List.copyOf(variations);
    }
}
