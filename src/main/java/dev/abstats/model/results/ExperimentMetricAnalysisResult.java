package dev.abstats.model.results;

import java.util.List;

/** Result of one analysis of one metric. {@code multipleExposures} is always 0 for now. */
public record ExperimentMetricAnalysisResult(
        List<String> unknownVariations, List<DimensionResponse> dimensions, int multipleExposures) {

    public ExperimentMetricAnalysisResult {
        unknownVariations = List.copyOf(unknownVariations);
        dimensions = List.copyOf(dimensions);
    }

    public static ExperimentMetricAnalysisResult blank() {
        return new ExperimentMetricAnalysisResult(List.of(), List.of(), 0);
    }
}
