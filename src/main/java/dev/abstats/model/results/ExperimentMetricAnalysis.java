package dev.abstats.model.results;

import java.util.List;

/** All analyses of one metric, in the order the analyses were requested. */
public record ExperimentMetricAnalysis(
        String metric, List<ExperimentMetricAnalysisResult> analyses) {

    public ExperimentMetricAnalysis {
        analyses = List.copyOf(analyses);
    }
}
