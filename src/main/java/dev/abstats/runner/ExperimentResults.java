package dev.abstats.runner;

import dev.abstats.model.results.BanditResult;
import dev.abstats.model.results.ExperimentMetricAnalysis;
import java.util.List;
import javax.annotation.Nullable;

/** Metric analyses of one experiment, plus the bandit update when it has bandit settings. */
public record ExperimentResults(
        List<ExperimentMetricAnalysis> results, @Nullable BanditResult banditResult) {

    public ExperimentResults {
        results = List.copyOf(results);
    }
}
