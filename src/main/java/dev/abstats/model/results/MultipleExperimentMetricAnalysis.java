package dev.abstats.model.results;

import java.util.List;
import javax.annotation.Nullable;

/**
 * Result slot of one experiment in a batch. A failed experiment has empty {@code results}, no
 * bandit result and a non-null {@code error}.
 */
public record MultipleExperimentMetricAnalysis(
        String id,
        List<ExperimentMetricAnalysis> results,
        @Nullable BanditResult banditResult,
        @Nullable String error) {

    public MultipleExperimentMetricAnalysis {
        results = List.copyOf(results);
    }
}
