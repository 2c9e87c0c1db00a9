package dev.abstats.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/** Everything the engine needs to analyse one experiment. */
public record ExperimentData(
        Map<String, MetricSettings> metrics,
        List<AnalysisSettings> analyses,
        List<QueryResult> queryResults,
        @Nullable BanditSettings banditSettings) {

    public ExperimentData {
        metrics =
                Collections.unmodifiableMap(
                        new LinkedHashMap<>(Objects.requireNonNullElse(metrics, Map.of())));
        analyses = List.copyOf(Objects.requireNonNullElse(analyses, List.of()));
        queryResults = List.copyOf(Objects.requireNonNullElse(queryResults, List.of()));
    }

    public Optional<BanditSettings> bandit() {
        return Optional.ofNullable(banditSettings);
    }
}
