package dev.abstats.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Raw aggregate rows returned by the query engine for one or more metrics. Columns prefixed {@code
 * m{i}_} belong to the i-th entry of {@code metrics}; other columns are shared.
 */
public record QueryResult(List<String> metrics, List<Map<String, Object>> rows) {
    public QueryResult {
        metrics = List.copyOf(Objects.requireNonNullElse(metrics, List.of()));
        rows = List.copyOf(Objects.requireNonNullElse(rows, List.of()));
    }
}
