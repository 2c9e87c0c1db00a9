package dev.abstats.pipeline;

import dev.abstats.model.RawAggregateRow;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Pattern;

/** Per-metric views of a query result's rows. */
public final class QueryRows {
    /** Variation id the query engine assigns to users exposed to several variations. */
    public static final String MULTIPLE_EXPOSURES = "__multiple__";

    private static final Pattern METRIC_PREFIX = Pattern.compile("^m\\d+_");

    /**
     * Keeps the columns of the metric at {@code metricIndex} with their {@code m{index}_} prefix
     * stripped, plus every column shared by all metrics.
     */
    public static List<Map<String, Object>> filterQueryRows(
            List<Map<String, Object>> rows, int metricIndex) {
        var prefix = "m" + metricIndex + "_";
        var filtered = new ArrayList<Map<String, Object>>(rows.size());
        for (var row : rows) {
            var columns = new LinkedHashMap<String, Object>();
            for (var entry : row.entrySet()) {
                var key = entry.getKey();
                if (key.startsWith(prefix)) {
                    columns.put(key.substring(prefix.length()), entry.getValue());
                } else if (!METRIC_PREFIX.matcher(key).find()) {
                    columns.put(key, entry.getValue());
                }
            }
            filtered.add(columns);
        }
        return filtered;
    }

    /** Parsed aggregate rows of one metric. */
    public static List<RawAggregateRow> forMetric(List<Map<String, Object>> rows, int metricIndex) {
        return filterQueryRows(rows, metricIndex).stream().map(RawAggregateRow::fromColumns).toList();
    }

    /** Sorted variation ids present in {@code rows} but unknown to every analysis. */
    public static List<String> detectUnknownVariations(
            List<RawAggregateRow> rows, Collection<String> knownIds) {
        var unknown = new TreeSet<String>();
        for (var row : rows) {
            var id = row.variation();
            if (!MULTIPLE_EXPOSURES.equals(id) && !knownIds.contains(id)) {
                unknown.add(id);
            }
        }
        return List.copyOf(unknown);
    }

    private QueryRows() {}
}
