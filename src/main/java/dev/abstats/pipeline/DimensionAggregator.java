package dev.abstats.pipeline;

import dev.abstats.model.DimensionRecord;
import dev.abstats.model.RawAggregateRow;
import dev.abstats.model.RowColumns;
import dev.abstats.model.VariationColumns;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/** Folds per-variation rows into one {@link DimensionRecord} per dimension value or period. */
@Slf4j
public final class DimensionAggregator {

    /** What a record is keyed by. */
    public enum Keying {
        DIMENSION,
        BANDIT_PERIOD
    }

    /**
     * Records come out in the order their key was first seen. Every variation gets a column
     * group, zero-filled when no row matched it; rows of unknown variations are skipped. If a
     * (key, variation) pair repeats, the last row wins the column group but every row's users
     * count towards the record's total.
     */
    public static List<DimensionRecord> aggregate(
            List<RawAggregateRow> rows,
            Map<String, Integer> varIdMap,
            List<String> varNames,
            Keying keying) {
        var ids = new String[varNames.size()];
        Arrays.fill(ids, "");
        varIdMap.forEach(
                (id, index) -> {
                    if (index < ids.length) {
                        ids[index] = id;
                    }
                });

        var columnsByKey = new LinkedHashMap<String, RowColumns[]>();
        var usersByKey = new HashMap<String, Double>();
        for (var row : rows) {
            var key = keyOf(row, keying);
            var columns =
                    columnsByKey.computeIfAbsent(
                            key,
                            k -> {
                                var zeros = new RowColumns[varNames.size()];
                                Arrays.fill(zeros, RowColumns.ZERO);
                                return zeros;
                            });
            var index = varIdMap.get(row.variation());
            if (index != null && index < columns.length) {
                columns[index] = row.columns();
                usersByKey.merge(key, row.columns().users(), Double::sum);
            }
        }

        var records = new ArrayList<DimensionRecord>(columnsByKey.size());
        columnsByKey.forEach(
                (key, columns) -> {
                    var variations = new ArrayList<VariationColumns>(columns.length);
                    for (int i = 0; i < columns.length; i++) {
                        variations.add(new VariationColumns(ids[i], varNames.get(i), columns[i]));
                    }
                    records.add(
                            new DimensionRecord(key, usersByKey.getOrDefault(key, 0.0), variations));
                });
        log.debug("aggregated {} rows into {} records by {}", rows.size(), records.size(), keying);
        return records;
    }

    /**
     * Turns cumulative daily running sums into daily increments. Rows are ordered by dimension
     * value (the date) and each variation's running-sum columns become the difference from that
     * variation's previous day; the first day keeps its value.
     */
    public static List<RawAggregateRow> diffDailyTimeSeries(List<RawAggregateRow> rows) {
        var sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparing(RawAggregateRow::dimension));
        var previousByVariation = new HashMap<String, RowColumns>();
        var diffed = new ArrayList<RawAggregateRow>(sorted.size());
        for (var row : sorted) {
            var previous = previousByVariation.put(row.variation(), row.columns());
            diffed.add(
                    previous == null ? row : row.withColumns(row.columns().minusRunningSums(previous)));
        }
        return diffed;
    }

    private static String keyOf(RawAggregateRow row, Keying keying) {
        if (keying == Keying.BANDIT_PERIOD) {
            return row.banditPeriod() == null ? "" : row.banditPeriod();
        }
        return row.dimension();
    }

    private DimensionAggregator() {}
}
