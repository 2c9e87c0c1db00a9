package dev.abstats.pipeline;

import dev.abstats.model.DimensionRecord;
import dev.abstats.model.VariationColumns;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Caps the number of dimensions reported for one metric. */
public final class DimensionReducer {
    public static final String OTHER_DIMENSION = "(other)";

    /**
     * Keeps the {@code max} records with the most users. With {@code keepOther} the rest are
     * summed into the last kept record, which is renamed {@value #OTHER_DIMENSION}; otherwise they
     * are dropped. Quantile columns are never summed.
     */
    public static List<DimensionRecord> reduce(
            List<DimensionRecord> records, int max, boolean keepOther) {
        var limit = Math.max(max, 1);
        var sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparingDouble(DimensionRecord::totalUsers).reversed());
        if (sorted.size() <= limit) {
            return List.copyOf(sorted);
        }
        var kept = new ArrayList<>(sorted.subList(0, limit));
        if (keepOther) {
            var other = kept.get(limit - 1);
            for (var overflow : sorted.subList(limit, sorted.size())) {
                other = merge(other, overflow);
            }
            kept.set(limit - 1, other);
        }
        return List.copyOf(kept);
    }

    private static DimensionRecord merge(DimensionRecord into, DimensionRecord from) {
        var variations = new ArrayList<VariationColumns>(into.variationCount());
        for (int i = 0; i < into.variationCount(); i++) {
            var target = into.variation(i);
            variations.add(target.withColumns(target.columns().plus(from.variation(i).columns())));
        }
        return new DimensionRecord(
                OTHER_DIMENSION, into.totalUsers() + from.totalUsers(), variations);
    }

    private DimensionReducer() {}
}
