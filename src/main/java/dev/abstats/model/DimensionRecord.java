package dev.abstats.model;

import java.util.List;

/**
 * All variations' aggregates for one dimension value (or one bandit period). Index 0 of {@code
 * variations} is the baseline; every variation has a column group, zero-filled when the query
 * returned no row for it.
 */
public record DimensionRecord(String key, double totalUsers, List<VariationColumns> variations) {

    public DimensionRecord {
        variations = List.copyOf(variations);
    }

    public int variationCount() {
        return variations.size();
    }

    public VariationColumns baseline() {
        return variations.get(0);
    }

    public VariationColumns variation(int index) {
        return variations.get(index);
    }
}
