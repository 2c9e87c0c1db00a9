package dev.abstats.model;

/** One variation's column group within a {@link DimensionRecord}. */
public record VariationColumns(String id, String name, RowColumns columns) {

    public VariationColumns withColumns(RowColumns newColumns) {
        return new VariationColumns(id, name, newColumns);
    }
}
