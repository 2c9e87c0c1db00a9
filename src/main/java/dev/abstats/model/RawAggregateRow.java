package dev.abstats.model;

import dev.abstats.ConfigurationException;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * One query-engine row: the aggregate of one variation within one dimension value (or one bandit
 * period).
 */
public record RawAggregateRow(
        String variation, String dimension, @Nullable String banditPeriod, RowColumns columns) {

    public static RawAggregateRow of(String variation, String dimension, RowColumns columns) {
        return new RawAggregateRow(variation, dimension, null, columns);
    }

    public RawAggregateRow withColumns(RowColumns newColumns) {
        return new RawAggregateRow(variation, dimension, banditPeriod, newColumns);
    }

    /**
     * Parses a row from its column map, metric prefixes already stripped. A missing {@code count}
     * column falls back to {@code users}; every other missing numeric column is 0.
     */
    public static RawAggregateRow fromColumns(Map<String, Object> row) {
        var builder =
                RowColumns.builder()
                        .users(number(row, "users"))
                        .main(number(row, "main_sum"), number(row, "main_sum_squares"))
                        .denominator(
                                number(row, "denominator_sum"),
                                number(row, "denominator_sum_squares"),
                                number(row, "main_denominator_sum_product"))
                        .covariate(
                                number(row, "covariate_sum"),
                                number(row, "covariate_sum_squares"),
                                number(row, "main_covariate_sum_product"))
                        .quantile(
                                number(row, "quantile_n"),
                                number(row, "quantile_nstar"),
                                number(row, "quantile"),
                                number(row, "quantile_lower"),
                                number(row, "quantile_upper"));
        if (row.get("count") != null) {
            builder.count(number(row, "count"));
        }
        var period = row.get("bandit_period");
        return new RawAggregateRow(
                String.valueOf(row.get("variation")),
                text(row.get("dimension")),
                period == null ? null : text(period),
                builder.build());
    }

    private static String text(@Nullable Object value) {
        if (value == null) {
            return "";
        }
        // integral periods/dimensions arrive as doubles from some drivers
        if (value instanceof Double d && d == Math.rint(d) && !d.isInfinite()) {
            return Long.toString(d.longValue());
        }
        return value.toString();
    }

    private static double number(Map<String, Object> row, String column) {
        var value = row.get(column);
        if (value == null) {
            return 0;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    "column %s is not numeric: %s".formatted(column, value), e);
        }
    }
}
