package dev.abstats.model;

import dev.abstats.ConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Settings of one requested analysis of an experiment's metrics.
 *
 * @param varNames variation display names, baseline first
 * @param varIds variation identifiers, baseline first
 * @param weights configured traffic weights, one per variation
 * @param baselineIndex position of the baseline in the formatted variation list
 * @param dimension the dimension being analysed; {@code pre:datedaily} diffs cumulative daily data
 * @param statsEngine frequentist or bayesian
 * @param sequentialTestingEnabled whether the frequentist engine uses sequential intervals
 * @param sequentialTuningParameter tuning parameter of the sequential mixture boundary
 * @param differenceType relative, absolute or scaled effects
 * @param phaseLengthDays experiment phase length, used by scaled effects
 * @param alpha significance level
 * @param maxDimensions dimension cap; the engine default applies when absent
 */
public record AnalysisSettings(
        List<String> varNames,
        List<String> varIds,
        @Nullable List<Double> weights,
        Integer baselineIndex,
        String dimension,
        StatsEngineType statsEngine,
        Boolean sequentialTestingEnabled,
        Double sequentialTuningParameter,
        DifferenceType differenceType,
        Double phaseLengthDays,
        Double alpha,
        @Nullable Integer maxDimensions) {

    public static final String DAILY_TIME_SERIES_DIMENSION = "pre:datedaily";

    public AnalysisSettings {
        varNames = List.copyOf(Objects.requireNonNullElse(varNames, List.of()));
        varIds = List.copyOf(Objects.requireNonNullElse(varIds, List.of()));
        weights = weights == null ? equalWeights(varIds.size()) : List.copyOf(weights);
        baselineIndex = Objects.requireNonNullElse(baselineIndex, 0);
        dimension = Objects.requireNonNullElse(dimension, "");
        statsEngine = Objects.requireNonNullElse(statsEngine, StatsEngineType.BAYESIAN);
        sequentialTestingEnabled = Objects.requireNonNullElse(sequentialTestingEnabled, false);
        sequentialTuningParameter = Objects.requireNonNullElse(sequentialTuningParameter, 5000.0);
        differenceType = Objects.requireNonNullElse(differenceType, DifferenceType.RELATIVE);
        phaseLengthDays = Objects.requireNonNullElse(phaseLengthDays, 1.0);
        alpha = Objects.requireNonNullElse(alpha, 0.05);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Variation id to its zero-based index; the baseline maps to 0. */
    public Map<String, Integer> varIdMap() {
        var map = new LinkedHashMap<String, Integer>();
        for (int i = 0; i < varIds.size(); i++) {
            map.put(varIds.get(i), i);
        }
        return Collections.unmodifiableMap(map);
    }

    public int variationCount() {
        return varIds.size();
    }

    public int maxDimensionsOr(int defaultMax) {
        return maxDimensions == null ? defaultMax : maxDimensions;
    }

    public boolean isDailyTimeSeries() {
        return DAILY_TIME_SERIES_DIMENSION.equals(dimension);
    }

    /** Rejects settings whose per-variation lists disagree. */
    public void validate() {
        if (varIds.isEmpty()) {
            throw new ConfigurationException("analysis requires at least one variation");
        }
        if (varNames.size() != varIds.size()) {
            throw new ConfigurationException(
                    "var_names has %d entries but var_ids has %d"
                            .formatted(varNames.size(), varIds.size()));
        }
        if (weights.size() != varIds.size()) {
            throw new ConfigurationException(
                    "weights has %d entries but var_ids has %d"
                            .formatted(weights.size(), varIds.size()));
        }
        if (baselineIndex < 0 || baselineIndex >= varIds.size()) {
            throw new ConfigurationException("baseline_index out of range: " + baselineIndex);
        }
    }

    private static List<Double> equalWeights(int count) {
        var equal = new ArrayList<Double>(count);
        for (int i = 0; i < count; i++) {
            equal.add(1.0 / count);
        }
        return List.copyOf(equal);
    }

    public static final class Builder {
        private List<String> varNames = List.of();
        private List<String> varIds = List.of();
        private @Nullable List<Double> weights;
        private int baselineIndex = 0;
        private String dimension = "";
        private StatsEngineType statsEngine = StatsEngineType.BAYESIAN;
        private boolean sequentialTestingEnabled = false;
        private double sequentialTuningParameter = 5000.0;
        private DifferenceType differenceType = DifferenceType.RELATIVE;
        private double phaseLengthDays = 1.0;
        private double alpha = 0.05;
        private @Nullable Integer maxDimensions;

        public Builder variations(List<String> ids, List<String> names) {
            this.varIds = ids;
            this.varNames = names;
            return this;
        }

        public Builder weights(List<Double> weights) {
            this.weights = weights;
            return this;
        }

        public Builder baselineIndex(int baselineIndex) {
            this.baselineIndex = baselineIndex;
            return this;
        }

        public Builder dimension(String dimension) {
            this.dimension = dimension;
            return this;
        }

        public Builder statsEngine(StatsEngineType statsEngine) {
            this.statsEngine = statsEngine;
            return this;
        }

        public Builder sequential(double tuningParameter) {
            this.sequentialTestingEnabled = true;
            this.sequentialTuningParameter = tuningParameter;
            return this;
        }

        public Builder differenceType(DifferenceType differenceType) {
            this.differenceType = differenceType;
            return this;
        }

        public Builder phaseLengthDays(double phaseLengthDays) {
            this.phaseLengthDays = phaseLengthDays;
            return this;
        }

        public Builder alpha(double alpha) {
            this.alpha = alpha;
            return this;
        }

        public Builder maxDimensions(int maxDimensions) {
            this.maxDimensions = maxDimensions;
            return this;
        }

        public AnalysisSettings build() {
            return new AnalysisSettings(
                    varNames,
                    varIds,
                    weights,
                    baselineIndex,
                    dimension,
                    statsEngine,
                    sequentialTestingEnabled,
                    sequentialTuningParameter,
                    differenceType,
                    phaseLengthDays,
                    alpha,
                    maxDimensions);
        }
    }
}
