package dev.abstats.model;

import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Settings of an adaptive (bandit) experiment.
 *
 * @param decisionMetric id of the metric whose results drive the arm weights
 * @param varNames arm display names, baseline first
 * @param varIds arm identifiers, baseline first
 * @param currentWeights weights in effect before this update
 * @param weightByPeriod reweight each period's aggregates to undo allocation changes
 * @param topTwo use top-two Thompson sampling weights
 * @param alpha significance level of the per-arm intervals
 * @param banditWeightsSeed seed for the weight sampler; random when absent
 */
public record BanditSettings(
        String decisionMetric,
        List<String> varNames,
        List<String> varIds,
        @Nullable List<Double> currentWeights,
        Boolean weightByPeriod,
        Boolean topTwo,
        Double alpha,
        @Nullable Long banditWeightsSeed) {

    public BanditSettings {
        varNames = List.copyOf(Objects.requireNonNullElse(varNames, List.of()));
        varIds = List.copyOf(Objects.requireNonNullElse(varIds, List.of()));
        currentWeights = currentWeights == null ? null : List.copyOf(currentWeights);
        weightByPeriod = Objects.requireNonNullElse(weightByPeriod, true);
        topTwo = Objects.requireNonNullElse(topTwo, false);
        alpha = Objects.requireNonNullElse(alpha, 0.05);
    }
}
