package dev.abstats.model.results;

import java.util.List;
import javax.annotation.Nullable;

/**
 * Outcome of a bandit weight update. When the update did not happen all numeric fields are null
 * and {@code banditUpdateMessage} says why.
 */
public record BanditResult(
        @Nullable List<SingleVariationResult> singleVariationResults,
        @Nullable List<Double> banditWeights,
        @Nullable List<Double> bestArmProbabilities,
        @Nullable Double additionalReward,
        long seed,
        String banditUpdateMessage) {

    public static BanditResult notUpdated(String message) {
        return new BanditResult(null, null, null, null, 0, message);
    }
}
