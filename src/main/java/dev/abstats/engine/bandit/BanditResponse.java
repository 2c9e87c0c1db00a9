package dev.abstats.engine.bandit;

import java.util.List;
import javax.annotation.Nullable;

/** Output of one bandit weight update. Numeric fields are null when weights were not updated. */
public record BanditResponse(
        @Nullable List<Double> banditWeights,
        @Nullable List<Double> bestArmProbabilities,
        @Nullable Double additionalReward,
        long seed,
        String banditUpdateMessage,
        @Nullable List<List<Double>> ci) {

    public static final String SUCCESSFULLY_UPDATED = "successfully_updated";
    public static final String ZERO_USERS = "some variations have zero users; weights not updated";

    public boolean isUpdated() {
        return SUCCESSFULLY_UPDATED.equals(banditUpdateMessage);
    }

    static BanditResponse notUpdated(long seed, String message) {
        return new BanditResponse(null, null, null, seed, message, null);
    }
}
