package dev.abstats.pipeline;

import java.util.List;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;

/** Sample ratio mismatch test of observed users against configured traffic weights. */
public final class SrmCheck {

    /**
     * Pearson chi-square p-value over the variations whose users and weight are both positive.
     * Returns 1 when fewer than two such variations exist.
     */
    public static double check(List<Double> users, List<Double> weights) {
        var pairs = Math.min(users.size(), weights.size());
        var totalUsers = 0.0;
        var totalWeight = 0.0;
        var used = 0;
        for (int i = 0; i < pairs; i++) {
            if (users.get(i) > 0 && weights.get(i) > 0) {
                totalUsers += users.get(i);
                totalWeight += weights.get(i);
                used++;
            }
        }
        if (used < 2) {
            return 1;
        }
        var chiSquare = 0.0;
        for (int i = 0; i < pairs; i++) {
            if (users.get(i) > 0 && weights.get(i) > 0) {
                var expected = weights.get(i) / totalWeight * totalUsers;
                chiSquare += Math.pow(users.get(i) - expected, 2) / expected;
            }
        }
        return 1 - new ChiSquaredDistribution(used - 1).cumulativeProbability(chiSquare);
    }

    private SrmCheck() {}
}
