package dev.abstats.config;

import dev.abstats.ConfigurationException;
import dev.abstats.engine.bayesian.GaussianPrior;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;
import lombok.experimental.Accessors;

/** Configuration for the stats engine */
@Getter
@Accessors(fluent = true)
public final class StatsEngineConfig extends BaseConfig {
    private final int defaultMaxDimensions = getConfig("ABSTATS_DEFAULT_MAX_DIMENSIONS", 20);
    private final int errorMessageLimit = getConfig("ABSTATS_ERROR_MESSAGE_LIMIT", 64);
    private final double banditPriorMean = getConfig("ABSTATS_BANDIT_PRIOR_MEAN", 0.0);
    private final double banditPriorVariance = getConfig("ABSTATS_BANDIT_PRIOR_VARIANCE", 1e4);
    private final int banditDraws = getConfig("ABSTATS_BANDIT_DRAWS", 10_000);
    private final double banditMinWeight = getConfig("ABSTATS_BANDIT_MIN_WEIGHT", 0.01);
    private final boolean parallel = getConfig("ABSTATS_PARALLEL", false);

    public static StatsEngineConfig fromEnvironment() {
        return of();
    }

    public static StatsEngineConfig of(String... envOverrides) {
        if (envOverrides.length % 2 != 0) {
            throw new ConfigurationException(
                    "config overrides require key-value pairs. Found dangling key: %s"
                            .formatted(envOverrides[envOverrides.length - 1]));
        }
        var overridesMap = new HashMap<String, String>();
        for (int i = 0; i < envOverrides.length - 1; i = i + 2) {
            overridesMap.put(envOverrides[i], envOverrides[i + 1]);
        }
        return new StatsEngineConfig(overridesMap);
    }

    private StatsEngineConfig(Map<String, String> envOverrides) {
        super(envOverrides);
        if (defaultMaxDimensions < 1) {
            throw new ConfigurationException("ABSTATS_DEFAULT_MAX_DIMENSIONS must be positive");
        }
        if (errorMessageLimit < 1) {
            throw new ConfigurationException("ABSTATS_ERROR_MESSAGE_LIMIT must be positive");
        }
        if (banditPriorVariance <= 0) {
            throw new ConfigurationException("ABSTATS_BANDIT_PRIOR_VARIANCE must be positive");
        }
        if (banditDraws < 1) {
            throw new ConfigurationException("ABSTATS_BANDIT_DRAWS must be positive");
        }
        if (banditMinWeight < 0 || banditMinWeight >= 1) {
            throw new ConfigurationException("ABSTATS_BANDIT_MIN_WEIGHT must be in [0, 1)");
        }
    }

    /** The prior every bandit arm starts from. Always proper. */
    public GaussianPrior banditPrior() {
        return new GaussianPrior(banditPriorMean, banditPriorVariance, true);
    }
}
