package dev.abstats;

/** More than one metric of a single experiment resolved to the bandit decision metric. */
public class DuplicateBanditDecisionMetricException extends StatsEngineException {

    public DuplicateBanditDecisionMetricException(String metricId) {
        super("Bandit weights already computed; duplicate decision metric " + metricId);
    }
}
