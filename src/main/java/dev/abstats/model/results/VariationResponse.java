package dev.abstats.model.results;

/**
 * The result of one variation within one dimension. The baseline carries only its point
 * statistics; other variations add the test result of the engine that analysed them.
 */
public sealed interface VariationResponse
        permits BaselineResponse, FrequentistVariationResponse, BayesianVariationResponse {
    /** Conversion rate, the unadjusted mean of the metric. */
    double cr();

    /** Sum of the main metric. */
    double value();

    double users();

    /** Sum of the denominator, 0 for non-ratio metrics. */
    double denominator();

    MetricStats stats();
}
