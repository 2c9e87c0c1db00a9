package dev.abstats.model.results;

public record BaselineResponse(
        double cr, double value, double users, double denominator, MetricStats stats)
        implements VariationResponse {}
