package dev.abstats.model.results;

import java.util.List;

/** Pooled bandit statistics of one arm with its posterior interval. */
public record SingleVariationResult(double users, double mean, List<Double> ci) {

    public SingleVariationResult {
        ci = List.copyOf(ci);
    }
}
