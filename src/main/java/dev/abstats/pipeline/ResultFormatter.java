package dev.abstats.pipeline;

import dev.abstats.engine.BayesianTestResult;
import dev.abstats.engine.FrequentistTestResult;
import dev.abstats.model.results.BaselineResponse;
import dev.abstats.model.results.BayesianVariationResponse;
import dev.abstats.model.results.DimensionResponse;
import dev.abstats.model.results.FrequentistVariationResponse;
import dev.abstats.model.results.MetricStats;
import dev.abstats.model.results.VariationResponse;
import java.util.ArrayList;
import java.util.List;

/** Turns analysed dimensions into response records. */
public final class ResultFormatter {

    /** The baseline is re-inserted at {@code baselineIndex} of each dimension's variation list. */
    public static List<DimensionResponse> format(
            List<AnalyzedDimension> analyzed, int baselineIndex) {
        var responses = new ArrayList<DimensionResponse>(analyzed.size());
        for (var dimension : analyzed) {
            var variations = new ArrayList<VariationResponse>(dimension.variations().size() + 1);
            for (var variation : dimension.variations()) {
                variations.add(variationResponse(variation));
            }
            variations.add(
                    Math.min(Math.max(baselineIndex, 0), variations.size()),
                    baselineResponse(dimension.baseline()));
            responses.add(
                    new DimensionResponse(dimension.dimension(), dimension.srmP(), variations));
        }
        return responses;
    }

    static BaselineResponse baselineResponse(AnalyzedVariation baseline) {
        var cols = baseline.columns().columns();
        return new BaselineResponse(
                baseline.mean(), cols.mainSum(), cols.users(), cols.denominatorSum(), stats(baseline));
    }

    static VariationResponse variationResponse(AnalyzedVariation variation) {
        var cols = variation.columns().columns();
        var result = variation.result();
        if (result instanceof FrequentistTestResult frequentist) {
            return new FrequentistVariationResponse(
                    variation.mean(),
                    cols.mainSum(),
                    cols.users(),
                    cols.denominatorSum(),
                    stats(variation),
                    variation.expected(),
                    frequentist.uplift(),
                    frequentist.ci(),
                    frequentist.errorMessage(),
                    frequentist.pValue());
        } else if (result instanceof BayesianTestResult bayesian) {
            return new BayesianVariationResponse(
                    variation.mean(),
                    cols.mainSum(),
                    cols.users(),
                    cols.denominatorSum(),
                    stats(variation),
                    variation.expected(),
                    bayesian.uplift(),
                    bayesian.ci(),
                    bayesian.errorMessage(),
                    bayesian.chanceToWin(),
                    bayesian.risk(),
                    bayesian.riskType());
        }
        throw new IllegalStateException("variation has no test result");
    }

    private static MetricStats stats(AnalyzedVariation variation) {
        return new MetricStats(
                variation.columns().columns().users(),
                variation.count(),
                variation.stddev(),
                variation.mean());
    }

    private ResultFormatter() {}
}
