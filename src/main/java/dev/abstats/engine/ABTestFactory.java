package dev.abstats.engine;

import dev.abstats.model.AnalysisSettings;
import dev.abstats.model.MetricSettings;
import dev.abstats.statistics.TestStatistic;

/** Chooses and configures the test engine for one baseline/variation pair. */
@FunctionalInterface
public interface ABTestFactory {
    ABTest create(
            TestStatistic statA,
            TestStatistic statB,
            int variationIndex,
            AnalysisSettings analysis,
            MetricSettings metric);
}
