package dev.abstats.pipeline;

import dev.abstats.engine.ABTest;
import dev.abstats.engine.ABTestFactory;
import dev.abstats.engine.bayesian.EffectBayesianABTest;
import dev.abstats.engine.bayesian.EffectBayesianConfig;
import dev.abstats.engine.bayesian.GaussianPrior;
import dev.abstats.engine.frequentist.FrequentistConfig;
import dev.abstats.engine.frequentist.SequentialConfig;
import dev.abstats.engine.frequentist.SequentialTwoSidedTTest;
import dev.abstats.engine.frequentist.TwoSidedTTest;
import dev.abstats.model.AnalysisSettings;
import dev.abstats.model.DifferenceType;
import dev.abstats.model.MetricSettings;
import dev.abstats.model.StatsEngineType;
import dev.abstats.statistics.TestStatistic;

/**
 * Default engine choice: sequential or plain t-test for frequentist analyses, effect Bayesian test
 * with the metric's relative prior otherwise.
 */
public final class TestEngineSelector implements ABTestFactory {

    @Override
    public ABTest create(
            TestStatistic statA,
            TestStatistic statB,
            int variationIndex,
            AnalysisSettings analysis,
            MetricSettings metric) {
        var traffic = analysis.weights().get(variationIndex);
        if (analysis.statsEngine() == StatsEngineType.FREQUENTIST) {
            if (analysis.sequentialTestingEnabled()) {
                return new SequentialTwoSidedTTest(
                        statA,
                        statB,
                        new SequentialConfig(
                                traffic,
                                analysis.phaseLengthDays(),
                                analysis.differenceType(),
                                analysis.alpha(),
                                analysis.sequentialTuningParameter()));
            }
            return new TwoSidedTTest(
                    statA,
                    statB,
                    new FrequentistConfig(
                            traffic,
                            analysis.phaseLengthDays(),
                            analysis.differenceType(),
                            analysis.alpha()));
        }
        var prior =
                new GaussianPrior(
                        metric.priorMean(),
                        Math.pow(metric.priorStddev(), 2),
                        metric.priorProper());
        return new EffectBayesianABTest(
                statA,
                statB,
                new EffectBayesianConfig(
                        traffic,
                        analysis.phaseLengthDays(),
                        analysis.differenceType(),
                        analysis.alpha(),
                        metric.inverse(),
                        prior,
                        DifferenceType.RELATIVE));
    }
}
