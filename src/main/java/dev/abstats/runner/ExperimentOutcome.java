package dev.abstats.runner;

import dev.abstats.model.results.MultipleExperimentMetricAnalysis;
import java.util.List;

/** What happened to one experiment of a batch. */
public sealed interface ExperimentOutcome {
    String id();

    MultipleExperimentMetricAnalysis toAnalysis();

    record Success(String id, ExperimentResults results) implements ExperimentOutcome {
        @Override
        public MultipleExperimentMetricAnalysis toAnalysis() {
            return new MultipleExperimentMetricAnalysis(
                    id, results.results(), results.banditResult(), null);
        }
    }

    record Failure(String id, String error) implements ExperimentOutcome {

        /** A failure whose error is the exception message cut to {@code limit} characters. */
        public static Failure of(String id, Throwable cause, int limit) {
            var message = cause.getMessage();
            if (message == null) {
                message = cause.getClass().getSimpleName();
            }
            return new Failure(id, message.length() > limit ? message.substring(0, limit) : message);
        }

        @Override
        public MultipleExperimentMetricAnalysis toAnalysis() {
            return new MultipleExperimentMetricAnalysis(id, List.of(), null, error);
        }
    }
}
