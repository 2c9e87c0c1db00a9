package dev.abstats.engine;

import java.util.List;
import javax.annotation.Nullable;

/** Outcome of one variation-vs-baseline test. */
public sealed interface TestResult permits FrequentistTestResult, BayesianTestResult {
    /** Engine estimate of the effect; 0 means the engine could not compute one. */
    double expected();

    /** Two-element interval on the effect scale. */
    List<Double> ci();

    Uplift uplift();

    @Nullable
    String errorMessage();
}
