package dev.abstats.engine.bayesian;

/**
 * Normal prior. An improper prior is flat and leaves the data untouched.
 *
 * @param mean prior mean
 * @param variance prior variance
 * @param proper whether the prior is used at all
 */
public record GaussianPrior(double mean, double variance, boolean proper) {

    public static GaussianPrior improper() {
        return new GaussianPrior(0, 1, false);
    }
}
