package dev.abstats.engine;

/** Distribution of the effect, as drawn by result charts. */
public record Uplift(String dist, double mean, double stddev) {

    public static Uplift normal(double mean, double stddev) {
        return new Uplift("normal", mean, stddev);
    }
}
