package dev.abstats.model.results;

/** Point statistics of one variation as shown next to its result. */
public record MetricStats(double users, double count, double stddev, double mean) {}
