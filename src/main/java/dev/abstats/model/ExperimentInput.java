package dev.abstats.model;

/** One experiment of a batch. */
public record ExperimentInput(String id, ExperimentData data) {}
