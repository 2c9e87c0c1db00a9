package dev.abstats.runner;

import com.fasterxml.jackson.databind.JsonNode;
import javax.annotation.Nullable;

/**
 * One experiment of a JSON batch whose {@code data} payload is still unmapped. Mapping happens
 * when the experiment runs, so a malformed payload fails only its own experiment.
 */
public record JsonExperiment(String id, @Nullable JsonNode data) {}
