package dev.abstats.runner;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import dev.abstats.ConfigurationException;
import dev.abstats.StatsEngineException;
import dev.abstats.model.ExperimentData;
import dev.abstats.model.results.MultipleExperimentMetricAnalysis;
import java.util.List;
import javax.annotation.Nullable;

/**
 * JSON boundary of the engine. Inputs use snake_case property names; results are written with
 * camelCase names.
 */
public final class StatsEngineJson {
    private static final ObjectMapper INPUT_MAPPER =
            createObjectMapper().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    private static final ObjectMapper OUTPUT_MAPPER = createObjectMapper();

    /**
     * Splits a JSON batch into its experiments. Only the batch shape is checked here; each
     * experiment's {@code data} is mapped by {@link #toExperimentData(JsonNode)} when it runs.
     *
     * @throws StatsEngineException when the input is not a JSON array of objects
     */
    public static List<JsonExperiment> readBatch(String json) {
        try {
            return INPUT_MAPPER.readValue(json, new TypeReference<List<JsonExperiment>>() {});
        } catch (JsonProcessingException e) {
            throw new StatsEngineException("invalid experiment batch: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Maps one experiment's payload. A missing or null payload maps to null.
     *
     * @throws StatsEngineException when the payload does not describe valid experiment data
     */
    public static @Nullable ExperimentData toExperimentData(@Nullable JsonNode data) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return null;
        }
        try {
            return INPUT_MAPPER.treeToValue(data, ExperimentData.class);
        } catch (JsonProcessingException e) {
            // settings validation failures surface with their own message
            for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
                if (cause instanceof StatsEngineException settingsError) {
                    throw settingsError;
                }
            }
            throw new ConfigurationException(
                    "invalid experiment data: " + e.getOriginalMessage(), e);
        }
    }

    public static String writeResults(List<MultipleExperimentMetricAnalysis> results) {
        try {
            return OUTPUT_MAPPER.writeValueAsString(results);
        } catch (JsonProcessingException e) {
            throw new StatsEngineException("unable to serialize results", e);
        }
    }

    private static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new Jdk8Module())
                .setSerializationInclusion(JsonInclude.Include.NON_ABSENT)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private StatsEngineJson() {}
}
