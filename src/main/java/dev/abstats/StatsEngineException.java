package dev.abstats;

/** Base exception for failures raised while analysing experiment data. */
public class StatsEngineException extends RuntimeException {

    public StatsEngineException(String message) {
        super(message);
    }

    public StatsEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
