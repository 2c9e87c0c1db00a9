package dev.abstats.trace;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Tracer;
import java.util.Properties;

/**
 * Tracer access for the stats engine. The engine never installs an OpenTelemetry SDK itself; spans
 * are recorded only when the host application registers one globally or passes its own instance.
 */
public final class StatsTracing {
    static final String INSTRUMENTATION_NAME = "abstats-java";
    static final String INSTRUMENTATION_VERSION = loadVersionFromProperties();

    public static final String EXPERIMENT_SPAN = "experiment";
    public static final AttributeKey<String> EXPERIMENT_ID =
            AttributeKey.stringKey("abstats.experiment_id");
    public static final AttributeKey<Long> METRIC_COUNT =
            AttributeKey.longKey("abstats.metric_count");

    /** Gets a tracer with abstats instrumentation scope. */
    public static Tracer getTracer() {
        return getTracer(GlobalOpenTelemetry.get());
    }

    /** Gets a tracer from a specific OpenTelemetry instance. */
    public static Tracer getTracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_NAME, INSTRUMENTATION_VERSION);
    }

    private static String loadVersionFromProperties() {
        try (var is = StatsTracing.class.getResourceAsStream("/abstats.properties")) {
            var props = new Properties();
            props.load(is);
            return props.getProperty("sdk.version");
        } catch (Exception e) {
            throw new RuntimeException("unable to determine abstats version", e);
        }
    }

    private StatsTracing() {}
}
