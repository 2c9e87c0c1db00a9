package dev.abstats.trace;

import static org.assertj.core.api.Assertions.*;

import io.opentelemetry.sdk.testing.junit5.OpenTelemetryExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

class StatsTracingTest {
    @RegisterExtension
    static final OpenTelemetryExtension otelTesting = OpenTelemetryExtension.create();

    @Test
    void versionIsReadFromProperties() {
        assertThat(StatsTracing.INSTRUMENTATION_VERSION).isNotBlank();
    }

    @Test
    void tracerCarriesInstrumentationScope() {
        // Given
        var tracer = StatsTracing.getTracer(otelTesting.getOpenTelemetry());

        // When
        tracer.spanBuilder(StatsTracing.EXPERIMENT_SPAN).startSpan().end();

        // Then
        var span = otelTesting.getSpans().get(0);
        assertThat(span.getInstrumentationScopeInfo().getName())
                .isEqualTo(StatsTracing.INSTRUMENTATION_NAME);
        assertThat(span.getInstrumentationScopeInfo().getVersion())
                .isEqualTo(StatsTracing.INSTRUMENTATION_VERSION);
    }
}
