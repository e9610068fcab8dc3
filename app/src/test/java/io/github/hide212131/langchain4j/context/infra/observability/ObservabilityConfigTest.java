package io.github.hide212131.langchain4j.context.infra.observability;

import static org.assertj.core.api.Assertions.assertThat;

import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.Test;

class ObservabilityConfigTest {

    @Test
    void fromEnvironment_whenNoEndpoint_shouldReturnDisabledConfig() {
        // When: No CONTEXT_COMPILER_OTLP_ENDPOINT environment variable is set
        ObservabilityConfig config = ObservabilityConfig.fromEnvironment(name -> null);

        // Then: Observability should be disabled
        assertThat(config.isEnabled()).isFalse();
        assertThat(config.openTelemetry()).isNotNull();
        assertThat(config.tracer()).isNotNull();
    }

    @Test
    void fromEnvironment_whenEndpointIsBlank_shouldReturnDisabledConfig() {
        ObservabilityConfig config = ObservabilityConfig.fromEnvironment(
                name -> ObservabilityConfig.ENV_OTLP_ENDPOINT.equals(name) ? "  " : null);

        assertThat(config.isEnabled()).isFalse();
    }

    @Test
    void fromEnvironment_withEndpoint_shouldEnableTracing() {
        // When: An endpoint and a service name are configured
        ObservabilityConfig config = ObservabilityConfig.fromEnvironment(name -> {
            if (ObservabilityConfig.ENV_OTLP_ENDPOINT.equals(name)) {
                return "http://localhost:4318/v1/traces";
            }
            if (ObservabilityConfig.ENV_SERVICE_NAME.equals(name)) {
                return "compiler-test";
            }
            return null;
        });

        // Then: Configuration should be enabled with a real tracer
        assertThat(config.isEnabled()).isTrue();
        assertThat(config.openTelemetry()).isNotNull();
        assertThat(config.tracer()).isNotNull();
    }

    @Test
    void of_shouldWrapGivenOpenTelemetry() {
        OpenTelemetry openTelemetry = OpenTelemetry.noop();

        ObservabilityConfig config = ObservabilityConfig.of(openTelemetry);

        assertThat(config.isEnabled()).isTrue();
        assertThat(config.openTelemetry()).isSameAs(openTelemetry);
    }
}
