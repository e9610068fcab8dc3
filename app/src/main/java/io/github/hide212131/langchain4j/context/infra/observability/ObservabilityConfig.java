package io.github.hide212131.langchain4j.context.infra.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OTLP HTTP エクスポーターで OpenTelemetry を構成する。エンドポイント未設定時は noop を返す。
 */
public final class ObservabilityConfig {

    static final String ENV_OTLP_ENDPOINT = "CONTEXT_COMPILER_OTLP_ENDPOINT";
    static final String ENV_SERVICE_NAME = "CONTEXT_COMPILER_SERVICE_NAME";

    private static final String DEFAULT_SERVICE_NAME = "langchain4j-context-compiler";
    private static final String INSTRUMENTATION_NAME = "io.github.hide212131.langchain4j.context";
    private static final Logger LOGGER = LoggerFactory.getLogger(ObservabilityConfig.class);

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final boolean enabled;

    private ObservabilityConfig(OpenTelemetry openTelemetry, Tracer tracer, boolean enabled) {
        this.openTelemetry = openTelemetry;
        this.tracer = tracer;
        this.enabled = enabled;
    }

    /**
     * Builds the configuration from the process environment.
     *
     * <ul>
     *   <li>CONTEXT_COMPILER_OTLP_ENDPOINT enables tracing when present.</li>
     *   <li>CONTEXT_COMPILER_SERVICE_NAME overrides the service name.</li>
     * </ul>
     */
    public static ObservabilityConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static ObservabilityConfig fromEnvironment(EnvironmentVariables environment) {
        String endpoint = environment.get(ENV_OTLP_ENDPOINT);
        if (endpoint == null || endpoint.isBlank()) {
            LOGGER.debug("OTLP endpoint is not configured; lifecycle spans are disabled");
            return disabled();
        }

        String serviceName = environment.get(ENV_SERVICE_NAME);
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = DEFAULT_SERVICE_NAME;
        }

        Resource resource = Resource.getDefault()
                .merge(Resource.create(Attributes.of(AttributeKey.stringKey("service.name"), serviceName)));

        OtlpHttpSpanExporter spanExporter = OtlpHttpSpanExporter.builder()
                .setEndpoint(endpoint)
                .setTimeout(30, TimeUnit.SECONDS)
                .build();

        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
                .setResource(resource)
                .build();

        OpenTelemetrySdk openTelemetry = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                .build();

        Runtime.getRuntime().addShutdownHook(new Thread(openTelemetry::close, "opentelemetry-shutdown"));

        LOGGER.info("Lifecycle spans are exported to {}", endpoint);
        return new ObservabilityConfig(openTelemetry, openTelemetry.getTracer(INSTRUMENTATION_NAME), true);
    }

    /** 任意の OpenTelemetry インスタンスで有効化する。テスト用のインメモリ SDK を想定。 */
    public static ObservabilityConfig of(OpenTelemetry openTelemetry) {
        return new ObservabilityConfig(openTelemetry, openTelemetry.getTracer(INSTRUMENTATION_NAME), true);
    }

    public static ObservabilityConfig disabled() {
        OpenTelemetry noop = OpenTelemetry.noop();
        return new ObservabilityConfig(noop, noop.getTracer("noop"), false);
    }

    public OpenTelemetry openTelemetry() {
        return openTelemetry;
    }

    public Tracer tracer() {
        return tracer;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @FunctionalInterface
    interface EnvironmentVariables {
        String get(String key);
    }
}
