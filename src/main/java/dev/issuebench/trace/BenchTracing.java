package dev.issuebench.trace;

import dev.issuebench.config.BenchConfig;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SdkTracerProviderBuilder;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.util.Properties;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for tracing evaluations. Every evaluation the dispatcher runs becomes a span; this
 * class wires those spans into OpenTelemetry.
 */
@Slf4j
public final class BenchTracing {
    static final String OTEL_SERVICE_NAME = "issuebench";
    static final String INSTRUMENTATION_NAME = "issuebench-java";
    static final String INSTRUMENTATION_VERSION = loadVersionFromProperties();

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION =
            AttributeKey.stringKey("service.version");

    /** Builds an OpenTelemetry SDK from {@code config}, optionally registered globally. */
    public static OpenTelemetry of(@Nonnull BenchConfig config, boolean registerGlobal) {
        var tracerBuilder = SdkTracerProvider.builder();
        enable(config, tracerBuilder);
        var openTelemetry =
                OpenTelemetrySdk.builder().setTracerProvider(tracerBuilder.build()).build();
        if (registerGlobal) {
            GlobalOpenTelemetry.set(openTelemetry);
            log.debug("Registered OpenTelemetry globally");
        }
        return openTelemetry;
    }

    /**
     * Adds the issuebench resource, and the span console log when enabled, to an existing tracer
     * provider builder.
     */
    public static void enable(
            @Nonnull BenchConfig config, @Nonnull SdkTracerProviderBuilder tracerProviderBuilder) {
        log.info(
                "Initializing issuebench tracing with service={}, instrumentation-version={},"
                        + " console-log={}",
                OTEL_SERVICE_NAME,
                INSTRUMENTATION_VERSION,
                config.enableTraceConsoleLog());
        var resource =
                Resource.getDefault().toBuilder()
                        .put(SERVICE_NAME, OTEL_SERVICE_NAME)
                        .put(SERVICE_VERSION, INSTRUMENTATION_VERSION)
                        .build();
        tracerProviderBuilder.addResource(resource);
        if (config.enableTraceConsoleLog()) {
            tracerProviderBuilder.addSpanProcessor(
                    SimpleSpanProcessor.create(new DebugSpanExporter()));
        }
    }

    /** Gets a tracer with issuebench instrumentation scope from the global OpenTelemetry. */
    public static Tracer getTracer() {
        return getTracer(GlobalOpenTelemetry.get());
    }

    /** Gets a tracer from a specific OpenTelemetry instance. */
    public static Tracer getTracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_NAME, INSTRUMENTATION_VERSION);
    }

    private static String loadVersionFromProperties() {
        try (var is = BenchTracing.class.getResourceAsStream("/issuebench.properties")) {
            var props = new Properties();
            props.load(is);
            return props.getProperty("sdk.version");
        } catch (Exception e) {
            throw new IllegalStateException("unable to determine issuebench version", e);
        }
    }

    private BenchTracing() {}
}
