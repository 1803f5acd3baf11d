package com.helios.transform.infrastructure.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the tracer the transformer, compiler and rule set manager report to.
 * <p>
 * The process-wide instance is built lazily from {@link TracingSettings#fromEnvironment()}.
 * Spans are batched to the logging or OTLP exporter; when tracing is disabled, or the
 * SDK cannot be built, a no-op tracer is handed out instead. The provider is never
 * registered as the global OpenTelemetry instance.
 */
public final class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    static final String INSTRUMENTATION_NAME = "com.helios.transform";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

    private static volatile TracingService instance;
    private static final Object LOCK = new Object();

    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;

    private TracingService(Tracer tracer, SdkTracerProvider tracerProvider) {
        this.tracer = tracer;
        this.tracerProvider = tracerProvider;
    }

    public static TracingService getInstance() {
        TracingService current = instance;
        if (current == null) {
            synchronized (LOCK) {
                current = instance;
                if (current == null) {
                    current = create(TracingSettings.fromEnvironment());
                    if (current.isEnabled()) {
                        Runtime.getRuntime().addShutdownHook(new Thread(current::shutdown, "otel-shutdown-hook"));
                    }
                    instance = current;
                }
            }
        }
        return current;
    }

    /**
     * Builds a service for the given settings. Never throws: a failure to build the
     * SDK is logged and yields a no-op service.
     */
    public static TracingService create(TracingSettings settings) {
        if (!settings.enabled()) {
            logger.info("Tracing disabled");
            return noop();
        }
        try {
            SdkTracerProvider provider = SdkTracerProvider.builder()
                    .setResource(resource(settings))
                    .setSampler(Sampler.parentBased(Sampler.traceIdRatioBased(settings.samplingRatio())))
                    .addSpanProcessor(BatchSpanProcessor.builder(exporter(settings))
                            .setMaxQueueSize(2048)
                            .setMaxExportBatchSize(256)
                            .setScheduleDelay(Duration.ofSeconds(5))
                            .build())
                    .build();
            logger.info(String.format("Tracing enabled: service=%s, exporter=%s, sampling=%.2f",
                    settings.serviceName(), settings.exporter(), settings.samplingRatio()));
            return new TracingService(provider.get(INSTRUMENTATION_NAME, serviceVersion()), provider);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to initialize tracing, falling back to no-op", e);
            return noop();
        }
    }

    public static TracingService noop() {
        return new TracingService(OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME), null);
    }

    private static Resource resource(TracingSettings settings) {
        return Resource.getDefault().merge(Resource.create(Attributes.of(
                SERVICE_NAME, settings.serviceName(),
                SERVICE_VERSION, serviceVersion())));
    }

    private static SpanExporter exporter(TracingSettings settings) {
        return switch (settings.exporter()) {
            case OTLP -> {
                logger.info("Exporting spans over OTLP to " + settings.otlpEndpoint());
                yield OtlpGrpcSpanExporter.builder()
                        .setEndpoint(settings.otlpEndpoint())
                        .setTimeout(30, TimeUnit.SECONDS)
                        .build();
            }
            case LOGGING -> LoggingSpanExporter.create();
        };
    }

    // Implementation-Version from the jar manifest; absent when running from classes
    static String serviceVersion() {
        String version = TracingService.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }

    public Tracer getTracer() {
        return tracer;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }

    /**
     * Flushes pending spans and stops exporting. Safe to call more than once.
     */
    public void shutdown() {
        if (tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.shutdown().join(30, TimeUnit.SECONDS);
            logger.info("Tracing shutdown complete");
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error during tracing shutdown", e);
        }
    }
}
