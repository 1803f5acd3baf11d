package com.helios.transform.infrastructure.telemetry;

import com.helios.transform.infra.config.TransformConfig;

import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Tracing configuration, resolved like {@link TransformConfig}: environment variable,
 * then system property, then default.
 * <pre>
 * OTEL_SDK_DISABLED            otel.sdk.disabled            false
 * OTEL_TRACES_EXPORTER         otel.traces.exporter         logging (otlp, logging or none)
 * OTEL_EXPORTER_OTLP_ENDPOINT  otel.exporter.otlp.endpoint  http://localhost:4317
 * OTEL_TRACES_SAMPLER_ARG      otel.traces.sampler.arg      1.0 (clamped to 0..1)
 * OTEL_SERVICE_NAME            otel.service.name            helios-transform
 * </pre>
 * Exporter {@code none} disables tracing like {@code OTEL_SDK_DISABLED=true}.
 */
public record TracingSettings(boolean enabled, Exporter exporter, String otlpEndpoint,
                              double samplingRatio, String serviceName) {
    private static final Logger logger = Logger.getLogger(TracingSettings.class.getName());

    public static final String DEFAULT_SERVICE_NAME = "helios-transform";
    public static final String DEFAULT_OTLP_ENDPOINT = "http://localhost:4317";

    public enum Exporter {
        LOGGING, OTLP
    }

    public TracingSettings {
        if (exporter == null) {
            throw new IllegalArgumentException("exporter must not be null");
        }
        if (otlpEndpoint == null || otlpEndpoint.isBlank()) {
            throw new IllegalArgumentException("otlpEndpoint must not be blank");
        }
        if (!(samplingRatio >= 0.0 && samplingRatio <= 1.0)) {
            throw new IllegalArgumentException("samplingRatio must be within [0, 1], got " + samplingRatio);
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be blank");
        }
    }

    public static TracingSettings disabled() {
        return new TracingSettings(false, Exporter.LOGGING, DEFAULT_OTLP_ENDPOINT, 1.0, DEFAULT_SERVICE_NAME);
    }

    public static TracingSettings fromEnvironment() {
        return from(System::getenv, System.getProperties());
    }

    public static TracingSettings from(Function<String, String> env, Properties properties) {
        boolean disabled = Boolean.parseBoolean(
                TransformConfig.getEnvOrProperty(env, properties, "OTEL_SDK_DISABLED", "otel.sdk.disabled", "false"));
        String exporterName = TransformConfig.getEnvOrProperty(env, properties,
                "OTEL_TRACES_EXPORTER", "otel.traces.exporter", "logging").toLowerCase(Locale.ROOT);
        String endpoint = TransformConfig.getEnvOrProperty(env, properties,
                "OTEL_EXPORTER_OTLP_ENDPOINT", "otel.exporter.otlp.endpoint", DEFAULT_OTLP_ENDPOINT);
        String ratio = TransformConfig.getEnvOrProperty(env, properties,
                "OTEL_TRACES_SAMPLER_ARG", "otel.traces.sampler.arg", "1.0");
        String serviceName = TransformConfig.getEnvOrProperty(env, properties,
                "OTEL_SERVICE_NAME", "otel.service.name", DEFAULT_SERVICE_NAME);

        Exporter exporter;
        switch (exporterName) {
            case "otlp" -> exporter = Exporter.OTLP;
            case "logging" -> exporter = Exporter.LOGGING;
            case "none" -> {
                exporter = Exporter.LOGGING;
                disabled = true;
            }
            default -> {
                logger.warning("Unknown OTEL_TRACES_EXPORTER '" + exporterName + "', using logging");
                exporter = Exporter.LOGGING;
            }
        }
        return new TracingSettings(!disabled, exporter, endpoint, parseRatio(ratio), serviceName);
    }

    private static double parseRatio(String value) {
        try {
            double ratio = Double.parseDouble(value);
            if (Double.isNaN(ratio)) {
                throw new NumberFormatException("NaN");
            }
            return Math.max(0.0, Math.min(1.0, ratio));
        } catch (NumberFormatException e) {
            logger.warning("Invalid OTEL_TRACES_SAMPLER_ARG '" + value + "', sampling every trace");
            return 1.0;
        }
    }
}
