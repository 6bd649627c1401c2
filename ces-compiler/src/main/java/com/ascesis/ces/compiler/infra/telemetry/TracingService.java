/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler.infra.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide tracer for the compiler.
 *
 * <p>Configuration via environment variables (or system properties):
 * <ul>
 *   <li>{@code OTEL_DISABLED}: disable tracing entirely (default: true)</li>
 *   <li>{@code OTEL_EXPORTER_TYPE}: logging|otlp (default: logging)</li>
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT}: OTLP endpoint (default: http://localhost:4317)</li>
 *   <li>{@code OTEL_TRACE_SAMPLING_RATIO}: 0.0-1.0 (default: 1.0)</li>
 *   <li>{@code SERVICE_NAME}: service identifier (default: ces-compiler)</li>
 * </ul>
 * Compilation is a batch job, so spans are exported as they end rather than batched.
 */
public final class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.ascesis.ces-compiler";
    private static final String DEFAULT_SERVICE_NAME = "ces-compiler";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

    private static volatile TracingService INSTANCE;
    private static final Object LOCK = new Object();

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;

    private TracingService(OpenTelemetry openTelemetry, SdkTracerProvider tracerProvider) {
        this.openTelemetry = openTelemetry;
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
        this.tracerProvider = tracerProvider;
    }

    public static TracingService getInstance() {
        TracingService instance = INSTANCE;
        if (instance == null) {
            synchronized (LOCK) {
                instance = INSTANCE;
                if (instance == null) {
                    instance = initialize();
                    INSTANCE = instance;
                }
            }
        }
        return instance;
    }

    private static TracingService initialize() {
        if (Boolean.parseBoolean(getEnvOrProperty("OTEL_DISABLED", "true"))) {
            logger.fine("OpenTelemetry tracing is disabled");
            return new TracingService(OpenTelemetry.noop(), null);
        }
        try {
            Resource resource = Resource.getDefault().merge(Resource.create(Attributes.builder()
                    .put(SERVICE_NAME, getEnvOrProperty("SERVICE_NAME", DEFAULT_SERVICE_NAME))
                    .put(SERVICE_VERSION, getEnvOrProperty("SERVICE_VERSION", "unknown"))
                    .build()));

            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(resource)
                    .setSampler(configureSampler())
                    .addSpanProcessor(SimpleSpanProcessor.create(configureExporter()))
                    .build();

            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .build();

            TracingService service = new TracingService(sdk, tracerProvider);
            Runtime.getRuntime().addShutdownHook(new Thread(service::shutdown, "otel-shutdown-hook"));
            logger.info("OpenTelemetry tracing initialized");
            return service;
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry - falling back to noop", e);
            return new TracingService(OpenTelemetry.noop(), null);
        }
    }

    private static Sampler configureSampler() {
        String ratio = getEnvOrProperty("OTEL_TRACE_SAMPLING_RATIO", "1.0");
        double samplingRatio;
        try {
            samplingRatio = Math.max(0.0, Math.min(1.0, Double.parseDouble(ratio)));
        } catch (NumberFormatException e) {
            logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO: " + ratio + ", using 1.0");
            samplingRatio = 1.0;
        }
        return Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(samplingRatio)).build();
    }

    private static SpanExporter configureExporter() {
        String exporterType = getEnvOrProperty("OTEL_EXPORTER_TYPE", "logging").toLowerCase();
        return switch (exporterType) {
            case "otlp" -> {
                String endpoint = getEnvOrProperty("OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
                logger.info("Using OTLP exporter: " + endpoint);
                yield OtlpGrpcSpanExporter.builder()
                        .setEndpoint(endpoint)
                        .setTimeout(30, TimeUnit.SECONDS)
                        .build();
            }
            case "logging" -> LoggingSpanExporter.create();
            default -> {
                logger.warning("Unknown exporter type: " + exporterType + ", using logging");
                yield LoggingSpanExporter.create();
            }
        };
    }

    public void shutdown() {
        if (tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.shutdown().join(10, TimeUnit.SECONDS);
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error during OpenTelemetry shutdown", e);
        }
    }

    public Tracer getTracer() {
        return tracer;
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }

    private static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
