/**
 * OpenTelemetry-backed implementation of {@link io.sm2env.application.port.MetricsPort}.
 *
 * <p>Exporting is off unless {@code metricsExporter=otlp} or {@code OTEL_METRICS_EXPORTER=otlp} is set.</p>
 *
 * @since 0.1.0
 */
package io.sm2env.infrastructure.metrics;
