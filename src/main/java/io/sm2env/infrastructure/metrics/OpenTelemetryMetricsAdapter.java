package io.sm2env.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.sm2env.application.port.MetricsPort;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MetricsPort} over OpenTelemetry.
 *
 * <p>Each dotted key such as {@code get.fetch.failure.not_found} becomes its own instrument, created on first
 * use and tagged with the original key. Keys ending in {@code .bytes} get the {@code By} unit.
 * {@link #close()} flushes and stops the provider; the CLI calls it once before exiting.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final AttributeKey<String> KEY = AttributeKey.stringKey("sm2env.metric.key");

  private final OpenTelemetryBootstrap.MeterSession session;
  private final Map<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final Map<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /** Uses the exporter chosen through {@code otel.*} properties or {@code OTEL_*} variables. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.start());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.MeterSession session) {
    this.session = Objects.requireNonNull(session, "session");
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    if (session.enabled()) {
      counters.computeIfAbsent(key, k -> session.meter()
              .counterBuilder(metricName(k))
              .setUnit("1")
              .setDescription("sm2env outcome count for " + k)
              .build())
          .add(1, Attributes.of(KEY, key));
    }
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    if (session.enabled()) {
      histograms.computeIfAbsent(key, k -> session.meter()
              .histogramBuilder(metricName(k))
              .ofLongs()
              .setUnit(k.endsWith(".bytes") ? "By" : "1")
              .setDescription("sm2env observed value for " + k)
              .build())
          .record(value, Attributes.of(KEY, key));
    }
  }

  void forceFlush() {
    session.flush();
  }

  @Override
  public void close() {
    session.close();
  }

  /**
   * Lower-cases the key and replaces characters outside {@code [a-z0-9._-]} with {@code _}. A key that does not
   * start with a letter gets an {@code m} prefix; a blank key becomes {@code sm2env.metric}.
   */
  static String metricName(String key) {
    String lower = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
    if (lower.isEmpty()) {
      return "sm2env.metric";
    }
    String cleaned = lower.replaceAll("[^\\p{L}\\p{N}._-]", "_");
    return Character.isLetter(cleaned.charAt(0)) ? cleaned : "m" + cleaned;
  }
}
