package io.sm2env.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the OpenTelemetry meter provider for one sm2env run.
 *
 * <p>Settings come from the {@code otel.*} system properties that {@code metricsExporter}, {@code otelEndpoint}
 * and {@code otelResourceAttributes} are copied into, falling back to the matching {@code OTEL_*} environment
 * variables. Nothing is exported unless the exporter is {@code otlp}. The periodic interval is longer than any run,
 * so data leaves the process through the flush in {@link MeterSession#close()}.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String SCOPE = "io.sm2env";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofMinutes(1);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  private OpenTelemetryBootstrap() {}

  /** Exporter settings after property and environment lookup. */
  record Settings(boolean export, String endpoint, Attributes resourceAttributes) {
    static Settings resolve(UnaryOperator<String> properties, UnaryOperator<String> environment) {
      String exporter = pick(properties.apply("otel.metrics.exporter"), environment.apply("OTEL_METRICS_EXPORTER"));
      String endpoint = pick(
          properties.apply("otel.exporter.otlp.endpoint"), environment.apply("OTEL_EXPORTER_OTLP_ENDPOINT"));
      String attributes = pick(
          properties.apply("otel.resource.attributes"), environment.apply("OTEL_RESOURCE_ATTRIBUTES"));
      return new Settings(
          exportsOtlp(exporter),
          endpoint == null ? DEFAULT_ENDPOINT : endpoint,
          parseResourceAttributes(attributes));
    }

    private static String pick(String property, String env) {
      if (property != null && !property.isBlank()) {
        return property.trim();
      }
      return env == null || env.isBlank() ? null : env.trim();
    }
  }

  static MeterSession start() {
    return start(Settings.resolve(System::getProperty, System::getenv));
  }

  static MeterSession start(Settings settings) {
    if (!settings.export()) {
      log.debug("Metrics export disabled");
      return MeterSession.disabled();
    }
    try {
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      log.debug("Exporting metrics over OTLP to {}", settings.endpoint());
      return open(reader, settings.resourceAttributes());
    } catch (RuntimeException ex) {
      log.warn("Metrics export to {} unavailable, continuing without metrics", settings.endpoint(), ex);
      return MeterSession.disabled();
    }
  }

  static MeterSession forTesting(MetricReader reader) {
    return open(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  /**
   * Only {@code otlp} enables export. Any other value, including typos, leaves metrics off with a warning.
   */
  static boolean exportsOtlp(String exporter) {
    if (exporter == null || exporter.isBlank() || exporter.trim().equalsIgnoreCase("none")) {
      return false;
    }
    if (exporter.trim().equalsIgnoreCase("otlp")) {
      return true;
    }
    log.warn("Unknown metrics exporter '{}'; metrics disabled", exporter);
    return false;
  }

  /**
   * Parses {@code k1=v1,k2=v2}. Entries without a key or value are skipped with a warning.
   */
  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null) {
      return builder.build();
    }
    for (String entry : raw.split(",")) {
      String[] parts = entry.split("=", 2);
      String key = parts[0].trim();
      String value = parts.length == 2 ? parts[1].trim() : "";
      if (key.isEmpty() || value.isEmpty()) {
        if (!entry.isBlank()) {
          log.warn("Ignoring malformed resource attribute: {}", entry.trim());
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static MeterSession open(MetricReader reader, Attributes extra) {
    String version = serviceVersion();
    Resource resource = Resource.getDefault()
        .merge(Resource.builder().put("service.name", "sm2env").put("service.version", version).build())
        .merge(Resource.create(extra));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    return new MeterSession(provider.meterBuilder(SCOPE).setInstrumentationVersion(version).build(), provider);
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? "0.0.0-dev" : version;
  }

  /** A meter plus the provider that must be flushed before the process exits; the provider is absent when off. */
  static final class MeterSession implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private MeterSession(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static MeterSession disabled() {
      return new MeterSession(MeterProvider.noop().get(SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean enabled() {
      return provider != null;
    }

    void flush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    /** Flushes, then shuts the provider down. Failures are logged, never thrown: metrics must not change the exit. */
    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        await(provider.forceFlush(), "flush");
        await(provider.shutdown(), "shutdown");
      } catch (RuntimeException ex) {
        log.warn("Meter provider did not shut down cleanly", ex);
      }
    }

    private static void await(CompletableResultCode result, String step) {
      if (!result.join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS).isSuccess()) {
        log.warn("Metrics {} did not complete within {}s", step, SHUTDOWN_TIMEOUT_SECONDS);
      }
    }
  }
}
