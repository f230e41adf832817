package io.sm2env.api;

import io.sm2env.validation.Paths;
import io.sm2env.validation.Strings;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the telemetry options out of the effective configuration and into the {@code otel.*} system properties
 * that the metrics adapter reads when the composition root builds it.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);

  private enum Option {
    EXPORTER("metricsExporter", "otel.metrics.exporter", TelemetryConfigurator::exporter),
    ENDPOINT("otelEndpoint", "otel.exporter.otlp.endpoint",
        value -> Paths.requireEndpoint("otelEndpoint", value).toString()),
    RESOURCE_ATTRIBUTES("otelResourceAttributes", "otel.resource.attributes",
        value -> Strings.requirePrintableAscii("otelResourceAttributes", value, 4_096));

    final String configKey;
    final String property;
    final UnaryOperator<String> validator;

    Option(String configKey, String property, UnaryOperator<String> validator) {
      this.configKey = configKey;
      this.property = property;
      this.validator = validator;
    }
  }

  private TelemetryConfigurator() {}

  /**
   * Removes every telemetry option from {@code effective}; non-blank ones are validated and published.
   *
   * @param effective mutable effective configuration
   * @throws IllegalArgumentException if a value is invalid; nothing later in the table is applied
   */
  static void configureMetrics(Map<String, String> effective) {
    for (Option option : Option.values()) {
      String value = effective.remove(option.configKey);
      if (value == null || value.isBlank()) {
        continue;
      }
      String checked = option.validator.apply(value.trim());
      log.debug("{} -> {}={}", option.configKey, option.property, checked);
      System.setProperty(option.property, checked);
    }
  }

  private static String exporter(String value) {
    String normalized = value.toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    return normalized;
  }
}
