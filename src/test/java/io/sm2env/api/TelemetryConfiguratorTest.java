package io.sm2env.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {

  @AfterEach
  void clearProperties() {
    System.clearProperty("otel.metrics.exporter");
    System.clearProperty("otel.exporter.otlp.endpoint");
    System.clearProperty("otel.resource.attributes");
  }

  @Test
  void publishesOptionsAndRemovesThemFromConfig() {
    Map<String, String> effective = new HashMap<>(Map.of(
        "metricsExporter", " OTLP ",
        "otelEndpoint", "http://collector:4317",
        "otelResourceAttributes", "",
        "region", "eu-west-1"));

    TelemetryConfigurator.configureMetrics(effective);

    assertEquals(Map.of("region", "eu-west-1"), effective);
    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertNull(System.getProperty("otel.resource.attributes"));
  }

  @Test
  void rejectsUnknownExporter() {
    Map<String, String> effective = new HashMap<>(Map.of("metricsExporter", "prometheus"));

    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.configureMetrics(effective));
    assertNull(System.getProperty("otel.metrics.exporter"));
  }
}
