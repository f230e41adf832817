package io.sm2env.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliWinsOverYamlWhichWinsOverDefaults() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig("get",
        Optional.of(Map.of("output", "yaml", "region", "eu-west-1")),
        Map.of("output", "json"),
        DefaultsForMode.asFlatMap("get"),
        warnings::add);

    assertEquals("json", merged.get("output"));
    assertEquals("eu-west-1", merged.get("region"));
    assertEquals("none", merged.get("metricsExporter"));
    assertEquals(List.of("CLI overrides YAML for key: output"), warnings);
  }

  @Test
  void defaultsApplyWithoutYaml() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig("list", Optional.empty(), Map.of(),
        DefaultsForMode.asFlatMap("list"), null);

    assertEquals("", merged.get("filter"));
    assertEquals("false", merged.get("verbose"));
  }

  @Test
  void rejectsUnknownMetricsExporter() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig("get", Optional.empty(),
        Map.of("metricsExporter", "prometheus"), DefaultsForMode.asFlatMap("get"), null));
  }

  @Test
  void unknownCommandHasNoDefaults() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("delete"));
  }
}
