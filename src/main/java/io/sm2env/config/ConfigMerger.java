package io.sm2env.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Layers defaults, YAML and CLI settings; a later layer replaces an earlier one key by key.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration for a command.
   *
   * <p>A CLI value that replaces a YAML value is reported through {@code warn}, because the file the user passed
   * is then partly ignored. Replacing a default is silent. Null CLI keys or values are skipped.</p>
   *
   * @param command {@code get} or {@code list}
   * @param yaml settings from {@link YamlConfigLoader}, if a file was given
   * @param cli settings from {@code key=value} arguments (may be {@code null})
   * @param defaults {@link DefaultsForMode#asFlatMap(String)} for the command
   * @param warn override sink, may be {@code null}
   * @return immutable merged map
   * @throws IllegalArgumentException when {@code metricsExporter} is neither {@code otlp} nor {@code none}
   */
  public static Map<String, String> buildEffectiveConfig(
      String command,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(command, "command");
    Map<String, String> fromFile = Objects.requireNonNull(yaml, "yaml").orElse(Map.of());
    Consumer<String> sink = warn == null ? message -> { } : warn;

    Map<String, String> merged = new LinkedHashMap<>();
    if (defaults != null) {
      merged.putAll(defaults);
    }
    merged.putAll(fromFile);
    if (cli != null) {
      cli.forEach((key, value) -> {
        if (key != null && value != null) {
          if (fromFile.containsKey(key)) {
            sink.accept("CLI overrides YAML for key: " + key);
          }
          merged.put(key, value);
        }
      });
    }

    String exporter = merged.getOrDefault("metricsExporter", "").trim();
    if (!exporter.isEmpty() && !exporter.equalsIgnoreCase("otlp") && !exporter.equalsIgnoreCase("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    return Map.copyOf(merged);
  }
}
