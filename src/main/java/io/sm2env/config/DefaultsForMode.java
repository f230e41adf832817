package io.sm2env.config;

import io.sm2env.domain.secret.OutputFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Built-in settings, the lowest layer of {@link ConfigMerger}. Both commands share the telemetry and verbosity
 * keys; {@code get} adds the {@code env} output format and {@code list} an empty filter.
 */
public final class DefaultsForMode {
  private static final Map<String, Map<String, String>> BY_COMMAND = Map.of(
      "get", Map.of("output", OutputFormat.ENV.cliName()),
      "list", Map.of("filter", ""));

  private DefaultsForMode() {}

  /**
   * @param command {@code get} or {@code list}, any case
   * @return unmodifiable defaults
   * @throws IllegalArgumentException for other commands
   */
  public static Map<String, String> asFlatMap(String command) {
    String key = Objects.requireNonNull(command, "command").trim().toLowerCase(Locale.ROOT);
    Map<String, String> specific = BY_COMMAND.get(key);
    if (specific == null) {
      throw new IllegalArgumentException("Unsupported command: " + command);
    }
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put("verbose", "false");
    defaults.put("metricsExporter", "none");
    defaults.put("otelEndpoint", "");
    defaults.put("otelResourceAttributes", "");
    defaults.putAll(specific);
    return Map.copyOf(defaults);
  }
}
