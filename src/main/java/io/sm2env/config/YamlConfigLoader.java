package io.sm2env.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads an sm2env YAML file into the flat {@code key=value} shape the CLI uses.
 *
 * <p>Settings under {@code common} apply to every command; the section named after the running command
 * ({@code get} or {@code list}) is layered on top. Nested mappings become dotted keys.</p>
 *
 * <pre>
 * common:
 *   region: eu-west-1
 *   profile: staging
 * get:
 *   output: yaml
 * </pre>
 */
public final class YamlConfigLoader {
  private static final String SHARED_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Reads {@code path} and returns the settings visible to {@code command}.
   *
   * @param path YAML file
   * @param command {@code get} or {@code list}
   * @return settings, empty map for an empty document, or empty optional when the file is absent
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the YAML is malformed, a section is not a mapping, or a value is a list
   */
  public static Optional<Map<String, String>> load(Path path, String command) throws IOException {
    Objects.requireNonNull(path, "path");
    String wanted = Objects.requireNonNull(command, "command").trim().toLowerCase(Locale.ROOT);
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<?, ?> sections = mapping(document, "root");
    Map<String, String> settings = new LinkedHashMap<>();
    for (String name : new String[] {SHARED_SECTION, wanted}) {
      sections.forEach((key, body) -> {
        if (key instanceof String s && s.trim().equalsIgnoreCase(name)) {
          putFlattened(mapping(body, name), null, settings);
        }
      });
    }
    return Optional.of(Map.copyOf(settings));
  }

  private static Map<?, ?> mapping(Object node, String where) {
    if (node instanceof Map<?, ?> map) {
      return map;
    }
    throw new IllegalArgumentException(where + " section must be a mapping");
  }

  private static void putFlattened(Map<?, ?> node, String prefix, Map<String, String> out) {
    node.forEach((rawKey, value) -> {
      if (!(rawKey instanceof String key)) {
        throw new IllegalArgumentException((prefix == null ? "root" : prefix) + " section contains non-string key");
      }
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String dotted = prefix == null ? key : prefix + '.' + key;
      if (value instanceof Map<?, ?> child) {
        putFlattened(child, dotted, out);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + dotted);
      } else {
        out.put(dotted, value == null ? "" : String.valueOf(value));
      }
    });
  }
}
