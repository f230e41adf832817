package io.sm2env.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir
  Path tempDir;

  @Test
  void mergesCommonAndCommandSections() throws Exception {
    Path file = tempDir.resolve("sm2env.yaml");
    Files.writeString(file, """
        common:
          region: eu-west-1
          profile: shared
        get:
          output: yaml
          profile: deploy
        list:
          filter: prod
        """);

    Optional<Map<String, String>> loaded = YamlConfigLoader.load(file, "get");

    assertEquals(Map.of("region", "eu-west-1", "profile", "deploy", "output", "yaml"), loaded.orElseThrow());
  }

  @Test
  void missingFileYieldsEmpty() throws Exception {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "get").isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws Exception {
    Path file = tempDir.resolve("empty.yaml");
    Files.writeString(file, "");

    assertEquals(Optional.of(Map.of()), YamlConfigLoader.load(file, "list"));
  }

  @Test
  void nestedKeysAreFlattenedAndNullsBecomeEmpty() throws Exception {
    Path file = tempDir.resolve("nested.yaml");
    Files.writeString(file, """
        list:
          filter:
          extra:
            depth: 2
        """);

    assertEquals(Map.of("filter", "", "extra.depth", "2"), YamlConfigLoader.load(file, "list").orElseThrow());
  }

  @Test
  void arraysAreRejected() throws Exception {
    Path file = tempDir.resolve("array.yaml");
    Files.writeString(file, """
        get:
          output: [json, yaml]
        """);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(file, "get"));
    assertTrue(ex.getMessage().contains("output"));
  }

  @Test
  void malformedYamlIsAnArgumentError() throws Exception {
    Path file = tempDir.resolve("broken.yaml");
    Files.writeString(file, "get: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "get"));
  }
}
