package io.sm2env.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.URI;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir
  Path tempDir;

  @Test
  void acceptsRelativeAndMissingFiles() {
    assertEquals(Path.of("out.txt"), Paths.requireFilePath("file", "out.txt"));
    assertEquals(tempDir.resolve("new.json"), Paths.requireFilePath("file", tempDir.resolve("new.json").toString()));
  }

  @Test
  void rejectsDirectoriesAndNulBytes() {
    assertThrows(IllegalArgumentException.class, () -> Paths.requireFilePath("file", tempDir.toString()));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireFilePath("file", "a\0b"));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireFilePath("file", " "));
  }

  @Test
  void endpointsNeedHttpSchemeAndHost() {
    assertEquals(URI.create("https://secretsmanager.us-east-1.amazonaws.com"),
        Paths.requireEndpoint("endpoint", "https://secretsmanager.us-east-1.amazonaws.com"));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireEndpoint("endpoint", "localhost:4566"));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireEndpoint("endpoint", "http://"));
  }
}
