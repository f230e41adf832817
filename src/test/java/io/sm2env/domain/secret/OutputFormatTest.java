package io.sm2env.domain.secret;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class OutputFormatTest {

  @Test
  void parsesCaseInsensitively() {
    assertEquals(OutputFormat.JSON, OutputFormat.fromString("JSON"));
    assertEquals(OutputFormat.STDOUT, OutputFormat.fromString(" stdout "));
    assertEquals(OutputFormat.CSV, OutputFormat.fromString("Csv"));
  }

  @Test
  void unknownFormatIsRejected() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> OutputFormat.fromString("toml"));
    assertTrue(ex.getMessage().contains("toml"));
  }

  @Test
  void defaultFileNames() {
    assertEquals(".env", OutputFormat.ENV.defaultFileName());
    assertEquals(".env", OutputFormat.STDOUT.defaultFileName());
    assertEquals("secret.json", OutputFormat.JSON.defaultFileName());
    assertEquals("secret.yaml", OutputFormat.YAML.defaultFileName());
    assertEquals("secret.csv", OutputFormat.CSV.defaultFileName());
  }

  @Test
  void outputRequestNormalizesNullPathAndRejectsBlankName() {
    OutputRequest request = new OutputRequest("db", OutputFormat.ENV, null);
    assertEquals(Optional.empty(), request.explicitPath());
    assertEquals(Optional.of(Path.of("x")), new OutputRequest("db", OutputFormat.ENV, Optional.of(Path.of("x")))
        .explicitPath());
    assertThrows(IllegalArgumentException.class, () -> OutputRequest.of(" ", OutputFormat.ENV));
  }
}
