package io.sm2env.application.render;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.sm2env.domain.secret.OutputFormat;
import io.sm2env.domain.secret.OutputRequest;
import io.sm2env.domain.secret.RawSecret;
import io.sm2env.domain.secret.SecretValue;
import io.sm2env.testutil.RecordingOutputPort;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SecretRendererTest {
  private final Path workDir = Path.of("/work");
  private final RecordingOutputPort port = new RecordingOutputPort();
  private final SecretRenderer renderer =
      new SecretRenderer(new SecretClassifier(), new SecretEncoders(), new OutputRouter(workDir, port));

  @Test
  void binaryAsJsonLandsInDefaultFile() throws Exception {
    byte[] bytes = new byte[42];
    bytes[0] = (byte) 0xFF;

    RenderResult result = renderer.render(OutputRequest.of("blob", OutputFormat.JSON), RawSecret.ofBytes(bytes));

    Path expected = workDir.resolve("secret.json");
    assertEquals(Optional.of(expected), result.file());
    assertEquals(SecretValue.Kind.BINARY, result.kind());
    String json = new String(port.files().get(expected), StandardCharsets.UTF_8);
    assertTrue(json.contains("\"binary_size_bytes\" : 42"), json);
    assertEquals(Optional.of("JSON file created successfully at " + expected), result.confirmation());
  }

  @Test
  void stdoutWithFileWritesPlainTextExactly() throws Exception {
    OutputRequest request = new OutputRequest("greeting", OutputFormat.STDOUT, Optional.of(Path.of("out.txt")));

    RenderResult result = renderer.render(request, RawSecret.ofText("hello"));

    Path expected = workDir.resolve("out.txt");
    assertArrayEquals("hello".getBytes(StandardCharsets.UTF_8), port.files().get(expected));
    assertEquals(0, port.console().length);
    assertEquals(Optional.of("Secret written to file: " + expected), result.confirmation());
  }

  @Test
  void stdoutWithFileWritesBinaryBytesUntouched() throws Exception {
    byte[] bytes = {(byte) 0xC3, 0x28, 0x00};
    OutputRequest request = new OutputRequest("blob", OutputFormat.STDOUT, Optional.of(Path.of("blob.bin")));

    RenderResult result = renderer.render(request, RawSecret.ofBytes(bytes));

    Path expected = workDir.resolve("blob.bin");
    assertArrayEquals(bytes, port.files().get(expected));
    assertEquals(Optional.of("Binary secret (3 bytes) written to file: " + expected), result.confirmation());
  }

  @Test
  void stdoutWithoutFilePrintsEnvLinesToConsole() throws Exception {
    RenderResult result = renderer.render(OutputRequest.of("db", OutputFormat.STDOUT),
        RawSecret.ofText("{\"DB_HOST\":\"localhost\",\"DB_PORT\":\"5432\"}"));

    assertEquals("DB_HOST=localhost\nDB_PORT=5432\n", new String(port.console(), StandardCharsets.UTF_8));
    assertTrue(port.files().isEmpty());
    assertEquals("console", result.destination());
    assertTrue(result.confirmation().isEmpty());
  }

  @Test
  void envFormatWritesDotEnvInWorkingDirectory() throws Exception {
    RenderResult result = renderer.render(OutputRequest.of("db", OutputFormat.ENV), RawSecret.ofText("{\"A\":\"1\"}"));

    assertEquals(Optional.of(".env file created successfully at " + workDir.resolve(".env")),
        result.confirmation());
  }

  @Test
  void unencodableValueFailsBeforeAnyWrite() {
    RenderException ex = assertThrows(RenderException.class,
        () -> renderer.render(OutputRequest.of("bad", OutputFormat.YAML), RawSecret.ofText("broken \uD800")));

    assertEquals(RenderException.Stage.ENCODE, ex.stage());
    assertInstanceOf(EncodingException.class, ex.getCause());
    assertTrue(port.files().isEmpty());
    assertEquals(0, port.console().length);
  }

  @Test
  void writeFailureCarriesTheAttemptedPath() {
    port.failWith(new NoSuchFileException("/missing/dir/x.csv"));
    OutputRequest request = new OutputRequest("s", OutputFormat.CSV, Optional.of(Path.of("/missing/dir/x.csv")));

    RenderException ex = assertThrows(RenderException.class,
        () -> renderer.render(request, RawSecret.ofText("v")));

    assertEquals(RenderException.Stage.WRITE, ex.stage());
    assertEquals(Optional.of(Path.of("/missing/dir/x.csv")), ex.path());
    assertInstanceOf(IOException.class, ex.getCause());
  }

  @Test
  void renderingTwiceProducesIdenticalBytes() throws Exception {
    String payload = "{\"B\":\"2\",\"A\":\"multi\\nline\"}";
    renderer.render(OutputRequest.of("s", OutputFormat.YAML), RawSecret.ofText(payload));
    byte[] first = port.files().get(workDir.resolve("secret.yaml"));
    renderer.render(OutputRequest.of("s", OutputFormat.YAML), RawSecret.ofText(payload));

    assertArrayEquals(first, port.files().get(workDir.resolve("secret.yaml")));
  }
}
