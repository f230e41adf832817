package io.sm2env.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.sm2env.application.port.MetricsPort;
import io.sm2env.application.port.SecretFetchException;
import io.sm2env.config.ClientConfig;
import io.sm2env.config.CompositionRoot;
import io.sm2env.domain.secret.RawSecret;
import io.sm2env.infrastructure.output.LocalOutputAdapter;
import io.sm2env.testutil.StubSecretSource;
import java.io.ByteArrayOutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ListCliTest {
  @TempDir
  Path workDir;

  private final StubSecretSource source = new StubSecretSource();
  private StringWriter printed;

  @BeforeEach
  void setUp() {
    printed = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(printed, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void printsSortedNamesAndTotal() {
    source.put("prod/db", RawSecret.ofText("x")).put("dev/db", RawSecret.ofText("x"));

    assertEquals(ExitCode.SUCCESS, ListCli.run(new String[0], factory()));
    assertEquals(String.join(System.lineSeparator(),
        "Available secrets:", "- dev/db", "- prod/db", "", "Total: 2 secrets", ""), printed.toString());
  }

  @Test
  void positionalFilterNarrowsNames() {
    source.put("prod/db", RawSecret.ofText("x")).put("prod/api", RawSecret.ofText("x"));

    assertEquals(ExitCode.SUCCESS, ListCli.run(new String[] {"api"}, factory()));
    assertEquals(String.join(System.lineSeparator(),
        "Available secrets:", "- prod/api", "", "Total: 1 secrets", ""), printed.toString());
  }

  @Test
  void emptyResultSaysSo() {
    assertEquals(ExitCode.SUCCESS, ListCli.run(new String[] {"filter=none"}, factory()));
    assertEquals("No secrets found." + System.lineSeparator(), printed.toString());
  }

  @Test
  void failureIsFetchError() {
    source.failWith(new SecretFetchException(SecretFetchException.Kind.ACCESS_DENIED, "denied"));

    assertEquals(ExitCode.FETCH_ERROR, ListCli.run(new String[0], factory()));
  }

  @Test
  void filterGivenTwiceIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, ListCli.run(new String[] {"a", "filter=b"}, factory()));
  }

  private Function<ClientConfig, CompositionRoot> factory() {
    return client -> new CompositionRoot(source, new LocalOutputAdapter(new ByteArrayOutputStream()),
        MetricsPort.NO_OP, workDir);
  }
}
