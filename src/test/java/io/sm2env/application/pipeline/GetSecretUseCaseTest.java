package io.sm2env.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.sm2env.application.port.SecretFetchException;
import io.sm2env.application.render.OutputRouter;
import io.sm2env.application.render.RenderException;
import io.sm2env.application.render.RenderResult;
import io.sm2env.application.render.SecretClassifier;
import io.sm2env.application.render.SecretEncoders;
import io.sm2env.application.render.SecretRenderer;
import io.sm2env.domain.secret.OutputFormat;
import io.sm2env.domain.secret.OutputRequest;
import io.sm2env.domain.secret.RawSecret;
import io.sm2env.testutil.RecordingMetricsPort;
import io.sm2env.testutil.RecordingOutputPort;
import io.sm2env.testutil.StubSecretSource;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

class GetSecretUseCaseTest {
  private final StubSecretSource source = new StubSecretSource();
  private final RecordingOutputPort port = new RecordingOutputPort();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final GetSecretUseCase useCase = new GetSecretUseCase(source,
      new SecretRenderer(new SecretClassifier(), new SecretEncoders(), new OutputRouter(Path.of("/work"), port)),
      metrics);

  private Logger logger;
  private ListAppender<ILoggingEvent> appender;

  @BeforeEach
  void attachAppender() {
    logger = (Logger) LoggerFactory.getLogger(GetSecretUseCase.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void detachAppender() {
    logger.detachAppender(appender);
  }

  @Test
  void successCountsAndObservesBytes() throws Exception {
    source.put("db", RawSecret.ofText("{\"PASSWORD\":\"hunter2\"}"));

    RenderResult result = useCase.run(OutputRequest.of("db", OutputFormat.ENV));

    assertEquals(List.of("get.render.success"), metrics.increments());
    assertEquals(List.of((long) "PASSWORD=hunter2\n".length()), metrics.observations("get.render.bytes"));
    assertEquals(Path.of("/work/.env"), result.file().orElseThrow());
    assertTrue(appender.list.stream().noneMatch(e -> e.getFormattedMessage().contains("hunter2")));
    assertTrue(appender.list.stream().anyMatch(e -> e.getFormattedMessage().contains("rendered as ENV")));
    assertNull(MDC.get("secret"));
  }

  @Test
  void fetchFailureWritesNothing() {
    source.failWith(new SecretFetchException(SecretFetchException.Kind.ACCESS_DENIED, "denied"));

    SecretFetchException ex = assertThrows(SecretFetchException.class,
        () -> useCase.run(OutputRequest.of("db", OutputFormat.JSON)));

    assertEquals(SecretFetchException.Kind.ACCESS_DENIED, ex.kind());
    assertEquals(List.of("get.fetch.failure.access_denied"), metrics.increments());
    assertTrue(port.files().isEmpty());
    assertEquals(0, port.console().length);
  }

  @Test
  void missingSecretIsNotFound() {
    SecretFetchException ex = assertThrows(SecretFetchException.class,
        () -> useCase.run(OutputRequest.of("absent", OutputFormat.JSON)));

    assertEquals(SecretFetchException.Kind.NOT_FOUND, ex.kind());
    assertEquals(List.of("get.fetch.failure.not_found"), metrics.increments());
  }

  @Test
  void renderFailureIsCountedByStage() {
    source.put("s", RawSecret.ofText("v"));
    port.failWith(new NoSuchFileException("/work/secret.csv"));

    RenderException ex = assertThrows(RenderException.class,
        () -> useCase.run(OutputRequest.of("s", OutputFormat.CSV)));

    assertEquals(RenderException.Stage.WRITE, ex.stage());
    assertEquals(List.of("get.render.failure.write"), metrics.increments());
    assertNull(MDC.get("secret"));
  }
}
