package io.sm2env.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ExitCodeTest {

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  void failureCodeIsKeptWhenThreadIsRunning() {
    assertEquals(ExitCode.FETCH_ERROR, ExitCode.unlessInterrupted(ExitCode.FETCH_ERROR));
  }

  @Test
  void interruptedThreadReportsSignalStatus() {
    Thread.currentThread().interrupt();

    ExitCode exit = ExitCode.unlessInterrupted(ExitCode.RUNTIME_FAILURE);

    assertEquals(ExitCode.INTERRUPTED, exit);
    assertEquals(130, exit.code());
  }
}
