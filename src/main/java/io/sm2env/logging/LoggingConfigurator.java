package io.sm2env.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies {@code --verbose} to the Logback context.
 *
 * <p>sm2env code drops to DEBUG and the AWS SDK to INFO. The SDK request and HTTP wire loggers stay at WARN in
 * every mode since at DEBUG they print response bodies, which here are secret values.</p>
 *
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String[] PAYLOAD_LOGGERS = {
      "software.amazon.awssdk.request",
      "software.amazon.awssdk.http",
      "org.apache.http.wire"
  };

  private LoggingConfigurator() {}

  /**
   * Raises verbosity for the rest of the process. Repeated calls are harmless.
   *
   * @return {@code false} when the SLF4J backend is not Logback and nothing changed
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("--verbose ignored: logging backend {} is not Logback", factory.getClass().getName());
      return false;
    }
    context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.DEBUG);
    context.getLogger("io.sm2env").setLevel(Level.DEBUG);
    context.getLogger("software.amazon.awssdk").setLevel(Level.INFO);
    for (String name : PAYLOAD_LOGGERS) {
      context.getLogger(name).setLevel(Level.WARN);
    }
    return true;
  }
}
