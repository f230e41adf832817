package io.sm2env.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port for the two destinations a rendered secret can reach.
 * <p><strong>Role:</strong> Driven-side port used by the output router; implemented by
 * {@code LocalOutputAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Single-threaded use per invocation.</p>
 *
 * @since 0.1.0
 */
public interface OutputPort {
  /**
   * Replaces the file at {@code path} with {@code bytes} in one step.
   *
   * <p>Implementations must leave no partial file behind when the write fails.</p>
   *
   * @param path destination file
   * @param bytes whole file content
   * @throws IOException if the file cannot be written (missing directory, permissions, ...)
   */
  void writeFile(Path path, byte[] bytes) throws IOException;

  /**
   * Writes bytes to the console.
   *
   * @param bytes console presentation of the secret
   * @throws IOException if the console stream fails
   */
  void writeConsole(byte[] bytes) throws IOException;
}
