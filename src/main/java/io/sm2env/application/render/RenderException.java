package io.sm2env.application.render;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Raised when a classified secret cannot be encoded or delivered.
 *
 * @since 0.1.0
 */
public class RenderException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Pipeline stage that failed. */
  public enum Stage {
    ENCODE,
    WRITE;

    /**
     * Returns the lower-case tag used in metric names.
     *
     * @return metric tag
     */
    public String metricTag() {
      return name().toLowerCase(java.util.Locale.ROOT);
    }
  }

  private final Stage stage;
  private final transient Path path;

  public RenderException(Stage stage, String message, Throwable cause) {
    this(stage, message, null, cause);
  }

  public RenderException(Stage stage, String message, Path path, Throwable cause) {
    super(message, cause);
    this.stage = Objects.requireNonNull(stage, "stage");
    this.path = path;
  }

  public Stage stage() {
    return stage;
  }

  /**
   * Returns the file the write attempted, when the failure happened at {@link Stage#WRITE}.
   *
   * @return attempted path
   */
  public Optional<Path> path() {
    return Optional.ofNullable(path);
  }
}
