package io.sm2env.application.render;

import io.sm2env.domain.secret.OutputFormat;
import java.util.Objects;

/**
 * Raised when an encoder cannot represent a field in its target encoding after escaping was attempted.
 *
 * @since 0.1.0
 */
public class EncodingException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String field;
  private final OutputFormat format;

  public EncodingException(String field, OutputFormat format, String message) {
    super(message);
    this.field = Objects.requireNonNull(field, "field");
    this.format = Objects.requireNonNull(format, "format");
  }

  /**
   * Returns the offending key, or a placeholder such as {@code <value>} for unkeyed payloads.
   *
   * @return field name
   */
  public String field() {
    return field;
  }

  public OutputFormat format() {
    return format;
  }
}
