package io.sm2env.application.port;

import java.util.Locale;
import java.util.Objects;

/**
 * Raised when a secret cannot be fetched or listed.
 *
 * <p>Surfaced verbatim to the operator with a non-zero exit; never retried by this tool.</p>
 *
 * @since 0.1.0
 */
public class SecretFetchException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Failure categories reported by {@link SecretSource} implementations. */
  public enum Kind {
    /** The named secret does not exist. */
    NOT_FOUND,
    /** Credentials lack permission to read the secret. */
    ACCESS_DENIED,
    /** The service could not be reached. */
    NETWORK_ERROR,
    /** Any other service or client failure. */
    OTHER;

    /**
     * Returns the lowercase tag used in metric names.
     *
     * @return metric-friendly name such as {@code not_found}
     */
    public String metricTag() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  private final Kind kind;

  public SecretFetchException(Kind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public SecretFetchException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public Kind kind() {
    return kind;
  }
}
