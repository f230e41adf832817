package io.sm2env.api;

/**
 * Process status of an sm2env run, so scripts can tell a missing secret from a bad argument or an unwritable file.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  SUCCESS(0, "ok"),
  /** Unknown command, malformed {@code key=value}, or an option value that failed validation. */
  INVALID_ARGS(2, "invalid arguments"),
  /** Reading the YAML config or writing the output file failed. */
  IO_ERROR(3, "I/O failure"),
  /** The YAML config parsed but its shape or values are unusable, or the AWS client could not be built. */
  CONFIG_ERROR(4, "configuration rejected"),
  RUNTIME_FAILURE(5, "unexpected failure"),
  /** Secrets Manager refused or could not answer the request. */
  FETCH_ERROR(6, "secret fetch failed"),
  /** The secret has a value the chosen format cannot carry. */
  ENCODING_ERROR(7, "secret not representable in format"),
  INTERRUPTED(130, "interrupted");

  private final int code;
  private final String summary;

  ExitCode(int code, String summary) {
    this.code = code;
    this.summary = summary;
  }

  /** Value handed to {@link System#exit(int)}. */
  public int code() {
    return code;
  }

  /**
   * Reports {@link #INTERRUPTED} instead of {@code failure} when the calling thread was interrupted, since the SDK
   * surfaces an aborted call as an ordinary client error.
   */
  static ExitCode unlessInterrupted(ExitCode failure) {
    return Thread.currentThread().isInterrupted() ? INTERRUPTED : failure;
  }

  /** Short phrase for the final diagnostic line, for example {@code secret fetch failed}. */
  public String summary() {
    return summary;
  }
}
