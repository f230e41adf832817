package io.sm2env.domain.secret;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Describes one render operation: which secret, which format, and an optional explicit destination.
 *
 * <p>Built once per invocation from validated CLI input and never mutated.</p>
 *
 * @param secretName name or ARN of the secret; never blank
 * @param format requested output format
 * @param explicitPath caller-supplied destination overriding the default filename
 * @since 0.1.0
 */
public record OutputRequest(String secretName, OutputFormat format, Optional<Path> explicitPath) {

  public OutputRequest {
    Objects.requireNonNull(secretName, "secretName");
    Objects.requireNonNull(format, "format");
    explicitPath = explicitPath == null ? Optional.empty() : explicitPath;
    if (secretName.isBlank()) {
      throw new IllegalArgumentException("secretName must not be blank");
    }
  }

  /**
   * Convenience factory for requests without an explicit path.
   *
   * @param secretName secret name
   * @param format output format
   * @return request routed to the console or the format's default file
   */
  public static OutputRequest of(String secretName, OutputFormat format) {
    return new OutputRequest(secretName, format, Optional.empty());
  }
}
