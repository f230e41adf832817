package io.sm2env.config;

import io.sm2env.validation.Paths;
import io.sm2env.validation.Strings;
import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * AWS client settings shared by every command.
 *
 * @param region region override; empty uses the SDK's region provider chain
 * @param profile named credentials profile; empty uses the default credentials chain
 * @param endpoint endpoint override for local emulators
 * @since 0.1.0
 */
public record ClientConfig(Optional<String> region, Optional<String> profile, Optional<URI> endpoint) {
  private static final int MAX_PROFILE_LENGTH = 128;

  public ClientConfig {
    region = Objects.requireNonNullElse(region, Optional.empty());
    profile = Objects.requireNonNullElse(profile, Optional.empty());
    endpoint = Objects.requireNonNullElse(endpoint, Optional.empty());
  }

  /**
   * Returns settings that defer entirely to the SDK defaults.
   *
   * @return empty client configuration
   */
  public static ClientConfig defaults() {
    return new ClientConfig(Optional.empty(), Optional.empty(), Optional.empty());
  }

  /**
   * Builds client settings from a merged key/value map.
   *
   * @param args effective configuration; keys {@code region}, {@code profile}, {@code endpoint}
   * @return validated settings
   * @throws IllegalArgumentException if a value is malformed
   */
  public static ClientConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    Optional<String> region = optional(args.get("region")).map(Strings::requireRegion);
    Optional<String> profile = optional(args.get("profile"))
        .map(p -> Strings.requirePrintableAscii("profile", p, MAX_PROFILE_LENGTH));
    Optional<URI> endpoint = optional(args.get("endpoint")).map(e -> Paths.requireEndpoint("endpoint", e));
    return new ClientConfig(region, profile, endpoint);
  }

  static Optional<String> optional(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }
}
