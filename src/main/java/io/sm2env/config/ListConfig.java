package io.sm2env.config;

import io.sm2env.validation.Strings;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated settings for {@code sm2env list}.
 *
 * @param client AWS client settings
 * @param filter optional case-sensitive substring
 * @since 0.1.0
 */
public record ListConfig(ClientConfig client, Optional<String> filter) {
  private static final int MAX_FILTER_LENGTH = 512;

  public ListConfig {
    Objects.requireNonNull(client, "client");
    filter = Objects.requireNonNullElse(filter, Optional.empty());
  }

  public static ListConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    Optional<String> filter = ClientConfig.optional(args.get("filter"))
        .map(f -> Strings.requirePrintableAscii("filter", f, MAX_FILTER_LENGTH));
    return new ListConfig(ClientConfig.fromMap(args), filter);
  }
}
