package io.sm2env.config;

import io.sm2env.domain.secret.OutputFormat;
import io.sm2env.domain.secret.OutputRequest;
import io.sm2env.validation.Paths;
import io.sm2env.validation.Strings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated settings for {@code sm2env get}.
 * <p><strong>Role:</strong> Configuration aggregate handed from the CLI to {@code GetSecretUseCase}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param client AWS client settings
 * @param request render request built from {@code name}, {@code output}, and {@code file}
 * @since 0.1.0
 */
public record GetConfig(ClientConfig client, OutputRequest request) {

  public GetConfig {
    Objects.requireNonNull(client, "client");
    Objects.requireNonNull(request, "request");
  }

  /**
   * Builds the configuration from a merged key/value map.
   *
   * @param args effective configuration
   * @return validated configuration
   * @throws IllegalArgumentException if the name is missing or invalid, the format is unknown, or the file path is
   *         unusable
   */
  public static GetConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    String rawName = args.get("name");
    if (rawName == null || rawName.isBlank()) {
      throw new IllegalArgumentException("missing secret name: sm2env get <name>");
    }
    String name = Strings.requireSecretName(rawName);
    String output = ClientConfig.optional(args.get("output")).orElse(OutputFormat.ENV.cliName());
    OutputFormat format = OutputFormat.fromString(output);
    Optional<Path> file = ClientConfig.optional(args.get("file")).map(f -> Paths.requireFilePath("file", f));
    return new GetConfig(ClientConfig.fromMap(args), new OutputRequest(name, format, file));
  }
}
