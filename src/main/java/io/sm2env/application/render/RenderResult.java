package io.sm2env.application.render;

import io.sm2env.domain.secret.OutputFormat;
import io.sm2env.domain.secret.SecretValue;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a successful render.
 *
 * @param route routing decision that was applied
 * @param kind classified secret variant
 * @param format requested format
 * @param file file written, empty for console output
 * @param bytesWritten number of bytes delivered
 * @since 0.1.0
 */
public record RenderResult(
    OutputRouter.Route route,
    SecretValue.Kind kind,
    OutputFormat format,
    Optional<Path> file,
    int bytesWritten) {

  public RenderResult {
    Objects.requireNonNull(route, "route");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(format, "format");
    file = file == null ? Optional.empty() : file;
  }

  /**
   * Describes the destination for logs: {@code console} or the file path.
   *
   * @return destination description
   */
  public String destination() {
    return file.map(Path::toString).orElse("console");
  }

  /**
   * Returns the line confirming a file write, or empty when output went to the console.
   *
   * @return confirmation message
   */
  public Optional<String> confirmation() {
    if (file.isEmpty()) {
      return Optional.empty();
    }
    String path = file.get().toString();
    if (route.payload() == OutputRouter.Payload.RAW_CONTENT) {
      if (kind == SecretValue.Kind.BINARY) {
        return Optional.of("Binary secret (" + bytesWritten + " bytes) written to file: " + path);
      }
      return Optional.of("Secret written to file: " + path);
    }
    String label = switch (format) {
      case ENV, STDOUT -> ".env";
      case JSON -> "JSON";
      case YAML -> "YAML";
      case CSV -> "CSV";
    };
    return Optional.of(label + " file created successfully at " + path);
  }
}
