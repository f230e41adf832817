package io.sm2env.application.render;

import io.sm2env.application.port.OutputPort;
import io.sm2env.domain.secret.EncodedOutput;
import io.sm2env.domain.secret.OutputFormat;
import io.sm2env.domain.secret.OutputRequest;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Resolves where a rendered secret goes and which payload form is written there.
 * <p><strong>Why:</strong> An explicit file combined with the {@code stdout} format writes the raw secret instead of
 * the console presentation; keeping that rule in one table keeps precedence auditable.</p>
 * <p><strong>Decision table</strong> (format x explicit path):</p>
 * <table>
 *   <caption>Routing rules</caption>
 *   <tr><th>format</th><th>path</th><th>destination</th><th>payload</th></tr>
 *   <tr><td>stdout</td><td>yes</td><td>explicit file</td><td>raw content</td></tr>
 *   <tr><td>stdout</td><td>no</td><td>console</td><td>presentation</td></tr>
 *   <tr><td>other</td><td>yes</td><td>explicit file</td><td>presentation</td></tr>
 *   <tr><td>other</td><td>no</td><td>default file in working directory</td><td>presentation</td></tr>
 * </table>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class OutputRouter {

  /** Where bytes are delivered. */
  public enum Destination {
    CONSOLE,
    EXPLICIT_FILE,
    DEFAULT_FILE
  }

  /** Which encoding of the secret is delivered. */
  public enum Payload {
    /** Output of the format's encoder. */
    PRESENTATION,
    /** Underlying text or bytes without presentation formatting. */
    RAW_CONTENT
  }

  /**
   * Resolved routing decision.
   *
   * @param destination destination kind
   * @param payload payload kind
   * @param target file to write; empty when the default filename or the console applies
   */
  public record Route(Destination destination, Payload payload, Optional<Path> target) {
    public Route {
      Objects.requireNonNull(destination, "destination");
      Objects.requireNonNull(payload, "payload");
      target = target == null ? Optional.empty() : target;
    }
  }

  private record Rule(boolean stdoutFormat, boolean pathPresent, Destination destination, Payload payload) {}

  private static final List<Rule> RULES = List.of(
      new Rule(true, true, Destination.EXPLICIT_FILE, Payload.RAW_CONTENT),
      new Rule(true, false, Destination.CONSOLE, Payload.PRESENTATION),
      new Rule(false, true, Destination.EXPLICIT_FILE, Payload.PRESENTATION),
      new Rule(false, false, Destination.DEFAULT_FILE, Payload.PRESENTATION));

  private final Path workingDirectory;
  private final OutputPort outputPort;

  /**
   * Creates a router.
   *
   * @param workingDirectory directory that default filenames and relative paths resolve against
   * @param outputPort destination adapter
   */
  public OutputRouter(Path workingDirectory, OutputPort outputPort) {
    this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
    this.outputPort = Objects.requireNonNull(outputPort, "outputPort");
  }

  /**
   * Applies the decision table to a request.
   *
   * @param request render request
   * @return route with an absolute target for explicit files
   */
  public Route decide(OutputRequest request) {
    boolean stdoutFormat = request.format() == OutputFormat.STDOUT;
    boolean pathPresent = request.explicitPath().isPresent();
    Rule rule = RULES.stream()
        .filter(r -> r.stdoutFormat() == stdoutFormat && r.pathPresent() == pathPresent)
        .findFirst()
        .orElseThrow();
    Optional<Path> target = request.explicitPath().map(workingDirectory::resolve);
    return new Route(rule.destination(), rule.payload(), target);
  }

  /**
   * Resolves the concrete file a route writes to.
   *
   * @param route resolved route
   * @param output encoded output supplying the default filename
   * @return file path, or empty for the console
   */
  public Optional<Path> targetFile(Route route, EncodedOutput output) {
    return switch (route.destination()) {
      case CONSOLE -> Optional.empty();
      case EXPLICIT_FILE -> route.target();
      case DEFAULT_FILE -> Optional.of(workingDirectory.resolve(output.defaultFileName()));
    };
  }

  /**
   * Delivers encoded bytes along a route.
   *
   * @param route resolved route
   * @param output bytes to deliver
   * @return file written, or empty for the console
   * @throws IOException if the destination cannot be written
   */
  public Optional<Path> deliver(Route route, EncodedOutput output) throws IOException {
    Optional<Path> file = targetFile(route, output);
    if (file.isPresent()) {
      outputPort.writeFile(file.get(), output.bytes());
    } else {
      outputPort.writeConsole(output.bytes());
    }
    return file;
  }
}
