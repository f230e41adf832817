package io.sm2env.config;

import io.sm2env.application.pipeline.GetSecretUseCase;
import io.sm2env.application.pipeline.ListSecretsUseCase;
import io.sm2env.application.port.MetricsPort;
import io.sm2env.application.port.OutputPort;
import io.sm2env.application.port.SecretSource;
import io.sm2env.application.render.OutputRouter;
import io.sm2env.application.render.SecretClassifier;
import io.sm2env.application.render.SecretEncoders;
import io.sm2env.application.render.SecretRenderer;
import io.sm2env.infrastructure.aws.SecretsManagerClientFactory;
import io.sm2env.infrastructure.aws.SecretsManagerSecretSource;
import io.sm2env.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.sm2env.infrastructure.output.LocalOutputAdapter;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires use cases to concrete adapters for one CLI run.
 * <p><strong>Role:</strong> Composition root; owns the secret source and metrics adapter and closes both.</p>
 * <p><strong>Thread-safety:</strong> Built and used on the CLI thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final SecretSource source;
  private final OutputPort output;
  private final MetricsPort metrics;
  private final Path workingDirectory;

  /**
   * Creates a root from explicit collaborators.
   *
   * @param source secret source; closed with this root
   * @param output output adapter
   * @param metrics metrics port; closed with this root when it is {@link AutoCloseable}
   * @param workingDirectory directory for default filenames and relative paths
   */
  public CompositionRoot(SecretSource source, OutputPort output, MetricsPort metrics, Path workingDirectory) {
    this.source = Objects.requireNonNull(source, "source");
    this.output = Objects.requireNonNull(output, "output");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
  }

  /**
   * Creates the production wiring: Secrets Manager, local files and stdout, OpenTelemetry.
   *
   * @param client AWS client settings
   * @return composition root
   */
  public static CompositionRoot forAws(ClientConfig client) {
    Objects.requireNonNull(client, "client");
    SecretSource source = new SecretsManagerSecretSource(
        SecretsManagerClientFactory.create(client.region(), client.profile(), client.endpoint()));
    Path cwd = Path.of(System.getProperty("user.dir", ".")).toAbsolutePath();
    return new CompositionRoot(source, new LocalOutputAdapter(), new OpenTelemetryMetricsAdapter(), cwd);
  }

  public GetSecretUseCase getSecretUseCase() {
    SecretRenderer renderer = new SecretRenderer(
        new SecretClassifier(), new SecretEncoders(), new OutputRouter(workingDirectory, output));
    return new GetSecretUseCase(source, renderer, metrics);
  }

  public ListSecretsUseCase listSecretsUseCase() {
    return new ListSecretsUseCase(source, metrics);
  }

  public Path workingDirectory() {
    return workingDirectory;
  }

  @Override
  public void close() {
    try {
      source.close();
    } catch (RuntimeException ex) {
      log.warn("Failed to close secret source", ex);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }
}
