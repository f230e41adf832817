package io.sm2env.application.render;

import io.sm2env.domain.secret.EncodedOutput;
import io.sm2env.domain.secret.OutputRequest;
import io.sm2env.domain.secret.RawSecret;
import io.sm2env.domain.secret.SecretValue;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs classification, routing, encoding, and delivery for one fetched secret.
 * <p><strong>Role:</strong> Application service behind {@code GetSecretUseCase}.</p>
 * <p><strong>Thread-safety:</strong> Stateless beyond its collaborators; one render per call.</p>
 * <p><strong>Observability:</strong> Logs the variant, route, and byte count at DEBUG; never the content.</p>
 *
 * @since 0.1.0
 */
public final class SecretRenderer {
  private static final Logger log = LoggerFactory.getLogger(SecretRenderer.class);

  private final SecretClassifier classifier;
  private final SecretEncoders encoders;
  private final OutputRouter router;

  public SecretRenderer(SecretClassifier classifier, SecretEncoders encoders, OutputRouter router) {
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.encoders = Objects.requireNonNull(encoders, "encoders");
    this.router = Objects.requireNonNull(router, "router");
  }

  /**
   * Renders a fetched secret according to the request.
   *
   * @param request secret name, format, and optional destination
   * @param raw fetched payload
   * @return what was written and where
   * @throws RenderException if encoding or writing fails; nothing is written on encode failure
   */
  public RenderResult render(OutputRequest request, RawSecret raw) throws RenderException {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(raw, "raw");
    SecretValue value = classifier.classify(raw);
    OutputRouter.Route route = router.decide(request);
    SecretEncoder encoder = route.payload() == OutputRouter.Payload.RAW_CONTENT
        ? encoders.rawPayload()
        : encoders.forFormat(request.format());

    EncodedOutput output;
    try {
      output = encoder.encode(value);
    } catch (EncodingException ex) {
      throw new RenderException(RenderException.Stage.ENCODE,
          "Cannot encode secret '" + request.secretName() + "' as " + ex.format()
              + ": field '" + ex.field() + "': " + ex.getMessage(), ex);
    }

    Optional<Path> written;
    try {
      written = router.deliver(route, output);
    } catch (IOException ex) {
      Path attempted = router.targetFile(route, output).orElse(null);
      String where = attempted == null ? "console" : attempted.toString();
      throw new RenderException(RenderException.Stage.WRITE,
          "Failed to write secret '" + request.secretName() + "' to " + where + ": " + ex.getMessage(),
          attempted, ex);
    }

    log.debug("Rendered secret {} as {} ({}) to {} ({} bytes)",
        request.secretName(), request.format(), value.kind(), route.destination(), output.length());
    return new RenderResult(route, value.kind(), request.format(), written, output.length());
  }
}
