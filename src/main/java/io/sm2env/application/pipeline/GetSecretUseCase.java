package io.sm2env.application.pipeline;

import io.sm2env.application.port.MetricsPort;
import io.sm2env.application.port.SecretFetchException;
import io.sm2env.application.port.SecretSource;
import io.sm2env.application.render.RenderException;
import io.sm2env.application.render.RenderResult;
import io.sm2env.application.render.SecretRenderer;
import io.sm2env.domain.secret.OutputRequest;
import io.sm2env.domain.secret.RawSecret;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Fetches one secret and renders it to the requested destination.
 * <p><strong>Role:</strong> Application-layer use case behind {@code sm2env get}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Fetch the raw payload through {@link SecretSource}; the fetch completes before rendering starts.</li>
 *   <li>Delegate classification, encoding, and delivery to {@link SecretRenderer}.</li>
 *   <li>Count failures per kind and stage, plus successful renders and their size.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one invocation per CLI run.</p>
 * <p><strong>Observability:</strong> Emits {@code get.fetch.failure.<kind>}, {@code get.render.success},
 * {@code get.render.failure.<stage>}, and {@code get.render.bytes}; sets the {@code secret} MDC key while running.</p>
 *
 * @since 0.1.0
 */
public final class GetSecretUseCase {
  private static final Logger log = LoggerFactory.getLogger(GetSecretUseCase.class);

  private final SecretSource source;
  private final SecretRenderer renderer;
  private final MetricsPort metrics;

  public GetSecretUseCase(SecretSource source, SecretRenderer renderer, MetricsPort metrics) {
    this.source = Objects.requireNonNull(source, "source");
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Fetches and renders a secret.
   *
   * @param request validated render request
   * @return outcome of the render
   * @throws SecretFetchException if the secret cannot be fetched; nothing is written
   * @throws RenderException if encoding or writing fails
   */
  public RenderResult run(OutputRequest request) throws SecretFetchException, RenderException {
    Objects.requireNonNull(request, "request");
    String previous = MDC.get("secret");
    MDC.put("secret", request.secretName());
    try {
      RawSecret raw;
      try {
        raw = source.fetch(request.secretName());
      } catch (SecretFetchException ex) {
        metrics.increment("get.fetch.failure." + ex.kind().metricTag());
        throw ex;
      }
      log.debug("Fetched secret {} ({} bytes, binary={})", request.secretName(), raw.size(), raw.binary());

      RenderResult result;
      try {
        result = renderer.render(request, raw);
      } catch (RenderException ex) {
        metrics.increment("get.render.failure." + ex.stage().metricTag());
        throw ex;
      }
      metrics.increment("get.render.success");
      metrics.observe("get.render.bytes", result.bytesWritten());
      log.info("Secret {} rendered as {} to {}", request.secretName(), request.format(), result.destination());
      return result;
    } finally {
      if (previous == null) {
        MDC.remove("secret");
      } else {
        MDC.put("secret", previous);
      }
    }
  }
}
