package io.sm2env.application.pipeline;

import io.sm2env.application.port.MetricsPort;
import io.sm2env.application.port.SecretFetchException;
import io.sm2env.application.port.SecretSource;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists secret names visible to the caller, optionally narrowed by a substring filter.
 *
 * <p>Names are returned sorted alphabetically regardless of the order the store reports them.</p>
 *
 * @since 0.1.0
 */
public final class ListSecretsUseCase {
  private static final Logger log = LoggerFactory.getLogger(ListSecretsUseCase.class);

  private final SecretSource source;
  private final MetricsPort metrics;

  public ListSecretsUseCase(SecretSource source, MetricsPort metrics) {
    this.source = Objects.requireNonNull(source, "source");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Lists matching secret names.
   *
   * @param filter optional case-sensitive substring
   * @return sorted, unmodifiable list of names
   * @throws SecretFetchException if the store cannot be listed
   */
  public List<String> run(Optional<String> filter) throws SecretFetchException {
    Optional<String> effective = filter == null ? Optional.empty() : filter.filter(f -> !f.isEmpty());
    List<String> names;
    try {
      names = new ArrayList<>(source.list(effective));
    } catch (SecretFetchException ex) {
      metrics.increment("list.failure." + ex.kind().metricTag());
      throw ex;
    }
    // Sources may ignore the filter; apply it again so the contract holds for any adapter.
    effective.ifPresent(f -> names.removeIf(name -> !name.contains(f)));
    Collections.sort(names);
    metrics.observe("list.count", names.size());
    log.debug("Listed {} secrets (filter={})", names.size(), effective.orElse("<none>"));
    return List.copyOf(names);
  }
}
