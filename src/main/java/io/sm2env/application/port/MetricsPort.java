package io.sm2env.application.port;

/**
 * Outcome counters and size observations emitted by the use cases.
 *
 * <p>Keys are dotted and lower case: {@code get.render.success}, {@code get.fetch.failure.not_found},
 * {@code get.render.bytes}, {@code list.count}. Callers never pass {@code null}; adapters may rewrite characters
 * their backend does not allow.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /** Discards everything; used when no metrics adapter is wired. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override
    public void increment(String key) {}

    @Override
    public void observe(String key, long value) {}
  };

  /** Adds one to the counter named {@code key}. */
  void increment(String key);

  /**
   * Records one value, such as the byte size of a rendered secret or the number of listed names.
   *
   * @param key dotted metric key
   * @param value observed value
   */
  void observe(String key, long value);
}
