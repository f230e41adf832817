package io.sm2env.application.port;

import io.sm2env.domain.secret.RawSecret;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Port for reading secrets from a remote secret store.
 * <p><strong>Why:</strong> Keeps the render engine independent of the AWS SDK so it can be exercised with in-memory
 * sources.</p>
 * <p><strong>Role:</strong> Driven-side port implemented by {@code SecretsManagerSecretSource}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Fetch a single secret payload by name, preserving its text or binary shape.</li>
 *   <li>List secret names, optionally filtered by substring.</li>
 *   <li>Translate transport failures into {@link SecretFetchException} kinds.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Used from a single CLI thread; implementations need not be thread-safe.</p>
 * <p><strong>Performance:</strong> Calls block on network I/O and are fully awaited before classification.</p>
 *
 * @since 0.1.0
 */
public interface SecretSource extends AutoCloseable {
  /**
   * Fetches the current value of a secret.
   *
   * @param secretName secret name or ARN; must not be blank
   * @return raw payload as returned by the store
   * @throws SecretFetchException if the secret is missing, access is denied, or the call fails
   */
  RawSecret fetch(String secretName) throws SecretFetchException;

  /**
   * Lists secret names visible to the caller.
   *
   * @param filter optional case-sensitive substring a name must contain
   * @return matching names in the order the store returned them
   * @throws SecretFetchException if listing fails
   */
  List<String> list(Optional<String> filter) throws SecretFetchException;

  /**
   * Releases client resources.
   */
  @Override
  default void close() {}
}
