package io.sm2env.application.render;

import io.sm2env.domain.secret.EncodedOutput;
import io.sm2env.domain.secret.SecretValue;

/**
 * Pure function rendering a classified secret into one output encoding.
 *
 * <p>Implementations are deterministic: the same value always yields byte-identical output.</p>
 *
 * @since 0.1.0
 */
public interface SecretEncoder {
  /**
   * Encodes the secret value.
   *
   * @param value classified secret; must not be {@code null}
   * @return encoded bytes plus the format's default filename
   * @throws EncodingException if a field cannot be represented even after escaping
   */
  EncodedOutput encode(SecretValue value) throws EncodingException;
}
