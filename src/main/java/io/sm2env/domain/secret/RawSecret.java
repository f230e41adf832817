package io.sm2env.domain.secret;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Unclassified payload returned by a secret fetch.
 * <p><strong>Why:</strong> Keeps the remote service's two payload shapes (string or binary blob) intact until
 * classification decides how to interpret them.</p>
 * <p><strong>Thread-safety:</strong> Immutable; byte arrays are copied on entry and exit.</p>
 *
 * @since 0.1.0
 */
public final class RawSecret {
  private final String text;
  private final byte[] bytes;

  private RawSecret(String text, byte[] bytes) {
    this.text = text;
    this.bytes = bytes;
  }

  /**
   * Creates a text payload.
   *
   * @param text secret string as returned by the service
   * @return raw secret carrying text
   */
  public static RawSecret ofText(String text) {
    return new RawSecret(Objects.requireNonNull(text, "text"), null);
  }

  /**
   * Creates a binary-flagged payload.
   *
   * @param bytes raw bytes as returned by the service; copied
   * @return raw secret carrying bytes
   */
  public static RawSecret ofBytes(byte[] bytes) {
    return new RawSecret(null, Objects.requireNonNull(bytes, "bytes").clone());
  }

  /**
   * Indicates whether the service flagged the payload as binary.
   *
   * @return {@code true} for byte payloads
   */
  public boolean binary() {
    return bytes != null;
  }

  /**
   * Returns the text payload when present.
   *
   * @return text, or empty for binary payloads
   */
  public Optional<String> text() {
    return Optional.ofNullable(text);
  }

  /**
   * Returns the payload as bytes; text payloads are encoded as UTF-8.
   *
   * @return byte copy of the payload
   */
  public byte[] bytes() {
    return bytes != null ? bytes.clone() : text.getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Returns the payload length in bytes.
   *
   * @return byte length
   */
  public int size() {
    return bytes != null ? bytes.length : text.getBytes(StandardCharsets.UTF_8).length;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof RawSecret that)) {
      return false;
    }
    return Objects.equals(text, that.text) && Arrays.equals(bytes, that.bytes);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hashCode(text) + Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return binary() ? "RawSecret[binary, size=" + bytes.length + "]" : "RawSecret[text]";
  }
}
