package io.sm2env.domain.secret;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Classified payload of a fetched secret.
 * <p><strong>Why:</strong> Gives every encoder a single canonical input so escaping rules live in one place per format.</p>
 * <p><strong>Role:</strong> Domain value produced by the classifier and consumed by encoders and the output router.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Represent exactly one of key/value map, plain text, or binary blob.</li>
 *   <li>Copy byte arrays and maps on the way in and out so values can be shared freely.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All variants are immutable.</p>
 * <p><strong>Observability:</strong> {@link #kind()} is the only part that may appear in logs or metrics; contents never do.</p>
 *
 * @since 0.1.0
 */
public sealed interface SecretValue permits SecretValue.KeyValueMap, SecretValue.PlainText, SecretValue.Binary {

  /**
   * Returns the variant tag used in logs, metrics, and routing descriptions.
   *
   * @return variant kind
   */
  Kind kind();

  /** Variant tags. */
  enum Kind {
    /** Ordered key/value entries taken from a JSON object. */
    KEY_VALUE,
    /** Unstructured text. */
    PLAIN_TEXT,
    /** Bytes that are not valid UTF-8. */
    BINARY
  }

  /**
   * Creates a key/value variant preserving the iteration order of {@code entries}.
   *
   * @param entries ordered entries; must not contain {@code null} keys or values
   * @return key/value secret value
   */
  static SecretValue keyValue(Map<String, String> entries) {
    return new KeyValueMap(entries);
  }

  /**
   * Creates a plain text variant.
   *
   * @param text secret text, kept verbatim
   * @return plain text secret value
   */
  static SecretValue plainText(String text) {
    return new PlainText(text);
  }

  /**
   * Creates a binary variant.
   *
   * @param bytes raw bytes; copied
   * @return binary secret value
   */
  static SecretValue binary(byte[] bytes) {
    return new Binary(bytes);
  }

  /**
   * Ordered mapping of string keys to string values.
   */
  final class KeyValueMap implements SecretValue {
    private final Map<String, String> entries;

    KeyValueMap(Map<String, String> entries) {
      Objects.requireNonNull(entries, "entries");
      Map<String, String> copy = new LinkedHashMap<>();
      for (Map.Entry<String, String> entry : entries.entrySet()) {
        copy.put(
            Objects.requireNonNull(entry.getKey(), "key"),
            Objects.requireNonNull(entry.getValue(), "value for " + entry.getKey()));
      }
      this.entries = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the entries in source order.
     *
     * @return unmodifiable ordered view
     */
    public Map<String, String> entries() {
      return entries;
    }

    @Override
    public Kind kind() {
      return Kind.KEY_VALUE;
    }

    @Override
    public boolean equals(Object other) {
      if (this == other) {
        return true;
      }
      if (!(other instanceof KeyValueMap that)) {
        return false;
      }
      // Order is part of the value.
      return entries.equals(that.entries)
          && Arrays.equals(entries.keySet().toArray(), that.entries.keySet().toArray());
    }

    @Override
    public int hashCode() {
      return entries.hashCode();
    }

    @Override
    public String toString() {
      return "KeyValueMap[keys=" + entries.keySet() + "]";
    }
  }

  /**
   * Text without key/value structure.
   */
  final class PlainText implements SecretValue {
    private final String text;

    PlainText(String text) {
      this.text = Objects.requireNonNull(text, "text");
    }

    /**
     * Returns the secret text exactly as fetched.
     *
     * @return text
     */
    public String text() {
      return text;
    }

    @Override
    public Kind kind() {
      return Kind.PLAIN_TEXT;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof PlainText that && text.equals(that.text);
    }

    @Override
    public int hashCode() {
      return text.hashCode();
    }

    @Override
    public String toString() {
      return "PlainText[length=" + text.length() + "]";
    }
  }

  /**
   * Opaque bytes; content is never assumed to be textual.
   */
  final class Binary implements SecretValue {
    private final byte[] bytes;

    Binary(byte[] bytes) {
      this.bytes = Objects.requireNonNull(bytes, "bytes").clone();
    }

    /**
     * Returns a copy of the raw bytes.
     *
     * @return byte copy
     */
    public byte[] bytes() {
      return bytes.clone();
    }

    /**
     * Returns the payload length.
     *
     * @return number of bytes
     */
    public int size() {
      return bytes.length;
    }

    @Override
    public Kind kind() {
      return Kind.BINARY;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Binary that && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
      return "Binary[size=" + bytes.length + "]";
    }
  }
}
