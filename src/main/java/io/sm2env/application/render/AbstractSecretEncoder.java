package io.sm2env.application.render;

import io.sm2env.domain.secret.EncodedOutput;
import io.sm2env.domain.secret.OutputFormat;
import io.sm2env.domain.secret.SecretValue;
import io.sm2env.domain.util.Utf8;
import java.util.Map;
import java.util.Objects;

/**
 * Dispatches a {@link SecretValue} to the variant-specific rendering method of a concrete encoder.
 *
 * <p>Every key and value is checked for UTF-8 representability before rendering so no encoder silently
 * substitutes characters.</p>
 */
abstract class AbstractSecretEncoder implements SecretEncoder {
  static final String VALUE_FIELD = "<value>";

  private final OutputFormat format;

  AbstractSecretEncoder(OutputFormat format) {
    this.format = Objects.requireNonNull(format, "format");
  }

  @Override
  public final EncodedOutput encode(SecretValue value) throws EncodingException {
    Objects.requireNonNull(value, "value");
    if (value instanceof SecretValue.KeyValueMap map) {
      for (Map.Entry<String, String> entry : map.entries().entrySet()) {
        requireEncodable(entry.getKey(), entry.getKey());
        requireEncodable(entry.getKey(), entry.getValue());
      }
      return encodeMap(map.entries());
    }
    if (value instanceof SecretValue.PlainText text) {
      requireEncodable(VALUE_FIELD, text.text());
      return encodeText(text.text());
    }
    SecretValue.Binary binary = (SecretValue.Binary) value;
    return encodeBinary(binary);
  }

  abstract EncodedOutput encodeMap(Map<String, String> entries) throws EncodingException;

  abstract EncodedOutput encodeText(String text) throws EncodingException;

  abstract EncodedOutput encodeBinary(SecretValue.Binary binary) throws EncodingException;

  OutputFormat format() {
    return format;
  }

  EncodedOutput utf8(String text) {
    return EncodedOutput.ofUtf8(text, format.defaultFileName());
  }

  private void requireEncodable(String field, String text) throws EncodingException {
    if (!Utf8.isEncodable(text)) {
      throw new EncodingException(field, format,
          "Field '" + field + "' contains characters that cannot be encoded as UTF-8 for " + format);
    }
  }
}
