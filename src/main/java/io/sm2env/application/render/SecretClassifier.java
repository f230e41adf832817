package io.sm2env.application.render;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import io.sm2env.domain.secret.RawSecret;
import io.sm2env.domain.secret.SecretValue;
import io.sm2env.domain.util.Utf8;
import java.io.IOException;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decides which {@link SecretValue} variant a fetched payload represents.
 * <p><strong>Why:</strong> Secrets arrive as JSON objects, free text, or opaque bytes; encoders need one canonical
 * shape to render deterministically.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Treat bytes that are not valid UTF-8 as {@link SecretValue.Binary}.</li>
 *   <li>Turn a single top-level JSON object into an ordered {@link SecretValue.KeyValueMap}; scalars become their
 *       literal text and nested objects/arrays become compact JSON text.</li>
 *   <li>Fall back to {@link SecretValue.PlainText} for everything else, verbatim.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared {@link JsonFactory}, which is thread-safe.</p>
 * <p><strong>Observability:</strong> Logs the chosen variant at DEBUG; payloads are never logged.</p>
 *
 * @implNote Classification never throws: any parse failure resolves to plain text.
 * @since 0.1.0
 */
public final class SecretClassifier {
  private static final Logger log = LoggerFactory.getLogger(SecretClassifier.class);

  private final JsonFactory factory = new JsonFactory();

  /**
   * Classifies a raw fetch result.
   *
   * @param raw payload returned by the secret source; must not be {@code null}
   * @return exactly one secret value variant
   */
  public SecretValue classify(RawSecret raw) {
    Objects.requireNonNull(raw, "raw");
    String text;
    if (raw.binary()) {
      byte[] bytes = raw.bytes();
      Optional<String> decoded = Utf8.decodeStrict(bytes);
      if (decoded.isEmpty()) {
        log.debug("Classified payload as binary ({} bytes)", bytes.length);
        return SecretValue.binary(bytes);
      }
      text = decoded.get();
    } else {
      text = raw.text().orElseThrow();
    }
    return classifyText(text);
  }

  /**
   * Classifies a text payload as key/value or plain text.
   *
   * @param text secret text; must not be {@code null}
   * @return key/value map for JSON objects, otherwise plain text
   */
  public SecretValue classifyText(String text) {
    Objects.requireNonNull(text, "text");
    Optional<Map<String, String>> entries = parseObject(text);
    if (entries.isPresent()) {
      log.debug("Classified payload as key/value map with {} entries", entries.get().size());
      return SecretValue.keyValue(entries.get());
    }
    log.debug("Classified payload as plain text");
    return SecretValue.plainText(text);
  }

  private Optional<Map<String, String>> parseObject(String text) {
    try (JsonParser parser = factory.createParser(text)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        return Optional.empty();
      }
      Map<String, String> entries = new LinkedHashMap<>();
      while (true) {
        JsonToken token = parser.nextToken();
        if (token == JsonToken.END_OBJECT) {
          break;
        }
        if (token != JsonToken.FIELD_NAME) {
          return Optional.empty();
        }
        String key = parser.currentName();
        JsonToken valueToken = parser.nextToken();
        entries.put(key, stringify(parser, valueToken));
      }
      if (parser.nextToken() != null) {
        return Optional.empty();
      }
      return Optional.of(entries);
    } catch (IOException ex) {
      return Optional.empty();
    }
  }

  private String stringify(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new IOException("Unexpected end of JSON object");
    }
    return switch (token) {
      case VALUE_STRING, VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT, VALUE_TRUE, VALUE_FALSE, VALUE_NULL ->
          parser.getText();
      case START_OBJECT, START_ARRAY -> compact(parser);
      default -> throw new IOException("Unsupported JSON token: " + token);
    };
  }

  private String compact(JsonParser parser) throws IOException {
    StringWriter buffer = new StringWriter();
    try (JsonGenerator generator = factory.createGenerator(buffer)) {
      generator.copyCurrentStructure(parser);
    }
    return buffer.toString();
  }
}
