package io.sm2env.application.render;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import io.sm2env.domain.secret.EncodedOutput;
import io.sm2env.domain.secret.OutputFormat;
import io.sm2env.domain.secret.SecretValue;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Renders secrets as pretty-printed JSON.
 *
 * <p>Key/value secrets become an object in source order, plain text becomes a string literal, and binary
 * secrets become {@code {"binary_size_bytes": N}}; binary content is never embedded.</p>
 *
 * @since 0.1.0
 */
public final class JsonEncoder extends AbstractSecretEncoder {
  static final String BINARY_SIZE_FIELD = "binary_size_bytes";

  private final JsonFactory factory = new JsonFactory();

  public JsonEncoder() {
    super(OutputFormat.JSON);
  }

  @Override
  EncodedOutput encodeMap(Map<String, String> entries) {
    return render(generator -> {
      generator.writeStartObject();
      for (Map.Entry<String, String> entry : entries.entrySet()) {
        generator.writeStringField(entry.getKey(), entry.getValue());
      }
      generator.writeEndObject();
    });
  }

  @Override
  EncodedOutput encodeText(String text) {
    return render(generator -> generator.writeString(text));
  }

  @Override
  EncodedOutput encodeBinary(SecretValue.Binary binary) {
    return render(generator -> {
      generator.writeStartObject();
      generator.writeNumberField(BINARY_SIZE_FIELD, binary.size());
      generator.writeEndObject();
    });
  }

  private EncodedOutput render(GeneratorAction action) {
    StringWriter buffer = new StringWriter();
    try (JsonGenerator generator = factory.createGenerator(buffer)) {
      generator.setPrettyPrinter(new StablePrettyPrinter());
      action.write(generator);
    } catch (IOException ex) {
      // StringWriter never fails; anything here is a generator bug.
      throw new UncheckedIOException("JSON generation failed", ex);
    }
    return utf8(buffer.toString());
  }

  @FunctionalInterface
  private interface GeneratorAction {
    void write(JsonGenerator generator) throws IOException;
  }
}
