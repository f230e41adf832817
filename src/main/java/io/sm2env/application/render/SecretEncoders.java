package io.sm2env.application.render;

import io.sm2env.domain.secret.OutputFormat;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Registry resolving the encoder for each {@link OutputFormat}.
 *
 * @since 0.1.0
 */
public final class SecretEncoders {
  private final Map<OutputFormat, SecretEncoder> byFormat = new EnumMap<>(OutputFormat.class);
  private final SecretEncoder rawPayload = new RawPayloadEncoder();

  public SecretEncoders() {
    byFormat.put(OutputFormat.STDOUT, new EnvEncoder(OutputFormat.STDOUT));
    byFormat.put(OutputFormat.ENV, new EnvEncoder(OutputFormat.ENV));
    byFormat.put(OutputFormat.JSON, new JsonEncoder());
    byFormat.put(OutputFormat.YAML, new YamlEncoder());
    byFormat.put(OutputFormat.CSV, new CsvEncoder());
  }

  /**
   * Returns the presentation encoder for a format.
   *
   * @param format requested format
   * @return encoder producing that format
   */
  public SecretEncoder forFormat(OutputFormat format) {
    return byFormat.get(Objects.requireNonNull(format, "format"));
  }

  /**
   * Returns the encoder that writes the underlying secret content unformatted.
   *
   * @return raw payload encoder
   */
  public SecretEncoder rawPayload() {
    return rawPayload;
  }
}
