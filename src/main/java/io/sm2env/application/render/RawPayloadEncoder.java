package io.sm2env.application.render;

import io.sm2env.domain.secret.EncodedOutput;
import io.sm2env.domain.secret.OutputFormat;
import io.sm2env.domain.secret.SecretValue;
import java.util.Map;

/**
 * Produces the underlying secret content for {@code stdout} output redirected to a file.
 *
 * <p>Text and binary payloads are written byte for byte. Key/value secrets keep the {@code KEY=VALUE} line
 * form used on the console.</p>
 *
 * @since 0.1.0
 */
public final class RawPayloadEncoder extends AbstractSecretEncoder {

  public RawPayloadEncoder() {
    super(OutputFormat.STDOUT);
  }

  @Override
  EncodedOutput encodeMap(Map<String, String> entries) {
    return utf8(EnvEncoder.lines(entries));
  }

  @Override
  EncodedOutput encodeText(String text) {
    return utf8(text);
  }

  @Override
  EncodedOutput encodeBinary(SecretValue.Binary binary) {
    return new EncodedOutput(binary.bytes(), format().defaultFileName());
  }
}
