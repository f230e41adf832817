package io.sm2env.application.render;

import io.sm2env.domain.secret.EncodedOutput;
import io.sm2env.domain.secret.OutputFormat;
import io.sm2env.domain.secret.SecretValue;
import java.util.Map;

/**
 * Renders secrets as {@code KEY=VALUE} lines for {@code env} files and the console.
 *
 * <p>Values are written verbatim without quoting; each line ends with {@code \n}. Plain text passes through
 * untouched and binary secrets render as a one-line size report.</p>
 *
 * @since 0.1.0
 */
public final class EnvEncoder extends AbstractSecretEncoder {

  /**
   * Creates an encoder for {@link OutputFormat#ENV} or {@link OutputFormat#STDOUT}.
   *
   * @param format env or stdout
   */
  public EnvEncoder(OutputFormat format) {
    super(format);
    if (format != OutputFormat.ENV && format != OutputFormat.STDOUT) {
      throw new IllegalArgumentException("EnvEncoder supports env and stdout, not " + format);
    }
  }

  @Override
  EncodedOutput encodeMap(Map<String, String> entries) {
    return utf8(lines(entries));
  }

  @Override
  EncodedOutput encodeText(String text) {
    return utf8(text);
  }

  @Override
  EncodedOutput encodeBinary(SecretValue.Binary binary) {
    return utf8(sizeReport(binary.size()) + "\n");
  }

  static String lines(Map<String, String> entries) {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, String> entry : entries.entrySet()) {
      sb.append(entry.getKey()).append('=').append(entry.getValue()).append('\n');
    }
    return sb.toString();
  }

  static String sizeReport(int size) {
    return "Binary secret data (" + size + " bytes)";
  }
}
