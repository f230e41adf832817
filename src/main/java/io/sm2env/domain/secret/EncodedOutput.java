package io.sm2env.domain.secret;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Bytes produced by an encoder plus the filename used when the caller names no destination.
 *
 * <p>Produced by an encoder and consumed immediately by the output router; never retained.</p>
 *
 * @since 0.1.0
 */
public final class EncodedOutput {
  private final byte[] bytes;
  private final String defaultFileName;

  /**
   * Creates an encoded output.
   *
   * @param bytes encoded bytes; copied
   * @param defaultFileName suggested filename relative to the working directory
   */
  public EncodedOutput(byte[] bytes, String defaultFileName) {
    this.bytes = Objects.requireNonNull(bytes, "bytes").clone();
    this.defaultFileName = Objects.requireNonNull(defaultFileName, "defaultFileName");
  }

  /**
   * Creates an encoded output from UTF-8 text.
   *
   * @param text encoded text
   * @param defaultFileName suggested filename
   * @return encoded output
   */
  public static EncodedOutput ofUtf8(String text, String defaultFileName) {
    return new EncodedOutput(text.getBytes(StandardCharsets.UTF_8), defaultFileName);
  }

  public byte[] bytes() {
    return bytes.clone();
  }

  public int length() {
    return bytes.length;
  }

  public String defaultFileName() {
    return defaultFileName;
  }

  /**
   * Decodes the bytes as UTF-8; intended for text formats and tests.
   *
   * @return decoded text
   */
  public String asUtf8() {
    return new String(bytes, StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof EncodedOutput that
        && Arrays.equals(bytes, that.bytes)
        && defaultFileName.equals(that.defaultFileName);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(bytes) + defaultFileName.hashCode();
  }

  @Override
  public String toString() {
    return "EncodedOutput[length=" + bytes.length + ", defaultFileName=" + defaultFileName + "]";
  }
}
