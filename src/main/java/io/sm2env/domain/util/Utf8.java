package io.sm2env.domain.util;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * <strong>What:</strong> Strict UTF-8 helpers used to classify payloads and validate encoder output.
 * <p><strong>Why:</strong> {@link String#String(byte[], java.nio.charset.Charset)} silently substitutes malformed
 * input; classification needs to know when bytes are not text.</p>
 * <p><strong>Thread-safety:</strong> Stateless; a fresh decoder/encoder is created per call.</p>
 * <p><strong>Performance:</strong> Single pass over the input; allocations proportional to the payload.</p>
 *
 * @since 0.1.0
 */
public final class Utf8 {
  private Utf8() {}

  /**
   * Decodes bytes as UTF-8, failing on malformed or unmappable sequences.
   *
   * @param data bytes to decode; {@code null} decodes to an empty result
   * @return decoded text, or empty when the bytes are not valid UTF-8
   */
  public static Optional<String> decodeStrict(byte[] data) {
    if (data == null) {
      return Optional.empty();
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      CharBuffer decoded = decoder.decode(ByteBuffer.wrap(data));
      return Optional.of(decoded.toString());
    } catch (CharacterCodingException ex) {
      return Optional.empty();
    }
  }

  /**
   * Checks whether text can be encoded to UTF-8 without substitution (no unpaired surrogates).
   *
   * @param text candidate text; {@code null} is treated as encodable
   * @return {@code true} when every code point is representable
   */
  public static boolean isEncodable(CharSequence text) {
    if (text == null || text.length() == 0) {
      return true;
    }
    CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    return encoder.canEncode(text);
  }
}
