package io.sm2env.logging;

/**
 * Bounds diagnostic text before it is logged.
 *
 * <p>Meant for SDK error messages and user input echoed in errors. Secret payloads never pass through here.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  /** UTF-8 byte budget used by {@link #truncate(String)}. */
  public static final int DEFAULT_MAX_BYTES = 512;

  private Logs() {}

  /**
   * Shortens {@code value} to at most {@code maxBytes} UTF-8 bytes without splitting a character, and folds line
   * breaks and other control characters to spaces so one failure stays on one log line.
   *
   * @param value text to bound; {@code null} gives {@code "<null>"}
   * @param maxBytes positive byte budget
   * @return the single-line text, with a {@code (truncated, N of M bytes)} suffix when it was cut
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return "<null>";
    }
    StringBuilder kept = new StringBuilder(Math.min(value.length(), maxBytes));
    int used = 0;
    int total = 0;
    boolean full = false;
    for (int i = 0; i < value.length(); ) {
      int cp = value.codePointAt(i);
      i += Character.charCount(cp);
      int width = utf8Width(cp);
      total += width;
      full = full || used + width > maxBytes;
      if (!full) {
        used += width;
        kept.appendCodePoint(Character.isISOControl(cp) ? ' ' : cp);
      }
    }
    if (total <= maxBytes) {
      return kept.toString();
    }
    return kept + "... (truncated, " + maxBytes + " of " + total + " bytes)";
  }

  /**
   * Applies {@link #DEFAULT_MAX_BYTES}.
   *
   * @param value text to bound
   * @return bounded single-line text
   */
  public static String truncate(String value) {
    return truncate(value, DEFAULT_MAX_BYTES);
  }

  private static int utf8Width(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }
}
