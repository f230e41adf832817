package io.sm2env.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Locale;

/**
 * <strong>What:</strong> Validation for output file paths, config file paths, and endpoint URIs.
 * <p><strong>Why:</strong> Catches unusable destinations while arguments are parsed; problems that only show up
 * when writing, such as a missing parent directory, are left to the write and reported as I/O errors.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses a destination file path.
   *
   * @param name logical parameter name for diagnostics
   * @param raw user-supplied path text
   * @return parsed path, possibly relative
   * @throws IllegalArgumentException if the text is blank, contains NUL or control characters, is not a valid path,
   *         or names an existing directory
   */
  public static Path requireFilePath(String name, String raw) {
    if (raw == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    String value = Strings.requireNonBlank(name, raw);
    Path path;
    try {
      path = Path.of(value);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
    if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException(name + " points to a directory: " + value);
    }
    return path;
  }

  /**
   * Parses an HTTP(S) endpoint override such as {@code http://localhost:4566}.
   *
   * @param name logical parameter name for diagnostics
   * @param raw endpoint text
   * @return absolute URI with an http or https scheme and a host
   * @throws IllegalArgumentException if the URI is malformed or uses another scheme
   */
  public static URI requireEndpoint(String name, String raw) {
    String value = Strings.requireNonBlank(name, raw);
    URI uri;
    try {
      uri = new URI(value);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " is not a valid URI: " + value, ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException(name + " must use http or https (was " + value + ")");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException(name + " must include a host (was " + value + ")");
    }
    return uri;
  }
}
