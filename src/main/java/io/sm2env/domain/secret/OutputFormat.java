package io.sm2env.domain.secret;

import java.util.Locale;

/**
 * <strong>What:</strong> Output encodings a secret can be rendered to.
 * <p><strong>Role:</strong> Part of every {@link OutputRequest}; selects the encoder and the default filename.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum OutputFormat {
  /** Console presentation in {@code KEY=VALUE} form. */
  STDOUT("stdout", ".env"),
  /** Pretty-printed JSON. */
  JSON("json", "secret.json"),
  /** {@code KEY=VALUE} lines. */
  ENV("env", ".env"),
  /** Block-style YAML. */
  YAML("yaml", "secret.yaml"),
  /** RFC 4180 CSV with a {@code key,value} header. */
  CSV("csv", "secret.csv");

  private final String cliName;
  private final String defaultFileName;

  OutputFormat(String cliName, String defaultFileName) {
    this.cliName = cliName;
    this.defaultFileName = defaultFileName;
  }

  /**
   * Returns the lowercase name accepted on the command line.
   *
   * @return CLI name such as {@code json}
   */
  public String cliName() {
    return cliName;
  }

  /**
   * Returns the file written in the working directory when no explicit path is given.
   *
   * @return default filename
   */
  public String defaultFileName() {
    return defaultFileName;
  }

  /**
   * Parses a CLI name, ignoring case and surrounding whitespace.
   *
   * @param value textual format such as {@code "yaml"}
   * @return parsed format
   * @throws IllegalArgumentException if the value is blank or unknown
   */
  public static OutputFormat fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("output format must not be blank");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (OutputFormat format : values()) {
      if (format.cliName.equals(normalized)) {
        return format;
      }
    }
    throw new IllegalArgumentException(
        "Unknown output format: " + value + " (expected stdout|json|env|yaml|csv)");
  }

  @Override
  public String toString() {
    return cliName;
  }
}
