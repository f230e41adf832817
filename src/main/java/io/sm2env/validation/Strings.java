package io.sm2env.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Checks for text options: secret names, regions, profiles and filters.
 *
 * <p>Everything here runs before an AWS client exists, so a typo is reported as an argument error and never
 * reaches Secrets Manager. Violations raise {@link IllegalArgumentException} with a message that starts with the
 * option name.</p>
 *
 * @since 0.1.0
 * @see Paths
 */
public final class Strings {
  /** Longest secret name or ARN accepted by Secrets Manager. */
  public static final int MAX_SECRET_NAME_LENGTH = 2048;

  private static final Pattern SECRET_NAME = Pattern.compile("[A-Za-z0-9/_+=.@:-]+");
  private static final Pattern REGION = Pattern.compile("[a-z]{2}(-[a-z0-9]+)+-\\d+");
  private static final Pattern PRINTABLE_ASCII = Pattern.compile("[\\x20-\\x7E]*");

  private Strings() {}

  /**
   * Trims {@code value} after rejecting control characters anywhere in it, including tabs and newlines.
   *
   * @param name option name used in the message
   * @param value text as given
   * @return trimmed text
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or has a control character
   */
  public static String requireNonBlank(String name, String value) {
    Objects.requireNonNull(value, label(name));
    if (value.chars().anyMatch(Character::isISOControl)) {
      throw invalid(name, "must not contain control characters");
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw invalid(name, "must not be blank");
    }
    return trimmed;
  }

  /**
   * A friendly name such as {@code prod/db-creds} or a full ARN.
   *
   * @param value candidate
   * @return trimmed name
   * @throws IllegalArgumentException if too long or outside {@code [A-Za-z0-9/_+=.@:-]}
   */
  public static String requireSecretName(String value) {
    String name = requireNonBlank("name", value);
    if (name.length() > MAX_SECRET_NAME_LENGTH) {
      throw invalid("name", "length must be <= " + MAX_SECRET_NAME_LENGTH);
    }
    if (!SECRET_NAME.matcher(name).matches()) {
      throw invalid("name", "must only contain letters, digits, and / _ + = . @ : - (was " + name + ")");
    }
    return name;
  }

  /**
   * A region code such as {@code us-east-1} or {@code us-gov-west-1}. Upper case is rejected rather than folded,
   * since the SDK would not resolve it either.
   */
  public static String requireRegion(String value) {
    String region = requireNonBlank("region", value);
    if (!REGION.matcher(region).matches()) {
      throw invalid("region", "must look like us-east-1 (was " + region + ")");
    }
    return region;
  }

  /**
   * @param name option name used in the message
   * @param value candidate
   * @param maxLength inclusive length limit after trimming
   * @return trimmed value made of characters {@code 0x20-0x7E}
   * @throws IllegalArgumentException if too long or not printable ASCII
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw invalid(name, "length must be <= " + maxLength);
    }
    if (!PRINTABLE_ASCII.matcher(trimmed).matches()) {
      throw invalid(name, "must contain printable ASCII characters");
    }
    return trimmed;
  }

  private static IllegalArgumentException invalid(String name, String reason) {
    return new IllegalArgumentException(label(name) + " " + reason);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
