package io.sm2env.api;

import io.sm2env.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} settings into a map keyed by canonical option name.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern NAME = Pattern.compile("-{0,2}([A-Za-z][A-Za-z0-9._-]*)");
  private static final Map<String, String> SHORT_NAMES = Map.of(
      "o", "output",
      "f", "file",
      "n", "name",
      "c", "config");

  private CliArgsParser() {}

  /**
   * Splits each setting on its first {@code '='}.
   *
   * <p>{@code --output=json}, {@code -o=json} and {@code output=json} all produce {@code output -> json}. The
   * value keeps any further {@code '='} characters.</p>
   *
   * @param args settings from {@link CliInput#keyValueArgs()}; {@code null} returns an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException if a setting is malformed or names the same option twice
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> settings = new LinkedHashMap<>();
    if (args == null) {
      return settings;
    }
    for (String raw : args) {
      Setting setting = Setting.parse(raw);
      if (setting != null && settings.putIfAbsent(setting.name(), setting.value()) != null) {
        throw new IllegalArgumentException("argument " + setting.name() + " given more than once");
      }
    }
    return settings;
  }

  private record Setting(String name, String value) {
    static Setting parse(String raw) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        return null;
      }
      int eq = arg.indexOf('=');
      if (eq <= 0 || eq == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String typed = arg.substring(0, eq).trim();
      var matcher = NAME.matcher(typed);
      if (!matcher.matches()) {
        throw new IllegalArgumentException("invalid argument name: " + typed);
      }
      String name = SHORT_NAMES.getOrDefault(matcher.group(1), matcher.group(1));
      String value = arg.substring(eq + 1).trim();
      if (value.indexOf('\0') >= 0) {
        throw new IllegalArgumentException("argument " + name + " must not contain null bytes");
      }
      return new Setting(name, Strings.requireNonBlank(name, value));
    }
  }
}
