package io.sm2env.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Command-line tokens of one subcommand, sorted into switches, {@code key=value} settings and bare operands.
 *
 * <p>{@code get app/db output=json --verbose} yields the operand {@code app/db}, the setting {@code output=json}
 * and the verbose switch.</p>
 */
public final class CliInput {
  private enum Kind { HELP, VERBOSE, SWITCH, SETTING, OPERAND }

  private final List<String> settings = new ArrayList<>();
  private final List<String> operands = new ArrayList<>();
  private final Set<String> switches = new TreeSet<>();

  private CliInput() {}

  /**
   * Sorts raw arguments. Blank and {@code null} tokens are dropped.
   *
   * <p>A token containing {@code =} after its first character is a setting, even when it starts with dashes
   * ({@code --output=json}). Other dash-prefixed tokens are switches, compared case-insensitively.</p>
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return sorted tokens
   */
  public static CliInput parse(String[] args) {
    CliInput input = new CliInput();
    if (args == null) {
      return input;
    }
    for (String raw : args) {
      String token = raw == null ? "" : raw.trim();
      if (!token.isEmpty()) {
        input.accept(token);
      }
    }
    return input;
  }

  private void accept(String token) {
    String lower = token.toLowerCase(Locale.ROOT);
    switch (classify(token, lower)) {
      case HELP -> switches.add("--help");
      case VERBOSE -> switches.add("--verbose");
      case SWITCH -> switches.add(lower);
      case SETTING -> settings.add(token);
      case OPERAND -> operands.add(token);
    }
  }

  private static Kind classify(String token, String lower) {
    switch (lower) {
      case "help", "-h", "--help":
        return Kind.HELP;
      case "-v", "--verbose", "--debug":
        return Kind.VERBOSE;
      default:
        break;
    }
    int eq = token.indexOf('=');
    if (eq > 0) {
      return Kind.SETTING;
    }
    return token.startsWith("-") && eq < 0 ? Kind.SWITCH : Kind.OPERAND;
  }

  /**
   * Settings in command-line order, for {@link CliArgsParser#toMap(String[])}.
   *
   * @return fresh array
   */
  public String[] keyValueArgs() {
    return settings.toArray(new String[0]);
  }

  /**
   * Bare operands in command-line order: the secret name for {@code get}, the filter for {@code list}.
   *
   * @return fresh array
   */
  public String[] positionals() {
    return operands.toArray(new String[0]);
  }

  public boolean help() {
    return switches.contains("--help");
  }

  public boolean verbose() {
    return switches.contains("--verbose");
  }

  /**
   * @param flag switch such as {@code --version}, any case
   * @return whether it was given
   */
  public boolean hasFlag(String flag) {
    return flag != null && switches.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
