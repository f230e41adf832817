package io.sm2env.api;

import io.sm2env.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * sm2env CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  static final String FALLBACK_VERSION = "0.1.5";
  private static final String SUMMARY_USAGE = "usage: sm2env <get|list> [options]";
  private static final String HELP_TEXT = """
      sm2env: render AWS Secrets Manager secrets as env, JSON, YAML or CSV

      Usage:
        sm2env <command> [options]

      Commands:
        get         Fetch a secret and write it (get --help for details)
        list        List available secrets (list --help for details)

      Global flags:
        --help      Show this message
        --version   Print the version
        --verbose   Enable DEBUG logging on stderr
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    if (exit != ExitCode.SUCCESS) {
      log.debug("Exiting with status {}: {}", exit.code(), exit.summary());
    }
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * <p>Flags before the command apply to the dispatcher; everything after the command is handed to it.</p>
   *
   * @param args dispatcher arguments
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = 0;
    while (commandIndex < safeArgs.length
        && (safeArgs[commandIndex] == null || safeArgs[commandIndex].trim().startsWith("-"))) {
      commandIndex++;
    }

    CliInput global = CliInput.parse(Arrays.copyOfRange(safeArgs, 0, commandIndex));
    if (global.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (global.hasFlag("--version")) {
      CliPrinter.println("sm2env " + version());
      return ExitCode.SUCCESS;
    }
    if (commandIndex >= safeArgs.length) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return global.help() || safeArgs.length == 0 ? ExitCode.SUCCESS : ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, commandIndex + 1, safeArgs.length);
    if (global.verbose()) {
      delegateArgs = append(delegateArgs, "--verbose");
    }

    return switch (command) {
      case "get" -> GetCli.run(delegateArgs);
      case "list" -> ListCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  static String version() {
    Package pkg = Main.class.getPackage();
    String impl = pkg == null ? null : pkg.getImplementationVersion();
    return impl == null || impl.isBlank() ? FALLBACK_VERSION : impl;
  }

  private static String[] append(String[] args, String extra) {
    String[] copy = Arrays.copyOf(args, args.length + 1);
    copy[args.length] = extra;
    return copy;
  }
}
