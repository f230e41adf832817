package io.sm2env.api;

import io.sm2env.application.port.SecretFetchException;
import io.sm2env.config.ClientConfig;
import io.sm2env.config.CompositionRoot;
import io.sm2env.config.ListConfig;
import io.sm2env.logging.LoggingConfigurator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for {@code sm2env list}: prints the secret names visible to the caller.
 *
 * @since 0.1.0
 */
public final class ListCli {
  private static final Logger log = LoggerFactory.getLogger(ListCli.class);
  static final String SUMMARY_USAGE =
      "usage: sm2env list [filter=TEXT] [region=R] [profile=P] [endpoint=URL] [config=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      sm2env list: list secrets in AWS Secrets Manager

      Usage:
        sm2env list [options]

      Optional:
        filter=TEXT                Only names containing TEXT (case-sensitive)
        region=REGION              AWS region (default: SDK region chain)
        profile=PROFILE            Named AWS profile (default: SDK credentials chain)
        endpoint=URL               Endpoint override, e.g. http://localhost:4566
        config=PATH                YAML file with common/list sections
        --verbose                  Enable DEBUG logging on stderr
        --help                     Show this message
      """;

  private ListCli() {}

  static ExitCode run(String[] args) {
    return run(args, CompositionRoot::forAws);
  }

  static ExitCode run(String[] args, Function<ClientConfig, CompositionRoot> rootFactory) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for list CLI");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
      String[] positionals = input.positionals();
      if (positionals.length > 1) {
        throw new IllegalArgumentException("expected at most one filter, got " + positionals.length);
      }
      if (positionals.length == 1 && kv.putIfAbsent("filter", positionals[0]) != null) {
        throw new IllegalArgumentException("filter given both positionally and as filter=");
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ListConfig config;
    try {
      config = ListConfig.fromMap(CommandSupport.effectiveConfig("list", kv, SUMMARY_USAGE));
    } catch (CommandSupport.CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid list arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = rootFactory.apply(config.client())) {
      List<String> names = root.listSecretsUseCase().run(config.filter());
      CliPrinter.secretNames(names);
      return ExitCode.SUCCESS;
    } catch (SecretFetchException ex) {
      log.error("Failed to list secrets ({}): {}", ex.kind(), ex.getMessage());
      return ExitCode.unlessInterrupted(ExitCode.FETCH_ERROR);
    } catch (IllegalArgumentException ex) {
      log.error("list configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while listing secrets", ex);
      return ExitCode.unlessInterrupted(ExitCode.RUNTIME_FAILURE);
    }
  }
}
