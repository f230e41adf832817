package io.sm2env.api;

import io.sm2env.application.port.SecretFetchException;
import io.sm2env.application.render.RenderException;
import io.sm2env.application.render.RenderResult;
import io.sm2env.config.ClientConfig;
import io.sm2env.config.CompositionRoot;
import io.sm2env.config.GetConfig;
import io.sm2env.logging.LoggingConfigurator;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for {@code sm2env get}: fetches one secret and renders it.
 *
 * @since 0.1.0
 */
public final class GetCli {
  private static final Logger log = LoggerFactory.getLogger(GetCli.class);
  static final String SUMMARY_USAGE =
      "usage: sm2env get <name> [output=stdout|json|env|yaml|csv] [file=PATH] "
          + "[region=R] [profile=P] [endpoint=URL] [config=PATH] [metricsExporter=otlp|none] [--verbose]";
  private static final String HELP_TEXT = """
      sm2env get: fetch a secret from AWS Secrets Manager and render it

      Usage:
        sm2env get <name> [options]

      Required:
        <name> | name=NAME         Secret name or ARN

      Optional:
        output=FORMAT              stdout, json, env, yaml or csv (default env); alias -o=, --output=
        file=PATH                  Write to PATH instead of the format's default file; alias -f=, --file=
                                   With output=stdout the raw secret content is written to PATH
        region=REGION              AWS region (default: SDK region chain)
        profile=PROFILE            Named AWS profile (default: SDK credentials chain)
        endpoint=URL               Endpoint override, e.g. http://localhost:4566
        config=PATH                YAML file with common/get sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        --verbose                  Enable DEBUG logging on stderr
        --help                     Show this message

      Default files:
        env -> .env, json -> secret.json, yaml -> secret.yaml, csv -> secret.csv
      """;

  private GetCli() {}

  /**
   * Runs the command with the production AWS wiring.
   *
   * @param args arguments after {@code get}
   * @return exit code
   */
  static ExitCode run(String[] args) {
    return run(args, CompositionRoot::forAws);
  }

  /**
   * Runs the command with a caller-supplied composition root.
   *
   * @param args arguments after {@code get}
   * @param rootFactory builds the adapter graph from the client settings
   * @return exit code
   */
  static ExitCode run(String[] args, Function<ClientConfig, CompositionRoot> rootFactory) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for get CLI");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
      String[] positionals = input.positionals();
      if (positionals.length > 1) {
        throw new IllegalArgumentException("expected one secret name, got " + positionals.length);
      }
      if (positionals.length == 1) {
        if (kv.containsKey("name")) {
          throw new IllegalArgumentException("secret name given both positionally and as name=");
        }
        kv.put("name", positionals[0]);
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    GetConfig config;
    try {
      Map<String, String> effective = CommandSupport.effectiveConfig("get", kv, SUMMARY_USAGE);
      config = GetConfig.fromMap(effective);
    } catch (CommandSupport.CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid get arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String name = config.request().secretName();
    try (CompositionRoot root = rootFactory.apply(config.client())) {
      RenderResult result = root.getSecretUseCase().run(config.request());
      result.confirmation().ifPresent(CliPrinter::println);
      return ExitCode.SUCCESS;
    } catch (SecretFetchException ex) {
      log.error("Failed to fetch secret {} ({}): {}", name, ex.kind(), ex.getMessage());
      return ExitCode.unlessInterrupted(ExitCode.FETCH_ERROR);
    } catch (RenderException ex) {
      if (ex.stage() == RenderException.Stage.ENCODE) {
        log.error("Failed to encode secret {}: {}", name, ex.getMessage());
        return ExitCode.ENCODING_ERROR;
      }
      log.error("Failed to write secret {}: {}", name, ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("get configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while getting secret {}", name, ex);
      return ExitCode.unlessInterrupted(ExitCode.RUNTIME_FAILURE);
    }
  }
}
