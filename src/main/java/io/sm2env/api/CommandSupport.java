package io.sm2env.api;

import io.sm2env.config.ConfigMerger;
import io.sm2env.config.DefaultsForMode;
import io.sm2env.config.YamlConfigLoader;
import io.sm2env.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration steps shared by {@link GetCli} and {@link ListCli}: YAML loading, precedence merge, verbose
 * handling, and telemetry properties.
 */
final class CommandSupport {
  private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);

  private CommandSupport() {}

  /**
   * Signals that a command must stop with the given exit code; the cause has already been logged.
   */
  static final class CliAbort extends Exception {
    private static final long serialVersionUID = 1L;

    private final ExitCode exitCode;

    CliAbort(ExitCode exitCode) {
      super(exitCode.name(), null, false, false);
      this.exitCode = Objects.requireNonNull(exitCode, "exitCode");
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }

  /**
   * Resolves the effective configuration for a command.
   *
   * @param command {@code get} or {@code list}
   * @param cli canonicalized CLI arguments; {@code config} is consumed
   * @param usage usage line printed on argument errors
   * @return mutable effective map with telemetry keys already applied and removed
   * @throws CliAbort when the configuration cannot be used
   */
  static Map<String, String> effectiveConfig(String command, Map<String, String> cli, String usage)
      throws CliAbort {
    Map<String, String> kv = new LinkedHashMap<>(cli);
    String configPath = kv.remove("config");

    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null && !configPath.isBlank()) {
      Path yamlPath = Path.of(configPath.trim());
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        throw new CliAbort(ExitCode.INVALID_ARGS);
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, command);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        throw new CliAbort(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}: {}", yamlPath, ex.getMessage());
        throw new CliAbort(ExitCode.IO_ERROR);
      }
    }

    Map<String, String> effective;
    try {
      effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          command, yamlConfig, kv, DefaultsForMode.asFlatMap(command), log::warn));
      if (Boolean.parseBoolean(effective.getOrDefault("verbose", "false").trim())) {
        LoggingConfigurator.enableVerboseLogging();
      }
      TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", command, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    return effective;
  }
}
