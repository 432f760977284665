package ca.gc.cra.tbfs.api;

import ca.gc.cra.tbfs.config.ClusterConfig;
import ca.gc.cra.tbfs.config.CompositionRoot;
import ca.gc.cra.tbfs.config.ConfigMerger;
import ca.gc.cra.tbfs.config.DefaultsForMode;
import ca.gc.cra.tbfs.config.YamlConfigLoader;
import ca.gc.cra.tbfs.domain.fs.PathNotFoundException;
import ca.gc.cra.tbfs.infrastructure.exec.ExternalCommandException;
import ca.gc.cra.tbfs.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.tbfs.logging.LoggingConfigurator;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Argument, configuration and failure handling shared by the TBFS subcommands.
 *
 * <p>Every subcommand follows the same sequence: parse flags, split {@code key=value} pairs, load the optional
 * YAML file, merge with defaults, apply telemetry settings, then run a body against a {@link CompositionRoot}.
 * Failures map onto {@link ExitCode} in one place.</p>
 */
final class CommandSupport {
  private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);

  private CommandSupport() {}

  /** Work executed once configuration is valid. */
  @FunctionalInterface
  interface CommandBody {
    ExitCode run(CompositionRoot root) throws IOException;
  }

  /**
   * Outcome of {@link #prepare}: either a ready configuration or an exit code to return immediately.
   */
  record Prepared(CliInput input, Map<String, String> effective, ClusterConfig cluster, ExitCode exit) {
    static Prepared stop(ExitCode exit) {
      return new Prepared(null, Map.of(), null, exit);
    }

    boolean stopped() {
      return exit != null;
    }

    boolean dryRun() {
      return input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");
    }
  }

  static Prepared prepare(String mode, String[] args, String usage, String help) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(help.stripTrailing());
      return Prepared.stop(ExitCode.SUCCESS);
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", mode);
    }
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return Prepared.stop(ExitCode.INVALID_ARGS);
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return Prepared.stop(ExitCode.INVALID_ARGS);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return Prepared.stop(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return Prepared.stop(ExitCode.IO_ERROR);
      }
    }

    Map<String, String> effective;
    ClusterConfig cluster;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn);
      cluster = ClusterConfig.fromMap(effective);
      TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return Prepared.stop(ExitCode.INVALID_ARGS);
    }
    if (ConfigCliUtils.parseBoolean(effective, "verbose") && !input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    return new Prepared(input, effective, cluster, null);
  }

  static ExitCode execute(String what, ClusterConfig cluster, CommandBody body) {
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      return body.run(new CompositionRoot(cluster, metrics));
    } catch (PathNotFoundException ex) {
      log.error("{} failed: {}", what, ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (ExternalCommandException ex) {
      log.error("{} failed: cluster command exited with {}: {}", what, ex.exitCode(), ex.getMessage());
      log.debug("Failing command: {}", ex.command(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedIOException ex) {
      log.error("{} interrupted", what);
      return ExitCode.INTERRUPTED;
    } catch (IOException ex) {
      log.error("{} failed with an I/O error", what, ex);
      return ExitCode.IO_ERROR;
    } catch (UncheckedIOException ex) {
      log.error("{} failed with an I/O error", what, ex.getCause());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("{} configuration error: {}", what, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {}", what, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
