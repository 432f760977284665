package ca.gc.cra.tbfs.config;

import ca.gc.cra.tbfs.application.pipeline.ReaderOptions;
import ca.gc.cra.tbfs.infrastructure.exec.ProcessCommand;
import ca.gc.cra.tbfs.validation.Numbers;
import ca.gc.cra.tbfs.validation.Strings;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable settings describing how to reach the cluster and how hard to drive it.
 * <p><strong>Why:</strong> Keeps CLI, YAML and default values behind one validated record so adapters never
 * parse raw strings.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param hadoopCommand executable used for every cluster command
 * @param hadoopHome installation directory searched for the streaming jar, if configured
 * @param streamingJar explicit streaming jar, if configured
 * @param javaMemoryMb JVM heap ceiling exported to spawned tools
 * @param readers maximum number of concurrent dump processes
 * @param ignoreLogs whether status entries such as {@code _SUCCESS} and {@code _logs} are skipped when reading
 * @param failOnAbnormalExit whether a dump process exiting nonzero fails the read
 * @since 0.1.0
 */
public record ClusterConfig(
    String hadoopCommand,
    Optional<Path> hadoopHome,
    Optional<Path> streamingJar,
    int javaMemoryMb,
    int readers,
    boolean ignoreLogs,
    boolean failOnAbnormalExit) {
  /** Default executable name. */
  public static final String DEFAULT_HADOOP_COMMAND = "hadoop";
  /** Largest accepted heap ceiling, in mebibytes. */
  public static final int MAX_JAVA_MEMORY_MB = 65_536;

  /**
   * Validates the configuration.
   *
   * @throws IllegalArgumentException if a value is blank or out of range
   */
  public ClusterConfig {
    hadoopCommand = Strings.requireNonBlank("hadoopCommand", hadoopCommand).trim();
    hadoopHome = Objects.requireNonNull(hadoopHome, "hadoopHome");
    streamingJar = Objects.requireNonNull(streamingJar, "streamingJar");
    Numbers.requireRange("javaMemoryMb", javaMemoryMb, 1, MAX_JAVA_MEMORY_MB);
    Numbers.requireRange("readers", readers, 1, ReaderOptions.MAX_CAPACITY);
  }

  /**
   * Returns the built-in defaults.
   *
   * @return default configuration
   */
  public static ClusterConfig defaults() {
    return new ClusterConfig(
        DEFAULT_HADOOP_COMMAND,
        Optional.empty(),
        Optional.empty(),
        ProcessCommand.DEFAULT_JAVA_MEMORY_MB,
        ReaderOptions.DEFAULT_CAPACITY,
        true,
        true);
  }

  /**
   * Builds a configuration from flattened key/value pairs; missing keys take their defaults.
   *
   * @param options merged configuration map
   * @return validated configuration
   * @throws IllegalArgumentException if a value cannot be parsed or is out of range
   */
  public static ClusterConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    ClusterConfig defaults = defaults();
    String command = options.get("hadoopCommand");
    return new ClusterConfig(
        Strings.isBlank(command) ? defaults.hadoopCommand() : command,
        optionalPath(options.get("hadoopHome")),
        optionalPath(options.get("streamingJar")),
        parseInt("javaMemoryMb", options.get("javaMemoryMb"), defaults.javaMemoryMb(), MAX_JAVA_MEMORY_MB),
        parseInt("readers", options.get("readers"), defaults.readers(), ReaderOptions.MAX_CAPACITY),
        parseBoolean("ignoreLogs", options.get("ignoreLogs"), defaults.ignoreLogs()),
        parseBoolean("failOnAbnormalExit", options.get("failOnAbnormalExit"), defaults.failOnAbnormalExit()));
  }

  /**
   * Projects the reader-related settings.
   *
   * @return options for the record stream multiplexer
   */
  public ReaderOptions readerOptions() {
    return new ReaderOptions(readers, ignoreLogs, javaMemoryMb, failOnAbnormalExit);
  }

  private static int parseInt(String name, String raw, int fallback, int max) {
    if (Strings.isBlank(raw)) {
      return fallback;
    }
    return Numbers.parseIntInRange(name, raw.trim(), 1, max);
  }

  private static boolean parseBoolean(String name, String raw, boolean fallback) {
    if (Strings.isBlank(raw)) {
      return fallback;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(name + " must be true or false (was '" + raw + "')");
    };
  }

  private static Optional<Path> optionalPath(String raw) {
    if (Strings.isBlank(raw)) {
      return Optional.empty();
    }
    return Optional.of(Path.of(raw.trim()).toAbsolutePath().normalize());
  }
}
