package ca.gc.cra.tbfs.infrastructure.hadoop;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the Hadoop streaming jar that provides the {@code dumptb} and {@code loadtb} programs.
 *
 * <p>An explicitly configured jar wins and must exist. Otherwise the Hadoop installation directory is searched
 * recursively for a {@code .jar} whose file name contains {@code streaming}; the shortest matching path is
 * chosen, which prefers the top-level jar over copies nested in contrib or test directories.</p>
 *
 * @since 0.1.0
 */
public final class StreamingJarLocator {
  /** Environment variable consulted when no installation directory is configured. */
  public static final String HADOOP_HOME_ENV = "HADOOP_HOME";

  private static final Logger log = LoggerFactory.getLogger(StreamingJarLocator.class);

  private final Path explicitJar;
  private final Path hadoopHome;

  /**
   * Creates a locator.
   *
   * @param explicitJar configured jar, or {@code null} to search
   * @param hadoopHome installation directory to search, or {@code null} when unknown
   */
  public StreamingJarLocator(Path explicitJar, Path hadoopHome) {
    this.explicitJar = explicitJar;
    this.hadoopHome = hadoopHome;
  }

  /**
   * Creates a locator whose installation directory falls back to {@value #HADOOP_HOME_ENV}.
   *
   * @param explicitJar configured jar, or {@code null}
   * @param hadoopHome configured installation directory, or {@code null}
   * @return locator
   */
  public static StreamingJarLocator withEnvironmentFallback(Path explicitJar, Path hadoopHome) {
    if (hadoopHome != null) {
      return new StreamingJarLocator(explicitJar, hadoopHome);
    }
    String env = System.getenv(HADOOP_HOME_ENV);
    return new StreamingJarLocator(explicitJar, env == null || env.isBlank() ? null : Path.of(env));
  }

  /**
   * Resolves the jar.
   *
   * @return path of the streaming jar
   * @throws IOException if the explicit jar is missing or no streaming jar can be found
   */
  public Path locate() throws IOException {
    if (explicitJar != null) {
      if (!Files.isRegularFile(explicitJar)) {
        throw new IOException("Configured streaming jar does not exist: " + explicitJar);
      }
      return explicitJar;
    }
    if (hadoopHome == null) {
      throw new IOException(
          "Cannot locate the Hadoop streaming jar: set streamingJar, hadoopHome or " + HADOOP_HOME_ENV);
    }
    if (!Files.isDirectory(hadoopHome)) {
      throw new IOException("Hadoop home is not a directory: " + hadoopHome);
    }
    Optional<Path> found;
    try (Stream<Path> files = Files.walk(hadoopHome)) {
      found = files
          .filter(Files::isRegularFile)
          .filter(StreamingJarLocator::isStreamingJar)
          .min(Comparator.comparingInt((Path p) -> p.toString().length()).thenComparing(Path::toString));
    }
    Path jar = found.orElseThrow(() -> new IOException("No streaming jar found under " + hadoopHome));
    log.debug("Using streaming jar {}", jar);
    return jar;
  }

  static boolean isStreamingJar(Path path) {
    Path name = path.getFileName();
    if (name == null) {
      return false;
    }
    String fileName = name.toString();
    return fileName.endsWith(".jar") && fileName.contains("streaming");
  }
}
