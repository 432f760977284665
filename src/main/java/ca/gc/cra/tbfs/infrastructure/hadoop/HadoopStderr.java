package ca.gc.cra.tbfs.infrastructure.hadoop;

import java.util.stream.Collectors;

/**
 * Strips Hadoop's routine log chatter from captured stderr so error reports show the actual failure.
 *
 * <p>Hadoop client log lines look like {@code 24/03/02 12:00:01 INFO mapred.FileInputFormat: ...}; lines whose
 * third whitespace-separated token is {@code INFO} or {@code WARN} are dropped. Everything else is kept verbatim.</p>
 *
 * @since 0.1.0
 */
public final class HadoopStderr {

  private HadoopStderr() {}

  /**
   * Removes INFO and WARN log lines.
   *
   * @param stderr captured standard error; {@code null} yields an empty string
   * @return remaining lines joined by {@code '\n'}
   */
  public static String clean(String stderr) {
    if (stderr == null || stderr.isEmpty()) {
      return "";
    }
    return stderr.lines()
        .filter(line -> !isRoutine(line))
        .collect(Collectors.joining("\n"));
  }

  static boolean isRoutine(String line) {
    String[] parts = line.trim().split("\\s+");
    if (parts.length < 3) {
      return false;
    }
    return parts[2].equals("INFO") || parts[2].equals("WARN");
  }
}
