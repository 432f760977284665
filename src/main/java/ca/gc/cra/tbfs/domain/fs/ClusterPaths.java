package ca.gc.cra.tbfs.domain.fs;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * <strong>What:</strong> Pure helpers for slash-separated cluster filesystem paths.
 * <p><strong>Why:</strong> Cluster paths are not local {@link java.nio.file.Path}s; they must be normalized and
 * inspected without touching the local filesystem.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class ClusterPaths {
  /** First character of cluster-emitted status entries such as {@code _SUCCESS} and {@code _logs}. */
  public static final char STATUS_MARKER = '_';

  private ClusterPaths() {}

  /**
   * Returns the final path component, ignoring trailing slashes.
   *
   * @param path cluster path
   * @return last component, or an empty string for {@code "/"}
   */
  public static String basename(String path) {
    Objects.requireNonNull(path, "path");
    String trimmed = stripTrailingSlashes(path);
    int idx = trimmed.lastIndexOf('/');
    return idx < 0 ? trimmed : trimmed.substring(idx + 1);
  }

  /**
   * Returns everything before the final path component.
   *
   * @param path cluster path
   * @return parent path; {@code "/"} for top-level entries and {@code ""} when there is no slash
   */
  public static String parent(String path) {
    Objects.requireNonNull(path, "path");
    String trimmed = stripTrailingSlashes(path);
    int idx = trimmed.lastIndexOf('/');
    if (idx < 0) {
      return "";
    }
    return idx == 0 ? "/" : trimmed.substring(0, idx);
  }

  /**
   * Indicates whether the basename starts with {@link #STATUS_MARKER}, marking a log or status entry rather
   * than data.
   *
   * @param path cluster path
   * @return {@code true} for status entries
   */
  public static boolean isStatusEntry(String path) {
    String name = basename(path);
    return !name.isEmpty() && name.charAt(0) == STATUS_MARKER;
  }

  /**
   * Indicates whether the path is absolute.
   *
   * @param path cluster path
   * @return {@code true} when the path starts with {@code '/'}
   */
  public static boolean isAbsolute(String path) {
    return path != null && path.startsWith("/");
  }

  /**
   * Normalizes an absolute path: collapses repeated slashes, resolves {@code .} and {@code ..} and removes a
   * trailing slash.
   *
   * @param path absolute cluster path
   * @return normalized path
   * @throws IllegalArgumentException if the path is not absolute
   */
  public static String normalize(String path) {
    if (!isAbsolute(path)) {
      throw new IllegalArgumentException("path must be absolute: " + path);
    }
    Deque<String> parts = new ArrayDeque<>();
    for (String part : path.split("/")) {
      if (part.isEmpty() || part.equals(".")) {
        continue;
      }
      if (part.equals("..")) {
        parts.pollLast();
      } else {
        parts.addLast(part);
      }
    }
    return "/" + String.join("/", parts);
  }

  /**
   * Resolves {@code path} against {@code base} and normalizes the result.
   *
   * @param base absolute base directory
   * @param path absolute or relative path
   * @return normalized absolute path
   */
  public static String resolve(String base, String path) {
    Objects.requireNonNull(path, "path");
    if (isAbsolute(path)) {
      return normalize(path);
    }
    return normalize(base + "/" + path);
  }

  private static String stripTrailingSlashes(String path) {
    int end = path.length();
    while (end > 1 && path.charAt(end - 1) == '/') {
      end--;
    }
    return path.substring(0, end);
  }
}
