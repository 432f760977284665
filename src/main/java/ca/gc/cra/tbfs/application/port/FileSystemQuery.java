package ca.gc.cra.tbfs.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> Port for one-shot cluster filesystem operations.
 * <p><strong>Why:</strong> The record multiplexer only needs listing, but callers also test, delete and copy paths;
 * keeping them behind a port lets tests substitute an in-memory filesystem.</p>
 * <p><strong>Role:</strong> Output port implemented by {@code HadoopFsShell}.</p>
 * <p><strong>Errors:</strong> Failing commands surface as {@code ExternalCommandException}, an {@link IOException}.</p>
 *
 * @since 0.1.0
 */
public interface FileSystemQuery {
  /**
   * Tests whether a path exists.
   *
   * @param path cluster path without wildcards
   * @return {@code true} if the path exists
   * @throws IOException if the test command cannot be run
   */
  boolean exists(String path) throws IOException;

  /**
   * Tests whether a path is a directory.
   *
   * @param path cluster path without wildcards
   * @return {@code true} for directories
   * @throws IOException if the test command cannot be run
   */
  boolean isDirectory(String path) throws IOException;

  /**
   * Tests whether a path has zero length (directories count as empty).
   *
   * @param path cluster path without wildcards
   * @return {@code true} for zero-length entries
   * @throws IOException if the test command cannot be run
   */
  boolean isEmpty(String path) throws IOException;

  /**
   * Lists a path. A file lists as itself; a directory lists its children.
   *
   * @param path cluster path, possibly with wildcards
   * @return concrete paths in listing order
   * @throws IOException if the listing fails (for example the path does not exist)
   */
  List<String> list(String path) throws IOException;

  /**
   * Removes a path recursively.
   *
   * @param path cluster path, possibly with wildcards
   * @throws IOException if removal fails
   */
  void removeRecursive(String path) throws IOException;

  /**
   * Copies a local file into the cluster filesystem.
   *
   * @param localPath local source
   * @param clusterPath cluster destination
   * @throws IOException if the copy fails
   */
  void copyIn(Path localPath, String clusterPath) throws IOException;

  /**
   * Copies a cluster file to the local filesystem.
   *
   * @param clusterPath cluster source
   * @param localPath local destination
   * @throws IOException if the copy fails
   */
  void copyOut(String clusterPath, Path localPath) throws IOException;
}
