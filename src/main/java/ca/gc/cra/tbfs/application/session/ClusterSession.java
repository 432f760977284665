package ca.gc.cra.tbfs.application.session;

import ca.gc.cra.tbfs.application.port.FileSystemQuery;
import ca.gc.cra.tbfs.domain.fs.ClusterPaths;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-user view of the cluster filesystem that turns relative paths into absolute ones.
 *
 * <p>The home directory is discovered once, as the parent of the first entry listed for {@code "."}, and cached
 * for the lifetime of the session.</p>
 *
 * @since 0.1.0
 */
public final class ClusterSession {
  private static final Logger log = LoggerFactory.getLogger(ClusterSession.class);

  private final FileSystemQuery fileSystem;
  private String homeDirectory;

  /**
   * Creates a session over a filesystem.
   *
   * @param fileSystem filesystem used to discover the home directory
   */
  public ClusterSession(FileSystemQuery fileSystem) {
    this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
  }

  /**
   * Returns the normalized absolute form of a path: no trailing slash, no redundant separators.
   *
   * @param path absolute path, or path relative to the home directory; wildcards are not interpreted
   * @return absolute path
   * @throws IOException if the home directory is needed and cannot be determined
   */
  public String absolutePath(String path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (path.isEmpty()) {
      throw new IllegalArgumentException("path must not be empty");
    }
    if (ClusterPaths.isAbsolute(path)) {
      return ClusterPaths.normalize(path);
    }
    return ClusterPaths.resolve(homeDirectory(), path);
  }

  /**
   * Returns the cached home directory, discovering it on first use.
   *
   * @return absolute home directory
   * @throws IOException if {@code "."} cannot be listed; "Home directory doesn't exist" when it is missing
   */
  public synchronized String homeDirectory() throws IOException {
    if (homeDirectory != null) {
      return homeDirectory;
    }
    List<String> entries;
    try {
      entries = fileSystem.list(".");
    } catch (IOException ex) {
      if (!fileSystem.exists(".")) {
        throw new IOException("Home directory doesn't exist", ex);
      }
      throw ex;
    }
    if (entries.isEmpty()) {
      throw new IOException("Cannot determine home directory: listing of '.' is empty");
    }
    homeDirectory = ClusterPaths.parent(entries.get(0));
    log.debug("Resolved cluster home directory {}", homeDirectory);
    return homeDirectory;
  }
}
