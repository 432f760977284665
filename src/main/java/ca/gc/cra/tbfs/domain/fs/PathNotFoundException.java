package ca.gc.cra.tbfs.domain.fs;

import java.io.IOException;

/**
 * Checked exception raised when a root path cannot be enumerated on the cluster filesystem.
 *
 * @since 0.1.0
 */
public final class PathNotFoundException extends IOException {
  private final String path;

  /**
   * Creates an exception naming the offending path.
   *
   * @param path path that could not be listed
   * @param cause listing failure, typically an {@code ExternalCommandException}
   */
  public PathNotFoundException(String path, Throwable cause) {
    super("No such file or directory: '" + path + "'", cause);
    this.path = path;
  }

  /**
   * Returns the path that could not be listed.
   *
   * @return cluster path
   */
  public String path() {
    return path;
  }
}
