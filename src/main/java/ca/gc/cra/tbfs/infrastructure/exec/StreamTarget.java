package ca.gc.cra.tbfs.infrastructure.exec;

/**
 * Destination or origin of a child process standard stream.
 *
 * @since 0.1.0
 */
public enum StreamTarget {
  /** Exposed to the caller as a pipe ({@link CommandHandle#stdin()} or {@link CommandHandle#stdout()}). */
  PIPE,
  /** Piped and drained in the background; contents are returned by {@link CommandHandle#waitFor()}. */
  CAPTURE,
  /** Shared with the JVM's own stream. */
  INHERIT,
  /** Connected to the null device. */
  DISCARD
}
