package ca.gc.cra.tbfs.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by the TBFS command-line tools.
 * <p><strong>Why:</strong> Scripts driving {@code tbfs} distinguish bad arguments from cluster failures
 * without parsing log output.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** A filesystem predicate ({@code exists}, {@code isdir}, {@code isempty}) evaluated to false. */
  FALSE(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A local or cluster I/O operation failed, including nonzero exits of cluster commands. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
