package ca.gc.cra.tbfs.infrastructure.exec;

import ca.gc.cra.tbfs.infrastructure.hadoop.HadoopStderr;
import ca.gc.cra.tbfs.logging.Logs;
import java.io.IOException;
import java.util.Objects;

/**
 * Checked exception raised when a spawned command exits with a nonzero status or dies while the
 * caller is still feeding it data.
 *
 * <p>Carries the command line and the captured standard error so callers can report the failure
 * without re-running the command.</p>
 *
 * @since 0.1.0
 */
public final class ExternalCommandException extends IOException {
  private static final int MAX_STDERR_BYTES = 2_048;

  private final String command;
  private final int exitCode;
  private final String stderr;

  /**
   * Creates an exception for a command that finished unsuccessfully.
   *
   * @param command command line that was executed
   * @param exitCode exit status reported by the process
   * @param stderr captured standard error; may be {@code null}
   */
  public ExternalCommandException(String command, int exitCode, String stderr) {
    this(describe(command, exitCode, stderr), command, exitCode, stderr, null);
  }

  /**
   * Creates an exception with a caller-supplied message.
   *
   * @param message human-readable description
   * @param command command line that was executed
   * @param exitCode exit status reported by the process
   * @param stderr captured standard error; may be {@code null}
   * @param cause underlying I/O failure, if any
   */
  public ExternalCommandException(
      String message, String command, int exitCode, String stderr, Throwable cause) {
    super(message, cause);
    this.command = Objects.requireNonNull(command, "command");
    this.exitCode = exitCode;
    this.stderr = stderr == null ? "" : stderr;
  }

  /**
   * Builds an exception from a completed {@link CommandResult}.
   *
   * @param result finished command
   * @return exception describing the failure
   */
  public static ExternalCommandException from(CommandResult result) {
    return new ExternalCommandException(result.command(), result.exitCode(), result.stderr());
  }

  /**
   * Returns the command line that failed.
   *
   * @return command text
   */
  public String command() {
    return command;
  }

  /**
   * Returns the exit status reported by the process.
   *
   * @return exit code
   */
  public int exitCode() {
    return exitCode;
  }

  /**
   * Returns the full captured standard error.
   *
   * @return stderr text, possibly empty
   */
  public String stderr() {
    return stderr;
  }

  private static String describe(String command, int exitCode, String stderr) {
    String cleaned = HadoopStderr.clean(stderr == null ? "" : stderr).strip();
    return "Ran[" + command + "] exit=" + exitCode + ": " + Logs.truncate(cleaned, MAX_STDERR_BYTES);
  }
}
