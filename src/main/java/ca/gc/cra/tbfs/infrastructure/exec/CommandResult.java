package ca.gc.cra.tbfs.infrastructure.exec;

import java.util.Objects;

/**
 * Outcome of a finished external command.
 *
 * @param command command line that was executed, for diagnostics
 * @param exitCode process exit status; {@code 0} means success
 * @param stdout captured standard output, empty when stdout was not captured
 * @param stderr captured standard error, empty when stderr was not captured
 * @since 0.1.0
 */
public record CommandResult(String command, int exitCode, String stdout, String stderr) {

  /**
   * Normalizes missing output to empty strings.
   */
  public CommandResult {
    Objects.requireNonNull(command, "command");
    stdout = stdout == null ? "" : stdout;
    stderr = stderr == null ? "" : stderr;
  }

  /**
   * Indicates whether the command exited with status zero.
   *
   * @return {@code true} on success
   */
  public boolean succeeded() {
    return exitCode == 0;
  }
}
