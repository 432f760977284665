package ca.gc.cra.tbfs.infrastructure.exec;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle on a running child process started by {@link ProcessCommand#start()}.
 *
 * <p>Not thread-safe, with one exception: {@link #stdout()} may be read by a different thread than
 * the one calling {@link #waitFor()} or {@link #close()}.</p>
 *
 * @since 0.1.0
 */
public final class CommandHandle implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CommandHandle.class);
  private static final long REAP_TIMEOUT_MILLIS = 5_000L;

  private final String command;
  private final Process process;
  private final StreamTarget stdinTarget;
  private final StreamTarget stdoutTarget;
  private final CompletableFuture<byte[]> stdoutCapture;
  private final CompletableFuture<byte[]> stderrCapture;
  private boolean stdinClosed;
  private CommandResult result;
  private boolean closed;

  CommandHandle(
      String command,
      Process process,
      StreamTarget stdinTarget,
      StreamTarget stdoutTarget,
      StreamTarget stderrTarget,
      Executor drainPool) {
    this.command = command;
    this.process = process;
    this.stdinTarget = stdinTarget;
    this.stdoutTarget = stdoutTarget;
    this.stdoutCapture = stdoutTarget == StreamTarget.CAPTURE
        ? drain(process.getInputStream(), drainPool)
        : null;
    this.stderrCapture = stderrTarget == StreamTarget.CAPTURE
        ? drain(process.getErrorStream(), drainPool)
        : null;
  }

  /**
   * Returns the command line this handle runs.
   *
   * @return printable command line
   */
  public String command() {
    return command;
  }

  /**
   * Returns the operating-system process id.
   *
   * @return pid
   */
  public long pid() {
    return process.pid();
  }

  /**
   * Returns the writable end of the child's stdin.
   *
   * @return pipe into the child
   * @throws IllegalStateException if stdin was not configured as {@link StreamTarget#PIPE}
   */
  public OutputStream stdin() {
    if (stdinTarget != StreamTarget.PIPE) {
      throw new IllegalStateException("stdin is not piped for [" + command + "]");
    }
    return process.getOutputStream();
  }

  /**
   * Returns the readable end of the child's stdout.
   *
   * @return pipe from the child
   * @throws IllegalStateException if stdout was not configured as {@link StreamTarget#PIPE}
   */
  public InputStream stdout() {
    if (stdoutTarget != StreamTarget.PIPE) {
      throw new IllegalStateException("stdout is not piped for [" + command + "]");
    }
    return process.getInputStream();
  }

  /**
   * Checks for process exit without blocking.
   *
   * @return exit code if the process has finished, otherwise empty
   */
  public OptionalInt poll() {
    if (process.isAlive()) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(process.exitValue());
  }

  /**
   * Closes a piped stdin, blocks until the process exits and collects captured output.
   *
   * <p>A piped stdout must be drained by the caller beforehand, otherwise a child blocked on a full
   * pipe never exits. Repeated calls return the same result.</p>
   *
   * @return finished result
   * @throws InterruptedIOException if the calling thread is interrupted while waiting
   * @throws IOException if captured output cannot be collected
   */
  public CommandResult waitFor() throws IOException {
    if (result != null) {
      return result;
    }
    closeStdin();
    int exitCode;
    try {
      exitCode = process.waitFor();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw interrupted(ex);
    }
    result = new CommandResult(command, exitCode, collect(stdoutCapture), collect(stderrCapture));
    log.debug("[{}] exited with {}", command, exitCode);
    return result;
  }

  /**
   * {@link #waitFor()} variant that fails on a nonzero exit status.
   *
   * @return successful result
   * @throws ExternalCommandException if the exit status is nonzero
   * @throws IOException if waiting fails
   */
  public CommandResult checked() throws IOException {
    CommandResult finished = waitFor();
    if (!finished.succeeded()) {
      throw ExternalCommandException.from(finished);
    }
    return finished;
  }

  /**
   * Releases the pipes and, when the process is still running, terminates it together with its
   * descendants and reaps it. Idempotent; never throws.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (process.isAlive()) {
      log.debug("Destroying still-running [{}] pid={}", command, process.pid());
      process.descendants().forEach(ProcessHandle::destroy);
      process.destroy();
    }
    closeStdin();
    if (stdoutTarget == StreamTarget.PIPE) {
      closeQuietly(process.getInputStream(), "stdout");
    }
    try {
      if (!process.waitFor(REAP_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
        log.warn("[{}] pid={} ignored termination; killing", command, process.pid());
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
    }
  }

  private void closeStdin() {
    if (stdinTarget != StreamTarget.PIPE || stdinClosed) {
      return;
    }
    stdinClosed = true;
    closeQuietly(process.getOutputStream(), "stdin");
  }

  private void closeQuietly(Closeable stream, String name) {
    try {
      stream.close();
    } catch (IOException ex) {
      // Expected when the child already exited and the pipe is broken.
      log.debug("Ignoring failure closing {} of [{}]: {}", name, command, ex.getMessage());
    }
  }

  private String collect(CompletableFuture<byte[]> capture) throws IOException {
    if (capture == null) {
      return "";
    }
    try {
      return new String(capture.get(), StandardCharsets.UTF_8);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw interrupted(ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() instanceof UncheckedIOException unchecked ? unchecked.getCause() : ex.getCause();
      throw new IOException("Unable to capture output of [" + command + "]", cause);
    }
  }

  private InterruptedIOException interrupted(InterruptedException cause) {
    InterruptedIOException ex = new InterruptedIOException("Interrupted while waiting for [" + command + "]");
    ex.initCause(cause);
    return ex;
  }

  private static CompletableFuture<byte[]> drain(InputStream stream, Executor pool) {
    return CompletableFuture.supplyAsync(() -> {
      try (InputStream in = stream) {
        return in.readAllBytes();
      } catch (IOException ex) {
        throw new UncheckedIOException(ex);
      }
    }, pool);
  }
}
