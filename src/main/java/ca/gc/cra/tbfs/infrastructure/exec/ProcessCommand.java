package ca.gc.cra.tbfs.infrastructure.exec;

import java.io.File;
import java.io.IOException;
import java.lang.ProcessBuilder.Redirect;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Describes one external command and spawns it as a supervised child process.
 * <p><strong>Why:</strong> Every cluster interaction (filesystem verbs, record dump, record load) is a
 * command-line invocation; this class is the single place where such processes are created.</p>
 * <p><strong>Role:</strong> Infrastructure primitive shared by the filesystem adapter, the record writer and
 * the record stream multiplexer.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Apply stdin/stdout/stderr targets ({@link StreamTarget}).</li>
 *   <li>Pass the JVM memory ceiling to spawned tools through {@value #MEMORY_ENV}.</li>
 *   <li>Return a {@link CommandHandle} offering poll, wait and checked-wait semantics.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Instances are mutable builders; configure and start on one thread.
 * The returned handles are independent.</p>
 *
 * @since 0.1.0
 */
public final class ProcessCommand {
  /** Environment variable carrying JVM options for Hadoop launcher scripts. */
  public static final String MEMORY_ENV = "HADOOP_OPTS";
  /** Default JVM heap ceiling, in mebibytes, for spawned tools. */
  public static final int DEFAULT_JAVA_MEMORY_MB = 100;

  private static final Logger log = LoggerFactory.getLogger(ProcessCommand.class);
  private static final ExecutorService DRAIN_POOL = ExecutorFactories.newDrainPool("tbfs-drain");
  private static final File NULL_DEVICE = new File(
      System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows") ? "NUL" : "/dev/null");

  private final List<String> argv;
  private final Map<String, String> environment = new LinkedHashMap<>();
  private StreamTarget stdin = StreamTarget.DISCARD;
  private StreamTarget stdout = StreamTarget.CAPTURE;
  private StreamTarget stderr = StreamTarget.CAPTURE;
  private int javaMemoryMb = DEFAULT_JAVA_MEMORY_MB;

  private ProcessCommand(List<String> argv) {
    Objects.requireNonNull(argv, "argv");
    if (argv.isEmpty()) {
      throw new IllegalArgumentException("argv must not be empty");
    }
    for (String token : argv) {
      Objects.requireNonNull(token, "argv token");
    }
    this.argv = List.copyOf(argv);
  }

  /**
   * Creates a command from an argument vector; the first element is the executable.
   *
   * @param argv executable followed by its arguments
   * @return command with stdin discarded and stdout/stderr captured
   */
  public static ProcessCommand of(List<String> argv) {
    return new ProcessCommand(argv);
  }

  /**
   * Varargs variant of {@link #of(List)}.
   *
   * @param argv executable followed by its arguments
   * @return new command
   */
  public static ProcessCommand of(String... argv) {
    return new ProcessCommand(List.of(argv));
  }

  /**
   * Sets the stdin target. {@link StreamTarget#CAPTURE} is not meaningful for input and is rejected.
   *
   * @param target stdin target
   * @return this command
   */
  public ProcessCommand stdin(StreamTarget target) {
    Objects.requireNonNull(target, "target");
    if (target == StreamTarget.CAPTURE) {
      throw new IllegalArgumentException("stdin cannot be captured");
    }
    this.stdin = target;
    return this;
  }

  /**
   * Sets the stdout target.
   *
   * @param target stdout target
   * @return this command
   */
  public ProcessCommand stdout(StreamTarget target) {
    this.stdout = Objects.requireNonNull(target, "target");
    return this;
  }

  /**
   * Sets the stderr target.
   *
   * @param target stderr target
   * @return this command
   */
  public ProcessCommand stderr(StreamTarget target) {
    this.stderr = Objects.requireNonNull(target, "target");
    return this;
  }

  /**
   * Sets the JVM heap ceiling exported to the child through {@value #MEMORY_ENV}.
   *
   * @param megabytes heap ceiling in mebibytes; must be positive
   * @return this command
   */
  public ProcessCommand javaMemoryMb(int megabytes) {
    if (megabytes <= 0) {
      throw new IllegalArgumentException("javaMemoryMb must be positive");
    }
    this.javaMemoryMb = megabytes;
    return this;
  }

  /**
   * Adds an environment entry on top of the inherited environment.
   *
   * @param name variable name
   * @param value variable value
   * @return this command
   */
  public ProcessCommand environment(String name, String value) {
    environment.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
    return this;
  }

  /**
   * Returns the argument vector.
   *
   * @return immutable argv
   */
  public List<String> argv() {
    return argv;
  }

  /**
   * Returns the argument vector joined by spaces, for logs and error messages.
   *
   * @return printable command line
   */
  public String commandLine() {
    return String.join(" ", argv);
  }

  /**
   * Spawns the process.
   *
   * @return handle owning the running process
   * @throws IOException if the executable cannot be started
   */
  public CommandHandle start() throws IOException {
    ProcessBuilder builder = new ProcessBuilder(argv);
    builder.environment().put(MEMORY_ENV, "-Xmx" + javaMemoryMb + "m");
    builder.environment().putAll(environment);
    builder.redirectInput(inputRedirect(stdin));
    builder.redirectOutput(outputRedirect(stdout));
    builder.redirectError(outputRedirect(stderr));
    Process process;
    try {
      process = builder.start();
    } catch (IOException ex) {
      throw new IOException("Unable to start [" + commandLine() + "]: " + ex.getMessage(), ex);
    }
    log.debug("Started [{}] pid={}", commandLine(), process.pid());
    return new CommandHandle(commandLine(), process, stdin, stdout, stderr, DRAIN_POOL);
  }

  /**
   * Starts the command and waits for it, regardless of exit status.
   *
   * @return finished result
   * @throws IOException if the command cannot be started or its output cannot be collected
   */
  public CommandResult run() throws IOException {
    try (CommandHandle handle = start()) {
      return handle.waitFor();
    }
  }

  /**
   * Starts the command and waits for it, failing on a nonzero exit status.
   *
   * @return successful result
   * @throws ExternalCommandException if the command exits nonzero
   * @throws IOException if the command cannot be started or its output cannot be collected
   */
  public CommandResult runChecked() throws IOException {
    try (CommandHandle handle = start()) {
      return handle.checked();
    }
  }

  @Override
  public String toString() {
    return "ProcessCommand[" + commandLine() + "]";
  }

  private static Redirect inputRedirect(StreamTarget target) {
    return switch (target) {
      case PIPE, CAPTURE -> Redirect.PIPE;
      case INHERIT -> Redirect.INHERIT;
      case DISCARD -> Redirect.from(NULL_DEVICE);
    };
  }

  private static Redirect outputRedirect(StreamTarget target) {
    return switch (target) {
      case PIPE, CAPTURE -> Redirect.PIPE;
      case INHERIT -> Redirect.INHERIT;
      case DISCARD -> Redirect.DISCARD;
    };
  }
}
