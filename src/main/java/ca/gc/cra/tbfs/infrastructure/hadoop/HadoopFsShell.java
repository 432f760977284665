package ca.gc.cra.tbfs.infrastructure.hadoop;

import ca.gc.cra.tbfs.application.port.FileSystemQuery;
import ca.gc.cra.tbfs.infrastructure.exec.CommandResult;
import ca.gc.cra.tbfs.infrastructure.exec.ProcessCommand;
import ca.gc.cra.tbfs.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link FileSystemQuery} backed by the {@code hadoop fs} command-line client.
 * <p><strong>Why:</strong> Talking to the cluster through its own client avoids linking the Hadoop libraries and
 * their configuration into this process.</p>
 * <p><strong>Role:</strong> Infrastructure adapter used by the reader for enumeration and by the CLI for
 * filesystem verbs.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable settings; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class HadoopFsShell implements FileSystemQuery {
  private static final Logger log = LoggerFactory.getLogger(HadoopFsShell.class);
  private static final Pattern FOUND_LINE = Pattern.compile("Found [0-9]+ items$");

  private final String hadoopCommand;
  private final int javaMemoryMb;

  /**
   * Creates the adapter.
   *
   * @param hadoopCommand executable used to reach the cluster, usually {@code hadoop}
   * @param javaMemoryMb heap ceiling exported to each client invocation
   */
  public HadoopFsShell(String hadoopCommand, int javaMemoryMb) {
    this.hadoopCommand = Strings.requireNonBlank("hadoopCommand", hadoopCommand);
    if (javaMemoryMb <= 0) {
      throw new IllegalArgumentException("javaMemoryMb must be positive");
    }
    this.javaMemoryMb = javaMemoryMb;
  }

  @Override
  public boolean exists(String path) throws IOException {
    return test("-e", path);
  }

  @Override
  public boolean isDirectory(String path) throws IOException {
    return test("-d", path);
  }

  @Override
  public boolean isEmpty(String path) throws IOException {
    return test("-z", path);
  }

  /**
   * Lists a path with {@code hadoop fs -ls}. Each non-blank output line contributes its last space-separated
   * token; the {@code Found N items} header is dropped.
   */
  @Override
  public List<String> list(String path) throws IOException {
    CommandResult result = fs("-ls", path).runChecked();
    List<String> entries = new ArrayList<>();
    for (String line : result.stdout().split("\n")) {
      if (line.isEmpty() || FOUND_LINE.matcher(line).find()) {
        continue;
      }
      entries.add(line.substring(line.lastIndexOf(' ') + 1));
    }
    log.debug("Listed {} entries under {}", entries.size(), path);
    return entries;
  }

  @Override
  public void removeRecursive(String path) throws IOException {
    fs("-rmr", path).runChecked();
  }

  @Override
  public void copyIn(Path localPath, String clusterPath) throws IOException {
    fs("-put", localPath.toString(), clusterPath).runChecked();
  }

  @Override
  public void copyOut(String clusterPath, Path localPath) throws IOException {
    fs("-get", clusterPath, localPath.toString()).runChecked();
  }

  private boolean test(String flag, String path) throws IOException {
    return fs("-test", flag, path).run().succeeded();
  }

  private ProcessCommand fs(String... args) {
    for (String arg : args) {
      Strings.requireNonBlank("path", arg);
    }
    List<String> argv = new ArrayList<>(args.length + 2);
    argv.add(hadoopCommand);
    argv.add("fs");
    argv.addAll(List.of(args));
    return ProcessCommand.of(argv).javaMemoryMb(javaMemoryMb);
  }
}
