package ca.gc.cra.tbfs.api;

import ca.gc.cra.tbfs.application.port.FileSystemQuery;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filesystem verbs: {@code ls}, {@code rmr}, {@code put}, {@code get}, {@code exists}, {@code isdir},
 * {@code isempty} and {@code abspath}.
 *
 * <p>Predicates print {@code true} or {@code false} and exit with {@link ExitCode#SUCCESS} or
 * {@link ExitCode#FALSE} so shell scripts can branch on them.</p>
 *
 * @since 0.1.0
 */
public final class FsCli {
  /** Verbs handled by this command. */
  public static final Set<String> VERBS =
      Set.of("ls", "rmr", "put", "get", "exists", "isdir", "isempty", "abspath");

  private static final Logger log = LoggerFactory.getLogger(FsCli.class);
  private static final String SUMMARY_USAGE =
      "usage: tbfs <ls|rmr|exists|isdir|isempty|abspath> path=PATH | tbfs put local=FILE path=PATH"
          + " | tbfs get path=PATH local=FILE";
  private static final String HELP_TEXT = """
      TBFS filesystem verbs

      Usage:
        tbfs ls path=PATH          List entries (one absolute path per line)
        tbfs rmr path=PATH         Remove recursively
        tbfs put local=FILE path=PATH
        tbfs get path=PATH local=FILE
        tbfs exists path=PATH      Prints true/false; exit 0 when true, 1 when false
        tbfs isdir path=PATH
        tbfs isempty path=PATH
        tbfs abspath path=PATH     Resolve against the cluster home directory

      Optional:
        hadoopCommand=CMD          Hadoop client executable (default hadoop)
        javaMemoryMb=N             Heap ceiling exported through HADOOP_OPTS (default 100)
        config=FILE                YAML file with common/fs sections
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private FsCli() {}

  static ExitCode run(String verb, String[] args) {
    String normalized = verb.toLowerCase(Locale.ROOT);
    if (!VERBS.contains(normalized)) {
      throw new IllegalArgumentException("Unknown filesystem verb: " + verb);
    }
    CommandSupport.Prepared prepared = CommandSupport.prepare("fs", args, SUMMARY_USAGE, HELP_TEXT);
    if (prepared.stopped()) {
      return prepared.exit();
    }
    String path;
    String local;
    try {
      path = ConfigCliUtils.require(prepared.effective(), "path");
      local = normalized.equals("put") || normalized.equals("get")
          ? ConfigCliUtils.require(prepared.effective(), "local")
          : null;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", normalized, ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    return CommandSupport.execute(normalized, prepared.cluster(), root -> {
      FileSystemQuery fs = root.fileSystem();
      switch (normalized) {
        case "ls" -> fs.list(path).forEach(CliPrinter::println);
        case "rmr" -> fs.removeRecursive(path);
        case "put" -> fs.copyIn(Path.of(local), path);
        case "get" -> fs.copyOut(path, Path.of(local));
        case "abspath" -> CliPrinter.println(root.clusterSession().absolutePath(path));
        case "exists" -> {
          return predicate(fs.exists(path));
        }
        case "isdir" -> {
          return predicate(fs.isDirectory(path));
        }
        case "isempty" -> {
          return predicate(fs.isEmpty(path));
        }
        default -> throw new IllegalStateException("Unhandled verb " + normalized);
      }
      return ExitCode.SUCCESS;
    });
  }

  private static ExitCode predicate(boolean result) {
    CliPrinter.println(Boolean.toString(result));
    return result ? ExitCode.SUCCESS : ExitCode.FALSE;
  }
}
