package ca.gc.cra.tbfs.api;

import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code tbfs writetb}: loads a local tab-separated text file into a cluster typed bytes file.
 *
 * @since 0.1.0
 */
public final class WriteCli {
  private static final Logger log = LoggerFactory.getLogger(WriteCli.class);
  private static final String SUMMARY_USAGE =
      "usage: tbfs writetb path=DEST in=FILE [javaMemoryMb=N] [config=FILE] [--dry-run]";
  private static final String HELP_TEXT = """
      TBFS writetb

      Usage:
        tbfs writetb path=/user/me/input.tb in=./records.tsv [options]

      Required:
        path=PATH                  Cluster file to create
        in=FILE                    Local UTF-8 file; each line is key<TAB>value (no tab = empty value)

      Optional:
        javaMemoryMb=N             Heap ceiling exported through HADOOP_OPTS (default 100)
        hadoopCommand=CMD          Hadoop client executable (default hadoop)
        hadoopHome=DIR             Installation searched for the streaming jar (default $HADOOP_HOME)
        streamingJar=FILE          Explicit streaming jar
        config=FILE                YAML file with common/writetb sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        --dry-run                  Validate inputs without contacting the cluster
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private WriteCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CommandSupport.Prepared prepared =
        CommandSupport.prepare("writetb", args, SUMMARY_USAGE, HELP_TEXT);
    if (prepared.stopped()) {
      return prepared.exit();
    }
    String destination;
    try {
      destination = ConfigCliUtils.require(prepared.effective(), "path");
    } catch (IllegalArgumentException ex) {
      log.error("Invalid writetb arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Path input = Path.of(prepared.effective().get("in").trim());
    if (!Files.isRegularFile(input) || !Files.isReadable(input)) {
      log.error("Input file is not a readable file: {}", input);
      return ExitCode.INVALID_ARGS;
    }
    if (prepared.dryRun()) {
      CliPrinter.println("writetb plan: in=" + input.toAbsolutePath() + " path=" + destination
          + " javaMemoryMb=" + prepared.cluster().javaMemoryMb());
      return ExitCode.SUCCESS;
    }
    return CommandSupport.execute("writetb", prepared.cluster(), root -> {
      long written = root.loadRecordsUseCase().run(destination, input);
      CliPrinter.println(Long.toString(written));
      return ExitCode.SUCCESS;
    });
  }
}
