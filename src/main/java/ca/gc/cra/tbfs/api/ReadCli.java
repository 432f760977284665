package ca.gc.cra.tbfs.api;

import ca.gc.cra.tbfs.application.pipeline.DumpRecordsUseCase;
import ca.gc.cra.tbfs.domain.record.TextRecords;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code tbfs readtb}: prints every record under one or more cluster paths as {@code key<TAB>value} lines.
 *
 * @since 0.1.0
 */
public final class ReadCli {
  private static final Logger log = LoggerFactory.getLogger(ReadCli.class);
  private static final String SUMMARY_USAGE =
      "usage: tbfs readtb path=PATH[,PATH...] [out=FILE] [limit=N] [readers=N] [ignoreLogs=true|false] "
          + "[failOnAbnormalExit=true|false] [config=FILE] [--dry-run]";
  private static final String HELP_TEXT = """
      TBFS readtb

      Usage:
        tbfs readtb path=/user/me/output [options]

      Required:
        path=PATH[,PATH]           Cluster files, directories or globs; repeatable

      Optional:
        out=FILE                   Write lines to a local file instead of stdout
        limit=N                    Stop after N records and terminate remaining dumps (0 = all)
        readers=N                  Concurrent dump processes (default 10)
        ignoreLogs=true|false      Skip entries starting with '_' such as _SUCCESS (default true)
        failOnAbnormalExit=BOOL    Fail when a dump exits nonzero (default true)
        javaMemoryMb=N             Heap ceiling exported through HADOOP_OPTS (default 100)
        hadoopCommand=CMD          Hadoop client executable (default hadoop)
        hadoopHome=DIR             Installation searched for the streaming jar (default $HADOOP_HOME)
        streamingJar=FILE          Explicit streaming jar
        config=FILE                YAML file with common/readtb sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        --dry-run                  Print the plan without contacting the cluster
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Output:
        One line per record: key, TAB, value. Byte arrays are Base64 encoded.
      """;

  private ReadCli() {}

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
        CommandSupport.prepare("readtb", args, SUMMARY_USAGE, HELP_TEXT);
    if (prepared.stopped()) {
      return prepared.exit();
    }
    List<String> roots = ConfigCliUtils.splitList(prepared.effective().get("path"));
    if (roots.isEmpty()) {
      log.error("readtb requires path=<cluster path>");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    long limit = Long.parseLong(prepared.effective().getOrDefault("limit", "0").trim());
    String out = prepared.effective().getOrDefault("out", "").trim();

    if (prepared.dryRun()) {
      CliPrinter.println("readtb plan: roots=" + roots
          + " readers=" + prepared.cluster().readers()
          + " ignoreLogs=" + prepared.cluster().ignoreLogs()
          + " limit=" + (limit == 0 ? "none" : limit)
          + " out=" + (out.isEmpty() ? "stdout" : out));
      return ExitCode.SUCCESS;
    }

    return CommandSupport.execute("readtb", prepared.cluster(), root -> {
      if (out.isEmpty()) {
        PrintWriter stdout = CliPrinter.writer();
        try {
          return dump(root.dumpRecordsUseCase(), roots, limit, stdout);
        } finally {
          stdout.flush();
        }
      }
      try (BufferedWriter file = Files.newBufferedWriter(Path.of(out), StandardCharsets.UTF_8)) {
        return dump(root.dumpRecordsUseCase(), roots, limit, file);
      }
    });
  }

  private static ExitCode dump(
      DumpRecordsUseCase useCase,
      List<String> roots,
      long limit,
      Writer writer) throws IOException {
    useCase.run(roots, limit, record -> {
      writer.write(TextRecords.format(record));
      writer.write('\n');
    });
    return ExitCode.SUCCESS;
  }
}
