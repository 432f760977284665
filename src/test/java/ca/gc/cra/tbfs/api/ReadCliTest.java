package ca.gc.cra.tbfs.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tbfs.domain.record.TypedRecord;
import ca.gc.cra.tbfs.testutil.FakeHadoop;
import ca.gc.cra.tbfs.testutil.TypedBytesFixtures;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReadCliTest extends CliTestBase {
  @TempDir
  Path dir;

  private FakeHadoop hadoop;
  private Path data;

  @BeforeEach
  void setUp() throws IOException {
    hadoop = FakeHadoop.install(dir.resolve("hadoop"));
    data = Files.createDirectory(dir.resolve("data"));
    TypedBytesFixtures.write(data.resolve("part-00000"), List.of(
        TypedRecord.of("a", 1), TypedRecord.of("b", 2)));
    TypedBytesFixtures.write(data.resolve("part-00001"), List.of(
        TypedRecord.of("c", List.of(3L, "x"))));
    Files.createFile(data.resolve("_SUCCESS"));
  }

  @Test
  void printsEveryRecordAsTabSeparatedLine() {
    ExitCode code = ReadCli.run(args("path=" + data));

    assertEquals(ExitCode.SUCCESS, code);
    List<String> lines = new ArrayList<>(stdoutLines());
    Collections.sort(lines);
    assertEquals(List.of("a\t1", "b\t2", "c\t[3, x]"), lines);
  }

  @Test
  void limitStopsEarly() {
    ExitCode code = ReadCli.run(args("path=" + data, "limit=1", "readers=1"));

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(1, stdoutLines().size());
  }

  @Test
  void writesToOutputFile() throws IOException {
    Path out = dir.resolve("records.tsv");

    ExitCode code = ReadCli.run(args("path=" + data.resolve("part-00000"), "out=" + out));

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("a\t1\nb\t2\n", Files.readString(out, StandardCharsets.UTF_8));
    assertEquals(List.of(), stdoutLines());
  }

  @Test
  void repeatedPathsAreAllRead() {
    ExitCode code = ReadCli.run(args(
        "path=" + data.resolve("part-00000"), "path=" + data.resolve("part-00001")));

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(3, stdoutLines().size());
  }

  @Test
  void missingPathIsAnIoError() {
    ExitCode code = ReadCli.run(args("path=" + dir.resolve("missing")));

    assertEquals(ExitCode.IO_ERROR, code);
    assertTrue(loggedError("No such file or directory"));
  }

  @Test
  void pathIsRequired() {
    ExitCode code = ReadCli.run(args());

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(stdout.toString().contains("usage: tbfs readtb"));
    assertTrue(loggedError("readtb requires path"));
  }

  @Test
  void invalidReadersReturnUsage() {
    ExitCode code = ReadCli.run(args("path=/x", "readers=0"));

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(stdout.toString().contains("usage: tbfs readtb"));
  }

  @Test
  void dryRunPrintsPlanWithoutCluster() {
    ExitCode code = ReadCli.run(new String[] {
        "path=/a,/b", "hadoopCommand=/nonexistent/hadoop", "limit=5", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(
        List.of("readtb plan: roots=[/a, /b] readers=10 ignoreLogs=true limit=5 out=stdout"),
        stdoutLines());
  }

  @Test
  void yamlSuppliesClusterSettings() throws IOException {
    Path yaml = Files.writeString(dir.resolve("tbfs.yaml"), String.join("\n",
        "common:",
        "  hadoopCommand: " + hadoop.command(),
        "  streamingJar: " + hadoop.jar(),
        "readtb:",
        "  path: " + data.resolve("part-00001"),
        ""), StandardCharsets.UTF_8);

    ExitCode code = ReadCli.run(new String[] {"config=" + yaml});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of("c\t[3, x]"), stdoutLines());
  }

  @Test
  void missingConfigFileIsInvalid() {
    ExitCode code = ReadCli.run(new String[] {"path=/x", "config=" + dir.resolve("absent.yaml")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("Configuration file does not exist"));
  }

  @Test
  void malformedConfigIsConfigError() throws IOException {
    Path yaml = Files.writeString(dir.resolve("bad.yaml"), "- just\n- a list\n", StandardCharsets.UTF_8);

    ExitCode code = ReadCli.run(new String[] {"path=/x", "config=" + yaml});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void helpPrintsUsage() {
    ExitCode code = ReadCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(stdout.toString().contains("TBFS readtb"));
  }

  private String[] args(String... extra) {
    List<String> all = new ArrayList<>(List.of(
        "hadoopCommand=" + hadoop.command(),
        "streamingJar=" + hadoop.jar()));
    all.addAll(List.of(extra));
    return all.toArray(String[]::new);
  }
}
