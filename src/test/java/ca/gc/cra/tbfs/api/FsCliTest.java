package ca.gc.cra.tbfs.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tbfs.testutil.FakeHadoop;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FsCliTest extends CliTestBase {
  @TempDir
  Path dir;

  private FakeHadoop hadoop;
  private Path data;

  @BeforeEach
  void setUp() throws IOException {
    hadoop = FakeHadoop.install(dir.resolve("hadoop"));
    data = Files.createDirectory(dir.resolve("data"));
    Files.writeString(data.resolve("a.txt"), "alpha", StandardCharsets.UTF_8);
  }

  @Test
  void listsPaths() {
    ExitCode code = FsCli.run("ls", args("path=" + data));

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of(data + "/a.txt"), stdoutLines());
  }

  @Test
  void predicatesMapToExitCodes() {
    assertEquals(ExitCode.SUCCESS, FsCli.run("exists", args("path=" + data)));
    assertEquals(ExitCode.FALSE, FsCli.run("exists", args("path=" + dir.resolve("missing"))));
    assertEquals(ExitCode.SUCCESS, FsCli.run("isdir", args("path=" + data)));
    assertEquals(ExitCode.FALSE, FsCli.run("isempty", args("path=" + data.resolve("a.txt"))));
    assertEquals(List.of("true", "false", "true", "false"), stdoutLines());
  }

  @Test
  void putGetAndRemove() throws IOException {
    Path local = Files.writeString(dir.resolve("local.txt"), "payload", StandardCharsets.UTF_8);
    Path fetched = dir.resolve("fetched.txt");
    String remote = data.resolve("remote.txt").toString();

    assertEquals(ExitCode.SUCCESS, FsCli.run("put", args("local=" + local, "path=" + remote)));
    assertEquals(ExitCode.SUCCESS, FsCli.run("get", args("path=" + remote, "local=" + fetched)));
    assertEquals("payload", Files.readString(fetched, StandardCharsets.UTF_8));
    assertEquals(ExitCode.SUCCESS, FsCli.run("rmr", args("path=" + data)));
    assertFalse(Files.exists(data));
  }

  @Test
  void putRequiresLocalFile() {
    ExitCode code = FsCli.run("put", args("path=/x"));

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("local is required"));
  }

  @Test
  void failedCommandIsAnIoError() {
    ExitCode code = FsCli.run("ls", args("path=" + dir.resolve("missing")));

    assertEquals(ExitCode.IO_ERROR, code);
    assertTrue(loggedError("exited with 255"));
  }

  @Test
  void absolutePathNeedsNoHomeWhenAlreadyAbsolute() {
    ExitCode code = FsCli.run("abspath", args("path=/user//tbfs/./out/"));

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of("/user/tbfs/out"), stdoutLines());
  }

  @Test
  void unknownVerbIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> FsCli.run("chmod", new String[0]));
  }

  private String[] args(String... extra) {
    String[] all = new String[extra.length + 1];
    all[0] = "hadoopCommand=" + hadoop.command();
    System.arraycopy(extra, 0, all, 1, extra.length);
    return all;
  }
}
