package ca.gc.cra.tbfs.infrastructure.hadoop;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StreamingJarLocatorTest {
  @TempDir
  Path home;

  @Test
  void explicitJarWins() throws IOException {
    Path jar = Files.createFile(home.resolve("custom.jar"));
    touch(home.resolve("lib/hadoop-streaming.jar"));

    assertEquals(jar, new StreamingJarLocator(jar, home).locate());
  }

  @Test
  void missingExplicitJarFails() {
    IOException ex = assertThrows(IOException.class,
        () -> new StreamingJarLocator(home.resolve("absent.jar"), home).locate());

    assertTrue(ex.getMessage().contains("absent.jar"));
  }

  @Test
  void searchPrefersShortestPath() throws IOException {
    Path top = touch(home.resolve("share/hadoop/tools/lib/hadoop-streaming-2.7.7.jar"));
    touch(home.resolve("share/hadoop/tools/lib/sources/hadoop-streaming-2.7.7-test-sources.jar"));
    touch(home.resolve("share/hadoop/tools/lib/hadoop-archives-2.7.7.jar"));

    assertEquals(top, new StreamingJarLocator(null, home).locate());
  }

  @Test
  void homeWithoutStreamingJarFails() throws IOException {
    touch(home.resolve("lib/hadoop-common.jar"));

    IOException ex = assertThrows(IOException.class, () -> new StreamingJarLocator(null, home).locate());

    assertTrue(ex.getMessage().startsWith("No streaming jar found"));
  }

  @Test
  void unknownHomeFails() {
    assertThrows(IOException.class, () -> new StreamingJarLocator(null, null).locate());
    assertThrows(IOException.class, () -> new StreamingJarLocator(null, home.resolve("nowhere")).locate());
  }

  @Test
  void recognisesStreamingJarNames() {
    assertTrue(StreamingJarLocator.isStreamingJar(Path.of("/opt/hadoop-streaming-3.3.6.jar")));
    assertFalse(StreamingJarLocator.isStreamingJar(Path.of("/opt/hadoop-streaming.txt")));
    assertFalse(StreamingJarLocator.isStreamingJar(Path.of("/opt/hadoop-common.jar")));
  }

  private static Path touch(Path file) throws IOException {
    Files.createDirectories(file.getParent());
    return Files.createFile(file);
  }
}
