package ca.gc.cra.tbfs.application.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.tbfs.testutil.InMemoryFileSystem;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;

class ClusterSessionTest {

  @Test
  void homeIsParentOfFirstListedEntry() throws IOException {
    InMemoryFileSystem fs = new InMemoryFileSystem().with(".", List.of("/user/tbfs/a", "/user/tbfs/b"));
    ClusterSession session = new ClusterSession(fs);

    assertEquals("/user/tbfs", session.homeDirectory());
    assertEquals("/user/tbfs", session.homeDirectory());
    assertEquals(List.of("."), fs.listCalls());
  }

  @Test
  void relativePathsResolveAgainstHome() throws IOException {
    ClusterSession session = new ClusterSession(
        new InMemoryFileSystem().with(".", List.of("/user/tbfs/a")));

    assertEquals("/user/tbfs/out", session.absolutePath("out/"));
    assertEquals("/user/tbfs/y", session.absolutePath("x/../y"));
    assertEquals("/user/shared", session.absolutePath("../shared"));
  }

  @Test
  void absolutePathsAreNormalizedWithoutListing() throws IOException {
    InMemoryFileSystem fs = new InMemoryFileSystem();
    ClusterSession session = new ClusterSession(fs);

    assertEquals("/a/b", session.absolutePath("/a//b/"));
    assertEquals("/", session.absolutePath("/"));
    assertEquals(List.of(), fs.listCalls());
  }

  @Test
  void missingHomeIsReported() {
    ClusterSession session = new ClusterSession(new InMemoryFileSystem());

    IOException ex = assertThrows(IOException.class, () -> session.absolutePath("relative"));

    assertEquals("Home directory doesn't exist", ex.getMessage());
  }

  @Test
  void emptyHomeListingIsReported() {
    ClusterSession session = new ClusterSession(new InMemoryFileSystem().with(".", List.of()));

    assertThrows(IOException.class, session::homeDirectory);
  }

  @Test
  void emptyPathIsRejected() {
    ClusterSession session = new ClusterSession(new InMemoryFileSystem());

    assertThrows(IllegalArgumentException.class, () -> session.absolutePath(""));
  }
}
