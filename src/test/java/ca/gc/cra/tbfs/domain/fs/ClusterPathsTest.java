package ca.gc.cra.tbfs.domain.fs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ClusterPathsTest {

  @Test
  void basenameAndParentIgnoreTrailingSlash() {
    assertEquals("part-0", ClusterPaths.basename("/data/out/part-0"));
    assertEquals("out", ClusterPaths.basename("/data/out/"));
    assertEquals("/data", ClusterPaths.parent("/data/out/"));
    assertEquals("/", ClusterPaths.parent("/data"));
    assertEquals("", ClusterPaths.parent("relative"));
    assertEquals("", ClusterPaths.basename("/"));
  }

  @Test
  void statusEntriesStartWithUnderscore() {
    assertTrue(ClusterPaths.isStatusEntry("/data/_SUCCESS"));
    assertTrue(ClusterPaths.isStatusEntry("/data/_logs/"));
    assertFalse(ClusterPaths.isStatusEntry("/data_x/part_0"));
    assertFalse(ClusterPaths.isStatusEntry("/"));
  }

  @Test
  void normalizeCollapsesDotsAndSlashes() {
    assertEquals("/a/c", ClusterPaths.normalize("/a/./b/../c//"));
    assertEquals("/", ClusterPaths.normalize("/.."));
    assertThrows(IllegalArgumentException.class, () -> ClusterPaths.normalize("a/b"));
  }

  @Test
  void resolveKeepsAbsolutePaths() {
    assertEquals("/x", ClusterPaths.resolve("/home", "/x/"));
    assertEquals("/home/x", ClusterPaths.resolve("/home", "x"));
  }
}
