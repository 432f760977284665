package ca.gc.cra.tbfs.testutil;

import ca.gc.cra.tbfs.application.port.FileSystemQuery;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link FileSystemQuery} whose listings are registered up front. Unknown paths fail to list like a missing
 * cluster path; only listing and existence are supported.
 */
public final class InMemoryFileSystem implements FileSystemQuery {
  private final Map<String, List<String>> listings = new LinkedHashMap<>();
  private final List<String> listCalls = new ArrayList<>();

  public InMemoryFileSystem with(String path, List<String> entries) {
    listings.put(path, List.copyOf(entries));
    return this;
  }

  public List<String> listCalls() {
    return List.copyOf(listCalls);
  }

  @Override
  public boolean exists(String path) {
    return listings.containsKey(path);
  }

  @Override
  public boolean isDirectory(String path) {
    return listings.containsKey(path);
  }

  @Override
  public boolean isEmpty(String path) {
    return listings.getOrDefault(path, List.of()).isEmpty();
  }

  @Override
  public List<String> list(String path) throws IOException {
    listCalls.add(path);
    List<String> entries = listings.get(path);
    if (entries == null) {
      throw new IOException("ls: Cannot access " + path + ": No such file or directory.");
    }
    return entries;
  }

  @Override
  public void removeRecursive(String path) {
    throw new UnsupportedOperationException("removeRecursive");
  }

  @Override
  public void copyIn(Path localPath, String clusterPath) {
    throw new UnsupportedOperationException("copyIn");
  }

  @Override
  public void copyOut(String clusterPath, Path localPath) {
    throw new UnsupportedOperationException("copyOut");
  }
}
