package ca.gc.cra.tbfs.testutil;

import ca.gc.cra.tbfs.application.port.StreamingTool;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * {@link StreamingTool} running local shell commands in place of {@code dumptb} and {@code loadtb}.
 */
public final class FakeStreamingTool implements StreamingTool {
  private final Function<String, List<String>> dump;
  private final Function<String, List<String>> load;
  private final List<String> dumped = Collections.synchronizedList(new ArrayList<>());

  public FakeStreamingTool(Function<String, List<String>> dump, Function<String, List<String>> load) {
    this.dump = dump;
    this.load = load;
  }

  /** Dumps a path by printing the local file of the same name; loads by writing it. */
  public static FakeStreamingTool catFiles() {
    return new FakeStreamingTool(
        path -> List.of("cat", path),
        path -> List.of("sh", "-c", "cat > \"$0\"", path));
  }

  /** Dumps every path with {@code sh -c script path}; the script sees the path as {@code $0}. */
  public static FakeStreamingTool dumpingWith(String script) {
    return new FakeStreamingTool(path -> List.of("sh", "-c", script, path), path -> List.of("true"));
  }

  /** Loads every path with {@code sh -c script path}. */
  public static FakeStreamingTool loadingWith(String script) {
    return new FakeStreamingTool(path -> List.of("true"), path -> List.of("sh", "-c", script, path));
  }

  public List<String> dumpedPaths() {
    synchronized (dumped) {
      return List.copyOf(dumped);
    }
  }

  @Override
  public List<String> dumpCommand(String path) {
    dumped.add(path);
    return dump.apply(path);
  }

  @Override
  public List<String> loadCommand(String path) {
    return load.apply(path);
  }
}
