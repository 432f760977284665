package ca.gc.cra.tbfs.infrastructure.hadoop;

import ca.gc.cra.tbfs.application.port.StreamingTool;
import ca.gc.cra.tbfs.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * {@link StreamingTool} issuing {@code hadoop jar <streaming jar> dumptb|loadtb <path>}.
 *
 * <p>The jar is located on first use and reused for the lifetime of the instance.</p>
 *
 * @since 0.1.0
 */
public final class HadoopStreamingTool implements StreamingTool {
  private final String hadoopCommand;
  private final StreamingJarLocator locator;
  private Path jar;

  /**
   * Creates the tool.
   *
   * @param hadoopCommand executable used to reach the cluster
   * @param locator finder of the streaming jar
   */
  public HadoopStreamingTool(String hadoopCommand, StreamingJarLocator locator) {
    this.hadoopCommand = Strings.requireNonBlank("hadoopCommand", hadoopCommand);
    this.locator = Objects.requireNonNull(locator, "locator");
  }

  @Override
  public List<String> dumpCommand(String path) throws IOException {
    return List.of(hadoopCommand, "jar", jar().toString(), "dumptb", Strings.requireNonBlank("path", path));
  }

  @Override
  public List<String> loadCommand(String path) throws IOException {
    return List.of(hadoopCommand, "jar", jar().toString(), "loadtb", Strings.requireNonBlank("path", path));
  }

  private synchronized Path jar() throws IOException {
    if (jar == null) {
      jar = locator.locate();
    }
    return jar;
  }
}
