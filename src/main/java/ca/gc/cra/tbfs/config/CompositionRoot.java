package ca.gc.cra.tbfs.config;

import ca.gc.cra.tbfs.application.pipeline.DumpRecordsUseCase;
import ca.gc.cra.tbfs.application.pipeline.LoadRecordsUseCase;
import ca.gc.cra.tbfs.application.pipeline.RecordWriter;
import ca.gc.cra.tbfs.application.port.FileSystemQuery;
import ca.gc.cra.tbfs.application.port.MetricsPort;
import ca.gc.cra.tbfs.application.port.RecordCodec;
import ca.gc.cra.tbfs.application.port.StreamingTool;
import ca.gc.cra.tbfs.application.session.ClusterSession;
import ca.gc.cra.tbfs.infrastructure.codec.TypedBytesCodec;
import ca.gc.cra.tbfs.infrastructure.hadoop.HadoopFsShell;
import ca.gc.cra.tbfs.infrastructure.hadoop.HadoopStreamingTool;
import ca.gc.cra.tbfs.infrastructure.hadoop.StreamingJarLocator;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires TBFS use cases to the Hadoop command-line adapters described by a
 * {@link ClusterConfig}.
 * <p><strong>Role:</strong> Single place where configuration turns into runnable objects; the CLI never
 * constructs adapters itself.</p>
 * <p><strong>Thread-safety:</strong> Adapters are created once per root and shared; the streaming tool caches
 * the located jar.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final ClusterConfig config;
  private final MetricsPort metrics;
  private final FileSystemQuery fileSystem;
  private final StreamingTool streamingTool;
  private final RecordCodec codec;

  /**
   * Creates a composition root.
   *
   * @param config cluster configuration
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public CompositionRoot(ClusterConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.fileSystem = new HadoopFsShell(config.hadoopCommand(), config.javaMemoryMb());
    this.streamingTool = new HadoopStreamingTool(
        config.hadoopCommand(),
        StreamingJarLocator.withEnvironmentFallback(
            config.streamingJar().orElse(null), config.hadoopHome().orElse(null)));
    this.codec = new TypedBytesCodec();
  }

  /**
   * Returns the configuration this root was built from.
   *
   * @return cluster configuration
   */
  public ClusterConfig config() {
    return config;
  }

  /**
   * Returns the shared filesystem adapter.
   *
   * @return filesystem backed by {@code hadoop fs}
   */
  public FileSystemQuery fileSystem() {
    return fileSystem;
  }

  /**
   * Creates a session for absolutizing paths.
   *
   * @return new session with an unresolved home directory
   */
  public ClusterSession clusterSession() {
    return new ClusterSession(fileSystem);
  }

  /**
   * Creates the {@code readtb} use case.
   *
   * @return dump use case honouring the configured reader options
   */
  public DumpRecordsUseCase dumpRecordsUseCase() {
    return new DumpRecordsUseCase(fileSystem, streamingTool, codec, config.readerOptions(), metrics);
  }

  /**
   * Creates the record writer.
   *
   * @return writer streaming into {@code loadtb}
   */
  public RecordWriter recordWriter() {
    return new RecordWriter(streamingTool, codec, config.javaMemoryMb(), metrics);
  }

  /**
   * Creates the {@code writetb} use case.
   *
   * @return load use case
   */
  public LoadRecordsUseCase loadRecordsUseCase() {
    return new LoadRecordsUseCase(recordWriter());
  }
}
