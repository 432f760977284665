package ca.gc.cra.tbfs.application.pipeline;

import ca.gc.cra.tbfs.application.port.FileSystemQuery;
import ca.gc.cra.tbfs.application.port.MetricsPort;
import ca.gc.cra.tbfs.application.port.RecordCodec;
import ca.gc.cra.tbfs.application.port.RecordSink;
import ca.gc.cra.tbfs.application.port.StreamingTool;
import ca.gc.cra.tbfs.domain.record.TypedRecord;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Reads every record under a set of cluster roots and hands them to a {@link RecordSink}.
 * <p><strong>Role:</strong> Application-layer use case behind the {@code readtb} command.</p>
 * <p><strong>Thread-safety:</strong> Each {@link #run(List, long, RecordSink)} call owns its multiplexer; calls
 * may run concurrently.</p>
 * <p><strong>Observability:</strong> Logs the record count at INFO; per-source metrics come from the
 * multiplexer.</p>
 *
 * @since 0.1.0
 */
public final class DumpRecordsUseCase {
  private static final Logger log = LoggerFactory.getLogger(DumpRecordsUseCase.class);

  private final FileSystemQuery fileSystem;
  private final StreamingTool tool;
  private final RecordCodec codec;
  private final ReaderOptions options;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param fileSystem filesystem used to enumerate roots
   * @param tool dump command builder
   * @param codec record decoder factory
   * @param options reader options
   * @param metrics metrics sink
   */
  public DumpRecordsUseCase(
      FileSystemQuery fileSystem,
      StreamingTool tool,
      RecordCodec codec,
      ReaderOptions options,
      MetricsPort metrics) {
    this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
    this.tool = Objects.requireNonNull(tool, "tool");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.options = Objects.requireNonNull(options, "options");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Streams records to the sink until the data is exhausted or {@code limit} records were delivered.
   *
   * <p>Reaching the limit closes the reader early, terminating dump processes that are still running.</p>
   *
   * @param roots cluster roots to read
   * @param limit maximum number of records to deliver; {@code <= 0} means unlimited
   * @param sink receiver of records
   * @return number of records delivered
   * @throws IOException if enumeration, dumping, decoding or the sink fails
   */
  public long run(List<String> roots, long limit, RecordSink sink) throws IOException {
    Objects.requireNonNull(sink, "sink");
    long delivered = 0;
    MDC.put("operation", "readtb");
    try (RecordStreamMultiplexer reader =
        RecordStreamMultiplexer.open(roots, fileSystem, tool, codec, options, metrics)) {
      TypedRecord record;
      while ((limit <= 0 || delivered < limit) && (record = reader.next()) != null) {
        sink.accept(record);
        delivered++;
      }
      if (limit > 0 && delivered >= limit) {
        log.info("Stopped after {} record(s); {} file(s) left unread", delivered,
            reader.activeSourceCount() + reader.pendingSourceCount());
      } else {
        log.info("Read {} record(s) from {}", delivered, roots);
      }
      return delivered;
    } finally {
      MDC.remove("operation");
    }
  }
}
