package ca.gc.cra.tbfs.application.pipeline;

import ca.gc.cra.tbfs.application.port.MetricsPort;
import ca.gc.cra.tbfs.application.port.RecordCodec;
import ca.gc.cra.tbfs.application.port.RecordCodec.RecordEncoder;
import ca.gc.cra.tbfs.application.port.StreamingTool;
import ca.gc.cra.tbfs.domain.record.TypedRecord;
import ca.gc.cra.tbfs.infrastructure.exec.CommandHandle;
import ca.gc.cra.tbfs.infrastructure.exec.CommandResult;
import ca.gc.cra.tbfs.infrastructure.exec.ExternalCommandException;
import ca.gc.cra.tbfs.infrastructure.exec.ProcessCommand;
import ca.gc.cra.tbfs.infrastructure.exec.StreamTarget;
import ca.gc.cra.tbfs.infrastructure.hadoop.HadoopStderr;
import ca.gc.cra.tbfs.logging.Logs;
import java.io.IOException;
import java.util.Iterator;
import java.util.Objects;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Streams records into a cluster file through one load process.
 * <p><strong>Role:</strong> Application-layer writer; the counterpart of {@link RecordStreamMultiplexer}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Encode records one at a time into the loader's stdin; the input is never collected.</li>
 *   <li>Stop as soon as the loader is seen to have exited, reporting its captured output.</li>
 *   <li>Turn broken pipes and nonzero exits into {@link ExternalCommandException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Instances are stateless and may be shared; each {@code write} call owns
 * its loader process.</p>
 * <p><strong>Observability:</strong> Emits {@code write.records} per record sent and {@code write.loader.failed}
 * when the loader fails.</p>
 *
 * @since 0.1.0
 */
public final class RecordWriter {
  private static final Logger log = LoggerFactory.getLogger(RecordWriter.class);
  private static final int MAX_REPORTED_BYTES = 2_048;

  private final StreamingTool tool;
  private final RecordCodec codec;
  private final int javaMemoryMb;
  private final MetricsPort metrics;

  /**
   * Creates a writer.
   *
   * @param tool builder of load commands
   * @param codec encoder factory for the loader's input
   * @param javaMemoryMb heap ceiling exported to the loader
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public RecordWriter(StreamingTool tool, RecordCodec codec, int javaMemoryMb, MetricsPort metrics) {
    this.tool = Objects.requireNonNull(tool, "tool");
    this.codec = Objects.requireNonNull(codec, "codec");
    if (javaMemoryMb <= 0) {
      throw new IllegalArgumentException("javaMemoryMb must be positive");
    }
    this.javaMemoryMb = javaMemoryMb;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Writes a sequence of records to {@code destination}.
   *
   * @param destination cluster path of the file to create
   * @param records records to send, consumed lazily
   * @return number of records sent
   * @throws ExternalCommandException if the loader exits before all records are sent, breaks the pipe, or
   *     exits nonzero
   * @throws IOException if the loader cannot be started
   */
  public long write(String destination, Iterable<? extends TypedRecord> records) throws IOException {
    Objects.requireNonNull(records, "records");
    return write(destination, records.iterator());
  }

  /**
   * Iterator variant of {@link #write(String, Iterable)}.
   *
   * @param destination cluster path of the file to create
   * @param records records to send
   * @return number of records sent
   * @throws IOException if the loader fails or cannot be started
   */
  public long write(String destination, Iterator<? extends TypedRecord> records) throws IOException {
    Objects.requireNonNull(records, "records");
    ProcessCommand command = ProcessCommand.of(tool.loadCommand(destination))
        .stdin(StreamTarget.PIPE)
        .stdout(StreamTarget.CAPTURE)
        .stderr(StreamTarget.CAPTURE)
        .javaMemoryMb(javaMemoryMb);
    long sent = 0;
    try (CommandHandle loader = command.start()) {
      RecordEncoder encoder = codec.encoder(loader.stdin());
      try {
        while (records.hasNext()) {
          TypedRecord record = records.next();
          OptionalInt exited = loader.poll();
          if (exited.isPresent()) {
            throw loaderFailure(loader, "quit while records were still being sent", sent, null);
          }
          encoder.write(record);
          sent++;
          metrics.increment("write.records");
        }
        encoder.close();
      } catch (ExternalCommandException ex) {
        throw ex;
      } catch (IOException ex) {
        throw loaderFailure(loader, "stopped accepting input (" + ex.getMessage() + ")", sent, ex);
      }
      CommandResult result = loader.waitFor();
      if (!result.succeeded()) {
        throw loaderFailure(loader, "failed after all records were sent", sent, null);
      }
      log.debug("Wrote {} record(s) to {}", sent, destination);
      return sent;
    }
  }

  private ExternalCommandException loaderFailure(
      CommandHandle loader, String what, long sent, IOException cause) throws IOException {
    metrics.increment("write.loader.failed");
    CommandResult result = loader.waitFor();
    String message = "Loader [" + result.command() + "] " + what
        + " after " + sent + " record(s): exit=" + result.exitCode()
        + " stdout=" + Logs.truncate(result.stdout().strip(), MAX_REPORTED_BYTES)
        + " stderr=" + Logs.truncate(HadoopStderr.clean(result.stderr()).strip(), MAX_REPORTED_BYTES);
    log.warn("{}", message);
    return new ExternalCommandException(message, result.command(), result.exitCode(), result.stderr(), cause);
  }
}
