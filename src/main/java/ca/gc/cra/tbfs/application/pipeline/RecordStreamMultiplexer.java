package ca.gc.cra.tbfs.application.pipeline;

import ca.gc.cra.tbfs.application.port.FileSystemQuery;
import ca.gc.cra.tbfs.application.port.MetricsPort;
import ca.gc.cra.tbfs.application.port.RecordCodec;
import ca.gc.cra.tbfs.application.port.RecordCodec.RecordDecoder;
import ca.gc.cra.tbfs.application.port.StreamingTool;
import ca.gc.cra.tbfs.domain.fs.ClusterPaths;
import ca.gc.cra.tbfs.domain.fs.PathNotFoundException;
import ca.gc.cra.tbfs.domain.record.TypedRecord;
import ca.gc.cra.tbfs.infrastructure.exec.CommandHandle;
import ca.gc.cra.tbfs.infrastructure.exec.CommandResult;
import ca.gc.cra.tbfs.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.tbfs.infrastructure.exec.ExternalCommandException;
import ca.gc.cra.tbfs.infrastructure.exec.ProcessCommand;
import ca.gc.cra.tbfs.infrastructure.exec.StreamTarget;
import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads every file under a set of cluster roots through a bounded pool of dump processes
 * and merges their record streams into one lazily produced sequence.
 * <p><strong>Why:</strong> A dataset is a directory of part files; dumping them one by one serializes on process
 * start-up and cluster latency, while dumping all of them at once exhausts processes and file descriptors.</p>
 * <p><strong>Role:</strong> Application-layer reader driving {@link StreamingTool} dump commands through
 * {@link ProcessCommand} and decoding with {@link RecordCodec}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enumerate roots up front; a root that cannot be listed fails before any process starts.</li>
 *   <li>Keep {@code min(capacity, remaining files)} dump processes running until the data is exhausted.</li>
 *   <li>Forward each decoded record exactly once, preserving per-file order; files interleave freely.</li>
 *   <li>Release every process, pipe and pump thread on exhaustion, failure or {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by exactly one consuming thread. All scheduling
 * decisions (activation, retirement, hand-out order) happen on that thread. One daemon pump per active file
 * decodes a single record per demand and parks it on the readiness queue, so a file never runs more than one
 * record ahead of the consumer.</p>
 * <p><strong>Observability:</strong> Emits {@code read.sources.activated}, {@code read.sources.retired},
 * {@code read.sources.failed}, {@code read.records} and the {@code read.sources.active} occupancy sample.</p>
 *
 * <p>The sequence is single pass; reading the same roots again requires a new instance, which re-enumerates
 * and re-spawns.</p>
 *
 * @since 0.1.0
 */
public final class RecordStreamMultiplexer implements Closeable {
  private static final Logger log = LoggerFactory.getLogger(RecordStreamMultiplexer.class);

  private final StreamingTool tool;
  private final RecordCodec codec;
  private final MetricsPort metrics;
  private final ReaderOptions options;
  private final Deque<String> pending;
  private final Set<Source> active = new LinkedHashSet<>();
  private final BlockingQueue<Readiness> ready;
  private final ExecutorService pumps;
  private Source lastServiced;
  private boolean closed;

  private RecordStreamMultiplexer(
      Deque<String> pending,
      StreamingTool tool,
      RecordCodec codec,
      ReaderOptions options,
      MetricsPort metrics) {
    this.pending = pending;
    this.tool = tool;
    this.codec = codec;
    this.options = options;
    this.metrics = metrics;
    this.ready = new ArrayBlockingQueue<>(options.capacity());
    this.pumps = ExecutorFactories.newSourcePumpPool(
        options.capacity(),
        "tbfs-pump",
        (thread, ex) -> log.error("Record pump {} died unexpectedly", thread.getName(), ex));
  }

  /**
   * Enumerates the roots and starts up to {@link ReaderOptions#capacity()} dump processes.
   *
   * @param roots one or more cluster paths (files, directories or globs)
   * @param fileSystem filesystem used to list the roots
   * @param tool builder of dump commands
   * @param codec decoder factory for dump output
   * @param options reader options
   * @param metrics metrics sink
   * @return a running multiplexer; the caller must close it unless it is read to exhaustion
   * @throws PathNotFoundException if a root cannot be listed; no process has been started
   * @throws IOException if a dump process cannot be started
   */
  public static RecordStreamMultiplexer open(
      List<String> roots,
      FileSystemQuery fileSystem,
      StreamingTool tool,
      RecordCodec codec,
      ReaderOptions options,
      MetricsPort metrics) throws IOException {
    Objects.requireNonNull(roots, "roots");
    Objects.requireNonNull(fileSystem, "fileSystem");
    Objects.requireNonNull(tool, "tool");
    Objects.requireNonNull(codec, "codec");
    Objects.requireNonNull(options, "options");
    if (roots.isEmpty()) {
      throw new IllegalArgumentException("at least one root path is required");
    }
    Deque<String> pending = enumerate(roots, fileSystem, options.ignoreLogs());
    log.debug("Enumerated {} file(s) under {} root(s)", pending.size(), roots.size());
    RecordStreamMultiplexer multiplexer = new RecordStreamMultiplexer(
        pending, tool, codec, options, metrics == null ? MetricsPort.NO_OP : metrics);
    try {
      multiplexer.activate();
    } catch (IOException | RuntimeException ex) {
      multiplexer.close();
      throw ex;
    }
    return multiplexer;
  }

  /**
   * Returns the next record from whichever file is ready first.
   *
   * <p>Blocks until some active file has a record or reaches its end. Calling this method also signals that
   * the previously returned record has been consumed, allowing its file to decode the next one.</p>
   *
   * @return next record, or {@code null} when every file has been read
   * @throws ExternalCommandException if a dump process exits nonzero and
   *     {@link ReaderOptions#failOnAbnormalExit()} is set
   * @throws IOException if a record cannot be decoded or a replacement process cannot be started; the
   *     multiplexer is closed before the exception propagates
   */
  public TypedRecord next() throws IOException {
    if (closed) {
      throw new IllegalStateException("multiplexer is closed");
    }
    if (lastServiced != null) {
      lastServiced.demand.release();
      lastServiced = null;
    }
    try {
      while (!active.isEmpty()) {
        Readiness event = awaitReady();
        Source source = event.source();
        switch (event.kind()) {
          case RECORD -> {
            metrics.increment("read.records");
            lastServiced = source;
            return event.record();
          }
          case END_OF_STREAM -> {
            retire(source);
            activate();
          }
          case FAILURE -> {
            metrics.increment("read.sources.failed");
            log.debug("Decoding {} failed: {}", source.path, event.failure().getMessage());
            throw event.failure();
          }
          default -> throw new IllegalStateException("Unknown readiness kind " + event.kind());
        }
      }
      return null;
    } catch (IOException | RuntimeException ex) {
      close();
      throw ex;
    }
  }

  /**
   * Exposes the records as an iterator. I/O failures surface as {@link UncheckedIOException}.
   *
   * @return single-pass iterator backed by this multiplexer
   */
  public Iterator<TypedRecord> iterator() {
    return new Iterator<>() {
      private TypedRecord buffered;
      private boolean exhausted;

      @Override
      public boolean hasNext() {
        if (buffered != null) {
          return true;
        }
        if (exhausted) {
          return false;
        }
        try {
          buffered = RecordStreamMultiplexer.this.next();
        } catch (IOException ex) {
          throw new UncheckedIOException(ex);
        }
        exhausted = buffered == null;
        return !exhausted;
      }

      @Override
      public TypedRecord next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        TypedRecord record = buffered;
        buffered = null;
        return record;
      }
    };
  }

  /**
   * Exposes the records as a sequential stream; closing the stream closes this multiplexer.
   *
   * @return single-pass stream backed by this multiplexer
   */
  public Stream<TypedRecord> stream() {
    Spliterator<TypedRecord> spliterator = Spliterators.spliteratorUnknownSize(
        iterator(), Spliterator.ORDERED | Spliterator.NONNULL);
    return StreamSupport.stream(spliterator, false).onClose(this::close);
  }

  /**
   * Returns the number of files currently being dumped.
   *
   * @return active source count
   */
  public int activeSourceCount() {
    return active.size();
  }

  /**
   * Returns the number of enumerated files not yet started.
   *
   * @return pending path count
   */
  public int pendingSourceCount() {
    return pending.size();
  }

  /**
   * Terminates every remaining dump process, closes its pipe and stops the pump threads. Idempotent.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    lastServiced = null;
    List<Source> remaining = new ArrayList<>(active);
    active.clear();
    for (Source source : remaining) {
      source.cancelled = true;
    }
    pumps.shutdownNow();
    for (Source source : remaining) {
      release(source);
    }
    if (!remaining.isEmpty() || !pending.isEmpty()) {
      log.debug("Closed with {} active and {} pending file(s) abandoned", remaining.size(), pending.size());
    }
    pending.clear();
    ready.clear();
  }

  static Deque<String> enumerate(List<String> roots, FileSystemQuery fileSystem, boolean ignoreLogs)
      throws IOException {
    Deque<String> paths = new ArrayDeque<>();
    for (String root : roots) {
      List<String> entries;
      try {
        entries = fileSystem.list(root);
      } catch (InterruptedIOException ex) {
        throw ex;
      } catch (IOException ex) {
        throw new PathNotFoundException(root, ex);
      }
      for (String entry : entries) {
        if (ignoreLogs && ClusterPaths.isStatusEntry(entry)) {
          log.debug("Skipping status entry {}", entry);
          continue;
        }
        paths.addLast(entry);
      }
    }
    return paths;
  }

  private void activate() throws IOException {
    while (active.size() < options.capacity() && !pending.isEmpty()) {
      String path = pending.pollFirst();
      Source source = spawn(path);
      active.add(source);
      metrics.increment("read.sources.activated");
      metrics.observe("read.sources.active", active.size());
      log.debug("Activated {} (active={}, pending={})", path, active.size(), pending.size());
    }
    if (active.isEmpty() && pending.isEmpty()) {
      pumps.shutdown();
    }
  }

  private Source spawn(String path) throws IOException {
    CommandHandle handle = ProcessCommand.of(tool.dumpCommand(path))
        .stdout(StreamTarget.PIPE)
        .stderr(StreamTarget.CAPTURE)
        .javaMemoryMb(options.javaMemoryMb())
        .start();
    Source source = new Source(path, handle, codec.decoder(handle.stdout()));
    try {
      pumps.execute(() -> pump(source));
    } catch (RejectedExecutionException ex) {
      release(source);
      throw ex;
    }
    source.demand.release();
    return source;
  }

  private void retire(Source source) throws IOException {
    active.remove(source);
    CommandResult result;
    try {
      result = source.handle.waitFor();
    } finally {
      release(source);
    }
    metrics.increment("read.sources.retired");
    metrics.observe("read.sources.active", active.size());
    if (result.succeeded()) {
      log.debug("Retired {} (active={}, pending={})", source.path, active.size(), pending.size());
      return;
    }
    if (options.failOnAbnormalExit()) {
      metrics.increment("read.sources.failed");
      throw new ExternalCommandException(
          "Dump of '" + source.path + "' exited with " + result.exitCode()
              + " after end of data; output may be truncated",
          result.command(),
          result.exitCode(),
          result.stderr(),
          null);
    }
    log.warn("Dump of {} exited with {}; treating as end of data", source.path, result.exitCode());
  }

  private Readiness awaitReady() throws IOException {
    try {
      return ready.take();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      InterruptedIOException interrupted = new InterruptedIOException("Interrupted while waiting for records");
      interrupted.initCause(ex);
      throw interrupted;
    }
  }

  private void pump(Source source) {
    try {
      while (true) {
        source.demand.acquire();
        TypedRecord record = source.decoder.next();
        if (record == null) {
          ready.put(Readiness.endOfStream(source));
          return;
        }
        ready.put(Readiness.record(source, record));
      }
    } catch (InterruptedException ex) {
      // Only shutdownNow() interrupts pumps.
      Thread.currentThread().interrupt();
      log.debug("Pump for {} interrupted", source.path);
    } catch (IOException | RuntimeException ex) {
      fail(source, ex instanceof IOException io ? io : new IOException(ex.getMessage(), ex));
    } catch (StackOverflowError | OutOfMemoryError ex) {
      // Corrupt input can exhaust the decoder; the consumer still gets a failure event.
      fail(source, new IOException("Decoding " + source.path + " failed: " + ex, ex));
    }
  }

  private void fail(Source source, IOException failure) {
    if (source.cancelled) {
      log.debug("Pump for {} stopped during close: {}", source.path, failure.getMessage());
      return;
    }
    // Each source has at most one event in flight, so a capacity-sized queue always has room.
    if (!ready.offer(Readiness.failure(source, failure))) {
      log.error("Readiness queue full; dropping failure of {}", source.path, failure);
    }
  }

  private void release(Source source) {
    try {
      source.decoder.close();
    } catch (IOException ex) {
      log.debug("Closing decoder of {} failed: {}", source.path, ex.getMessage());
    }
    source.handle.close();
  }

  private static final class Source {
    private final String path;
    private final CommandHandle handle;
    private final RecordDecoder decoder;
    private final Semaphore demand = new Semaphore(0);
    private volatile boolean cancelled;

    private Source(String path, CommandHandle handle, RecordDecoder decoder) {
      this.path = path;
      this.handle = handle;
      this.decoder = decoder;
    }
  }

  private enum Kind {
    RECORD,
    END_OF_STREAM,
    FAILURE
  }

  private record Readiness(Kind kind, Source source, TypedRecord record, IOException failure) {
    static Readiness record(Source source, TypedRecord record) {
      return new Readiness(Kind.RECORD, source, record, null);
    }

    static Readiness endOfStream(Source source) {
      return new Readiness(Kind.END_OF_STREAM, source, null, null);
    }

    static Readiness failure(Source source, IOException failure) {
      return new Readiness(Kind.FAILURE, source, null, failure);
    }
  }
}
