package ca.gc.cra.tbfs.application.pipeline;

import ca.gc.cra.tbfs.infrastructure.exec.ProcessCommand;
import ca.gc.cra.tbfs.validation.Numbers;

/**
 * Tuning knobs of {@link RecordStreamMultiplexer}.
 *
 * @param capacity maximum number of concurrently running dump processes
 * @param ignoreLogs whether entries whose basename starts with {@code '_'} are skipped
 * @param javaMemoryMb heap ceiling exported to each dump process
 * @param failOnAbnormalExit whether a dump process exiting nonzero aborts the merge instead of being treated as
 *     a normal end of data
 * @since 0.1.0
 */
public record ReaderOptions(int capacity, boolean ignoreLogs, int javaMemoryMb, boolean failOnAbnormalExit) {
  /** Default number of concurrent dump processes. */
  public static final int DEFAULT_CAPACITY = 10;
  /** Upper bound on concurrent dump processes. */
  public static final int MAX_CAPACITY = 1_024;

  /**
   * Validates option ranges.
   *
   * @throws IllegalArgumentException if capacity or memory are out of range
   */
  public ReaderOptions {
    Numbers.requireRange("readers", capacity, 1, MAX_CAPACITY);
    Numbers.requireRange("javaMemoryMb", javaMemoryMb, 1, 65_536);
  }

  /**
   * Returns the default options: ten readers, status entries skipped, 100 MiB heap, abnormal exits fatal.
   *
   * @return default options
   */
  public static ReaderOptions defaults() {
    return new ReaderOptions(DEFAULT_CAPACITY, true, ProcessCommand.DEFAULT_JAVA_MEMORY_MB, true);
  }

  /**
   * Returns a copy with a different capacity.
   *
   * @param readers new capacity
   * @return updated options
   */
  public ReaderOptions withCapacity(int readers) {
    return new ReaderOptions(readers, ignoreLogs, javaMemoryMb, failOnAbnormalExit);
  }

  /**
   * Returns a copy with log filtering switched.
   *
   * @param ignore whether to skip status entries
   * @return updated options
   */
  public ReaderOptions withIgnoreLogs(boolean ignore) {
    return new ReaderOptions(capacity, ignore, javaMemoryMb, failOnAbnormalExit);
  }

  /**
   * Returns a copy with abnormal-exit handling switched.
   *
   * @param fail whether nonzero dump exits abort the merge
   * @return updated options
   */
  public ReaderOptions withFailOnAbnormalExit(boolean fail) {
    return new ReaderOptions(capacity, ignoreLogs, javaMemoryMb, fail);
  }
}
