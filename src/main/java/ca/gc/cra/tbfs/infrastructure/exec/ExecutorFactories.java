package ca.gc.cra.tbfs.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executors that feed subprocess pipes.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor hosting one pump task per active record source.
   *
   * <p>Tasks beyond {@code size} queue until a pump finishes; a retiring source's thread may still be
   * unwinding when its replacement is submitted.</p>
   *
   * @param size maximum number of concurrently running pumps
   * @param prefix thread-name prefix used to tag pump threads
   * @param handler uncaught exception handler installed on each thread
   * @return configured executor service
   */
  public static ExecutorService newSourcePumpPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    ThreadFactory factory = daemonThreadFactory(
        (prefix == null || prefix.isBlank()) ? "tbfs-pump" : prefix, handler);
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds an unbounded cached executor used to drain captured process output.
   *
   * @param prefix thread-name prefix
   * @return executor whose idle threads expire after 30 seconds
   */
  public static ExecutorService newDrainPool(String prefix) {
    ThreadFactory factory = daemonThreadFactory(
        (prefix == null || prefix.isBlank()) ? "tbfs-drain" : prefix, null);
    return new ThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        30L,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        factory);
  }

  private static ThreadFactory daemonThreadFactory(String prefix, UncaughtExceptionHandler handler) {
    Objects.requireNonNull(prefix, "prefix");
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      if (handler != null) {
        thread.setUncaughtExceptionHandler(handler);
      }
      return thread;
    };
  }
}
