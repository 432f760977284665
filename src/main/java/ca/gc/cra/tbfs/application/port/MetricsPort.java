package ca.gc.cra.tbfs.application.port;

/**
 * <strong>What:</strong> Port abstracting TBFS metrics emission.
 * <p><strong>Why:</strong> Lets the reader and writer record counters and occupancy samples without binding to
 * a vendor SDK.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent updates.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code read.sources.active}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram/gauge style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
