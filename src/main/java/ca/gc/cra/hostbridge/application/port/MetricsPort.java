package ca.gc.cra.hostbridge.application.port;

/**
 * <strong>What:</strong> Port abstracting bridge metrics emission.
 * <p><strong>Why:</strong> Lets the dispatcher, executor and sessions record counters and latencies without binding
 * to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter} and {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from every session thread and
 * the host loop.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g. {@code bridge.command.latencyNanos}).</p>
 *
 * @implNote Callers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier such as {@code bridge.command.succeeded}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier
   * @param value observed value, e.g. nanoseconds
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
