package ca.gc.cra.harvest.application.port;

/**
 * <strong>What:</strong> Port abstracting fetch metrics emission.
 * <p><strong>Why:</strong> Lets the scheduler count unit launches, failures and latencies without binding to
 * a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from fetch unit
 * threads.</p>
 * <p><strong>Observability:</strong> Metric names use dotted form, for example {@code fetch.unit.latencyNanos}.</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier such as {@code fetch.unit.failed}; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier; must not be {@code null}
   * @param value observed value (nanoseconds, counts); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
