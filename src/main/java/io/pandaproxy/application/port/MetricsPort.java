package io.pandaproxy.application.port;

/**
 * <strong>What:</strong> Port abstracting proxy metrics emission.
 * <p><strong>Why:</strong> Lets the upstream, hub and client paths count frames, drops and reconnects
 * without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from the
 * upstream thread and every client thread.</p>
 * <p><strong>Performance:</strong> Calls sit on the per-frame path; they must not block.</p>
 *
 * @implNote Metric keys use dotted names such as {@code hub.frames.dropped}.
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
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (bytes, milliseconds, queue depth)
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates; useful for tests.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
