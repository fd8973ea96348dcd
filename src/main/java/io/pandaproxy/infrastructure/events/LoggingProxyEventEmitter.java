package io.pandaproxy.infrastructure.events;

import io.pandaproxy.application.port.MetricsPort;
import io.pandaproxy.application.port.ProxyEventEmitter;
import io.pandaproxy.domain.events.ProxyEvent;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each lifecycle event as one structured log line and counts it.
 * <p>Line shape: {@code proxy.event type=<key> timestamp=<instant> k1=v1 k2=v2}. Counters are named
 * {@code <prefix>.<type key>}.</p>
 */
public final class LoggingProxyEventEmitter implements ProxyEventEmitter {
  private static final Logger log = LoggerFactory.getLogger(LoggingProxyEventEmitter.class);
  static final String DEFAULT_PREFIX = "events";

  private final MetricsPort metrics;
  private final String metricPrefix;

  /**
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param metricPrefix prefix for event counters; {@code events} when blank
   */
  public LoggingProxyEventEmitter(MetricsPort metrics, String metricPrefix) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix =
        metricPrefix == null || metricPrefix.isBlank() ? DEFAULT_PREFIX : metricPrefix.trim();
  }

  public LoggingProxyEventEmitter(MetricsPort metrics) {
    this(metrics, DEFAULT_PREFIX);
  }

  @Override
  public void emit(ProxyEvent event) {
    Objects.requireNonNull(event, "event");
    metrics.increment(metricPrefix + '.' + event.type().key());

    StringJoiner joiner = new StringJoiner(" ");
    joiner.add("type=" + event.type().key());
    joiner.add("timestamp=" + event.timestamp());
    for (Map.Entry<String, String> entry : event.attributes().entrySet()) {
      joiner.add(entry.getKey() + '=' + entry.getValue());
    }

    switch (event.type()) {
      case UPSTREAM_AUTH_REJECTED, UPSTREAM_DECODE_FAILURE, CLIENT_REJECTED ->
          log.warn("proxy.event {}", joiner);
      case CLIENT_CONNECTED, CLIENT_DISCONNECTED -> log.debug("proxy.event {}", joiner);
      default -> log.info("proxy.event {}", joiner);
    }
  }
}
