package io.pandaproxy.application.port;

import io.pandaproxy.domain.events.ProxyEvent;

/**
 * Port receiving structured lifecycle events (upstream state changes, client connects and
 * disconnects, decode failures).
 * <p>Implementations must be thread-safe and must not block the caller.</p>
 *
 * @since 0.1.0
 */
public interface ProxyEventEmitter {
  /**
   * Emits an event.
   *
   * @param event event to emit; must not be {@code null}
   */
  void emit(ProxyEvent event);

  /** Emitter discarding every event. */
  ProxyEventEmitter NO_OP = event -> {};
}
