package io.pandaproxy.application.port;

import io.pandaproxy.domain.chamber.Frame;

/**
 * Outbound side of one downstream client as seen by the fan-out hub.
 *
 * @since 0.1.0
 */
public interface ClientSink {
  /**
   * Hands a frame to the client without blocking.
   *
   * @param frame shared, read-only frame
   * @return {@code false} once the sink is closed and will never accept frames again
   */
  boolean offer(Frame frame);

  /** Closes the sink and wakes its consumer. Idempotent. */
  void close();
}
