package io.pandaproxy.application.port;

import io.pandaproxy.domain.chamber.Frame;

/**
 * Destination for frames decoded from the printer, in arrival order.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface FrameSink {
  /**
   * Accepts the next frame. Must return promptly; the upstream read loop waits on it.
   *
   * @param frame decoded frame
   */
  void publish(Frame frame);
}
