package io.pandaproxy.application.port;

import java.time.Duration;

/**
 * Blocking delay used between upstream reconnect attempts.
 * <p>Only the supervisor thread ever sleeps; client sessions never call this.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Sleeper {
  /**
   * Blocks the calling thread for the given delay.
   *
   * @param delay delay to wait
   * @throws InterruptedException if the thread is interrupted while waiting
   */
  void sleep(Duration delay) throws InterruptedException;

  /** Sleeper backed by {@link Thread#sleep(long)}. */
  Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());
}
