package io.pandaproxy.application.port;

import java.time.Instant;

/**
 * Port supplying wall-clock timestamps for lifecycle events.
 * <p>Implementations must be thread-safe. Tests inject fixed clocks for deterministic event output.</p>
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** @return the current time as an {@link Instant} */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Default clock backed by {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
