package io.pandaproxy.application.upstream;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential reconnect delay with bounded positive jitter.
 * <p>Each call to {@link #nextDelay()} returns the current base plus up to 10% jitter, capped at
 * the maximum, then doubles the base. Delays never decrease between resets.</p>
 * <p>Not thread-safe; owned by the supervisor thread.</p>
 *
 * @since 0.1.0
 */
public final class BackoffPolicy {
  static final double JITTER_FRACTION = 0.10d;

  private final long minMillis;
  private final long maxMillis;
  private final DoubleSupplier random;
  private long baseMillis;
  private long lastMillis;

  /**
   * @param min first delay after a reset; must be positive
   * @param max upper bound for every delay; must be at least {@code min}
   */
  public BackoffPolicy(Duration min, Duration max) {
    this(min, max, () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * @param min first delay after a reset
   * @param max upper bound for every delay
   * @param random source of uniform values in {@code [0, 1)} used for jitter
   */
  public BackoffPolicy(Duration min, Duration max, DoubleSupplier random) {
    Objects.requireNonNull(min, "min");
    Objects.requireNonNull(max, "max");
    this.random = Objects.requireNonNull(random, "random");
    if (min.isNegative() || min.isZero()) {
      throw new IllegalArgumentException("backoff minimum must be positive");
    }
    if (max.compareTo(min) < 0) {
      throw new IllegalArgumentException("backoff maximum must be >= minimum");
    }
    this.minMillis = min.toMillis();
    this.maxMillis = max.toMillis();
    reset();
  }

  /** @return delay to wait before the next attempt */
  public Duration nextDelay() {
    double fraction = Math.min(Math.max(random.getAsDouble(), 0d), 1d);
    long jitter = (long) (baseMillis * JITTER_FRACTION * fraction);
    long delay = Math.min(maxMillis, baseMillis + jitter);
    delay = Math.max(delay, lastMillis);
    lastMillis = delay;
    baseMillis = Math.min(maxMillis, baseMillis * 2);
    return Duration.ofMillis(delay);
  }

  /** Returns to the minimum delay; called whenever the upstream reaches streaming. */
  public void reset() {
    baseMillis = minMillis;
    lastMillis = 0L;
  }

  public Duration min() {
    return Duration.ofMillis(minMillis);
  }

  public Duration max() {
    return Duration.ofMillis(maxMillis);
  }
}
