package io.pandaproxy.application.hub;

import io.pandaproxy.application.port.ClientSink;
import io.pandaproxy.application.port.MetricsPort;
import io.pandaproxy.domain.chamber.Frame;
import io.pandaproxy.validation.Numbers;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded per-client frame queue that drops the oldest frame when the client falls behind.
 * <p>The hub's publisher thread only ever calls {@link #offer(Frame)}, which never blocks; the
 * owning client session drains with {@link #take(long, TimeUnit)}.</p>
 *
 * @since 0.1.0
 */
public final class ClientOutbox implements ClientSink {
  /** Default number of frames buffered per client. */
  public static final int DEFAULT_CAPACITY = 8;

  private final int capacity;
  private final MetricsPort metrics;
  private final ArrayDeque<Frame> frames;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private long dropped;
  private boolean closed;

  public ClientOutbox(int capacity, MetricsPort metrics) {
    Numbers.requireRange("capacity", capacity, 1, 1_024);
    this.capacity = capacity;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.frames = new ArrayDeque<>(capacity);
  }

  @Override
  public boolean offer(Frame frame) {
    Objects.requireNonNull(frame, "frame");
    lock.lock();
    try {
      if (closed) {
        return false;
      }
      if (frames.size() == capacity) {
        frames.pollFirst();
        dropped++;
        metrics.increment("hub.frames.dropped");
      }
      frames.addLast(frame);
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits for the next frame.
   *
   * @param timeout maximum wait
   * @param unit unit of {@code timeout}
   * @return next frame, or {@code null} on timeout or once closed and drained
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public Frame take(long timeout, TimeUnit unit) throws InterruptedException {
    long remaining = unit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (frames.isEmpty()) {
        if (closed || remaining <= 0L) {
          return null;
        }
        remaining = notEmpty.awaitNanos(remaining);
      }
      return frames.pollFirst();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    lock.lock();
    try {
      closed = true;
      frames.clear();
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  /** @return number of frames discarded because the client was too slow */
  public long droppedFrames() {
    lock.lock();
    try {
      return dropped;
    } finally {
      lock.unlock();
    }
  }

  /** @return frames currently waiting to be written */
  public int queued() {
    lock.lock();
    try {
      return frames.size();
    } finally {
      lock.unlock();
    }
  }
}
