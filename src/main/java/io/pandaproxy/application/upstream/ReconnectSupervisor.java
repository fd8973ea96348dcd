package io.pandaproxy.application.upstream;

import io.pandaproxy.application.port.ClockPort;
import io.pandaproxy.application.port.FrameSink;
import io.pandaproxy.application.port.MetricsPort;
import io.pandaproxy.application.port.ProxyEventEmitter;
import io.pandaproxy.application.port.Sleeper;
import io.pandaproxy.domain.chamber.AuthRejectedException;
import io.pandaproxy.domain.chamber.FramingException;
import io.pandaproxy.domain.chamber.HandshakeException;
import io.pandaproxy.domain.chamber.IdleTimeoutException;
import io.pandaproxy.domain.events.ProxyEvent;
import io.pandaproxy.domain.events.ProxyEventType;
import io.pandaproxy.domain.upstream.UpstreamState;
import io.pandaproxy.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Keeps exactly one upstream session alive for the life of the process.
 * <p><strong>Why:</strong> The printer goes away on reboots, Wi-Fi drops, and access-code changes;
 * clients should see a gap in frames, never a dead proxy.</p>
 * <p><strong>State machine:</strong> {@code DISCONNECTED -> CONNECTING -> AUTHENTICATING ->
 * STREAMING}; any failure moves to {@code BACKOFF}, which returns to {@code CONNECTING} once the
 * {@link BackoffPolicy} delay elapses. There is no terminal state besides {@link #stop()}.</p>
 * <p><strong>Thread-safety:</strong> The loop runs on one dedicated thread named
 * {@code chamber-upstream}. {@link #state()}, {@link #awaitState} and {@link #stop()} are safe from
 * any thread.</p>
 * <p><strong>Observability:</strong> Emits {@code upstream.state} events on every transition and
 * {@code upstream.auth.rejected} on credential refusal; counts {@code upstream.connect.attempts},
 * {@code upstream.failures.<kind>} and records {@code upstream.backoff.millis}.</p>
 *
 * @since 0.1.0
 */
public final class ReconnectSupervisor {
  private static final Logger log = LoggerFactory.getLogger(ReconnectSupervisor.class);
  static final String THREAD_NAME = "chamber-upstream";
  private static final Duration STOP_JOIN_TIMEOUT = Duration.ofSeconds(5);

  private final Supplier<UpstreamSession> sessions;
  private final FrameSink sink;
  private final BackoffPolicy backoff;
  private final Sleeper sleeper;
  private final ProxyEventEmitter events;
  private final ClockPort clock;
  private final MetricsPort metrics;

  private final ReentrantLock stateLock = new ReentrantLock();
  private final Condition stateChanged = stateLock.newCondition();
  private UpstreamState state = UpstreamState.DISCONNECTED;

  private volatile boolean running;
  private volatile UpstreamSession active;
  private volatile Thread worker;

  public ReconnectSupervisor(
      Supplier<UpstreamSession> sessions,
      FrameSink sink,
      BackoffPolicy backoff,
      Sleeper sleeper,
      ProxyEventEmitter events,
      ClockPort clock,
      MetricsPort metrics) {
    this.sessions = Objects.requireNonNull(sessions, "sessions");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.events = Objects.requireNonNull(events, "events");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Starts the supervisor thread. May be called once.
   */
  public synchronized void start() {
    if (worker != null) {
      throw new IllegalStateException("supervisor already started");
    }
    running = true;
    Thread thread = ExecutorFactories.newPlatformThread(THREAD_NAME, this::runLoop);
    worker = thread;
    thread.start();
  }

  /**
   * Ends the loop, force-closes the active session and waits briefly for the thread to exit.
   */
  public void stop() {
    running = false;
    UpstreamSession session = active;
    if (session != null) {
      session.close();
    }
    Thread thread = worker;
    if (thread == null || thread == Thread.currentThread()) {
      return;
    }
    thread.interrupt();
    try {
      thread.join(STOP_JOIN_TIMEOUT.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    if (thread.isAlive()) {
      log.warn("Upstream supervisor did not stop within {} ms", STOP_JOIN_TIMEOUT.toMillis());
    }
  }

  public UpstreamState state() {
    stateLock.lock();
    try {
      return state;
    } finally {
      stateLock.unlock();
    }
  }

  /**
   * Blocks until the supervisor reaches {@code expected}.
   *
   * @param expected state to wait for
   * @param timeout maximum wait
   * @return {@code true} if the state was reached in time
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitState(UpstreamState expected, Duration timeout) throws InterruptedException {
    long remaining = timeout.toNanos();
    stateLock.lock();
    try {
      while (state != expected) {
        if (remaining <= 0L) {
          return false;
        }
        remaining = stateChanged.awaitNanos(remaining);
      }
      return true;
    } finally {
      stateLock.unlock();
    }
  }

  void runLoop() {
    log.info("Upstream supervisor started");
    try {
      while (running) {
        attempt();
        if (!running) {
          break;
        }
        transition(UpstreamState.BACKOFF);
        Duration delay = backoff.nextDelay();
        metrics.observe("upstream.backoff.millis", delay.toMillis());
        log.info("Reconnecting to printer in {} ms", delay.toMillis());
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          break;
        }
      }
    } finally {
      running = false;
      transition(UpstreamState.DISCONNECTED);
      log.info("Upstream supervisor stopped");
    }
  }

  private void attempt() {
    transition(UpstreamState.CONNECTING);
    metrics.increment("upstream.connect.attempts");
    UpstreamSession session = null;
    try {
      session = sessions.get();
      active = session;
      if (!running) {
        return;
      }
      session.open();
      transition(UpstreamState.AUTHENTICATING);
      session.authenticate();
      transition(UpstreamState.STREAMING);
      backoff.reset();
      session.stream(sink);
    } catch (AuthRejectedException ex) {
      fail("auth", ex);
      log.warn("Printer rejected the access code ({}); check the access code shown on the printer "
          + "screen and that LAN mode is enabled", ex.getMessage());
      events.emit(ProxyEvent.of(clock.now(), ProxyEventType.UPSTREAM_AUTH_REJECTED,
          "reason", ex.getMessage()));
    } catch (HandshakeException ex) {
      fail("handshake", ex);
      log.warn("Could not reach printer: {}", describe(ex));
    } catch (FramingException ex) {
      fail("framing", ex);
      log.warn("Upstream stream corrupt: {}", ex.getMessage());
      events.emit(ProxyEvent.of(clock.now(), ProxyEventType.UPSTREAM_DECODE_FAILURE,
          "reason", ex.getMessage()));
    } catch (IdleTimeoutException ex) {
      fail("idle", ex);
      log.warn("Upstream idle: {}", ex.getMessage());
    } catch (IOException ex) {
      fail("io", ex);
      log.warn("Upstream connection lost: {}", describe(ex));
    } catch (RuntimeException ex) {
      fail("unexpected", ex);
      log.error("Unexpected failure in upstream session; reconnecting", ex);
    } finally {
      if (session != null) {
        session.close();
      }
      active = null;
    }
  }

  private void fail(String kind, Exception ex) {
    metrics.increment("upstream.failures." + kind);
    log.debug("Upstream attempt failed ({})", kind, ex);
  }

  private void transition(UpstreamState next) {
    UpstreamState previous;
    stateLock.lock();
    try {
      previous = state;
      if (previous == next) {
        return;
      }
      state = next;
      stateChanged.signalAll();
    } finally {
      stateLock.unlock();
    }
    log.debug("Upstream {} -> {}", previous, next);
    if (next == UpstreamState.STREAMING) {
      log.info("Streaming frames from printer");
    }
    events.emit(ProxyEvent.of(clock.now(), ProxyEventType.UPSTREAM_STATE,
        "from", previous, "to", next));
  }

  private static String describe(Throwable ex) {
    Throwable cause = ex.getCause();
    return cause == null || cause.getMessage() == null
        ? ex.getMessage()
        : ex.getMessage() + ": " + cause.getMessage();
  }
}
