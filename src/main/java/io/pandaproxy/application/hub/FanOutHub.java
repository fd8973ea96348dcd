package io.pandaproxy.application.hub;

import io.pandaproxy.application.port.ClientSink;
import io.pandaproxy.application.port.FrameSink;
import io.pandaproxy.application.port.MetricsPort;
import io.pandaproxy.domain.chamber.Frame;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Broadcasts each frame from the printer to every authenticated client.
 * <p><strong>Why:</strong> The printer serves a handful of viewers at most; the hub turns its one
 * stream into as many as needed.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Own the client set; only {@link #register} and {@link #deregister} mutate it.</li>
 *   <li>Deliver each frame to all live sinks in arrival order without ever blocking on a sink.</li>
 *   <li>Start late joiners at the next published frame; no backlog is kept.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> A single lock serializes mutations with publish iteration.
 * Sinks only perform non-blocking offers, so holding the lock while iterating is bounded.</p>
 * <p><strong>Observability:</strong> {@code hub.frames.published}, {@code hub.clients}.</p>
 *
 * @since 0.1.0
 */
public final class FanOutHub implements FrameSink {
  private static final Logger log = LoggerFactory.getLogger(FanOutHub.class);

  private final MetricsPort metrics;
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<ClientId, Registration> clients = new LinkedHashMap<>();
  private final AtomicLong nextId = new AtomicLong(1);

  public FanOutHub(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public FanOutHub() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Adds an authenticated client. It receives frames published after this call returns.
   *
   * @param sink client's outbound sink
   * @return identifier to pass to {@link #deregister(ClientId)}
   */
  public ClientId register(ClientSink sink) {
    Objects.requireNonNull(sink, "sink");
    ClientId id = new ClientId(nextId.getAndIncrement());
    int size;
    lock.lock();
    try {
      clients.put(id, new Registration(sink));
      size = clients.size();
    } finally {
      lock.unlock();
    }
    metrics.observe("hub.clients", size);
    log.debug("Registered {} ({} active)", id, size);
    return id;
  }

  /**
   * Removes a client. Safe to call repeatedly and after the client's connection already failed.
   *
   * @param id identifier returned by {@link #register(ClientSink)}
   * @return {@code true} if this call removed the registration
   */
  public boolean deregister(ClientId id) {
    if (id == null) {
      return false;
    }
    Registration removed;
    int size;
    lock.lock();
    try {
      removed = clients.remove(id);
      size = clients.size();
    } finally {
      lock.unlock();
    }
    if (removed == null) {
      return false;
    }
    removed.sink.close();
    metrics.observe("hub.clients", size);
    log.debug("Deregistered {} ({} active)", id, size);
    return true;
  }

  @Override
  public void publish(Frame frame) {
    Objects.requireNonNull(frame, "frame");
    lock.lock();
    try {
      Iterator<Registration> it = clients.values().iterator();
      while (it.hasNext()) {
        Registration registration = it.next();
        if (!registration.live) {
          continue;
        }
        if (!registration.sink.offer(frame)) {
          // sink closed underneath us; keep the entry until its owner deregisters
          registration.live = false;
        }
      }
    } finally {
      lock.unlock();
    }
    metrics.increment("hub.frames.published");
  }

  /** @return number of registered clients, live or not yet deregistered */
  public int clientCount() {
    lock.lock();
    try {
      return clients.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes every sink and empties the client set. Used on shutdown.
   */
  public void closeAll() {
    List<Registration> snapshot;
    lock.lock();
    try {
      snapshot = new ArrayList<>(clients.values());
      clients.clear();
    } finally {
      lock.unlock();
    }
    for (Registration registration : snapshot) {
      registration.sink.close();
    }
    metrics.observe("hub.clients", 0);
  }

  private static final class Registration {
    private final ClientSink sink;
    private boolean live = true;

    private Registration(ClientSink sink) {
      this.sink = sink;
    }
  }
}
