package io.pandaproxy.application.pipeline;

import io.pandaproxy.application.client.ClientSession;
import io.pandaproxy.application.hub.FanOutHub;
import io.pandaproxy.application.port.ClockPort;
import io.pandaproxy.application.port.ListenerFactory;
import io.pandaproxy.application.port.MetricsPort;
import io.pandaproxy.application.port.ProxyEventEmitter;
import io.pandaproxy.application.upstream.ReconnectSupervisor;
import io.pandaproxy.domain.chamber.AccessCredential;
import io.pandaproxy.domain.upstream.UpstreamState;
import io.pandaproxy.infrastructure.exec.ExecutorFactories;
import io.pandaproxy.logging.Logs;
import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the chamber image proxy: one upstream supervisor feeding a hub, and a listener that turns
 * each accepted connection into a {@link ClientSession}.
 * <p>{@link #start()} returns once the listener is bound; {@link #run()} additionally blocks until
 * {@link #close()} is called, typically from the CLI's shutdown hook. Instances are single-use.</p>
 * <p>Each client session runs on its own platform thread named {@code chamber-client-N}; the pool
 * grows with the number of connections and has no upper bound. The accept loop owns
 * {@code chamber-accept}.</p>
 *
 * @since 0.1.0
 */
public final class ChamberProxyUseCase implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ChamberProxyUseCase.class);
  private static final Duration CLIENT_POOL_SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);

  private final ListenerFactory listenerFactory;
  private final String bindHost;
  private final int proxyPort;
  private final AccessCredential credential;
  private final FanOutHub hub;
  private final ReconnectSupervisor supervisor;
  private final ClientSession.Settings clientSettings;
  private final ProxyEventEmitter events;
  private final ClockPort clock;
  private final MetricsPort metrics;

  private final Set<ClientSession> sessions = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final CountDownLatch terminated = new CountDownLatch(1);

  private volatile ServerSocket listener;
  private volatile ExecutorService clientPool;
  private volatile Thread acceptThread;

  public ChamberProxyUseCase(
      ListenerFactory listenerFactory,
      String bindHost,
      int proxyPort,
      AccessCredential credential,
      FanOutHub hub,
      ReconnectSupervisor supervisor,
      ClientSession.Settings clientSettings,
      ProxyEventEmitter events,
      ClockPort clock,
      MetricsPort metrics) {
    this.listenerFactory = Objects.requireNonNull(listenerFactory, "listenerFactory");
    this.bindHost = Objects.requireNonNull(bindHost, "bindHost");
    this.proxyPort = proxyPort;
    this.credential = Objects.requireNonNull(credential, "credential");
    this.hub = Objects.requireNonNull(hub, "hub");
    this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
    this.clientSettings = Objects.requireNonNull(clientSettings, "clientSettings");
    this.events = Objects.requireNonNull(events, "events");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Binds the listener and starts the upstream supervisor and accept loop.
   *
   * @throws IOException if the listener cannot be bound
   */
  public void start() throws IOException {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("proxy already started");
    }
    ServerSocket server = listenerFactory.bind(bindHost, proxyPort);
    listener = server;
    clientPool = ExecutorFactories.newUnboundedConnectionPool("chamber-client", null);
    supervisor.start();
    Thread thread = ExecutorFactories.newPlatformThread("chamber-accept", this::acceptLoop);
    acceptThread = thread;
    thread.start();
    log.info("Chamber image proxy listening on {}:{}", bindHost, server.getLocalPort());
  }

  /**
   * Starts the proxy and blocks until {@link #close()} completes.
   *
   * @throws IOException if the listener cannot be bound
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public void run() throws IOException, InterruptedException {
    start();
    terminated.await();
  }

  /** @return locally bound listener port, useful when configured with port 0 */
  public int boundPort() {
    ServerSocket server = listener;
    if (server == null) {
      throw new IllegalStateException("proxy not started");
    }
    return server.getLocalPort();
  }

  public UpstreamState upstreamState() {
    return supervisor.state();
  }

  public int clientCount() {
    return hub.clientCount();
  }

  /**
   * Stops accepting, stops the upstream, and force-closes every client. Idempotent.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    log.info("Shutting down chamber image proxy");
    ServerSocket server = listener;
    if (server != null) {
      try {
        server.close();
      } catch (IOException ex) {
        log.debug("Ignoring failure while closing listener", ex);
      }
    }
    supervisor.stop();
    for (ClientSession session : sessions) {
      session.close();
    }
    hub.closeAll();
    ExecutorService pool = clientPool;
    if (pool != null) {
      pool.shutdownNow();
      try {
        if (!pool.awaitTermination(CLIENT_POOL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("Client workers still active after {} ms", CLIENT_POOL_SHUTDOWN_TIMEOUT.toMillis());
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }
    Thread thread = acceptThread;
    if (thread != null && thread != Thread.currentThread()) {
      thread.interrupt();
    }
    terminated.countDown();
  }

  private void acceptLoop() {
    ServerSocket server = listener;
    while (!closed.get()) {
      Socket socket;
      try {
        socket = server.accept();
      } catch (IOException ex) {
        if (!closed.get()) {
          log.error("Listener failed; no further clients will be accepted", ex);
        }
        return;
      }
      dispatch(socket);
    }
  }

  private void dispatch(Socket socket) {
    try {
      socket.setTcpNoDelay(true);
    } catch (IOException ex) {
      log.debug("Could not disable Nagle for {}", Logs.peer(socket), ex);
    }
    ClientSession session = new ClientSession(
        socket, credential, hub, clientSettings, events, clock, metrics);
    sessions.add(session);
    try {
      clientPool.execute(() -> {
        try {
          session.run();
        } finally {
          sessions.remove(session);
        }
      });
    } catch (RejectedExecutionException ex) {
      sessions.remove(session);
      log.debug("Dropping client {} accepted during shutdown", session.peer());
      session.close();
    }
  }
}
