package io.pandaproxy.infrastructure.ftp;

import io.pandaproxy.application.port.ListenerFactory;
import io.pandaproxy.infrastructure.exec.ExecutorFactories;
import io.pandaproxy.logging.Logs;
import io.pandaproxy.validation.Net;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Byte-for-byte TCP relay for the printer's FTPS control and passive data ports.
 * <p>TLS is not terminated: each client negotiates directly with the printer, so session reuse
 * between the control and data channels keeps working. Either direction ending closes both
 * sockets.</p>
 * <p>The control route is mandatory; data routes that cannot be bound are skipped.</p>
 */
public final class FtpPassthroughProxy implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(FtpPassthroughProxy.class);
  /** Implicit FTPS control port. */
  public static final int CONTROL_PORT = 990;
  /** First passive data port used by the printer firmware. */
  public static final int DATA_PORT_FIRST = 2000;
  /** Last passive data port used by the printer firmware. */
  public static final int DATA_PORT_LAST = 2100;
  static final int MAX_CONNECTIONS = 32;
  private static final int COPY_BUFFER_BYTES = 64 * 1024;

  /**
   * One listening port and the printer port it forwards to.
   *
   * @param listenPort local port; 0 picks an ephemeral port
   * @param targetPort printer port
   */
  public record Route(int listenPort, int targetPort) {
    public Route {
      if (listenPort < 0 || listenPort > 65535) {
        throw new IllegalArgumentException("listenPort must be between 0 and 65535");
      }
      Net.validatePort("targetPort", targetPort);
    }
  }

  private final ListenerFactory listeners;
  private final String bindHost;
  private final String printerHost;
  private final Route control;
  private final List<Route> data;
  private final Duration connectTimeout;

  private final List<ServerSocket> bound = new CopyOnWriteArrayList<>();
  private final Set<Socket> open = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();
  private volatile ExecutorService forwarders;

  public FtpPassthroughProxy(
      ListenerFactory listeners,
      String bindHost,
      String printerHost,
      Route control,
      List<Route> data,
      Duration connectTimeout) {
    this.listeners = Objects.requireNonNull(listeners, "listeners");
    this.bindHost = Objects.requireNonNull(bindHost, "bindHost");
    this.printerHost = Net.validateHost("printerHost", printerHost);
    this.control = Objects.requireNonNull(control, "control");
    this.data = List.copyOf(Objects.requireNonNull(data, "data"));
    this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
  }

  /**
   * Relay for the printer's standard ports: 990 plus 2000-2100.
   *
   * @param listeners plain TCP listener factory
   * @param bindHost local bind address
   * @param printerHost printer address
   * @return proxy, not yet started
   */
  public static FtpPassthroughProxy standard(
      ListenerFactory listeners, String bindHost, String printerHost) {
    List<Route> data = new ArrayList<>();
    for (int port = DATA_PORT_FIRST; port <= DATA_PORT_LAST; port++) {
      data.add(new Route(port, port));
    }
    return new FtpPassthroughProxy(listeners, bindHost, printerHost,
        new Route(CONTROL_PORT, CONTROL_PORT), data, Duration.ofSeconds(10));
  }

  /**
   * Binds every route and starts accepting.
   *
   * @throws IOException if the control port cannot be bound
   */
  public void start() throws IOException {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("FTP proxy already started");
    }
    forwarders = ExecutorFactories.newConnectionPool(MAX_CONNECTIONS * 2, "ftp-forward", null);
    listen(control, listeners.bind(bindHost, control.listenPort()));
    int skipped = 0;
    for (Route route : data) {
      ServerSocket server;
      try {
        server = listeners.bind(bindHost, route.listenPort());
      } catch (IOException ex) {
        skipped++;
        log.debug("Could not bind FTP data port {}: {}", route.listenPort(), ex.getMessage());
        continue;
      }
      listen(route, server);
    }
    log.info("FTP passthrough listening on {}:{} with {} data ports ({} unavailable)",
        bindHost, control.listenPort(), data.size() - skipped, skipped);
  }

  /** @return ports actually bound, control port first */
  public List<Integer> boundPorts() {
    List<Integer> ports = new ArrayList<>();
    for (ServerSocket server : bound) {
      ports.add(server.getLocalPort());
    }
    return ports;
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    for (ServerSocket server : bound) {
      closeQuietly(server);
    }
    for (Socket socket : open) {
      closeQuietly(socket);
    }
    ExecutorService pool = forwarders;
    if (pool != null) {
      pool.shutdownNow();
    }
    log.info("FTP passthrough stopped");
  }

  private void listen(Route route, ServerSocket server) {
    bound.add(server);
    ExecutorFactories.newPlatformThread("ftp-accept-" + server.getLocalPort(),
        () -> acceptLoop(route, server)).start();
  }

  private void acceptLoop(Route route, ServerSocket server) {
    while (!closed.get()) {
      Socket client;
      try {
        client = server.accept();
      } catch (IOException ex) {
        if (!closed.get()) {
          log.warn("FTP listener on port {} failed: {}", server.getLocalPort(), ex.getMessage());
        }
        return;
      }
      open.add(client);
      try {
        forwarders.execute(() -> relay(route, client));
      } catch (RejectedExecutionException ex) {
        log.warn("Refusing FTP connection from {}: too many active transfers", Logs.peer(client));
        release(client);
      }
    }
  }

  private void relay(Route route, Socket client) {
    String peer = Logs.peer(client);
    Socket upstream = new Socket();
    open.add(upstream);
    try {
      upstream.connect(new InetSocketAddress(printerHost, route.targetPort()),
          (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()));
      log.debug("FTP {} -> {}:{} connected", peer, printerHost, route.targetPort());
      forwarders.execute(() -> pump(upstream, client, "printer->client"));
      pump(client, upstream, "client->printer");
    } catch (IOException | RejectedExecutionException ex) {
      log.debug("FTP relay for {} on port {} ended: {}", peer, route.targetPort(), ex.getMessage());
    } finally {
      release(client);
      release(upstream);
    }
  }

  private void pump(Socket from, Socket to, String direction) {
    byte[] buffer = new byte[COPY_BUFFER_BYTES];
    try {
      InputStream in = from.getInputStream();
      OutputStream out = to.getOutputStream();
      int read;
      while ((read = in.read(buffer)) >= 0) {
        out.write(buffer, 0, read);
        out.flush();
      }
    } catch (IOException ex) {
      log.debug("FTP {} stopped: {}", direction, ex.getMessage());
    } finally {
      release(from);
      release(to);
    }
  }

  private void release(Socket socket) {
    open.remove(socket);
    closeQuietly(socket);
  }

  private static void closeQuietly(AutoCloseable closeable) {
    try {
      closeable.close();
    } catch (Exception ex) {
      log.debug("Ignoring close failure", ex);
    }
  }
}
