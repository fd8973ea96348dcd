package io.pandaproxy.application.client;

import io.pandaproxy.application.hub.ClientId;
import io.pandaproxy.application.hub.ClientOutbox;
import io.pandaproxy.application.hub.FanOutHub;
import io.pandaproxy.application.port.ClockPort;
import io.pandaproxy.application.port.MetricsPort;
import io.pandaproxy.application.port.ProxyEventEmitter;
import io.pandaproxy.domain.chamber.AccessCredential;
import io.pandaproxy.domain.chamber.AuthRequest;
import io.pandaproxy.domain.chamber.ChamberFrameCodec;
import io.pandaproxy.domain.chamber.Frame;
import io.pandaproxy.domain.chamber.FramingException;
import io.pandaproxy.domain.events.ProxyEvent;
import io.pandaproxy.domain.events.ProxyEventType;
import io.pandaproxy.logging.Logs;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import javax.net.ssl.SSLSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves one downstream viewer: authenticates it, then writes every frame the hub publishes.
 * <p>Runs on its own worker thread. A failure here closes this connection only; the hub, the
 * upstream and every other client are unaffected. {@link #close()} may be called from any thread.</p>
 *
 * @since 0.1.0
 */
public final class ClientSession implements Runnable, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ClientSession.class);
  private static final long TAKE_POLL_MILLIS = 500L;
  private static final int WRITE_BUFFER_BYTES = 64 * 1024;

  private final Socket socket;
  private final AccessCredential expected;
  private final FanOutHub hub;
  private final Settings settings;
  private final ProxyEventEmitter events;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final String peer;

  private volatile boolean closed;
  private volatile ClientOutbox outbox;

  /**
   * Per-session tuning.
   *
   * @param authTimeout time allowed for the 80-byte authentication frame
   * @param queueFrames outbox capacity before the oldest frame is dropped
   */
  public record Settings(Duration authTimeout, int queueFrames) {
    public Settings {
      Objects.requireNonNull(authTimeout, "authTimeout");
      if (authTimeout.isNegative() || authTimeout.isZero()) {
        throw new IllegalArgumentException("authTimeout must be positive");
      }
      if (queueFrames <= 0) {
        throw new IllegalArgumentException("queueFrames must be positive");
      }
    }

    public static Settings defaults() {
      return new Settings(Duration.ofSeconds(10), ClientOutbox.DEFAULT_CAPACITY);
    }
  }

  public ClientSession(
      Socket socket,
      AccessCredential expected,
      FanOutHub hub,
      Settings settings,
      ProxyEventEmitter events,
      ClockPort clock,
      MetricsPort metrics) {
    this.socket = Objects.requireNonNull(socket, "socket");
    this.expected = Objects.requireNonNull(expected, "expected");
    this.hub = Objects.requireNonNull(hub, "hub");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.events = Objects.requireNonNull(events, "events");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.peer = Logs.peer(socket);
  }

  @Override
  public void run() {
    events.emit(ProxyEvent.of(clock.now(), ProxyEventType.CLIENT_CONNECTED, "peer", peer));
    ClientId id = null;
    String reason = "closed";
    try {
      AuthRequest request;
      try {
        request = readAuth();
      } catch (FramingException | EOFException | SocketTimeoutException ex) {
        reject(ex.getMessage());
        reason = "rejected";
        return;
      }
      if (!request.accepts(expected)) {
        reject("credential mismatch");
        reason = "rejected";
        return;
      }
      ClientOutbox box = new ClientOutbox(settings.queueFrames(), metrics);
      outbox = box;
      if (closed) {
        return;
      }
      id = hub.register(box);
      events.emit(ProxyEvent.of(clock.now(), ProxyEventType.CLIENT_AUTHENTICATED,
          "peer", peer, "client", id));
      log.info("Client {} authenticated as {}", peer, id);
      socket.setSoTimeout(0);
      pump(box);
    } catch (IOException ex) {
      reason = "io";
      if (!closed) {
        log.debug("Client {} connection ended: {}", peer, ex.getMessage());
      }
    } catch (InterruptedException ex) {
      reason = "shutdown";
      Thread.currentThread().interrupt();
    } finally {
      if (id != null) {
        hub.deregister(id);
      }
      closeSocket();
      events.emit(ProxyEvent.of(clock.now(), ProxyEventType.CLIENT_DISCONNECTED,
          "peer", peer, "reason", reason));
    }
  }

  /** Stops the session, waking its thread. Idempotent. */
  @Override
  public void close() {
    closed = true;
    ClientOutbox box = outbox;
    if (box != null) {
      box.close();
    }
    closeSocket();
  }

  public String peer() {
    return peer;
  }

  private AuthRequest readAuth() throws IOException {
    socket.setSoTimeout((int) Math.min(Integer.MAX_VALUE, settings.authTimeout().toMillis()));
    if (socket instanceof SSLSocket ssl) {
      ssl.startHandshake();
    }
    byte[] raw = new byte[ChamberFrameCodec.AUTH_FRAME_BYTES];
    try {
      new DataInputStream(socket.getInputStream()).readFully(raw);
    } catch (EOFException ex) {
      EOFException truncated = new EOFException("authentication frame truncated");
      truncated.initCause(ex);
      throw truncated;
    }
    return ChamberFrameCodec.decodeAuth(ByteBuffer.wrap(raw))
        .orElseThrow(() -> new FramingException("authentication frame incomplete"));
  }

  private void pump(ClientOutbox box) throws IOException, InterruptedException {
    OutputStream out = new BufferedOutputStream(socket.getOutputStream(), WRITE_BUFFER_BYTES);
    while (!closed) {
      Frame frame = box.take(TAKE_POLL_MILLIS, TimeUnit.MILLISECONDS);
      if (frame == null) {
        if (box.isClosed()) {
          return;
        }
        continue;
      }
      frame.writeTo(out);
      out.flush();
      metrics.increment("client.frames.written");
    }
  }

  private void reject(String why) {
    metrics.increment("client.rejected");
    log.warn("Rejected client {}: {}", peer, why);
    events.emit(ProxyEvent.of(clock.now(), ProxyEventType.CLIENT_REJECTED,
        "peer", peer, "reason", why));
  }

  private void closeSocket() {
    try {
      socket.close();
    } catch (IOException ex) {
      log.debug("Ignoring failure while closing client {}", peer, ex);
    }
  }
}
