package io.pandaproxy.application.upstream;

import io.pandaproxy.application.port.FrameSink;
import io.pandaproxy.application.port.MetricsPort;
import io.pandaproxy.application.port.UpstreamConnector;
import io.pandaproxy.domain.chamber.AccessCredential;
import io.pandaproxy.domain.chamber.AuthRejectedException;
import io.pandaproxy.domain.chamber.ChamberFrameCodec;
import io.pandaproxy.domain.chamber.Frame;
import io.pandaproxy.domain.chamber.FramingException;
import io.pandaproxy.domain.chamber.HandshakeException;
import io.pandaproxy.domain.chamber.IdleTimeoutException;
import io.pandaproxy.logging.Logs;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One connection attempt to the printer's chamber image port.
 * <p>Lifecycle: {@link #open()}, {@link #authenticate()}, {@link #stream(FrameSink)}, and finally
 * {@link #close()}. Instances are single-use. All methods except {@link #close()} must be called
 * from the same thread; {@code close()} may be called from any thread to abort a blocked read.</p>
 *
 * @since 0.1.0
 */
public final class UpstreamSession implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(UpstreamSession.class);
  private static final int INITIAL_BUFFER_BYTES = 64 * 1024;

  private final UpstreamConnector connector;
  private final AccessCredential credential;
  private final ChamberFrameCodec codec;
  private final Duration authTimeout;
  private final Duration idleTimeout;
  private final MetricsPort metrics;

  private volatile Socket socket;
  private volatile boolean closed;
  private ByteBuffer buffer = ByteBuffer.allocate(INITIAL_BUFFER_BYTES);

  public UpstreamSession(
      UpstreamConnector connector,
      AccessCredential credential,
      ChamberFrameCodec codec,
      Duration authTimeout,
      Duration idleTimeout,
      MetricsPort metrics) {
    this.connector = Objects.requireNonNull(connector, "connector");
    this.credential = Objects.requireNonNull(credential, "credential");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.authTimeout = Objects.requireNonNull(authTimeout, "authTimeout");
    this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Connects and completes the TLS handshake.
   *
   * @throws HandshakeException if the printer is unreachable or the handshake fails
   */
  public void open() throws HandshakeException {
    if (socket != null) {
      throw new IllegalStateException("session already opened");
    }
    Socket connected = connector.connect();
    socket = connected;
    if (closed) {
      closeQuietly(connected);
      throw new HandshakeException("session closed while connecting", null);
    }
  }

  /**
   * Sends the credential and waits up to the auth timeout for the printer's reaction.
   * <p>Any bytes received are kept as the beginning of the image stream. A peer that closes or
   * resets the connection has refused the credential. A window that elapses quietly is treated as
   * acceptance; the printer has no explicit acknowledgement and a dead link is caught later by the
   * idle timeout.</p>
   *
   * @throws AuthRejectedException if the printer drops the connection after the auth frame
   * @throws IOException if the write fails
   */
  public void authenticate() throws IOException {
    Socket s = requireOpen();
    OutputStream out = s.getOutputStream();
    out.write(ChamberFrameCodec.encodeAuth(credential));
    out.flush();
    s.setSoTimeout(timeoutMillis(authTimeout));
    int read;
    try {
      read = readMore(s.getInputStream());
    } catch (SocketTimeoutException quiet) {
      log.debug("No bytes within {} ms of authenticating; assuming accepted", authTimeout.toMillis());
      return;
    } catch (SocketException reset) {
      if (closed) {
        throw reset;
      }
      throw new AuthRejectedException("printer reset the connection after authentication", reset);
    }
    if (read < 0) {
      throw new AuthRejectedException("printer closed the connection after authentication");
    }
    if (log.isDebugEnabled()) {
      log.debug("Printer answered authentication with {} bytes: {}", read,
          Logs.hexPrefix(Arrays.copyOf(buffer.array(), buffer.position()), 16));
    }
  }

  /**
   * Reads frames until the connection fails, handing each to {@code sink} in arrival order.
   * <p>Returns normally only after {@link #close()} was called from another thread.</p>
   *
   * @param sink receiver of decoded frames; called on this thread
   * @throws IdleTimeoutException if no bytes arrive within the idle timeout
   * @throws FramingException if the stream carries an implausible frame length
   * @throws IOException on socket or TLS failure, including end of stream
   */
  public void stream(FrameSink sink) throws IOException {
    Objects.requireNonNull(sink, "sink");
    Socket s = requireOpen();
    s.setSoTimeout(timeoutMillis(idleTimeout));
    InputStream in = s.getInputStream();
    try {
      while (!closed) {
        drainFrames(sink);
        int read;
        try {
          read = readMore(in);
        } catch (SocketTimeoutException idle) {
          throw new IdleTimeoutException(
              "no data from printer for " + idleTimeout.toMillis() + " ms", idle);
        }
        if (read < 0) {
          throw new EOFException("printer closed the image stream");
        }
        metrics.observe("upstream.bytes", read);
      }
    } catch (IOException ex) {
      if (closed) {
        return;
      }
      throw ex;
    }
  }

  public boolean isClosed() {
    return closed;
  }

  /** Force-closes the socket. Idempotent. */
  @Override
  public void close() {
    closed = true;
    Socket s = socket;
    if (s != null) {
      closeQuietly(s);
    }
  }

  private void drainFrames(FrameSink sink) throws FramingException {
    buffer.flip();
    try {
      Optional<Frame> frame;
      while ((frame = codec.decodeFrame(buffer)).isPresent()) {
        metrics.increment("upstream.frames");
        sink.publish(frame.get());
      }
    } finally {
      buffer.compact();
    }
  }

  private int readMore(InputStream in) throws IOException {
    if (!buffer.hasRemaining()) {
      grow();
    }
    int read = in.read(buffer.array(), buffer.arrayOffset() + buffer.position(), buffer.remaining());
    if (read > 0) {
      buffer.position(buffer.position() + read);
    }
    return read;
  }

  private void grow() {
    int limit = ChamberFrameCodec.FRAME_HEADER_BYTES + codec.maxFrameBytes();
    int next = Math.min(limit, buffer.capacity() * 2);
    if (next <= buffer.capacity()) {
      throw new IllegalStateException("receive buffer already at its limit of " + limit + " bytes");
    }
    ByteBuffer bigger = ByteBuffer.allocate(next);
    buffer.flip();
    bigger.put(buffer);
    buffer = bigger;
  }

  private Socket requireOpen() {
    Socket s = socket;
    if (s == null) {
      throw new IllegalStateException("session not opened");
    }
    return s;
  }

  private static int timeoutMillis(Duration timeout) {
    return (int) Math.min(Integer.MAX_VALUE, Math.max(1L, timeout.toMillis()));
  }

  private static void closeQuietly(Socket s) {
    try {
      s.close();
    } catch (IOException ex) {
      log.debug("Ignoring failure while closing upstream socket", ex);
    }
  }
}
