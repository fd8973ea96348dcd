package io.pandaproxy.infrastructure.tls;

import io.pandaproxy.application.port.UpstreamConnector;
import io.pandaproxy.domain.chamber.HandshakeException;
import io.pandaproxy.validation.Net;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens TLS connections to a fixed printer port with bounded connect and handshake time.
 */
public final class TlsUpstreamConnector implements UpstreamConnector {
  private static final Logger log = LoggerFactory.getLogger(TlsUpstreamConnector.class);

  private final String host;
  private final int port;
  private final Duration timeout;
  private final SSLSocketFactory factory;

  /**
   * @param host printer address
   * @param port printer port
   * @param timeout bound applied separately to the TCP connect and the TLS handshake
   * @param factory socket factory, normally from {@link TlsContexts#printerClient()}
   */
  public TlsUpstreamConnector(String host, int port, Duration timeout, SSLSocketFactory factory) {
    this.host = Net.validateHost("host", host);
    this.port = Net.validatePort("port", port);
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  @Override
  public Socket connect() throws HandshakeException {
    int millis = (int) Math.min(Integer.MAX_VALUE, Math.max(1L, timeout.toMillis()));
    Socket raw = new Socket();
    try {
      raw.connect(new InetSocketAddress(host, port), millis);
      raw.setTcpNoDelay(true);
      SSLSocket tls = (SSLSocket) factory.createSocket(raw, host, port, true);
      tls.setSoTimeout(millis);
      tls.startHandshake();
      log.debug("TLS session with {}:{} using {}", host, port, tls.getSession().getProtocol());
      return tls;
    } catch (IOException ex) {
      try {
        raw.close();
      } catch (IOException closeFailure) {
        ex.addSuppressed(closeFailure);
      }
      throw new HandshakeException("TLS connection to " + host + ':' + port + " failed", ex);
    }
  }
}
