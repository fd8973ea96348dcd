package io.pandaproxy.application.port;

import io.pandaproxy.domain.chamber.HandshakeException;
import java.net.Socket;

/**
 * Opens the transport to the printer's chamber image port.
 * <p>Implementations return a socket that is connected and, for TLS, already handshaken.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface UpstreamConnector {
  /**
   * Opens a new connection to the printer.
   *
   * @return connected socket owned by the caller
   * @throws HandshakeException if the TCP connect or TLS negotiation fails or times out
   */
  Socket connect() throws HandshakeException;
}
