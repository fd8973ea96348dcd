package io.pandaproxy.application.port;

import java.io.IOException;
import java.net.ServerSocket;

/**
 * Creates bound listening sockets for the proxy's downstream side.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ListenerFactory {
  /**
   * Binds a listener.
   *
   * @param host local address to bind; {@code 0.0.0.0} or {@code ::} for all interfaces
   * @param port local port; {@code 0} picks an ephemeral port
   * @return bound server socket owned by the caller
   * @throws IOException if the address cannot be bound
   */
  ServerSocket bind(String host, int port) throws IOException;
}
