package io.pandaproxy.infrastructure.tls;

import io.pandaproxy.application.port.ListenerFactory;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.Objects;
import javax.net.ssl.SSLServerSocket;
import javax.net.ssl.SSLServerSocketFactory;

/**
 * Binds TLS server sockets for the proxy's client-facing listener.
 */
public final class TlsListenerFactory implements ListenerFactory {
  private static final int BACKLOG = 50;

  private final SSLServerSocketFactory factory;

  public TlsListenerFactory(SSLServerSocketFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  @Override
  public ServerSocket bind(String host, int port) throws IOException {
    SSLServerSocket server = (SSLServerSocket) factory.createServerSocket();
    try {
      server.setReuseAddress(true);
      server.setNeedClientAuth(false);
      server.bind(new InetSocketAddress(host, port), BACKLOG);
      return server;
    } catch (IOException ex) {
      server.close();
      throw ex;
    }
  }
}
