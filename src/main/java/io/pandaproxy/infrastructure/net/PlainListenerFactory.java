package io.pandaproxy.infrastructure.net;

import io.pandaproxy.application.port.ListenerFactory;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;

/**
 * Binds unencrypted TCP listeners; used by the FTP passthrough, which forwards TLS untouched.
 */
public final class PlainListenerFactory implements ListenerFactory {
  private static final int BACKLOG = 50;

  @Override
  public ServerSocket bind(String host, int port) throws IOException {
    ServerSocket server = new ServerSocket();
    try {
      server.setReuseAddress(true);
      server.bind(new InetSocketAddress(host, port), BACKLOG);
      return server;
    } catch (IOException ex) {
      server.close();
      throw ex;
    }
  }
}
