package io.pandaproxy.infrastructure.tls;

import java.net.Socket;
import java.security.cert.X509Certificate;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.X509ExtendedTrustManager;

/**
 * Trust manager that accepts any certificate chain.
 * <p>Used only toward the printer, which presents a self-signed certificate with no stable
 * host name. Never installed on the proxy's own listener.</p>
 */
final class TrustAllX509TrustManager extends X509ExtendedTrustManager {
  static final TrustAllX509TrustManager INSTANCE = new TrustAllX509TrustManager();

  private static final X509Certificate[] NO_ISSUERS = new X509Certificate[0];

  private TrustAllX509TrustManager() {}

  @Override
  public void checkClientTrusted(X509Certificate[] chain, String authType) {}

  @Override
  public void checkServerTrusted(X509Certificate[] chain, String authType) {}

  @Override
  public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {}

  @Override
  public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {}

  @Override
  public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}

  @Override
  public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}

  @Override
  public X509Certificate[] getAcceptedIssuers() {
    return NO_ISSUERS;
  }
}
