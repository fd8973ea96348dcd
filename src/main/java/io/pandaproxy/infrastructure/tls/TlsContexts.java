package io.pandaproxy.infrastructure.tls;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.util.Objects;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;

/**
 * Builds the two TLS contexts the proxy needs.
 * <ul>
 *   <li>{@link #printerClient()}: client side toward the printer, trusting its self-signed certificate.</li>
 *   <li>{@link #listener(Path, char[])}: server side toward viewers, keyed from a PKCS12 keystore.</li>
 * </ul>
 */
public final class TlsContexts {
  static final String PROTOCOL = "TLS";
  static final String KEYSTORE_TYPE = "PKCS12";

  private TlsContexts() {
    // Utility
  }

  /**
   * @return context whose sockets accept any server certificate
   * @throws GeneralSecurityException if the JDK provides no TLS implementation
   */
  public static SSLContext printerClient() throws GeneralSecurityException {
    SSLContext context = SSLContext.getInstance(PROTOCOL);
    context.init(null, new TrustManager[] {TrustAllX509TrustManager.INSTANCE}, null);
    return context;
  }

  /**
   * Loads the listener's key material.
   *
   * @param keystore PKCS12 file holding the server key and certificate
   * @param password keystore and key password
   * @return server context
   * @throws IOException if the keystore cannot be read
   * @throws GeneralSecurityException if the keystore is malformed or the password is wrong
   */
  public static SSLContext listener(Path keystore, char[] password)
      throws IOException, GeneralSecurityException {
    Objects.requireNonNull(keystore, "keystore");
    Objects.requireNonNull(password, "password");
    KeyStore store = KeyStore.getInstance(KEYSTORE_TYPE);
    try (InputStream in = Files.newInputStream(keystore)) {
      store.load(in, password);
    }
    KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
    kmf.init(store, password);
    SSLContext context = SSLContext.getInstance(PROTOCOL);
    context.init(kmf.getKeyManagers(), null, null);
    return context;
  }
}
