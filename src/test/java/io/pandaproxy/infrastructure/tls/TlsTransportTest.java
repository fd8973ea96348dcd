package io.pandaproxy.infrastructure.tls;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import io.pandaproxy.domain.chamber.HandshakeException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import javax.net.ssl.SSLContext;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TlsTransportTest {
  private static final char[] PASSWORD = "changeit".toCharArray();

  @TempDir
  static Path tempDir;

  private static Path keystore;

  @BeforeAll
  static void createKeystore() throws Exception {
    Path keytool = Path.of(System.getProperty("java.home"), "bin", "keytool");
    assumeTrue(Files.isExecutable(keytool), "keytool not available");
    keystore = tempDir.resolve("listener.p12");
    Process process = new ProcessBuilder(
        keytool.toString(), "-genkeypair",
        "-alias", "pandaproxy",
        "-keyalg", "RSA", "-keysize", "2048",
        "-validity", "1",
        "-dname", "CN=localhost",
        "-storetype", "PKCS12",
        "-keystore", keystore.toString(),
        "-storepass", new String(PASSWORD),
        "-keypass", new String(PASSWORD))
        .redirectErrorStream(true)
        .start();
    process.getInputStream().transferTo(OutputStream.nullOutputStream());
    assumeTrue(process.waitFor(60, TimeUnit.SECONDS) && process.exitValue() == 0,
        "keytool could not generate a keystore");
  }

  @Test
  void printerClientTrustsSelfSignedListener() throws Exception {
    SSLContext serverContext = TlsContexts.listener(keystore, PASSWORD);
    byte[] greeting = "hello".getBytes(StandardCharsets.US_ASCII);

    try (ServerSocket server =
        new TlsListenerFactory(serverContext.getServerSocketFactory()).bind("127.0.0.1", 0)) {
      CompletableFuture<Void> served = CompletableFuture.runAsync(() -> {
        try (Socket accepted = server.accept()) {
          accepted.getOutputStream().write(greeting);
          accepted.getOutputStream().flush();
          // wait for the client to hang up
          accepted.getInputStream().read();
        } catch (IOException ex) {
          throw new IllegalStateException(ex);
        }
      });

      TlsUpstreamConnector connector = new TlsUpstreamConnector("127.0.0.1", server.getLocalPort(),
          Duration.ofSeconds(5), TlsContexts.printerClient().getSocketFactory());
      try (Socket socket = connector.connect()) {
        InputStream in = socket.getInputStream();
        assertArrayEquals(greeting, in.readNBytes(greeting.length));
      }
      served.get(5, TimeUnit.SECONDS);
    }
  }

  @Test
  void wrongKeystorePasswordIsRejected() {
    assertThrows(IOException.class, () -> TlsContexts.listener(keystore, "wrong".toCharArray()));
  }

  @Test
  void plainTextPeerFailsHandshake() throws Exception {
    try (ServerSocket plain = new ServerSocket(0)) {
      CompletableFuture.runAsync(() -> {
        try (Socket accepted = plain.accept()) {
          accepted.getOutputStream().write("220 not tls\r\n".getBytes(StandardCharsets.US_ASCII));
        } catch (IOException ignored) {
          // client already gave up
        }
      });
      TlsUpstreamConnector connector = new TlsUpstreamConnector("127.0.0.1", plain.getLocalPort(),
          Duration.ofSeconds(5), TlsContexts.printerClient().getSocketFactory());

      assertThrows(HandshakeException.class, connector::connect);
    }
  }
}
