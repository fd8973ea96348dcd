package io.pandaproxy.infrastructure.ftp;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.pandaproxy.infrastructure.ftp.FtpPassthroughProxy.Route;
import io.pandaproxy.infrastructure.net.PlainListenerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FtpPassthroughProxyTest {
  private ServerSocket printer;
  private ExecutorService printerThreads;

  @BeforeEach
  void startEchoPrinter() throws IOException {
    printer = new ServerSocket(0);
    printerThreads = Executors.newCachedThreadPool();
    printerThreads.execute(() -> {
      while (!printer.isClosed()) {
        try {
          Socket accepted = printer.accept();
          printerThreads.execute(() -> echo(accepted));
        } catch (IOException ex) {
          return;
        }
      }
    });
  }

  @AfterEach
  void stopEchoPrinter() throws IOException {
    printer.close();
    printerThreads.shutdownNow();
  }

  @Test
  void relaysBytesInBothDirections() throws Exception {
    try (FtpPassthroughProxy proxy = new FtpPassthroughProxy(new PlainListenerFactory(), "127.0.0.1",
        "127.0.0.1", new Route(0, printer.getLocalPort()), List.of(), Duration.ofSeconds(2))) {
      proxy.start();
      int port = proxy.boundPorts().get(0);

      byte[] payload = new byte[32_000];
      for (int i = 0; i < payload.length; i++) {
        payload[i] = (byte) (i * 31);
      }
      try (Socket client = new Socket("127.0.0.1", port)) {
        client.setSoTimeout(5_000);
        OutputStream out = client.getOutputStream();
        out.write(payload);
        out.flush();
        assertArrayEquals(payload, client.getInputStream().readNBytes(payload.length));
      }
    }
  }

  @Test
  void dataRoutesAreBoundAlongsideControl() throws Exception {
    try (FtpPassthroughProxy proxy = new FtpPassthroughProxy(new PlainListenerFactory(), "127.0.0.1",
        "127.0.0.1", new Route(0, printer.getLocalPort()),
        List.of(new Route(0, printer.getLocalPort()), new Route(0, printer.getLocalPort())),
        Duration.ofSeconds(2))) {
      proxy.start();

      assertEquals(3, proxy.boundPorts().size());
      try (Socket client = new Socket("127.0.0.1", proxy.boundPorts().get(2))) {
        client.setSoTimeout(5_000);
        client.getOutputStream().write("PASV\r\n".getBytes(StandardCharsets.US_ASCII));
        assertArrayEquals("PASV\r\n".getBytes(StandardCharsets.US_ASCII),
            client.getInputStream().readNBytes(6));
      }
    }
  }

  @Test
  void printerHangupClosesClient() throws Exception {
    int unusedPort;
    try (ServerSocket probe = new ServerSocket(0)) {
      unusedPort = probe.getLocalPort();
    }
    try (FtpPassthroughProxy proxy = new FtpPassthroughProxy(new PlainListenerFactory(), "127.0.0.1",
        "127.0.0.1", new Route(0, unusedPort), List.of(), Duration.ofSeconds(2))) {
      proxy.start();
      try (Socket client = new Socket("127.0.0.1", proxy.boundPorts().get(0))) {
        client.setSoTimeout(5_000);
        InputStream in = client.getInputStream();
        assertEquals(-1, in.read());
      }
    }
  }

  @Test
  void controlPortConflictFailsStart() throws Exception {
    try (ServerSocket occupied = new ServerSocket(0);
        FtpPassthroughProxy proxy = new FtpPassthroughProxy(new PlainListenerFactory(), "127.0.0.1",
            "127.0.0.1", new Route(occupied.getLocalPort(), 990), List.of(), Duration.ofSeconds(2))) {
      assertThrows(IOException.class, proxy::start);
    }
  }

  @Test
  void startTwiceIsRejected() throws Exception {
    try (FtpPassthroughProxy proxy = new FtpPassthroughProxy(new PlainListenerFactory(), "127.0.0.1",
        "127.0.0.1", new Route(0, printer.getLocalPort()), List.of(), Duration.ofSeconds(2))) {
      proxy.start();
      assertThrows(IllegalStateException.class, proxy::start);
    }
  }

  private static void echo(Socket socket) {
    try (socket) {
      socket.getInputStream().transferTo(socket.getOutputStream());
    } catch (IOException ignored) {
      // peer went away
    }
  }
}
