package io.pandaproxy.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.pandaproxy.config.ProxyConfig;
import io.pandaproxy.domain.protocol.CameraProtocol;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DetectCliTest {
  @TempDir Path tempDir;

  private final StringWriter output = new StringWriter();

  @BeforeEach
  void setUp() {
    CliPrinter.setWriterForTesting(new PrintWriter(output, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void reportsDetectedProtocolWithPort() {
    ProxyConfig config = ProxyConfig.fromMap(Map.of(
        "printerIp", "10.0.0.5", "accessCode", "12345678", "rtspPort", "8322"));

    assertEquals(ExitCode.SUCCESS, DetectCli.report(config, CameraProtocol.RTSP));
    assertTrue(output.toString().contains("10.0.0.5: RTSP on port 8322"));
  }

  @Test
  void closedPortsFailDetectionWithHint() throws IOException {
    Path yaml = tempDir.resolve("detect.yaml");
    Files.writeString(yaml, "detect:\n  detectTimeoutMillis: 500\n");
    int chamber = closedPort();
    int rtsp = closedPort();

    ExitCode code = DetectCli.run(new String[] {
        "config=" + yaml,
        "printerIp=127.0.0.1",
        "accessCode=12345678",
        "chamberPort=" + chamber,
        "rtspPort=" + rtsp}, Map.of());

    assertEquals(ExitCode.DETECTION_FAILED, code);
    assertTrue(output.toString().contains("check printer IP, access code, or LAN mode"));
  }

  @Test
  void missingAccessCodeIsInvalidArgs() throws IOException {
    Path yaml = tempDir.resolve("detect.yaml");
    Files.writeString(yaml, "");

    assertEquals(ExitCode.INVALID_ARGS,
        DetectCli.run(new String[] {"config=" + yaml, "printerIp=127.0.0.1"}, Map.of()));
  }

  private static int closedPort() throws IOException {
    try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      return socket.getLocalPort();
    }
  }
}
