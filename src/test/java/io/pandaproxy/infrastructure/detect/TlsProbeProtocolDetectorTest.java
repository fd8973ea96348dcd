package io.pandaproxy.infrastructure.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.pandaproxy.domain.protocol.CameraProtocol;
import io.pandaproxy.infrastructure.detect.TlsProbeProtocolDetector.Candidate;
import io.pandaproxy.infrastructure.tls.TlsContexts;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TlsProbeProtocolDetectorTest {
  private static final List<Candidate> STANDARD = List.of(
      new Candidate(CameraProtocol.CHAMBER_IMAGE, 6000),
      new Candidate(CameraProtocol.RTSP, 322));

  @Test
  void chamberPortWinsWhenBothAnswer() {
    List<Integer> probed = new ArrayList<>();
    TlsProbeProtocolDetector detector = new TlsProbeProtocolDetector(STANDARD, (host, port) -> {
      probed.add(port);
      return true;
    });

    assertEquals(CameraProtocol.CHAMBER_IMAGE, detector.detect("192.168.1.50"));
    assertEquals(List.of(6000), probed);
  }

  @Test
  void fallsBackToRtsp() {
    TlsProbeProtocolDetector detector =
        new TlsProbeProtocolDetector(STANDARD, (host, port) -> port == 322);

    assertEquals(CameraProtocol.RTSP, detector.detect("192.168.1.50"));
  }

  @Test
  void noAnswerIsUnknown() {
    TlsProbeProtocolDetector detector = new TlsProbeProtocolDetector(STANDARD, (host, port) -> false);

    assertEquals(CameraProtocol.UNKNOWN, detector.detect("192.168.1.50"));
  }

  @Test
  void socketProbeTreatsPlainListenerAsNoTls() throws Exception {
    try (ServerSocket silent = new ServerSocket(0)) {
      int port = silent.getLocalPort();
      TlsProbeProtocolDetector detector = TlsProbeProtocolDetector.forPorts(
          port, port, Duration.ofMillis(300), TlsContexts.printerClient().getSocketFactory());

      assertEquals(CameraProtocol.UNKNOWN, detector.detect("127.0.0.1"));
    }
  }
}
