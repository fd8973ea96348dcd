package io.pandaproxy.infrastructure.detect;

import io.pandaproxy.application.port.ProtocolDetector;
import io.pandaproxy.domain.protocol.CameraProtocol;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Determines which camera protocol a printer serves by attempting a TLS handshake on each
 * candidate port.
 * <p>Candidates are tried in a fixed order: chamber image first, then RTSP. The first port that
 * completes a handshake wins; when none does the result is {@link CameraProtocol#UNKNOWN}.</p>
 * <p>Thread-safe once constructed.</p>
 */
public final class TlsProbeProtocolDetector implements ProtocolDetector {
  private static final Logger log = LoggerFactory.getLogger(TlsProbeProtocolDetector.class);

  /** Attempts a bounded TLS handshake against one port. */
  @FunctionalInterface
  public interface TlsProbe {
    /**
     * @param host printer address
     * @param port port to probe
     * @return {@code true} if a TLS handshake completed
     */
    boolean handshakes(String host, int port);
  }

  /** One probe target. */
  public record Candidate(CameraProtocol protocol, int port) {
    public Candidate {
      Objects.requireNonNull(protocol, "protocol");
    }
  }

  private final List<Candidate> candidates;
  private final TlsProbe probe;

  /**
   * @param candidates ports to try, in priority order
   * @param probe handshake probe
   */
  public TlsProbeProtocolDetector(List<Candidate> candidates, TlsProbe probe) {
    this.candidates = List.copyOf(Objects.requireNonNull(candidates, "candidates"));
    this.probe = Objects.requireNonNull(probe, "probe");
  }

  /**
   * Probes the chamber image and RTSP ports with real sockets.
   *
   * @param chamberPort chamber image port, normally 6000
   * @param rtspPort RTSP port, normally 322
   * @param timeout bound on connect and on handshake for each probe
   * @param factory socket factory trusting the printer's certificate
   * @return detector
   */
  public static TlsProbeProtocolDetector forPorts(
      int chamberPort, int rtspPort, Duration timeout, SSLSocketFactory factory) {
    return new TlsProbeProtocolDetector(
        List.of(new Candidate(CameraProtocol.CHAMBER_IMAGE, chamberPort),
            new Candidate(CameraProtocol.RTSP, rtspPort)),
        socketProbe(timeout, factory));
  }

  @Override
  public CameraProtocol detect(String printerHost) {
    Objects.requireNonNull(printerHost, "printerHost");
    for (Candidate candidate : candidates) {
      if (probe.handshakes(printerHost, candidate.port())) {
        log.info("Printer {} answers {} on port {}", printerHost, candidate.protocol(), candidate.port());
        return candidate.protocol();
      }
      log.debug("No TLS handshake with {}:{}", printerHost, candidate.port());
    }
    log.warn("Printer {} answered none of the camera ports", printerHost);
    return CameraProtocol.UNKNOWN;
  }

  static TlsProbe socketProbe(Duration timeout, SSLSocketFactory factory) {
    Objects.requireNonNull(timeout, "timeout");
    Objects.requireNonNull(factory, "factory");
    int millis = (int) Math.min(Integer.MAX_VALUE, Math.max(1L, timeout.toMillis()));
    return (host, port) -> {
      try (Socket raw = new Socket()) {
        raw.connect(new InetSocketAddress(host, port), millis);
        try (SSLSocket tls = (SSLSocket) factory.createSocket(raw, host, port, false)) {
          tls.setSoTimeout(millis);
          tls.startHandshake();
          return true;
        }
      } catch (IOException ex) {
        log.debug("Probe of {}:{} failed: {}", host, port, ex.getMessage());
        return false;
      }
    };
  }
}
