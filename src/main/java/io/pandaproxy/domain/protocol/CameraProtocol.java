package io.pandaproxy.domain.protocol;

/**
 * <strong>What:</strong> Outcome of camera detection: the protocol a printer exposes, decided once at
 * startup.
 * <p><strong>Role:</strong> Selects which proxy path runs for the lifetime of the process.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum CameraProtocol {
  /** TLS-wrapped chamber image protocol (A1, A1 mini, P1P, P1S). */
  CHAMBER_IMAGE(6000),
  /** RTSP over TLS (X1 family, H2 family, P2S). */
  RTSP(322),
  /** No camera service answered. */
  UNKNOWN(-1);

  private final int defaultPort;

  CameraProtocol(int defaultPort) {
    this.defaultPort = defaultPort;
  }

  /**
   * Returns the printer port this protocol is served on by default.
   *
   * @return port number, or {@code -1} for {@link #UNKNOWN}
   */
  public int defaultPort() {
    return defaultPort;
  }
}
