package io.pandaproxy.domain.protocol;

import java.util.Locale;
import java.util.Optional;

/**
 * How the {@code camera} setting chooses the proxy path: probe the printer, or use a fixed
 * protocol.
 *
 * @since 0.1.0
 */
public enum CameraMode {
  /** Probe the chamber image port, then the RTSP port. */
  AUTO(null),
  /** Skip probing; serve the chamber image protocol. */
  CHAMBER_IMAGE(CameraProtocol.CHAMBER_IMAGE),
  /** Skip probing; hand off to the RTSP relay. */
  RTSP(CameraProtocol.RTSP);

  private final CameraProtocol forced;

  CameraMode(CameraProtocol forced) {
    this.forced = forced;
  }

  /** @return the protocol to use without probing, or empty for {@link #AUTO} */
  public Optional<CameraProtocol> forced() {
    return Optional.ofNullable(forced);
  }

  /**
   * Parses the {@code camera} configuration value.
   *
   * @param raw {@code chamber}, {@code rtsp} or {@code auto} (case-insensitive); blank means auto
   * @return parsed mode
   * @throws IllegalArgumentException for any other value
   */
  public static CameraMode fromConfig(String raw) {
    String normalized = raw == null ? "auto" : raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "", "auto" -> AUTO;
      case "chamber", "chamber_image", "chamber-image" -> CHAMBER_IMAGE;
      case "rtsp" -> RTSP;
      default -> throw new IllegalArgumentException("camera must be chamber, rtsp or auto (was " + raw + ")");
    };
  }
}
