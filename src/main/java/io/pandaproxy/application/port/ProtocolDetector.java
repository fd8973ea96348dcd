package io.pandaproxy.application.port;

import io.pandaproxy.domain.protocol.CameraProtocol;

/**
 * <strong>What:</strong> Port that decides which camera protocol a printer exposes.
 * <p><strong>Why:</strong> Chooses between the chamber image fan-out and the RTSP relay once, at startup.</p>
 * <p><strong>Thread-safety:</strong> Called once from the CLI thread.</p>
 *
 * @since 0.1.0
 */
public interface ProtocolDetector {
  /**
   * Probes the printer.
   *
   * @param printerHost printer address
   * @return detected protocol, or {@link CameraProtocol#UNKNOWN} when no camera service answered
   */
  CameraProtocol detect(String printerHost);
}
