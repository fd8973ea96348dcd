package io.pandaproxy.application.port;

import io.pandaproxy.domain.chamber.AccessCredential;

/**
 * Hand-off contract to the external RTSP relay used for printers that expose RTSP instead of the
 * chamber image protocol.
 *
 * @since 0.1.0
 */
public interface RelayLauncher {

  /** Outcome requested by the relay collaborator after a failure. */
  enum RelayFailureAction {
    RETRY,
    EXIT
  }

  /**
   * Starts relaying the printer's RTSP stream and blocks until the relay ends.
   *
   * @param printerHost printer address
   * @param credential printer credential
   * @throws Exception if the relay cannot be started or terminates abnormally
   */
  void start(String printerHost, AccessCredential credential) throws Exception;

  /**
   * Decides whether a failed relay should be restarted.
   *
   * @param failure failure raised by {@link #start(String, AccessCredential)}
   * @return action for the caller
   */
  RelayFailureAction onFailure(Exception failure);
}
