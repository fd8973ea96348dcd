package io.pandaproxy.infrastructure.relay;

import io.pandaproxy.application.port.RelayLauncher;
import io.pandaproxy.domain.chamber.AccessCredential;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relay launcher for builds that ship without an RTSP relay.
 * <p>{@link #start} always fails and {@link #onFailure} always answers {@code EXIT}, so an RTSP
 * printer produces a clear startup error instead of a silent hang.</p>
 */
public final class UnavailableRelayLauncher implements RelayLauncher {
  private static final Logger log = LoggerFactory.getLogger(UnavailableRelayLauncher.class);

  @Override
  public void start(String printerHost, AccessCredential credential) throws RelayUnavailableException {
    Objects.requireNonNull(printerHost, "printerHost");
    Objects.requireNonNull(credential, "credential");
    throw new RelayUnavailableException("printer " + printerHost
        + " streams RTSP, but no RTSP relay is bundled with this build");
  }

  @Override
  public RelayFailureAction onFailure(Exception failure) {
    log.error("RTSP relay unavailable: {}", failure.getMessage());
    return RelayFailureAction.EXIT;
  }

  /** Raised when no relay implementation is present. */
  public static final class RelayUnavailableException extends Exception {
    private static final long serialVersionUID = 1L;

    public RelayUnavailableException(String message) {
      super(message);
    }
  }
}
