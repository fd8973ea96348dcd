package io.pandaproxy.domain.chamber;

import java.io.IOException;

/**
 * Base type for failures of the chamber image protocol on a single connection.
 * <p>Always local to the connection that raised it; owners recover by closing (clients) or backing
 * off (upstream).</p>
 */
public class ChamberProtocolException extends IOException {
  private static final long serialVersionUID = 1L;

  public ChamberProtocolException(String message) {
    super(message);
  }

  public ChamberProtocolException(String message, Throwable cause) {
    super(message, cause);
  }
}
