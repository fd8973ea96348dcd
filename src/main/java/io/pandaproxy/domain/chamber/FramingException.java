package io.pandaproxy.domain.chamber;

/**
 * Raised when bytes on the wire cannot be a valid authentication frame or image frame header.
 */
public final class FramingException extends ChamberProtocolException {
  private static final long serialVersionUID = 1L;

  public FramingException(String message) {
    super(message);
  }
}
