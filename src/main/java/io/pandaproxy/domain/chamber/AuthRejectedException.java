package io.pandaproxy.domain.chamber;

/**
 * The peer refused the presented credential, signalled by closing the connection right after the
 * authentication frame.
 */
public final class AuthRejectedException extends ChamberProtocolException {
  private static final long serialVersionUID = 1L;

  public AuthRejectedException(String message) {
    super(message);
  }

  public AuthRejectedException(String message, Throwable cause) {
    super(message, cause);
  }
}
