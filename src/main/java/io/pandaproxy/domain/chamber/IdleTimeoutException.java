package io.pandaproxy.domain.chamber;

/**
 * No frame arrived from the printer within the idle window while the socket stayed open.
 */
public final class IdleTimeoutException extends ChamberProtocolException {
  private static final long serialVersionUID = 1L;

  public IdleTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
