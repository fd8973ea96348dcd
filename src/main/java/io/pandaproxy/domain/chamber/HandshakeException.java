package io.pandaproxy.domain.chamber;

/**
 * TCP connect or TLS negotiation with a peer failed before any protocol bytes were exchanged.
 */
public final class HandshakeException extends ChamberProtocolException {
  private static final long serialVersionUID = 1L;

  public HandshakeException(String message, Throwable cause) {
    super(message, cause);
  }
}
