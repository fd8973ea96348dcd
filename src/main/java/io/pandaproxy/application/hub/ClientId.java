package io.pandaproxy.application.hub;

/**
 * Opaque identifier handed out by {@link FanOutHub#register}.
 *
 * @param value monotonically assigned number, unique per hub
 * @since 0.1.0
 */
public record ClientId(long value) {
  @Override
  public String toString() {
    return "client-" + value;
  }
}
