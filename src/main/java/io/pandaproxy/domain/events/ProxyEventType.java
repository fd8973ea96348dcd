package io.pandaproxy.domain.events;

import java.util.Locale;

/**
 * Lifecycle event kinds emitted by the proxy core.
 *
 * @since 0.1.0
 */
public enum ProxyEventType {
  UPSTREAM_STATE,
  UPSTREAM_AUTH_REJECTED,
  UPSTREAM_DECODE_FAILURE,
  CLIENT_CONNECTED,
  CLIENT_AUTHENTICATED,
  CLIENT_REJECTED,
  CLIENT_DISCONNECTED;

  /** @return dotted lowercase name used in log lines and metric keys (e.g. {@code client.rejected}) */
  public String key() {
    return name().toLowerCase(Locale.ROOT).replace('_', '.');
  }
}
