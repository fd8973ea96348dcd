package io.pandaproxy.domain.upstream;

/**
 * Lifecycle of the single printer connection, owned by the reconnect supervisor.
 *
 * @since 0.1.0
 */
public enum UpstreamState {
  DISCONNECTED,
  CONNECTING,
  AUTHENTICATING,
  STREAMING,
  BACKOFF
}
