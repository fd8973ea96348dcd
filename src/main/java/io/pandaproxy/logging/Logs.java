package io.pandaproxy.logging;

import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;

/**
 * <strong>What:</strong> Logging hygiene helpers that keep credentials and raw payloads out of operator logs.
 * <p><strong>Why:</strong> The printer access code doubles as the viewer password, and JPEG payloads are
 * far too large to dump.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private Logs() {
    // Utility
  }

  /**
   * Returns a standard redacted placeholder for sensitive content.
   *
   * @param value ignored original value; retained for fluent API usage
   * @return the redacted placeholder string
   */
  public static String redact(String value) {
    return REDACTED_PLACEHOLDER;
  }

  /**
   * Renders at most {@code maxBytes} leading bytes as lowercase hex for protocol diagnostics.
   *
   * @param bytes source bytes; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to render; must be positive
   * @return hex string, suffixed with the total length when truncated
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String hexPrefix(byte[] bytes, int maxBytes) {
    if (bytes == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    int count = Math.min(bytes.length, maxBytes);
    StringBuilder out = new StringBuilder(count * 2 + 24);
    for (int i = 0; i < count; i++) {
      out.append(HEX[(bytes[i] >> 4) & 0x0F]).append(HEX[bytes[i] & 0x0F]);
    }
    if (count < bytes.length) {
      out.append("... (").append(count).append(" of ").append(bytes.length).append(')');
    }
    return out.toString();
  }

  /**
   * Describes the remote side of a socket as {@code host:port} without triggering DNS lookups.
   *
   * @param socket connected socket; may be {@code null}
   * @return printable peer description
   */
  public static String peer(Socket socket) {
    if (socket == null) {
      return NULL_PLACEHOLDER;
    }
    SocketAddress address = socket.getRemoteSocketAddress();
    if (address instanceof InetSocketAddress inet) {
      return inet.getHostString() + ':' + inet.getPort();
    }
    return String.valueOf(address);
  }
}
