package io.pandaproxy.config;

import io.pandaproxy.domain.chamber.AccessCredential;
import io.pandaproxy.domain.chamber.ChamberFrameCodec;
import io.pandaproxy.domain.protocol.CameraMode;
import io.pandaproxy.domain.protocol.CameraProtocol;
import io.pandaproxy.logging.Logs;
import io.pandaproxy.validation.Net;
import io.pandaproxy.validation.Numbers;
import io.pandaproxy.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable proxy configuration, validated on construction.
 *
 * @param printerIp printer host name or IP literal
 * @param accessCode printer access code; never logged
 * @param bind local address the client-facing listeners bind to
 * @param chamberPort printer's chamber image port
 * @param rtspPort printer's RTSP port, probed during detection
 * @param proxyPort local chamber image listener port
 * @param tlsKeystore PKCS12 keystore for the client-facing listener; {@code null} when unset
 * @param tlsKeystorePassword keystore password; never logged
 * @param connectTimeoutMillis bound on the upstream connect and on its TLS handshake
 * @param authTimeoutMillis time the printer is given to refuse a credential
 * @param idleTimeoutMillis silence after which a streaming upstream is declared dead
 * @param clientAuthTimeoutMillis time a client is given to send its authentication frame
 * @param backoffMinMillis first reconnect delay
 * @param backoffMaxMillis reconnect delay cap
 * @param clientQueueFrames frames buffered per client before the oldest is dropped
 * @param maxFrameBytes largest accepted image payload
 * @param detectTimeoutMillis bound on each detection probe
 * @param camera whether to probe the printer or use a fixed protocol
 * @param ftpEnabled whether the FTPS passthrough runs alongside the camera proxy
 * @since 0.1.0
 */
public record ProxyConfig(
    String printerIp,
    String accessCode,
    String bind,
    int chamberPort,
    int rtspPort,
    int proxyPort,
    Path tlsKeystore,
    String tlsKeystorePassword,
    int connectTimeoutMillis,
    int authTimeoutMillis,
    int idleTimeoutMillis,
    int clientAuthTimeoutMillis,
    int backoffMinMillis,
    int backoffMaxMillis,
    int clientQueueFrames,
    int maxFrameBytes,
    int detectTimeoutMillis,
    CameraMode camera,
    boolean ftpEnabled) {

  static final String DEFAULT_BIND = "0.0.0.0";
  static final int DEFAULT_CONNECT_TIMEOUT_MILLIS = 10_000;
  static final int DEFAULT_AUTH_TIMEOUT_MILLIS = 5_000;
  static final int DEFAULT_IDLE_TIMEOUT_MILLIS = 30_000;
  static final int DEFAULT_CLIENT_AUTH_TIMEOUT_MILLIS = 10_000;
  static final int DEFAULT_BACKOFF_MIN_MILLIS = 1_000;
  static final int DEFAULT_BACKOFF_MAX_MILLIS = 30_000;
  static final int DEFAULT_CLIENT_QUEUE_FRAMES = 8;
  static final int DEFAULT_DETECT_TIMEOUT_MILLIS = 5_000;
  private static final int MIN_TIMEOUT_MILLIS = 100;
  private static final int MAX_TIMEOUT_MILLIS = 600_000;
  private static final int MAX_BACKOFF_MILLIS = 3_600_000;
  private static final int MAX_CLIENT_QUEUE_FRAMES = 1_024;

  public ProxyConfig {
    printerIp = Net.validateHost("printerIp", printerIp);
    // validated for the wire format; the value itself is kept as text
    AccessCredential.forAccessCode(accessCode);
    accessCode = accessCode.trim();
    bind = Net.validateHost("bind", bind);
    Net.validatePort("chamberPort", chamberPort);
    Net.validatePort("rtspPort", rtspPort);
    Numbers.requireRange("proxyPort", proxyPort, 0, 65_535);
    if (tlsKeystore != null) {
      tlsKeystore = tlsKeystore.toAbsolutePath().normalize();
    }
    tlsKeystorePassword = tlsKeystorePassword == null ? "" : tlsKeystorePassword;
    Numbers.requireRange("connectTimeoutMillis", connectTimeoutMillis, MIN_TIMEOUT_MILLIS, MAX_TIMEOUT_MILLIS);
    Numbers.requireRange("authTimeoutMillis", authTimeoutMillis, MIN_TIMEOUT_MILLIS, MAX_TIMEOUT_MILLIS);
    Numbers.requireRange("idleTimeoutMillis", idleTimeoutMillis, MIN_TIMEOUT_MILLIS, MAX_TIMEOUT_MILLIS);
    Numbers.requireRange(
        "clientAuthTimeoutMillis", clientAuthTimeoutMillis, MIN_TIMEOUT_MILLIS, MAX_TIMEOUT_MILLIS);
    Numbers.requireRange("backoffMinMillis", backoffMinMillis, 1, MAX_BACKOFF_MILLIS);
    Numbers.requireRange("backoffMaxMillis", backoffMaxMillis, backoffMinMillis, MAX_BACKOFF_MILLIS);
    Numbers.requireRange("clientQueueFrames", clientQueueFrames, 1, MAX_CLIENT_QUEUE_FRAMES);
    Numbers.requireRange("maxFrameBytes", maxFrameBytes,
        ChamberFrameCodec.MIN_MAX_FRAME_BYTES, ChamberFrameCodec.MAX_MAX_FRAME_BYTES);
    Numbers.requireRange("detectTimeoutMillis", detectTimeoutMillis, MIN_TIMEOUT_MILLIS, MAX_TIMEOUT_MILLIS);
    camera = Objects.requireNonNullElse(camera, CameraMode.AUTO);
  }

  /**
   * Builds a configuration from a flattened key/value map such as the one produced by
   * {@link ConfigMerger}.
   *
   * @param args configuration keys; may be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException when a required key is missing or a value is invalid
   */
  public static ProxyConfig fromMap(Map<String, String> args) {
    Map<String, String> kv = args == null ? Map.of() : new HashMap<>(args);
    String printerIp = kv.get("printerIp");
    if (printerIp == null || printerIp.isBlank()) {
      throw new IllegalArgumentException("printerIp is required (printerIp=... or PRINTER_IP)");
    }
    String accessCode = kv.get("accessCode");
    if (accessCode == null || accessCode.isBlank()) {
      throw new IllegalArgumentException("accessCode is required (accessCode=... or ACCESS_CODE)");
    }
    return new ProxyConfig(
        printerIp,
        accessCode,
        textOrDefault(kv.get("bind"), DEFAULT_BIND),
        parseBoundedInt(kv, "chamberPort", CameraProtocol.CHAMBER_IMAGE.defaultPort(), 1, 65_535),
        parseBoundedInt(kv, "rtspPort", CameraProtocol.RTSP.defaultPort(), 1, 65_535),
        parseBoundedInt(kv, "proxyPort", CameraProtocol.CHAMBER_IMAGE.defaultPort(), 0, 65_535),
        parseOptionalPath("tlsKeystore", kv.get("tlsKeystore")).orElse(null),
        kv.get("tlsKeystorePassword"),
        parseBoundedInt(kv, "connectTimeoutMillis", DEFAULT_CONNECT_TIMEOUT_MILLIS,
            MIN_TIMEOUT_MILLIS, MAX_TIMEOUT_MILLIS),
        parseBoundedInt(kv, "authTimeoutMillis", DEFAULT_AUTH_TIMEOUT_MILLIS,
            MIN_TIMEOUT_MILLIS, MAX_TIMEOUT_MILLIS),
        parseBoundedInt(kv, "idleTimeoutMillis", DEFAULT_IDLE_TIMEOUT_MILLIS,
            MIN_TIMEOUT_MILLIS, MAX_TIMEOUT_MILLIS),
        parseBoundedInt(kv, "clientAuthTimeoutMillis", DEFAULT_CLIENT_AUTH_TIMEOUT_MILLIS,
            MIN_TIMEOUT_MILLIS, MAX_TIMEOUT_MILLIS),
        parseBoundedInt(kv, "backoffMinMillis", DEFAULT_BACKOFF_MIN_MILLIS, 1, MAX_BACKOFF_MILLIS),
        parseBoundedInt(kv, "backoffMaxMillis", DEFAULT_BACKOFF_MAX_MILLIS, 1, MAX_BACKOFF_MILLIS),
        parseBoundedInt(kv, "clientQueueFrames", DEFAULT_CLIENT_QUEUE_FRAMES, 1, MAX_CLIENT_QUEUE_FRAMES),
        parseBoundedInt(kv, "maxFrameBytes", ChamberFrameCodec.DEFAULT_MAX_FRAME_BYTES,
            ChamberFrameCodec.MIN_MAX_FRAME_BYTES, ChamberFrameCodec.MAX_MAX_FRAME_BYTES),
        parseBoundedInt(kv, "detectTimeoutMillis", DEFAULT_DETECT_TIMEOUT_MILLIS,
            MIN_TIMEOUT_MILLIS, MAX_TIMEOUT_MILLIS),
        CameraMode.fromConfig(kv.get("camera")),
        parseBoolean("ftpEnabled", kv.get("ftpEnabled"), false));
  }

  public AccessCredential credential() {
    return AccessCredential.forAccessCode(accessCode);
  }

  public Duration connectTimeout() {
    return Duration.ofMillis(connectTimeoutMillis);
  }

  public Duration authTimeout() {
    return Duration.ofMillis(authTimeoutMillis);
  }

  public Duration idleTimeout() {
    return Duration.ofMillis(idleTimeoutMillis);
  }

  public Duration clientAuthTimeout() {
    return Duration.ofMillis(clientAuthTimeoutMillis);
  }

  public Duration backoffMin() {
    return Duration.ofMillis(backoffMinMillis);
  }

  public Duration backoffMax() {
    return Duration.ofMillis(backoffMaxMillis);
  }

  public Duration detectTimeout() {
    return Duration.ofMillis(detectTimeoutMillis);
  }

  @Override
  public String toString() {
    return "ProxyConfig[printerIp=" + printerIp
        + ", accessCode=" + Logs.redact(accessCode)
        + ", bind=" + bind
        + ", chamberPort=" + chamberPort
        + ", rtspPort=" + rtspPort
        + ", proxyPort=" + proxyPort
        + ", tlsKeystore=" + tlsKeystore
        + ", tlsKeystorePassword=" + Logs.redact(tlsKeystorePassword)
        + ", connectTimeoutMillis=" + connectTimeoutMillis
        + ", authTimeoutMillis=" + authTimeoutMillis
        + ", idleTimeoutMillis=" + idleTimeoutMillis
        + ", clientAuthTimeoutMillis=" + clientAuthTimeoutMillis
        + ", backoffMinMillis=" + backoffMinMillis
        + ", backoffMaxMillis=" + backoffMaxMillis
        + ", clientQueueFrames=" + clientQueueFrames
        + ", maxFrameBytes=" + maxFrameBytes
        + ", detectTimeoutMillis=" + detectTimeoutMillis
        + ", camera=" + camera
        + ", ftpEnabled=" + ftpEnabled + ']';
  }

  private static String textOrDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  private static int parseBoundedInt(
      Map<String, String> kv, String key, int defaultValue, int min, int max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      Numbers.requireRange(key, defaultValue, min, max);
      return defaultValue;
    }
    return Numbers.parseIntInRange(key, raw, min, max);
  }

  private static boolean parseBoolean(String key, String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    String trimmed = value.trim();
    if ("true".equalsIgnoreCase(trimmed)) {
      return true;
    }
    if ("false".equalsIgnoreCase(trimmed)) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false (was " + trimmed + ')');
  }

  private static Optional<Path> parseOptionalPath(String name, String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }
}
