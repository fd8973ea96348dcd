package io.pandaproxy.config;

import io.pandaproxy.domain.chamber.ChamberFrameCodec;
import io.pandaproxy.domain.protocol.CameraProtocol;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>The defaults are the single source of truth for optional keys; required keys
 * ({@code printerIp}, {@code accessCode}) have no default.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode} merged with the common defaults.
   *
   * @param mode {@code run} or {@code detect}
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "run" -> buildRunDefaults();
      case "detect" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  /** @return default YAML location, {@code ~/.pandaproxy/pandaproxy.yaml} */
  public static Path defaultConfigPath() {
    String userHome = System.getProperty("user.home", ".");
    return Path.of(userHome, ".pandaproxy", "pandaproxy.yaml");
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("chamberPort", Integer.toString(CameraProtocol.CHAMBER_IMAGE.defaultPort()));
    map.put("rtspPort", Integer.toString(CameraProtocol.RTSP.defaultPort()));
    map.put("detectTimeoutMillis", Integer.toString(ProxyConfig.DEFAULT_DETECT_TIMEOUT_MILLIS));
    map.put("camera", "auto");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildRunDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("bind", ProxyConfig.DEFAULT_BIND);
    map.put("proxyPort", Integer.toString(CameraProtocol.CHAMBER_IMAGE.defaultPort()));
    map.put("tlsKeystore", "");
    map.put("tlsKeystorePassword", "");
    map.put("connectTimeoutMillis", Integer.toString(ProxyConfig.DEFAULT_CONNECT_TIMEOUT_MILLIS));
    map.put("authTimeoutMillis", Integer.toString(ProxyConfig.DEFAULT_AUTH_TIMEOUT_MILLIS));
    map.put("idleTimeoutMillis", Integer.toString(ProxyConfig.DEFAULT_IDLE_TIMEOUT_MILLIS));
    map.put("clientAuthTimeoutMillis", Integer.toString(ProxyConfig.DEFAULT_CLIENT_AUTH_TIMEOUT_MILLIS));
    map.put("backoffMinMillis", Integer.toString(ProxyConfig.DEFAULT_BACKOFF_MIN_MILLIS));
    map.put("backoffMaxMillis", Integer.toString(ProxyConfig.DEFAULT_BACKOFF_MAX_MILLIS));
    map.put("clientQueueFrames", Integer.toString(ProxyConfig.DEFAULT_CLIENT_QUEUE_FRAMES));
    map.put("maxFrameBytes", Integer.toString(ChamberFrameCodec.DEFAULT_MAX_FRAME_BYTES));
    map.put("ftpEnabled", "false");
    return Map.copyOf(map);
  }
}
