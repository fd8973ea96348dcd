package io.pandaproxy.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps the container-style environment variables onto configuration keys.
 * <ul>
 *   <li>{@code PRINTER_IP} to {@code printerIp}</li>
 *   <li>{@code ACCESS_CODE} to {@code accessCode}</li>
 *   <li>{@code BIND_ADDRESS} to {@code bind}</li>
 * </ul>
 */
public final class EnvironmentConfig {
  static final Map<String, String> VARIABLES = Map.of(
      "PRINTER_IP", "printerIp",
      "ACCESS_CODE", "accessCode",
      "BIND_ADDRESS", "bind");

  private EnvironmentConfig() {}

  /** @return keys present in the process environment */
  public static Map<String, String> fromSystem() {
    return from(System.getenv());
  }

  /**
   * @param environment variables to read
   * @return configuration keys for every non-blank recognised variable
   */
  public static Map<String, String> from(Map<String, String> environment) {
    Objects.requireNonNull(environment, "environment");
    Map<String, String> mapped = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : VARIABLES.entrySet()) {
      String value = environment.get(entry.getKey());
      if (value != null && !value.isBlank()) {
        mapped.put(entry.getValue(), value.trim());
      }
    }
    return Map.copyOf(mapped);
  }
}
