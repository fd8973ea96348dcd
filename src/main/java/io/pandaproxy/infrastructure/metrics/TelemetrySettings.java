package io.pandaproxy.infrastructure.metrics;

import java.util.Locale;

/**
 * Exporter options taken from the proxy configuration.
 * <p>Blank values fall back to the standard {@code otel.*} system properties and {@code OTEL_*}
 * environment variables, then to built-in defaults.</p>
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP gRPC endpoint
 * @param resourceAttributes comma-separated {@code key=value} resource attributes
 */
public record TelemetrySettings(String exporter, String endpoint, String resourceAttributes) {
  public TelemetrySettings {
    exporter = exporter == null ? "" : exporter.trim().toLowerCase(Locale.ROOT);
    endpoint = endpoint == null ? "" : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /** @return settings that disable export */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings("none", "", "");
  }
}
