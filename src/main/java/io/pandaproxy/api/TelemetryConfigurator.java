package io.pandaproxy.api;

import io.pandaproxy.infrastructure.metrics.TelemetrySettings;
import io.pandaproxy.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates the metrics keys of the effective configuration and turns them into exporter settings.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * @param effective merged configuration
   * @return settings for {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}
   * @throws IllegalArgumentException for an unknown exporter, a non-http(s) endpoint or
   *     non-printable resource attributes
   */
  static TelemetrySettings settingsFrom(Map<String, String> effective) {
    String exporter = trimmed(effective, "metricsExporter").toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    String endpoint = trimmed(effective, "otelEndpoint");
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
    }
    String attributes = trimmed(effective, "otelResourceAttributes");
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    log.debug("Metrics exporter '{}' endpoint '{}'", exporter.isEmpty() ? "<default>" : exporter,
        endpoint.isEmpty() ? "<default>" : endpoint);
    return new TelemetrySettings(exporter, endpoint, attributes);
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String trimmed(Map<String, String> map, String key) {
    String value = map == null ? null : map.get(key);
    return value == null ? "" : value.trim();
  }
}
