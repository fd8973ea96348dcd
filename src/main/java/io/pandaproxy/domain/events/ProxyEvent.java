package io.pandaproxy.domain.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured lifecycle event handed to the observability sink.
 *
 * @param timestamp time the event was observed
 * @param type event kind
 * @param attributes ordered string attributes (never credentials or payload bytes)
 * @since 0.1.0
 */
public record ProxyEvent(Instant timestamp, ProxyEventType type, Map<String, String> attributes) {

  public ProxyEvent {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(type, "type");
    attributes = attributes == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  /**
   * Convenience factory for events with a handful of attributes given as alternating key/value pairs.
   *
   * @param timestamp event time
   * @param type event kind
   * @param keyValues alternating keys and values; values are rendered with {@link String#valueOf(Object)}
   * @return event
   * @throws IllegalArgumentException when an odd number of arguments is supplied
   */
  public static ProxyEvent of(Instant timestamp, ProxyEventType type, Object... keyValues) {
    if (keyValues.length % 2 != 0) {
      throw new IllegalArgumentException("keyValues must contain key/value pairs");
    }
    Map<String, String> attributes = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      attributes.put(String.valueOf(keyValues[i]), String.valueOf(keyValues[i + 1]));
    }
    return new ProxyEvent(timestamp, type, attributes);
  }
}
