package io.pandaproxy.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration sources with precedence CLI > environment > YAML > defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param environment keys derived from environment variables
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer told when a higher source overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when cross-key validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> environment,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    overlay(merged, environment, yamlCopy, "Environment", warn);
    overlay(merged, cli, yamlCopy, "CLI", warn);

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void overlay(
      Map<String, String> merged,
      Map<String, String> source,
      Map<String, String> yaml,
      String label,
      Consumer<String> warn) {
    if (source == null) {
      return;
    }
    for (Map.Entry<String, String> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yaml.containsKey(key) && warn != null) {
        warn.accept(label + " overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }
  }

  private static void validate(String mode, Map<String, String> effective) {
    if (!"run".equalsIgnoreCase(mode)) {
      return;
    }
    long min = parseLong(effective, "backoffMinMillis");
    long max = parseLong(effective, "backoffMaxMillis");
    if (min > 0 && max > 0 && max < min) {
      throw new IllegalArgumentException(
          "backoffMaxMillis (" + max + ") must be >= backoffMinMillis (" + min + ')');
    }
  }

  private static long parseLong(Map<String, String> effective, String key) {
    String raw = effective.get(key);
    if (raw == null || raw.isBlank()) {
      return -1L;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be numeric (was " + raw.trim() + ')', ex);
    }
  }
}
