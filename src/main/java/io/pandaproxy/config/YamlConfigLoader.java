package io.pandaproxy.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the optional YAML configuration file.
 * <p>Only two top-level sections are read: {@code common} and the section named after the CLI
 * mode ({@code run} or {@code detect}); the mode section wins on conflicts. Nested mappings are
 * flattened with dotted keys. Example:</p>
 * <pre>
 * common:
 *   printerIp: 192.168.1.50
 *   accessCode: "12345678"
 * run:
 *   proxyPort: 6000
 *   tlsKeystore: /etc/pandaproxy/proxy.p12
 * </pre>
 */
public final class YamlConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);
  private static final Set<String> KNOWN_SECTIONS = Set.of("common", "run", "detect");

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and merges its {@code common} section with the {@code mode} section.
   *
   * @param path location of the YAML file; a leading {@code ~} expands to the user's home
   * @param mode CLI mode ({@code run} or {@code detect})
   * @return flat key/value map, or empty when the file does not exist
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or not shaped as sections of scalars
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    Path resolved = expandHome(path);
    if (!Files.exists(resolved)) {
      log.debug("No configuration file at {}", resolved);
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(resolved, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + resolved, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Object> root = asMap(document, "root");
    Map<String, Object> sections = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      String section = entry.getKey().trim().toLowerCase(Locale.ROOT);
      if (!KNOWN_SECTIONS.contains(section)) {
        log.warn("Ignoring unknown section '{}' in {}", entry.getKey(), resolved);
        continue;
      }
      sections.put(section, entry.getValue());
    }

    Map<String, String> flattened = new LinkedHashMap<>();
    flattenSection(sections.get("common"), "common", flattened);
    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    flattenSection(sections.get(normalizedMode), normalizedMode, flattened);
    log.info("Loaded {} configuration keys from {}", flattened.size(), resolved);
    return Optional.of(Map.copyOf(flattened));
  }

  static Path expandHome(Path path) {
    String raw = path.toString();
    if (raw.equals("~") || raw.startsWith("~/")) {
      String home = System.getProperty("user.home", ".");
      return Path.of(home + raw.substring(1));
    }
    return path;
  }

  private static void flattenSection(Object section, String name, Map<String, String> target) {
    if (section == null) {
      return;
    }
    flatten(asMap(section, name), "", target);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String composite = prefix.isEmpty() ? entry.getKey() : prefix + '.' + entry.getKey();
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
