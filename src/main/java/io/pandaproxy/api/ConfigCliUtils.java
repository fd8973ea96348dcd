package io.pandaproxy.api;

import io.pandaproxy.config.ConfigMerger;
import io.pandaproxy.config.DefaultsForMode;
import io.pandaproxy.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the effective configuration for a subcommand from CLI, environment, YAML and defaults.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config=PATH} argument.
   *
   * @param args mutable CLI map
   * @return configured path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Merges every configuration source for {@code mode}.
   * <p>An explicit {@code config=PATH} must exist; the default {@code ~/.pandaproxy/pandaproxy.yaml}
   * is optional.</p>
   *
   * @param mode {@code run} or {@code detect}
   * @param cli mutable CLI map; {@code config} is consumed
   * @param environment environment-derived keys
   * @return immutable effective map
   * @throws CliAbort when the YAML file cannot be used
   * @throws IllegalArgumentException when merged values fail cross-key validation
   */
  static Map<String, String> resolveEffectiveConfig(
      String mode, Map<String, String> cli, Map<String, String> environment) throws CliAbort {
    String explicit = extractConfigPath(cli);
    Optional<Map<String, String>> yaml;
    try {
      Path path = explicit != null ? Path.of(explicit) : DefaultsForMode.defaultConfigPath();
      yaml = YamlConfigLoader.load(path, mode);
      if (explicit != null && yaml.isEmpty()) {
        throw new CliAbort(ExitCode.CONFIG_ERROR, "Configuration file not found: " + explicit);
      }
    } catch (InvalidPathException ex) {
      throw new CliAbort(ExitCode.INVALID_ARGS, "config is not a valid path: " + explicit);
    } catch (IOException ex) {
      throw new CliAbort(ExitCode.IO_ERROR, "Unable to read configuration file: " + ex.getMessage());
    } catch (IllegalArgumentException ex) {
      throw new CliAbort(ExitCode.CONFIG_ERROR, ex.getMessage());
    }
    return ConfigMerger.buildEffectiveConfig(
        mode, yaml, environment, cli, DefaultsForMode.asFlatMap(mode), log::warn);
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }

  /** Stops a subcommand early with a specific exit code. */
  static final class CliAbort extends Exception {
    private static final long serialVersionUID = 1L;
    private final ExitCode exitCode;

    CliAbort(ExitCode exitCode, String message) {
      super(message);
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }
}
