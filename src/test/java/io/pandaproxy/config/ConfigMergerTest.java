package io.pandaproxy.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void precedenceIsCliThenEnvironmentThenYamlThenDefaults() {
    Map<String, String> defaults = Map.of("bind", "0.0.0.0", "proxyPort", "6000", "camera", "auto");
    Map<String, String> yaml = Map.of("printerIp", "10.0.0.5", "bind", "10.0.0.1", "proxyPort", "7000");
    Map<String, String> env = Map.of("printerIp", "10.0.0.6", "bind", "10.0.0.2");
    Map<String, String> cli = Map.of("bind", "127.0.0.1");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "run", Optional.of(yaml), env, cli, defaults, warnings::add);

    assertEquals("127.0.0.1", merged.get("bind"));
    assertEquals("10.0.0.6", merged.get("printerIp"));
    assertEquals("7000", merged.get("proxyPort"));
    assertEquals("auto", merged.get("camera"));
    assertTrue(warnings.contains("Environment overrides YAML for key: printerIp"));
    assertTrue(warnings.contains("CLI overrides YAML for key: bind"));
  }

  @Test
  void noWarningWithoutYaml() {
    List<String> warnings = new ArrayList<>();

    ConfigMerger.buildEffectiveConfig("detect", Optional.empty(),
        Map.of("printerIp", "printer.local"), Map.of("accessCode", "x"), Map.of(), warnings::add);

    assertTrue(warnings.isEmpty());
  }

  @Test
  void runModeRejectsBackoffMaxBelowMin() {
    Map<String, String> cli = Map.of("backoffMinMillis", "5000", "backoffMaxMillis", "1000");

    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "run", Optional.empty(), Map.of(), cli, DefaultsForMode.asFlatMap("run"), msg -> { }));
  }

  @Test
  void nonNumericBackoffIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "run", Optional.empty(), Map.of(), Map.of("backoffMinMillis", "soon"), Map.of(), msg -> { }));
  }
}
