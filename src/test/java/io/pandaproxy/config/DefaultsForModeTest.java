package io.pandaproxy.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void runDefaultsProduceValidConfigOnceRequiredKeysAreAdded() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("run");
    Map<String, String> kv = new HashMap<>(defaults);
    kv.put("printerIp", "10.0.0.5");
    kv.put("accessCode", "12345678");

    ProxyConfig config = ProxyConfig.fromMap(kv);

    assertEquals(6000, config.proxyPort());
    assertEquals("none", defaults.get("metricsExporter"));
    assertFalse(defaults.containsKey("printerIp"));
  }

  @Test
  void detectDefaultsOmitListenerKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("DETECT");

    assertFalse(defaults.containsKey("proxyPort"));
    assertEquals("5000", defaults.get("detectTimeoutMillis"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("serve"));
  }
}
