package io.pandaproxy.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.pandaproxy.domain.chamber.AccessCredential;
import io.pandaproxy.domain.protocol.CameraMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProxyConfigTest {

  @Test
  void requiredKeysOnlyUsesDefaults() {
    ProxyConfig config = ProxyConfig.fromMap(required());

    assertEquals("0.0.0.0", config.bind());
    assertEquals(6000, config.chamberPort());
    assertEquals(322, config.rtspPort());
    assertEquals(6000, config.proxyPort());
    assertEquals(Duration.ofSeconds(30), config.idleTimeout());
    assertEquals(Duration.ofSeconds(1), config.backoffMin());
    assertEquals(Duration.ofSeconds(30), config.backoffMax());
    assertEquals(8, config.clientQueueFrames());
    assertEquals(CameraMode.AUTO, config.camera());
    assertFalse(config.ftpEnabled());
    assertNull(config.tlsKeystore());
    assertTrue(config.credential().matches(AccessCredential.forAccessCode("12345678")));
  }

  @Test
  void missingPrinterOrAccessCodeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ProxyConfig.fromMap(Map.of("accessCode", "1")));
    assertThrows(IllegalArgumentException.class,
        () -> ProxyConfig.fromMap(Map.of("printerIp", "10.0.0.5")));
    assertThrows(IllegalArgumentException.class, () -> ProxyConfig.fromMap(null));
  }

  @Test
  void parsesOverrides() {
    Map<String, String> kv = required();
    kv.put("bind", "::");
    kv.put("proxyPort", "0");
    kv.put("camera", "rtsp");
    kv.put("ftpEnabled", "TRUE");
    kv.put("tlsKeystore", "proxy.p12");
    kv.put("clientQueueFrames", "32");

    ProxyConfig config = ProxyConfig.fromMap(kv);

    assertEquals("::", config.bind());
    assertEquals(0, config.proxyPort());
    assertEquals(CameraMode.RTSP, config.camera());
    assertTrue(config.ftpEnabled());
    assertEquals(Path.of("proxy.p12").toAbsolutePath().normalize(), config.tlsKeystore());
    assertEquals(32, config.clientQueueFrames());
  }

  @Test
  void rejectsOutOfRangeValues() {
    for (String[] invalid : new String[][] {
        {"proxyPort", "70000"},
        {"chamberPort", "0"},
        {"idleTimeoutMillis", "5"},
        {"clientQueueFrames", "0"},
        {"maxFrameBytes", "10"},
        {"ftpEnabled", "yes"},
        {"camera", "mjpeg"},
        {"camera", "unknown"},
        {"accessCode", "x".repeat(33)},
        {"printerIp", "bad host!"}}) {
      Map<String, String> kv = required();
      kv.put(invalid[0], invalid[1]);
      assertThrows(IllegalArgumentException.class, () -> ProxyConfig.fromMap(kv), invalid[0]);
    }
  }

  @Test
  void backoffMaxBelowMinIsRejected() {
    Map<String, String> kv = required();
    kv.put("backoffMinMillis", "2000");
    kv.put("backoffMaxMillis", "1000");

    assertThrows(IllegalArgumentException.class, () -> ProxyConfig.fromMap(kv));
  }

  @Test
  void toStringRedactsSecrets() {
    Map<String, String> kv = required();
    kv.put("tlsKeystorePassword", "hunter2hunter2");

    String rendered = ProxyConfig.fromMap(kv).toString();

    assertFalse(rendered.contains("12345678"));
    assertFalse(rendered.contains("hunter2hunter2"));
  }

  private static Map<String, String> required() {
    Map<String, String> kv = new HashMap<>();
    kv.put("printerIp", "10.0.0.5");
    kv.put("accessCode", "12345678");
    return kv;
  }
}
