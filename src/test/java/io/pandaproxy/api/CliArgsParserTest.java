package io.pandaproxy.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "printerIp=192.168.1.50", "otelResourceAttributes=site=lab,rack=2", "tlsKeystorePassword="});

    assertEquals("192.168.1.50", map.get("printerIp"));
    assertEquals("site=lab,rack=2", map.get("otelResourceAttributes"));
    assertEquals("", map.get("tlsKeystorePassword"));
    assertEquals(List.of("printerIp", "otelResourceAttributes", "tlsKeystorePassword"),
        List.copyOf(map.keySet()));
  }

  @Test
  void nullArgsGiveEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"printerIp"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=x"}));
    assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"accessCode=12\u000134"}));
  }
}
