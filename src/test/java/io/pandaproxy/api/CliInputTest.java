package io.pandaproxy.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.pandaproxy.api.CliInput.Switch;
import java.util.List;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void splitsCommandSwitchesAndSettings() {
    CliInput input = CliInput.parse(new String[] {"Run", "--DRY-RUN", "-v", "printerIp=10.0.0.5", " "});

    assertEquals("run", input.command());
    assertTrue(input.verbose());
    assertTrue(input.has(Switch.DRY_RUN));
    assertFalse(input.help());
    assertEquals(List.of("printerIp=10.0.0.5"), input.settings());
    assertEquals(List.of("--DRY-RUN", "-v", "printerIp=10.0.0.5"), input.afterCommand());
  }

  @Test
  void leadingSettingMeansNoCommand() {
    CliInput input = CliInput.parse(new String[] {"printerIp=10.0.0.5", "accessCode=12345678"});

    assertNull(input.command());
    assertArrayEquals(new String[] {"printerIp=10.0.0.5", "accessCode=12345678"}, input.settingArgs());
  }

  @Test
  void strayWordIsLeftForTheSettingsParser() {
    CliInput input = CliInput.parse(new String[] {"extra", "proxyPort=6001"});

    assertArrayEquals(new String[] {"extra", "proxyPort=6001"}, input.settingArgs());
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(input.settingArgs()));
  }

  @Test
  void recognisesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"detect", "--help"}).help());
    assertEquals(0, CliInput.parse(new String[] {"help"}).settingArgs().length);
    assertFalse(CliInput.parse(null).help());
    assertTrue(CliInput.parse(new String[] {null, ""}).isEmpty());
  }

  @Test
  void unknownSwitchIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliInput.parse(new String[] {"run", "--dryrun"}));
    assertTrue(ex.getMessage().contains("--dryrun"));
  }

  @Test
  void dashedValueInsideSettingIsNotASwitch() {
    CliInput input = CliInput.parse(new String[] {"run", "-x=1"});

    assertTrue(input.switches().isEmpty());
    assertEquals(List.of("-x=1"), input.settings());
  }
}
