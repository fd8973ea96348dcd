package io.pandaproxy.domain.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class CameraModeTest {

  @Test
  void parsesConfiguredValues() {
    assertEquals(CameraMode.AUTO, CameraMode.fromConfig(null));
    assertEquals(CameraMode.AUTO, CameraMode.fromConfig("  "));
    assertEquals(CameraMode.AUTO, CameraMode.fromConfig("Auto"));
    assertEquals(CameraMode.CHAMBER_IMAGE, CameraMode.fromConfig("chamber"));
    assertEquals(CameraMode.CHAMBER_IMAGE, CameraMode.fromConfig("CHAMBER_IMAGE"));
    assertEquals(CameraMode.RTSP, CameraMode.fromConfig(" rtsp "));
  }

  @Test
  void autoForcesNothing() {
    assertTrue(CameraMode.AUTO.forced().isEmpty());
    assertEquals(Optional.of(CameraProtocol.CHAMBER_IMAGE), CameraMode.CHAMBER_IMAGE.forced());
    assertEquals(Optional.of(CameraProtocol.RTSP), CameraMode.RTSP.forced());
  }

  @Test
  void detectionOutcomeNamesAreNotConfigurationValues() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> CameraMode.fromConfig("unknown"));
    assertTrue(ex.getMessage().contains("unknown"));
  }
}
