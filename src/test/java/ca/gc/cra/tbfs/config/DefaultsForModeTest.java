package ca.gc.cra.tbfs.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void readDefaultsAreUnlimitedToStdout() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("readtb");

    assertEquals("0", defaults.get("limit"));
    assertEquals("", defaults.get("out"));
    assertEquals("10", defaults.get("readers"));
    assertEquals("none", defaults.get("metricsExporter"));
  }

  @Test
  void modesOnlyCarryTheirOwnKeys() {
    assertFalse(DefaultsForMode.asFlatMap("fs").containsKey("limit"));
    assertFalse(DefaultsForMode.asFlatMap("writetb").containsKey("out"));
    assertEquals("", DefaultsForMode.asFlatMap("WRITETB").get("in"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
