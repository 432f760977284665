package ca.gc.cra.tbfs.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUntouched() {
    assertEquals("stderr", Logs.truncate("stderr", 16));
    assertEquals("<null>", Logs.truncate(null, 16));
  }

  @Test
  void longValuesReportOriginalLength() {
    String truncated = Logs.truncate("0123456789", 4);

    assertEquals("0123... (truncated, 4 of 10)", truncated);
  }

  @Test
  void truncationNeverSplitsMultibyteCharacters() {
    String truncated = Logs.truncate("ééé", 3);

    assertTrue(truncated.startsWith("é..."), truncated);
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
