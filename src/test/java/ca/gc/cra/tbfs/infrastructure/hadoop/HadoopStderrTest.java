package ca.gc.cra.tbfs.infrastructure.hadoop;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class HadoopStderrTest {

  @Test
  void dropsInfoAndWarnLines() {
    String stderr = String.join("\n",
        "24/01/01 10:00:00 INFO streaming.DumpTypedBytes: starting",
        "24/01/01 10:00:01 WARN util.NativeCodeLoader: Unable to load native-hadoop library",
        "ls: Cannot access /x: No such file or directory.");

    assertEquals("ls: Cannot access /x: No such file or directory.", HadoopStderr.clean(stderr));
  }

  @Test
  void keepsErrorsAndShortLines() {
    assertEquals("24/01/01 10:00:00 ERROR fs.FsShell: boom\nfail",
        HadoopStderr.clean("24/01/01 10:00:00 ERROR fs.FsShell: boom\nfail"));
  }

  @Test
  void nullOrEmptyBecomesEmpty() {
    assertEquals("", HadoopStderr.clean(null));
    assertEquals("", HadoopStderr.clean(""));
  }

  @Test
  void routineDetectionUsesThirdToken() {
    assertTrue(HadoopStderr.isRoutine("  24/01/01 10:00:00 INFO x"));
    assertFalse(HadoopStderr.isRoutine("INFO only"));
    assertFalse(HadoopStderr.isRoutine("a b INFORMATION"));
  }
}
