package ca.gc.cra.tbfs.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("hadoop", Strings.requireNonBlank("hadoopCommand", "  hadoop "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    IllegalArgumentException blank = assertThrows(IllegalArgumentException.class,
        () -> Strings.requireNonBlank("path", "   "));
    assertEquals("path must not be blank", blank.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("path", "/a\n/b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("path", null));
  }

  @Test
  void printableAsciiIsBounded() {
    assertEquals("a=b", Strings.requirePrintableAscii("attrs", "a=b", 10));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "abcdef", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "é", 10));
  }

  @Test
  void isBlankHandlesNull() {
    assertTrue(Strings.isBlank(null));
    assertTrue(Strings.isBlank(" \t"));
    assertFalse(Strings.isBlank("x"));
  }
}
