package ca.gc.cra.uvcalc.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValuesAndMarksLongOnes() {
    assertEquals("uvspec", Logs.truncate("uvspec", 10));
    assertEquals("abc... (truncated, 3 of 6)", Logs.truncate("abcdef", 3));
    assertEquals("<null>", Logs.truncate(null, 3));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void printableEscapesControlCharacters() {
    assertEquals("dark 10\\r\\n\\t\\x1A", Logs.printable("dark 10\r\n\t\u001A"));
  }
}
