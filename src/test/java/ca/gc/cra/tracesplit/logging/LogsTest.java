package ca.gc.cra.tracesplit.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void previewShowsLeadingValuesAndRemainder() {
    assertEquals("[4, 9, ... (+2 more)]", Logs.preview(new int[] {4, 9, 1, 7}, 2));
    assertEquals("[4, 9]", Logs.preview(new int[] {4, 9}, 5));
    assertEquals("[]", Logs.preview(new int[0], 3));
    assertEquals("<null>", Logs.preview(null, 3));
  }

  @Test
  void truncateMarksLength() {
    assertEquals("abc", Logs.truncate("abc", 3));
    assertEquals("ab... (truncated, 2 of 5)", Logs.truncate("abcde", 2));
    assertEquals("<null>", Logs.truncate(null, 2));
  }

  @Test
  void rejectsNonPositiveLimits() {
    assertThrows(IllegalArgumentException.class, () -> Logs.preview(new int[] {1}, 0));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
