package ca.gc.cra.rpx.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void escapesLineBreaks() {
    assertEquals("a\\r\\nb", Logs.truncate("a\r\nb", 64));
  }

  @Test
  void truncatesByUtf8Bytes() {
    String truncated = Logs.truncate("ééé", 3);

    assertTrue(truncated.startsWith("é... (truncated, 3 of 6)"), truncated);
  }

  @Test
  void nullIsPlaceholder() {
    assertEquals("<null>", Logs.truncate(null, 10));
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
