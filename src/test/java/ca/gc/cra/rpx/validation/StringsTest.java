package ca.gc.cra.rpx.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("localhost", Strings.requireNonBlank("bindHost", "  localhost "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("bindHost", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("bindHost", "local\nhost"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("bindHost", null));
  }

  @Test
  void requireTokenAllowsSafeCharacters() {
    assertEquals("logs.read-1_x", Strings.requireToken("permission", "logs.read-1_x"));
  }

  @Test
  void requireTokenRejectsSeparators() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireToken("permission", "logs read"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireToken("permission", "logs;read"));
  }
}
