package ca.gc.cra.rpx.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("ioThreads", 10, 1, 64));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("ioThreads", 0, 1, 64));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("ioThreads", 65, 1, 64));
  }

  @Test
  void requirePowerOfTwoAcceptsPowers() {
    assertEquals(512, Numbers.requirePowerOfTwo("nfft", 512, 16, 65_536));
  }

  @Test
  void requirePowerOfTwoRejectsOthers() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requirePowerOfTwo("nfft", 500, 16, 65_536));
    assertEquals("nfft must be a power of two (was 500)", ex.getMessage());
  }

  @Test
  void requireFiniteNonNegativeRejectsNaNAndNegatives() {
    assertEquals(0d, Numbers.requireFiniteNonNegative("spanHz", 0d));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireFiniteNonNegative("spanHz", -1d));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireFiniteNonNegative("spanHz", Double.NaN));
  }
}
