package ca.gc.cra.rpx.validation;

/**
 * Numeric validation helpers for configuration values.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Ensures {@code value} lies within {@code [min, max]}.
   *
   * @param name configuration key used in the error message
   * @param value value to check
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException when out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Ensures {@code value} is a power of two within {@code [min, max]}.
   *
   * @return {@code value}
   * @throws IllegalArgumentException when out of range or not a power of two
   */
  public static int requirePowerOfTwo(String name, int value, int min, int max) {
    requireRange(name, value, min, max);
    if (Integer.bitCount(value) != 1) {
      throw new IllegalArgumentException(label(name) + " must be a power of two (was " + value + ")");
    }
    return value;
  }

  /**
   * Ensures {@code value} is finite and not negative.
   *
   * @return {@code value}
   */
  public static double requireFiniteNonNegative(String name, double value) {
    if (!Double.isFinite(value) || value < 0d) {
      throw new IllegalArgumentException(label(name) + " must be a finite value >= 0 (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
