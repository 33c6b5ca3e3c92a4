package ca.gc.cra.rpx.config;

import java.util.Locale;

/**
 * Sample producer feeding the spectrum pipeline.
 *
 * @since 0.1.0
 */
public enum SampleSourceMode {
  /** No producer; batches arrive only through an embedding application. */
  NONE,
  /** Built-in sweeping tone generator. */
  SWEEP;

  /**
   * Parses a configuration value, case-insensitively.
   *
   * @param raw value; {@code null} or blank selects {@link #NONE}
   * @return parsed mode
   * @throws IllegalArgumentException for unknown values
   */
  public static SampleSourceMode fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return NONE;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("source must be one of none, sweep (was " + raw + ")", ex);
    }
  }
}
