package ca.gc.cra.rpx.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Domain port supplying wall-clock timestamps.
 * <p><strong>Why:</strong> Connection creation times come from an injectable clock so tests stay deterministic.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current time as an {@link Instant}.
   *
   * @return current instant at millisecond resolution
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
