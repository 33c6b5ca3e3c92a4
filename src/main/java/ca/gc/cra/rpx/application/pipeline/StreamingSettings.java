package ca.gc.cra.rpx.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for the {@link SpectrumStreamingWorker}.
 *
 * @param nfft transform size and bin count of every broadcast frame; power of two
 * @param lowWaterMark a batch is consumed only when more than this many are queued
 * @param reactorTimeout upper bound on one wait for transport activity; bounds shutdown latency
 * @since 0.1.0
 */
public record StreamingSettings(int nfft, int lowWaterMark, Duration reactorTimeout) {
  public static final int DEFAULT_NFFT = 512;
  public static final int DEFAULT_LOW_WATER_MARK = 5;
  public static final Duration DEFAULT_REACTOR_TIMEOUT = Duration.ofMillis(100);

  public StreamingSettings {
    if (nfft <= 0 || Integer.bitCount(nfft) != 1) {
      throw new IllegalArgumentException("nfft must be a positive power of two (was " + nfft + ')');
    }
    if (lowWaterMark < 0) {
      throw new IllegalArgumentException("lowWaterMark must be >= 0");
    }
    Objects.requireNonNull(reactorTimeout, "reactorTimeout");
    if (reactorTimeout.isZero() || reactorTimeout.isNegative()) {
      throw new IllegalArgumentException("reactorTimeout must be positive");
    }
  }

  public static StreamingSettings defaults() {
    return new StreamingSettings(DEFAULT_NFFT, DEFAULT_LOW_WATER_MARK, DEFAULT_REACTOR_TIMEOUT);
  }
}
