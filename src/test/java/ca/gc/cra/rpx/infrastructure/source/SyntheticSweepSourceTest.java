package ca.gc.cra.rpx.infrastructure.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rpx.domain.spectrum.SampleBatch;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class SyntheticSweepSourceTest {

  @Test
  void batchesHaveConfiguredSize() {
    SyntheticSweepSource source = new SyntheticSweepSource(1_000_000d, 256, Duration.ofMillis(10), 42L);

    SampleBatch batch = source.nextBatch();

    assertEquals(256, batch.sampleCount());
  }

  @Test
  void sweepAdvancesAndWraps() {
    double rate = 2_000d;
    SyntheticSweepSource source = new SyntheticSweepSource(rate, 8, Duration.ofMillis(10), 1L);
    assertEquals(-rate / 2d, source.currentFrequencyHz(), 1e-9);

    source.nextBatch();
    assertEquals(-rate / 2d + rate / SyntheticSweepSource.SWEEP_STEPS, source.currentFrequencyHz(), 1e-9);

    for (int i = 1; i < SyntheticSweepSource.SWEEP_STEPS; i++) {
      source.nextBatch();
    }
    assertEquals(-rate / 2d, source.currentFrequencyHz(), 1e-6);
  }

  @Test
  void samplesStayNearUnitCircle() {
    SyntheticSweepSource source = new SyntheticSweepSource(48_000d, 64, Duration.ofMillis(10), 7L);
    float[] iq = source.nextBatch().interleaved();

    for (int n = 0; n < 64; n++) {
      double magnitude = Math.hypot(iq[2 * n], iq[2 * n + 1]);
      assertEquals(1d, magnitude, 0.01d);
    }
  }

  @Test
  void startedSourceFeedsSinkUntilClosed() throws InterruptedException {
    SyntheticSweepSource source = new SyntheticSweepSource(48_000d, 32, Duration.ofMillis(5), 3L);
    CountDownLatch delivered = new CountDownLatch(3);

    source.start(batch -> {
      delivered.countDown();
      return true;
    });
    try {
      assertTrue(delivered.await(2, TimeUnit.SECONDS));
      assertThrows(IllegalStateException.class, () -> source.start(batch -> true));
    } finally {
      source.close();
    }
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class, () -> new SyntheticSweepSource(0d, 8, Duration.ofMillis(1), 0L));
    assertThrows(IllegalArgumentException.class, () -> new SyntheticSweepSource(1d, 0, Duration.ofMillis(1), 0L));
    assertThrows(IllegalArgumentException.class, () -> new SyntheticSweepSource(1d, 8, Duration.ZERO, 0L));
  }
}
