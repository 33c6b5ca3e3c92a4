package ca.gc.cra.rpx.infrastructure.source;

import ca.gc.cra.rpx.application.port.SampleSink;
import ca.gc.cra.rpx.application.port.SampleSource;
import ca.gc.cra.rpx.domain.spectrum.SampleBatch;
import ca.gc.cra.rpx.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sample source producing a complex sinusoid whose frequency sweeps across the full band, plus low-level noise.
 * <p>Used to exercise the spectrum pipeline without radio hardware. Each batch advances the tone by
 * {@code sampleRate / SWEEP_STEPS} Hz, wrapping from {@code +sampleRate/2} back to {@code -sampleRate/2}; phase is
 * continuous across batches.</p>
 *
 * @since 0.1.0
 */
public final class SyntheticSweepSource implements SampleSource {
  private static final Logger log = LoggerFactory.getLogger(SyntheticSweepSource.class);

  static final int SWEEP_STEPS = 200;
  private static final double NOISE_AMPLITUDE = 1.0e-3;

  private final double sampleRate;
  private final int batchSize;
  private final Duration interval;
  private final SplittableRandom random;
  private final AtomicBoolean started = new AtomicBoolean();
  private double frequencyHz;
  private double phase;
  private volatile ScheduledExecutorService scheduler;

  /**
   * Creates a sweep source.
   *
   * @param sampleRate samples per second; sets the swept band
   * @param batchSize complex samples per batch
   * @param interval delay between batches
   * @param seed noise seed
   */
  public SyntheticSweepSource(double sampleRate, int batchSize, Duration interval, long seed) {
    if (!(sampleRate > 0d) || Double.isInfinite(sampleRate)) {
      throw new IllegalArgumentException("sampleRate must be positive");
    }
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive");
    }
    this.interval = Objects.requireNonNull(interval, "interval");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    this.sampleRate = sampleRate;
    this.batchSize = batchSize;
    this.random = new SplittableRandom(seed);
    this.frequencyHz = -sampleRate / 2d;
  }

  @Override
  public void start(SampleSink sink) {
    Objects.requireNonNull(sink, "sink");
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Sweep source already started");
    }
    ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor(
        ExecutorFactories.namedThreadFactory("rpx-sweep", true, null));
    this.scheduler = exec;
    long periodMicros = TimeUnit.NANOSECONDS.toMicros(interval.toNanos());
    exec.scheduleAtFixedRate(() -> produce(sink), 0L, Math.max(1L, periodMicros), TimeUnit.MICROSECONDS);
    log.info("Synthetic sweep started: {} Hz sample rate, {} samples every {} ms",
        (long) sampleRate, batchSize, interval.toMillis());
  }

  @Override
  public void close() {
    ScheduledExecutorService exec = scheduler;
    if (exec == null) {
      return;
    }
    scheduler = null;
    exec.shutdownNow();
    log.debug("Synthetic sweep stopped");
  }

  /**
   * Generates the next batch and advances the sweep.
   *
   * @return batch of {@code batchSize} samples
   */
  synchronized SampleBatch nextBatch() {
    float[] iq = new float[batchSize * 2];
    double step = 2.0 * Math.PI * frequencyHz / sampleRate;
    for (int n = 0; n < batchSize; n++) {
      iq[2 * n] = (float) (Math.cos(phase) + noise());
      iq[2 * n + 1] = (float) (Math.sin(phase) + noise());
      phase += step;
    }
    phase %= 2.0 * Math.PI;
    frequencyHz += sampleRate / SWEEP_STEPS;
    if (frequencyHz >= sampleRate / 2d) {
      frequencyHz -= sampleRate;
    }
    return new SampleBatch(iq);
  }

  synchronized double currentFrequencyHz() {
    return frequencyHz;
  }

  private double noise() {
    return (random.nextDouble() * 2d - 1d) * NOISE_AMPLITUDE;
  }

  private void produce(SampleSink sink) {
    try {
      sink.offer(nextBatch());
    } catch (RuntimeException ex) {
      log.error("Synthetic sweep failed to deliver batch", ex);
    }
  }
}
