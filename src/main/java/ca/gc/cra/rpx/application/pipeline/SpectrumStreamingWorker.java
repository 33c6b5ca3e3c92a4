package ca.gc.cra.rpx.application.pipeline;

import ca.gc.cra.rpx.application.port.MetricsPort;
import ca.gc.cra.rpx.application.port.SpectrumEstimator;
import ca.gc.cra.rpx.application.port.TransportPort;
import ca.gc.cra.rpx.application.session.BroadcastRouter;
import ca.gc.cra.rpx.application.session.RegistryListener;
import ca.gc.cra.rpx.domain.session.Connection;
import ca.gc.cra.rpx.domain.spectrum.SampleBatch;
import ca.gc.cra.rpx.domain.spectrum.SpectrumFrame;
import ca.gc.cra.rpx.domain.spectrum.Tuning;
import ca.gc.cra.rpx.domain.spectrum.WorkerState;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Drains sample batches, estimates their power spectrum and broadcasts it to every connected client.
 *
 * <p>Each cycle first waits on the transport's activity signal for at most
 * {@link StreamingSettings#reactorTimeout()}, which sets both the pipeline cadence and the worst-case delay between
 * {@link #terminate()} and loop exit. A batch is consumed only while more than
 * {@link StreamingSettings#lowWaterMark()} batches are queued; shallower queues make the cycle a no-op, trading
 * some data for bounded latency.</p>
 *
 * <p>Subscribers are counted rather than flagged: the worker registers as a {@link RegistryListener}, so the
 * count rises on every connect and falls on every removal. The DSP step and the count updates share one lock.</p>
 *
 * <p>The stopping and terminated flags are atomics readable without blocking. On loop exit, normal or
 * exceptional, stopping is set before terminated, so observers never see terminated without stopping. Instances
 * run at most once.</p>
 *
 * @since 0.1.0
 */
public final class SpectrumStreamingWorker implements RegistryListener {
  private static final Logger log = LoggerFactory.getLogger(SpectrumStreamingWorker.class);

  private final SampleBatchQueue queue;
  private final SpectrumEstimator estimator;
  private final SpectrumPayloadEncoder encoder;
  private final BroadcastRouter router;
  private final TransportPort transport;
  private final MetricsPort metrics;
  private final StreamingSettings settings;

  // Grown to the largest batch seen; only touched under dspLock.
  private float[] workingBuffer;
  private final ReentrantLock dspLock = new ReentrantLock();
  private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.CREATED);
  private final AtomicBoolean stopping = new AtomicBoolean();
  private final AtomicBoolean terminated = new AtomicBoolean();
  private final AtomicLong framesBroadcast = new AtomicLong();
  private int subscribers;
  private volatile Tuning tuning;

  /**
   * Creates a worker.
   *
   * @param queue bounded sample queue filled by producers
   * @param estimator spectral estimator invoked once per broadcast cycle
   * @param encoder payload encoder
   * @param router router receiving each encoded frame
   * @param transport transport whose activity signal paces the loop
   * @param metrics metrics sink; {@code null} falls back to {@link MetricsPort#NO_OP}
   * @param settings transform size, low-water mark and wait bound
   * @param initialTuning center and span reported with each frame
   */
  public SpectrumStreamingWorker(
      SampleBatchQueue queue,
      SpectrumEstimator estimator,
      SpectrumPayloadEncoder encoder,
      BroadcastRouter router,
      TransportPort transport,
      MetricsPort metrics,
      StreamingSettings settings,
      Tuning initialTuning) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.estimator = Objects.requireNonNull(estimator, "estimator");
    this.encoder = Objects.requireNonNull(encoder, "encoder");
    this.router = Objects.requireNonNull(router, "router");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.settings = Objects.requireNonNull(settings, "settings");
    this.tuning = Objects.requireNonNull(initialTuning, "initialTuning");
    this.workingBuffer = new float[settings.nfft() * 2];
  }

  /**
   * Runs the streaming loop on the calling thread until {@link #terminate()} or interruption.
   *
   * @throws IllegalStateException if the worker already ran
   * @throws RuntimeException any estimator, encoder or router failure, after both flags are set
   */
  public void run() {
    if (!state.compareAndSet(WorkerState.CREATED, WorkerState.RUNNING)) {
      if (state.get() == WorkerState.STOPPING) {
        markTerminated();
        return;
      }
      throw new IllegalStateException("Spectrum worker already " + state.get());
    }
    MDC.put("pipeline", "spectrum");
    log.info("Spectrum worker started (nfft={}, lowWaterMark={}, timeout={}ms)",
        settings.nfft(), settings.lowWaterMark(), settings.reactorTimeout().toMillis());
    try {
      while (!stopping.get()) {
        try {
          transport.awaitActivity(settings.reactorTimeout());
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          log.info("Spectrum worker interrupted; stopping");
          break;
        }
        if (stopping.get()) {
          break;
        }
        cycle();
      }
      log.info("Spectrum worker stopped after {} frames", framesBroadcast.get());
    } catch (RuntimeException | Error ex) {
      metrics.increment("stream.worker.failed");
      log.error("Spectrum worker failed after {} frames", framesBroadcast.get(), ex);
      throw ex;
    } finally {
      markTerminated();
      MDC.remove("pipeline");
    }
  }

  /**
   * Executes one cycle without waiting on the transport.
   *
   * @return what the cycle did
   */
  CycleOutcome cycle() {
    int depth = queue.size();
    metrics.observe("stream.queue.depth", depth);
    if (depth <= settings.lowWaterMark()) {
      metrics.increment("stream.cycle.idle");
      return CycleOutcome.IDLE;
    }
    SampleBatch batch = queue.poll();
    if (batch == null) {
      metrics.increment("stream.cycle.idle");
      return CycleOutcome.IDLE;
    }
    float[] powers;
    dspLock.lock();
    try {
      if (subscribers == 0) {
        metrics.increment("stream.cycle.unsubscribed");
        return CycleOutcome.UNSUBSCRIBED;
      }
      int sampleCount = batch.copyInto(workingBufferFor(batch));
      long started = System.nanoTime();
      powers = estimator.estimate(workingBuffer, sampleCount, settings.nfft());
      metrics.observe("stream.estimate.latencyNanos", System.nanoTime() - started);
    } finally {
      dspLock.unlock();
    }
    if (powers == null || powers.length != settings.nfft()) {
      throw new IllegalStateException("Estimator returned "
          + (powers == null ? "null" : powers.length + " bins") + ", expected " + settings.nfft());
    }
    String payload = encoder.encode(new SpectrumFrame(tuning, powers));
    router.broadcast(payload);
    framesBroadcast.incrementAndGet();
    metrics.increment("stream.frames.broadcast");
    return CycleOutcome.BROADCAST;
  }

  private float[] workingBufferFor(SampleBatch batch) {
    int required = Math.max(settings.nfft(), batch.sampleCount()) * 2;
    if (workingBuffer.length < required) {
      workingBuffer = new float[required];
    } else {
      Arrays.fill(workingBuffer, 0f);
    }
    return workingBuffer;
  }

  /**
   * Requests the loop to stop. Returns immediately; the loop exits after its current wait.
   */
  public void terminate() {
    stopping.set(true);
    advance(WorkerState.STOPPING);
  }

  public boolean isStopping() {
    return stopping.get();
  }

  public boolean isTerminated() {
    return terminated.get();
  }

  public WorkerState state() {
    return state.get();
  }

  /**
   * Registers one more subscriber.
   */
  public void onClientConnect() {
    dspLock.lock();
    try {
      subscribers++;
    } finally {
      dspLock.unlock();
    }
  }

  /**
   * Removes one subscriber; the count never drops below zero.
   */
  public void onClientDisconnect() {
    dspLock.lock();
    try {
      if (subscribers > 0) {
        subscribers--;
      }
    } finally {
      dspLock.unlock();
    }
  }

  public int subscriberCount() {
    dspLock.lock();
    try {
      return subscribers;
    } finally {
      dspLock.unlock();
    }
  }

  @Override
  public void connectionAdded(Connection connection) {
    onClientConnect();
  }

  @Override
  public void connectionRemoved(Connection connection) {
    onClientDisconnect();
  }

  /**
   * Changes the center and span reported with subsequent frames.
   *
   * @param next new tuning
   */
  public void retune(Tuning next) {
    this.tuning = Objects.requireNonNull(next, "next");
    log.info("Retuned to center={}Hz span={}Hz", next.centerFrequencyHz(), next.spanHz());
  }

  public Tuning tuning() {
    return tuning;
  }

  public long framesBroadcast() {
    return framesBroadcast.get();
  }

  public StreamingSettings settings() {
    return settings;
  }

  private void markTerminated() {
    stopping.set(true);
    terminated.set(true);
    advance(WorkerState.TERMINATED);
  }

  private void advance(WorkerState next) {
    WorkerState current;
    do {
      current = state.get();
      if (!current.canAdvanceTo(next)) {
        return;
      }
    } while (!state.compareAndSet(current, next));
  }
}
