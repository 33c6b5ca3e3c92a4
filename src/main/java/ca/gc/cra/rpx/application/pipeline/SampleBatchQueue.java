package ca.gc.cra.rpx.application.pipeline;

import ca.gc.cra.rpx.application.port.MetricsPort;
import ca.gc.cra.rpx.application.port.SampleSink;
import ca.gc.cra.rpx.domain.spectrum.SampleBatch;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded hand-off between sample producers and the {@link SpectrumStreamingWorker}.
 * <p>Producers never block: when the queue is full the incoming batch is dropped and counted as
 * {@code stream.samples.dropped}. Ownership of a batch passes to the worker on {@link #poll()}.</p>
 *
 * @since 0.1.0
 */
public final class SampleBatchQueue implements SampleSink {
  private static final Logger log = LoggerFactory.getLogger(SampleBatchQueue.class);
  private static final int DROP_LOG_INTERVAL = 1_000;

  private final BlockingQueue<SampleBatch> queue;
  private final int capacity;
  private final MetricsPort metrics;
  private final AtomicInteger dropLogLimiter = new AtomicInteger();

  public SampleBatchQueue(int capacity, MetricsPort metrics) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Enqueues a batch without blocking.
   *
   * @param batch batch to hand to the worker
   * @return {@code false} when the queue was full and the batch was dropped
   */
  @Override
  public boolean offer(SampleBatch batch) {
    Objects.requireNonNull(batch, "batch");
    if (queue.offer(batch)) {
      return true;
    }
    metrics.increment("stream.samples.dropped");
    if (dropLogLimiter.getAndIncrement() % DROP_LOG_INTERVAL == 0) {
      log.warn("Sample queue full at {} batches; dropping incoming batches", capacity);
    }
    return false;
  }

  /**
   * Removes the oldest batch.
   *
   * @return the batch, or {@code null} when empty
   */
  public SampleBatch poll() {
    return queue.poll();
  }

  public int size() {
    return queue.size();
  }

  public int capacity() {
    return capacity;
  }

  /**
   * Discards all pending batches.
   *
   * @return number of batches discarded
   */
  public int clear() {
    int cleared = 0;
    while (queue.poll() != null) {
      cleared++;
    }
    return cleared;
  }
}
