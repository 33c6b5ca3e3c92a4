package ca.gc.cra.rpx.application.port;

import ca.gc.cra.rpx.domain.spectrum.SampleBatch;

/**
 * Non-blocking receiver of sample batches.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SampleSink {
  /**
   * Offers a batch.
   *
   * @param batch batch produced upstream
   * @return {@code false} when the batch was dropped
   */
  boolean offer(SampleBatch batch);
}
