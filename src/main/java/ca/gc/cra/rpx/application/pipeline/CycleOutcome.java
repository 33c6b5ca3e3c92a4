package ca.gc.cra.rpx.application.pipeline;

/**
 * Result of one {@link SpectrumStreamingWorker} cycle.
 *
 * @since 0.1.0
 */
public enum CycleOutcome {
  /** Queue depth at or below the low-water mark; nothing consumed. */
  IDLE,
  /** A batch was consumed but no client is connected, so no spectrum was computed. */
  UNSUBSCRIBED,
  /** A spectrum was computed and broadcast. */
  BROADCAST
}
