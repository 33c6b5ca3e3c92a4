package ca.gc.cra.rpx.domain.spectrum;

/**
 * Lifecycle of the spectrum streaming worker. Transitions only move forward:
 * {@code CREATED -> RUNNING -> STOPPING -> TERMINATED}; {@code CREATED -> STOPPING} is allowed when a stop is
 * requested before the loop starts.
 *
 * @since 0.1.0
 */
public enum WorkerState {
  /** Constructed but not yet running. */
  CREATED,
  /** Loop is active. */
  RUNNING,
  /** Stop requested; the loop exits after its current wait returns. */
  STOPPING,
  /** Loop has exited, normally or exceptionally. */
  TERMINATED;

  /**
   * Indicates whether moving from this state to {@code next} keeps the lifecycle monotonic.
   *
   * @param next candidate state
   * @return {@code true} when the transition is permitted
   */
  public boolean canAdvanceTo(WorkerState next) {
    return next != null && next.ordinal() > ordinal();
  }
}
