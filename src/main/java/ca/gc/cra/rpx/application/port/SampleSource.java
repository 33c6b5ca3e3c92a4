package ca.gc.cra.rpx.application.port;

/**
 * <strong>What:</strong> Domain port over the radio front end producing complex sample batches.
 * <p><strong>Why:</strong> The spectrum pipeline only sees batches on a bounded queue; the producer may be hardware,
 * a file replay or a synthetic generator.</p>
 * <p><strong>Thread-safety:</strong> Implementations produce on their own thread and must never block in
 * {@link SampleSink#offer}.</p>
 *
 * @since 0.1.0
 */
public interface SampleSource extends AutoCloseable {
  /**
   * Starts producing into {@code sink}.
   *
   * @param sink destination for produced batches
   */
  void start(SampleSink sink);

  /**
   * Stops producing and releases resources. Idempotent.
   */
  @Override
  void close();

  /** Source that never produces; used when no front end is configured. */
  SampleSource NONE = new SampleSource() {
    @Override public void start(SampleSink sink) {}

    @Override public void close() {}
  };
}
