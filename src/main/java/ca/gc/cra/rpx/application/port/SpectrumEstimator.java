package ca.gc.cra.rpx.application.port;

/**
 * <strong>What:</strong> Domain port computing a power spectrum from complex samples.
 * <p><strong>Why:</strong> Keeps the numerical periodogram swappable (pure-Java FFT, native DSP, test stubs).</p>
 * <p><strong>Role:</strong> Driven port implemented by {@code PeriodogramEstimator}.</p>
 * <p><strong>Thread-safety:</strong> The streaming worker calls estimators from one thread under its own lock;
 * implementations need not be thread-safe.</p>
 * <p><strong>Performance:</strong> Called once per broadcast cycle on the streaming thread.</p>
 *
 * @since 0.1.0
 */
public interface SpectrumEstimator {
  /**
   * Estimates the power spectrum of the first {@code sampleCount} complex samples.
   *
   * @param interleavedIq working buffer laid out as {@code [i0, q0, i1, q1, ...]}; not modified
   * @param sampleCount number of complex samples to consume from the buffer
   * @param nfft transform size
   * @return exactly {@code nfft} power values in bin order
   */
  float[] estimate(float[] interleavedIq, int sampleCount, int nfft);
}
