package ca.gc.cra.rpx.domain.spectrum;

import java.util.Arrays;

/**
 * <strong>What:</strong> Ordered chunk of complex baseband samples produced by the radio front end.
 * <p><strong>Why:</strong> Gives the streaming worker a self-contained unit of work it can own after dequeue.</p>
 * <p><strong>Role:</strong> Domain value object handed from sample producers to the spectrum pipeline.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the interleaved array is copied on construction and on access
 * through {@link #interleaved()}.</p>
 * <p><strong>Performance:</strong> Use {@link #copyInto(float[])} on the hot path to avoid the defensive copy.</p>
 *
 * @param interleaved samples as {@code [i0, q0, i1, q1, ...]}; length must be even
 * @since 0.1.0
 */
public record SampleBatch(float[] interleaved) {

  /**
   * Validates the sample layout and defensively copies the array.
   */
  public SampleBatch {
    interleaved = interleaved != null ? interleaved.clone() : new float[0];
    if ((interleaved.length & 1) != 0) {
      throw new IllegalArgumentException(
          "interleaved I/Q array must have even length (was " + interleaved.length + ')');
    }
  }

  /**
   * Builds a batch from separate in-phase and quadrature arrays.
   *
   * @param inPhase real parts
   * @param quadrature imaginary parts; same length as {@code inPhase}
   * @return sample batch
   */
  public static SampleBatch of(float[] inPhase, float[] quadrature) {
    if (inPhase.length != quadrature.length) {
      throw new IllegalArgumentException("I and Q arrays must have the same length");
    }
    float[] iq = new float[inPhase.length * 2];
    for (int n = 0; n < inPhase.length; n++) {
      iq[2 * n] = inPhase[n];
      iq[2 * n + 1] = quadrature[n];
    }
    return new SampleBatch(iq);
  }

  /**
   * Returns a batch of {@code sampleCount} zero-valued samples.
   *
   * @param sampleCount number of complex samples
   * @return silent batch
   */
  public static SampleBatch silence(int sampleCount) {
    return new SampleBatch(new float[Math.max(0, sampleCount) * 2]);
  }

  /**
   * Number of complex samples carried by this batch.
   *
   * @return sample count
   */
  public int sampleCount() {
    return interleaved.length / 2;
  }

  @Override
  public float[] interleaved() {
    return interleaved.clone();
  }

  /**
   * Copies as many leading samples as fit into {@code target}; samples beyond its capacity are not copied.
   *
   * @param target interleaved destination buffer
   * @return number of complex samples copied
   */
  public int copyInto(float[] target) {
    int count = Math.min(sampleCount(), target.length / 2);
    System.arraycopy(interleaved, 0, target, 0, count * 2);
    return count;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SampleBatch that)) {
      return false;
    }
    return Arrays.equals(interleaved, that.interleaved);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(interleaved);
  }

  @Override
  public String toString() {
    return "SampleBatch{samples=" + sampleCount() + '}';
  }
}
