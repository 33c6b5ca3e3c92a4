package ca.gc.cra.rpx.domain.spectrum;

import java.util.Arrays;
import java.util.Objects;

/**
 * Power-per-bin estimate for one pipeline cycle plus the tuning it was computed under.
 * <p>Frames are ephemeral: they exist for a single encode-and-broadcast cycle and are never persisted.</p>
 *
 * @param tuning center frequency and span the samples were captured with
 * @param powers power values in bin order; length equals the transform size
 * @since 0.1.0
 */
public record SpectrumFrame(Tuning tuning, float[] powers) {

  public SpectrumFrame {
    tuning = Objects.requireNonNull(tuning, "tuning");
    powers = Objects.requireNonNull(powers, "powers").clone();
  }

  /**
   * Number of transform bins in this frame.
   *
   * @return bin count
   */
  public int binCount() {
    return powers.length;
  }

  /**
   * Returns the power of a single bin.
   *
   * @param bin bin index in {@code [0, binCount())}
   * @return power value
   */
  public float power(int bin) {
    return powers[bin];
  }

  @Override
  public float[] powers() {
    return powers.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SpectrumFrame that)) {
      return false;
    }
    return tuning.equals(that.tuning) && Arrays.equals(powers, that.powers);
  }

  @Override
  public int hashCode() {
    return 31 * tuning.hashCode() + Arrays.hashCode(powers);
  }

  @Override
  public String toString() {
    return "SpectrumFrame{tuning=" + tuning + ", bins=" + powers.length + '}';
  }
}
