package ca.gc.cra.rpx.domain.spectrum;

/**
 * Receiver tuning reported alongside each spectrum frame.
 *
 * @param centerFrequencyHz receive center frequency in hertz
 * @param spanHz displayed bandwidth in hertz
 * @since 0.1.0
 */
public record Tuning(double centerFrequencyHz, double spanHz) {

  /** Tuning used before the radio reports one. */
  public static final Tuning UNTUNED = new Tuning(0d, 0d);

  public Tuning {
    if (!Double.isFinite(centerFrequencyHz)) {
      throw new IllegalArgumentException("centerFrequencyHz must be finite");
    }
    if (!Double.isFinite(spanHz) || spanHz < 0d) {
      throw new IllegalArgumentException("spanHz must be finite and non-negative (was " + spanHz + ')');
    }
  }
}
