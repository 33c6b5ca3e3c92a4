package ca.gc.cra.rpx.infrastructure.dsp;

import ca.gc.cra.rpx.application.port.SpectrumEstimator;
import java.util.Arrays;

/**
 * <strong>What:</strong> Welch periodogram in decibels using a Hann window and 75% segment overlap.
 * <p><strong>Output:</strong> Exactly {@code nfft} values, {@code 10*log10(power)}, ordered from the most negative
 * frequency to the most positive with DC at index {@code nfft/2}. Power is floored at {@value #POWER_FLOOR} so
 * silent input yields finite values.</p>
 * <p>Input shorter than {@code nfft} samples is zero-padded into a single segment.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; scratch buffers and the FFT plan are cached per transform
 * size. The streaming worker calls it under its own lock.</p>
 *
 * @since 0.1.0
 */
public final class PeriodogramEstimator implements SpectrumEstimator {
  static final double POWER_FLOOR = 1.0e-20;

  private Fft fft;
  private double[] window;
  private double windowPower;
  private double[] re;
  private double[] im;
  private double[] accumulator;

  @Override
  public float[] estimate(float[] interleavedIq, int sampleCount, int nfft) {
    if (sampleCount < 0 || sampleCount * 2 > interleavedIq.length) {
      throw new IllegalArgumentException("sampleCount " + sampleCount + " exceeds buffer");
    }
    prepare(nfft);
    Arrays.fill(accumulator, 0d);
    int hop = Math.max(1, nfft / 4);
    int segments = 0;
    int offset = 0;
    do {
      loadSegment(interleavedIq, sampleCount, offset, nfft);
      fft.transform(re, im);
      for (int k = 0; k < nfft; k++) {
        accumulator[k] += re[k] * re[k] + im[k] * im[k];
      }
      segments++;
      offset += hop;
    } while (offset + nfft <= sampleCount);

    float[] out = new float[nfft];
    int half = nfft / 2;
    double scale = 1.0 / (segments * windowPower * nfft);
    for (int k = 0; k < nfft; k++) {
      double power = Math.max(accumulator[k] * scale, POWER_FLOOR);
      out[(k + half) % nfft] = (float) (10.0 * Math.log10(power));
    }
    return out;
  }

  private void loadSegment(float[] iq, int sampleCount, int offset, int nfft) {
    for (int n = 0; n < nfft; n++) {
      int sample = offset + n;
      if (sample < sampleCount) {
        re[n] = iq[2 * sample] * window[n];
        im[n] = iq[2 * sample + 1] * window[n];
      } else {
        re[n] = 0d;
        im[n] = 0d;
      }
    }
  }

  private void prepare(int nfft) {
    if (fft != null && fft.size() == nfft) {
      return;
    }
    fft = new Fft(nfft);
    window = new double[nfft];
    double sum = 0d;
    for (int n = 0; n < nfft; n++) {
      window[n] = 0.5 - 0.5 * Math.cos(2.0 * Math.PI * n / nfft);
      sum += window[n] * window[n];
    }
    windowPower = sum / nfft;
    re = new double[nfft];
    im = new double[nfft];
    accumulator = new double[nfft];
  }
}
