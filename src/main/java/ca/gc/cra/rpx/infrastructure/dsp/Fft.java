package ca.gc.cra.rpx.infrastructure.dsp;

/**
 * In-place iterative radix-2 complex FFT over separate real and imaginary arrays.
 */
final class Fft {
  private final int size;
  private final int[] bitReversal;
  private final double[] cos;
  private final double[] sin;

  Fft(int size) {
    if (size < 2 || Integer.bitCount(size) != 1) {
      throw new IllegalArgumentException("FFT size must be a power of two >= 2 (was " + size + ')');
    }
    this.size = size;
    int bits = Integer.numberOfTrailingZeros(size);
    this.bitReversal = new int[size];
    for (int i = 0; i < size; i++) {
      bitReversal[i] = Integer.reverse(i) >>> (Integer.SIZE - bits);
    }
    this.cos = new double[size / 2];
    this.sin = new double[size / 2];
    for (int k = 0; k < size / 2; k++) {
      double angle = -2.0 * Math.PI * k / size;
      cos[k] = Math.cos(angle);
      sin[k] = Math.sin(angle);
    }
  }

  int size() {
    return size;
  }

  void transform(double[] re, double[] im) {
    if (re.length != size || im.length != size) {
      throw new IllegalArgumentException("buffers must hold " + size + " values");
    }
    for (int i = 0; i < size; i++) {
      int j = bitReversal[i];
      if (j > i) {
        double t = re[i];
        re[i] = re[j];
        re[j] = t;
        t = im[i];
        im[i] = im[j];
        im[j] = t;
      }
    }
    for (int len = 2; len <= size; len <<= 1) {
      int half = len >>> 1;
      int step = size / len;
      for (int start = 0; start < size; start += len) {
        for (int k = 0; k < half; k++) {
          double wr = cos[k * step];
          double wi = sin[k * step];
          int a = start + k;
          int b = a + half;
          double xr = re[b] * wr - im[b] * wi;
          double xi = re[b] * wi + im[b] * wr;
          re[b] = re[a] - xr;
          im[b] = im[a] - xi;
          re[a] += xr;
          im[a] += xi;
        }
      }
    }
  }
}
