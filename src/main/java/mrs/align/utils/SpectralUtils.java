package mrs.align.utils;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

/**
 * Methods for moving MRS data between the time domain (FID) and the frequency domain (spectrum),
 * and for applying frequency/phase corrections to time-domain data.
 *
 * Spectra produced here are centered: index 0 holds the most negative frequency offset and the
 * zero-frequency bin sits at index floor(N/2). The forward transform uses the unnormalized
 * exp(-2*pi*i*k*n/N) kernel, and the inverse transform divides by N, so that the two are exact
 * inverses of each other up to floating-point error.
 *
 * Power-of-two lengths (the usual case for MRS acquisitions) go through the Commons Math FFT.
 * Any other length falls back to a direct DFT using the same convention.
 */
public class SpectralUtils {

  private SpectralUtils() {
  }

  /**
   * Apply the combined frequency shift and phase rotation operator to a time-domain signal:
   * each point is multiplied by exp(i * pi * (2 * t * freqHz + phaseDeg / 180)).
   * The constant phase term rotates the whole spectrum; the linear ramp over time moves the
   * spectrum by freqHz along the frequency axis.
   *
   * @param fid Time-domain signal to correct (not modified)
   * @param t Acquisition time of each point, in seconds
   * @param freqHz Frequency shift to apply, in Hz
   * @param phaseDeg Zero-order phase shift to apply, in degrees
   * @return New array holding the corrected signal
   */
  public static Complex[] applyCorrection(Complex[] fid, double[] t, double freqHz,
      double phaseDeg) {
    if (fid.length != t.length) {
      throw new IllegalArgumentException("Time axis has " + t.length + " points but signal has "
          + fid.length);
    }
    Complex[] corrected = new Complex[fid.length];
    for (int i = 0; i < fid.length; ++i) {
      // keep the operand order below, results are compared bit-for-bit against reference output
      double angle = Math.PI * (t[i] * freqHz * 2 + phaseDeg / 180);
      corrected[i] = fid[i].multiply(new Complex(Math.cos(angle), Math.sin(angle)));
    }
    return corrected;
  }

  /**
   * Rotate an array so that the zero-frequency entry of an FFT result moves to the center.
   * For even lengths this swaps the two halves of the array.
   *
   * @param data Array in FFT order
   * @return New array in centered order
   */
  public static Complex[] fftShift(Complex[] data) {
    int n = data.length;
    int offset = (n + 1) / 2;
    Complex[] shifted = new Complex[n];
    for (int i = 0; i < n; ++i) {
      shifted[i] = data[(i + offset) % n];
    }
    return shifted;
  }

  /**
   * Undo {@link #fftShift(Complex[])}; identical to it for even lengths.
   *
   * @param data Array in centered order
   * @return New array in FFT order
   */
  public static Complex[] ifftShift(Complex[] data) {
    int n = data.length;
    int offset = n / 2;
    Complex[] shifted = new Complex[n];
    for (int i = 0; i < n; ++i) {
      shifted[i] = data[(i + offset) % n];
    }
    return shifted;
  }

  /**
   * Get the real components of a complex series
   *
   * @param data Complex series
   * @return Real part of each entry
   */
  public static double[] realPart(Complex[] data) {
    double[] real = new double[data.length];
    for (int i = 0; i < data.length; ++i) {
      real[i] = data[i].getReal();
    }
    return real;
  }

  /**
   * Get the frequency (Hz) of each bin of a centered spectrum.
   *
   * @param sampleCount Number of points in the spectrum
   * @param spectralWidth Spectral width (sample rate of the FID) in Hz
   * @return Frequency of each bin, ascending, with 0 Hz at index floor(N/2)
   */
  public static double[] centeredFrequencies(int sampleCount, double spectralWidth) {
    double[] freqs = new double[sampleCount];
    double deltaFreq = spectralWidth / sampleCount;
    int center = sampleCount / 2;
    for (int i = 0; i < sampleCount; ++i) {
      freqs[i] = (i - center) * deltaFreq;
    }
    return freqs;
  }

  /**
   * Inverse of {@link #transform(Complex[])}: go from a centered spectrum back to the FID.
   *
   * @param spec Centered spectrum
   * @return Time-domain signal
   */
  public static Complex[] inverseTransform(Complex[] spec) {
    return fourier(ifftShift(spec), TransformType.INVERSE);
  }

  /**
   * Get the centered spectrum of a time-domain signal (forward DFT followed by an FFT shift).
   *
   * @param fid Time-domain signal
   * @return Centered spectrum of the same length
   */
  public static Complex[] transform(Complex[] fid) {
    return fftShift(fourier(fid, TransformType.FORWARD));
  }

  private static Complex[] fourier(Complex[] data, TransformType type) {
    if (data.length == 0) {
      return new Complex[]{};
    }
    if (ArithmeticUtils.isPowerOfTwo(data.length)) {
      FastFourierTransformer fft =
          new FastFourierTransformer(DftNormalization.STANDARD);
      return fft.transform(data, type);
    }
    return directTransform(data, type);
  }

  /**
   * O(N^2) transform for lengths the FFT can't take, matching the STANDARD normalization
   * of the Commons Math transformer (no scaling forward, 1/N on the inverse)
   */
  private static Complex[] directTransform(Complex[] data, TransformType type) {
    int n = data.length;
    double sign = (type == TransformType.FORWARD) ? -1. : 1.;
    Complex[] result = new Complex[n];
    for (int k = 0; k < n; ++k) {
      double re = 0.;
      double im = 0.;
      for (int j = 0; j < n; ++j) {
        // reduce k * j first so the angle stays small for long series
        double angle = sign * NumericUtils.TAU * ((long) k * j % n) / n;
        double cos = Math.cos(angle);
        double sin = Math.sin(angle);
        re += data[j].getReal() * cos - data[j].getImaginary() * sin;
        im += data[j].getReal() * sin + data[j].getImaginary() * cos;
      }
      if (type == TransformType.INVERSE) {
        re /= n;
        im /= n;
      }
      result[k] = new Complex(re, im);
    }
    return result;
  }

}
