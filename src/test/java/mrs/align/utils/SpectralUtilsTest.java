package mrs.align.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import mrs.align.input.Spectrum;
import mrs.align.test.TestUtils;
import org.apache.commons.math3.complex.Complex;
import org.junit.Test;

public class SpectralUtilsTest {

  private static Complex[] ramp(int n) {
    Complex[] data = new Complex[n];
    for (int i = 0; i < n; ++i) {
      data[i] = new Complex(i, -0.5 * i);
    }
    return data;
  }

  @Test
  public void zeroCorrectionIsIdentity() {
    Complex[] fid = TestUtils.baseFid();
    double[] time = Spectrum.buildTimeAxis(fid.length, TestUtils.SPECTRAL_WIDTH);
    Complex[] corrected = SpectralUtils.applyCorrection(fid, time, 0., 0.);
    for (int i = 0; i < fid.length; ++i) {
      assertEquals(fid[i].getReal(), corrected[i].getReal(), 0.);
      assertEquals(fid[i].getImaginary(), corrected[i].getImaginary(), 0.);
    }
  }

  @Test
  public void correctionIsReversible() {
    Complex[] fid = TestUtils.baseFid();
    double[] time = Spectrum.buildTimeAxis(fid.length, TestUtils.SPECTRAL_WIDTH);
    Complex[] there = SpectralUtils.applyCorrection(fid, time, 3.7, -42.);
    Complex[] back = SpectralUtils.applyCorrection(there, time, -3.7, 42.);
    for (int i = 0; i < fid.length; ++i) {
      assertEquals(fid[i].getReal(), back[i].getReal(), 1E-12);
      assertEquals(fid[i].getImaginary(), back[i].getImaginary(), 1E-12);
    }
  }

  @Test
  public void phaseOf180NegatesSignal() {
    Complex[] fid = ramp(8);
    double[] time = Spectrum.buildTimeAxis(8, 1000.);
    Complex[] rotated = SpectralUtils.applyCorrection(fid, time, 0., 180.);
    for (int i = 0; i < fid.length; ++i) {
      assertEquals(-fid[i].getReal(), rotated[i].getReal(), 1E-12);
      assertEquals(-fid[i].getImaginary(), rotated[i].getImaginary(), 1E-12);
    }
  }

  @Test
  public void frequencyCorrectionMovesPeakByHertz() {
    // 1 Hz bins, so a whole-Hz shift lands exactly on a bin
    int n = 1024;
    double sw = 1024.; // 1 Hz bins
    double[] time = Spectrum.buildTimeAxis(n, sw);
    Complex[] fid = new Complex[n];
    for (int i = 0; i < n; ++i) {
      double angle = NumericUtils.TAU * 100. * time[i];
      fid[i] = new Complex(Math.cos(angle), Math.sin(angle));
    }
    Complex[] shifted = SpectralUtils.applyCorrection(fid, time, 5., 0.);
    double[] freqs = SpectralUtils.centeredFrequencies(n, sw);
    Complex[] spec = SpectralUtils.transform(shifted);
    int peak = 0;
    for (int i = 1; i < n; ++i) {
      if (spec[i].abs() > spec[peak].abs()) {
        peak = i;
      }
    }
    assertEquals(105., freqs[peak], 1E-9);
  }

  @Test(expected = IllegalArgumentException.class)
  public void correctionRejectsMismatchedTimeAxis() {
    SpectralUtils.applyCorrection(ramp(8), new double[7], 1., 1.);
  }

  @Test
  public void fftShiftEvenLength() {
    Complex[] data = ramp(4);
    Complex[] shifted = SpectralUtils.fftShift(data);
    double[] expected = {2., 3., 0., 1.};
    for (int i = 0; i < expected.length; ++i) {
      assertEquals(expected[i], shifted[i].getReal(), 0.);
    }
  }

  @Test
  public void fftShiftOddLengthAndInverse() {
    Complex[] data = ramp(5);
    Complex[] shifted = SpectralUtils.fftShift(data);
    double[] expected = {3., 4., 0., 1., 2.};
    for (int i = 0; i < expected.length; ++i) {
      assertEquals(expected[i], shifted[i].getReal(), 0.);
    }
    Complex[] back = SpectralUtils.ifftShift(shifted);
    for (int i = 0; i < data.length; ++i) {
      assertEquals(data[i].getReal(), back[i].getReal(), 0.);
    }
  }

  @Test
  public void transformRoundTripRecoversFid() {
    Complex[] fid = TestUtils.editedFid();
    Complex[] back = SpectralUtils.inverseTransform(SpectralUtils.transform(fid));
    for (int i = 0; i < fid.length; ++i) {
      assertEquals(fid[i].getReal(), back[i].getReal(), 1E-10);
      assertEquals(fid[i].getImaginary(), back[i].getImaginary(), 1E-10);
    }
  }

  @Test
  public void directTransformMatchesFFTConvention() {
    // 6 points go through the direct DFT; compare against the definition directly
    Complex[] data = ramp(6);
    Complex[] spec = SpectralUtils.transform(data);
    int n = data.length;
    Complex[] expected = new Complex[n];
    for (int k = 0; k < n; ++k) {
      Complex sum = Complex.ZERO;
      for (int j = 0; j < n; ++j) {
        double angle = -NumericUtils.TAU * k * j / n;
        sum = sum.add(data[j].multiply(new Complex(Math.cos(angle), Math.sin(angle))));
      }
      expected[k] = sum;
    }
    expected = SpectralUtils.fftShift(expected);
    for (int i = 0; i < n; ++i) {
      assertEquals(expected[i].getReal(), spec[i].getReal(), 1E-9);
      assertEquals(expected[i].getImaginary(), spec[i].getImaginary(), 1E-9);
    }

    Complex[] back = SpectralUtils.inverseTransform(spec);
    for (int i = 0; i < n; ++i) {
      assertEquals(data[i].getReal(), back[i].getReal(), 1E-9);
      assertEquals(data[i].getImaginary(), back[i].getImaginary(), 1E-9);
    }
  }

  @Test
  public void centeredFrequenciesHaveZeroAtMiddle() {
    double[] freqs = SpectralUtils.centeredFrequencies(8, 800.);
    assertEquals(-400., freqs[0], 0.);
    assertEquals(0., freqs[4], 0.);
    assertEquals(300., freqs[7], 0.);
    for (int i = 1; i < freqs.length; ++i) {
      assertTrue(freqs[i] > freqs[i - 1]);
    }
  }

  @Test
  public void emptyInputTransformsToEmpty() {
    assertEquals(0, SpectralUtils.transform(new Complex[]{}).length);
  }

}
