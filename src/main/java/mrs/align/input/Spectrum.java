package mrs.align.input;

import java.util.Arrays;
import mrs.align.output.CorrectionVector;
import mrs.align.utils.NumericUtils;
import mrs.align.utils.SpectralUtils;
import org.apache.commons.math3.complex.Complex;

/**
 * Holds one MRS acquisition: the time-domain data (FIDs) of each sub-spectrum packed into it,
 * the matching centered spectra, and the time and chemical-shift axes shared by all of them,
 * along with the acquisition metadata the alignment routines need.
 *
 * Instances are immutable. The spectra are always computed from the FIDs when the object is
 * created, so they can't drift out of sync with the time-domain data; every operation that
 * changes the data (scaling, correcting, splitting, merging) returns a new Spectrum.
 * Array getters return copies.
 *
 * Sub-spectra are indexed from 0, so for a four-way edited acquisition A, B, C and D are indices
 * 0 through 3.
 */
public class Spectrum {

  /**
   * Chemical shift of the transmitter (water) frequency, in ppm
   */
  public static final double WATER_PPM = 4.65;

  private final Complex[][] fids; // [subspectrum][sample]
  private final Complex[][] specs; // derived from fids, same shape
  private final double[] time; // seconds
  private final double[] ppm;
  private final double echoTime; // ms
  private final double spectralWidth; // Hz
  private final double transmitterFrequency; // MHz
  private final boolean coilsCombined;
  private final boolean averaged;

  /**
   * Create a spectrum from time-domain data and explicit axes.
   *
   * @param fids Time-domain data, indexed by sub-spectrum and then by sample
   * @param time Acquisition time of each sample (seconds)
   * @param ppm Chemical shift of each point of the centered spectrum
   * @param echoTime Echo time of the acquisition (ms)
   * @param spectralWidth Spectral width (Hz)
   * @param transmitterFrequency Transmitter frequency (MHz)
   * @param coilsCombined True if the receiver channels have already been combined
   * @param averaged True if the averages have already been combined
   */
  public Spectrum(Complex[][] fids, double[] time, double[] ppm, double echoTime,
      double spectralWidth, double transmitterFrequency, boolean coilsCombined,
      boolean averaged) {

    if (fids.length == 0) {
      throw new IllegalArgumentException("Spectrum needs at least one sub-spectrum");
    }
    int sampleCount = time.length;
    if (ppm.length != sampleCount) {
      throw new IllegalArgumentException("ppm axis has " + ppm.length
          + " points but time axis has " + sampleCount);
    }

    // all shapes are checked before any data is transformed
    for (int i = 0; i < fids.length; ++i) {
      if (fids[i].length != sampleCount) {
        throw new IllegalArgumentException("Sub-spectrum " + i + " has " + fids[i].length
            + " points but time axis has " + sampleCount);
      }
    }

    this.fids = new Complex[fids.length][];
    this.specs = new Complex[fids.length][];
    for (int i = 0; i < fids.length; ++i) {
      this.fids[i] = fids[i].clone();
      this.specs[i] = SpectralUtils.transform(fids[i]);
    }

    this.time = time.clone();
    this.ppm = ppm.clone();
    this.echoTime = echoTime;
    this.spectralWidth = spectralWidth;
    this.transmitterFrequency = transmitterFrequency;
    this.coilsCombined = coilsCombined;
    this.averaged = averaged;
  }

  /**
   * Create a single sub-spectrum acquisition, deriving the time and ppm axes from the
   * spectral width and transmitter frequency. The data is assumed to be coil-combined and
   * averaged already.
   *
   * @param fid Time-domain data
   * @param spectralWidth Spectral width (Hz)
   * @param transmitterFrequency Transmitter frequency (MHz)
   * @param echoTime Echo time (ms)
   * @return New spectrum
   */
  public static Spectrum fromFids(Complex[] fid, double spectralWidth,
      double transmitterFrequency, double echoTime) {
    return fromFids(new Complex[][]{fid}, spectralWidth, transmitterFrequency, echoTime);
  }

  /**
   * Create an acquisition with any number of packed sub-spectra, deriving the time and ppm axes
   * from the spectral width and transmitter frequency. The data is assumed to be coil-combined
   * and averaged already.
   *
   * @param fids Time-domain data, indexed by sub-spectrum and then by sample
   * @param spectralWidth Spectral width (Hz)
   * @param transmitterFrequency Transmitter frequency (MHz)
   * @param echoTime Echo time (ms)
   * @return New spectrum
   */
  public static Spectrum fromFids(Complex[][] fids, double spectralWidth,
      double transmitterFrequency, double echoTime) {
    int sampleCount = fids.length > 0 ? fids[0].length : 0;
    return new Spectrum(fids, buildTimeAxis(sampleCount, spectralWidth),
        buildPpmAxis(sampleCount, spectralWidth, transmitterFrequency), echoTime,
        spectralWidth, transmitterFrequency, true, true);
  }

  /**
   * Get the acquisition time of each sample, spaced by the dwell time (1 / spectral width)
   *
   * @param sampleCount Number of samples
   * @param spectralWidth Spectral width (Hz)
   * @return Time axis in seconds, starting at 0
   */
  public static double[] buildTimeAxis(int sampleCount, double spectralWidth) {
    double[] time = new double[sampleCount];
    for (int i = 0; i < sampleCount; ++i) {
      time[i] = i / spectralWidth;
    }
    return time;
  }

  /**
   * Get the chemical shift of each point of a centered spectrum. Positive frequency offsets
   * from the transmitter are upfield (lower ppm) of water.
   *
   * @param sampleCount Number of samples
   * @param spectralWidth Spectral width (Hz)
   * @param transmitterFrequency Transmitter frequency (MHz)
   * @return ppm axis, descending with index
   */
  public static double[] buildPpmAxis(int sampleCount, double spectralWidth,
      double transmitterFrequency) {
    double[] freqs = SpectralUtils.centeredFrequencies(sampleCount, spectralWidth);
    double[] ppm = new double[sampleCount];
    for (int i = 0; i < sampleCount; ++i) {
      ppm[i] = WATER_PPM - freqs[i] / transmitterFrequency;
    }
    return ppm;
  }

  /**
   * Merge acquisitions into one packed acquisition, keeping the sub-spectra in the order given.
   * Metadata comes from the first input; the result only counts as coil-combined (or averaged)
   * if every input is.
   *
   * @param toMerge Acquisitions to merge, all sharing the same time and ppm axes
   * @return Packed acquisition holding every sub-spectrum of every input
   */
  public static Spectrum mergeSubspectra(Spectrum... toMerge) {
    if (toMerge.length == 0) {
      throw new IllegalArgumentException("Nothing to merge");
    }
    Spectrum first = toMerge[0];
    int total = 0;
    boolean combined = true;
    boolean avg = true;
    for (Spectrum spectrum : toMerge) {
      if (!first.hasSameAxes(spectrum)) {
        throw new IllegalArgumentException("Cannot merge spectra with different axes");
      }
      total += spectrum.getSubspectrumCount();
      combined &= spectrum.isCoilCombined();
      avg &= spectrum.isAveraged();
    }

    Complex[][] merged = new Complex[total][];
    int idx = 0;
    for (Spectrum spectrum : toMerge) {
      for (Complex[] fid : spectrum.fids) {
        merged[idx] = fid;
        ++idx;
      }
    }
    return new Spectrum(merged, first.time, first.ppm, first.echoTime, first.spectralWidth,
        first.transmitterFrequency, combined, avg);
  }

  /**
   * Apply a frequency/phase correction to every sub-spectrum
   *
   * @param correction Frequency (Hz) and phase (degrees) to apply
   * @return New, corrected spectrum
   */
  public Spectrum applyCorrection(CorrectionVector correction) {
    Complex[][] corrected = new Complex[fids.length][];
    for (int i = 0; i < fids.length; ++i) {
      corrected[i] = SpectralUtils.applyCorrection(fids[i], time,
          correction.getFrequencyShift(), correction.getPhaseShift());
    }
    return withFids(corrected);
  }

  /**
   * Get the time-domain data of one sub-spectrum
   *
   * @param subspectrum Index of the sub-spectrum
   * @return Copy of the FID
   */
  public Complex[] getFids(int subspectrum) {
    return fids[subspectrum].clone();
  }

  public double getEchoTime() {
    return echoTime;
  }

  /**
   * Get the chemical shift axis, shared by all sub-spectra
   *
   * @return Copy of the ppm axis
   */
  public double[] getPpm() {
    return ppm.clone();
  }

  public int getSampleCount() {
    return time.length;
  }

  public double getSpectralWidth() {
    return spectralWidth;
  }

  /**
   * Get the centered spectrum of one sub-spectrum
   *
   * @param subspectrum Index of the sub-spectrum
   * @return Copy of the spectrum
   */
  public Complex[] getSpecs(int subspectrum) {
    return specs[subspectrum].clone();
  }

  /**
   * Get the number of sub-spectra packed into this acquisition (1 once separated)
   *
   * @return Sub-spectrum count
   */
  public int getSubspectrumCount() {
    return fids.length;
  }

  /**
   * Get the sample time axis, shared by all sub-spectra
   *
   * @return Copy of the time axis, in seconds
   */
  public double[] getTime() {
    return time.clone();
  }

  public double getTransmitterFrequency() {
    return transmitterFrequency;
  }

  /**
   * Check that another spectrum has the same number of samples and identical time and ppm axes.
   *
   * @param other Spectrum to compare against
   * @return True if the two could be compared point-by-point
   */
  public boolean hasSameAxes(Spectrum other) {
    return getSampleCount() == other.getSampleCount()
        && Arrays.equals(time, other.time)
        && Arrays.equals(ppm, other.ppm);
  }

  public boolean isAveraged() {
    return averaged;
  }

  public boolean isCoilCombined() {
    return coilsCombined;
  }

  /**
   * Multiply the data of every sub-spectrum by a constant
   *
   * @param scale Scale factor
   * @return New, scaled spectrum
   */
  public Spectrum scaleAmplitude(double scale) {
    Complex[][] scaled = new Complex[fids.length][];
    for (int i = 0; i < fids.length; ++i) {
      scaled[i] = NumericUtils.scale(fids[i], scale);
    }
    return withFids(scaled);
  }

  /**
   * Extract a single sub-spectrum as its own acquisition
   *
   * @param subspectrum Index of the sub-spectrum to take
   * @return New spectrum with one sub-spectrum and the same axes and metadata
   */
  public Spectrum takeSubspectrum(int subspectrum) {
    if (subspectrum < 0 || subspectrum >= fids.length) {
      throw new IndexOutOfBoundsException("Sub-spectrum index " + subspectrum
          + " out of range for acquisition with " + fids.length + " sub-spectra");
    }
    return withFids(new Complex[][]{fids[subspectrum]});
  }

  /**
   * Get a copy of this spectrum with its processing flags replaced
   *
   * @param coilsCombined True if the receiver channels have been combined
   * @param averaged True if the averages have been combined
   * @return New spectrum with the same data
   */
  public Spectrum withProcessingFlags(boolean coilsCombined, boolean averaged) {
    return new Spectrum(fids, time, ppm, echoTime, spectralWidth, transmitterFrequency,
        coilsCombined, averaged);
  }

  /**
   * Get a spectrum with the same axes and metadata but new time-domain data.
   * The spectra are recomputed from the new data.
   *
   * @param newFids Time-domain data, indexed by sub-spectrum and then by sample
   * @return New spectrum
   */
  public Spectrum withFids(Complex[][] newFids) {
    return new Spectrum(newFids, time, ppm, echoTime, spectralWidth, transmitterFrequency,
        coilsCombined, averaged);
  }

}
