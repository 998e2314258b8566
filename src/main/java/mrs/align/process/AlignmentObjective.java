package mrs.align.process;

import mrs.align.utils.NumericUtils;
import mrs.align.utils.SpectralUtils;
import org.apache.commons.math3.complex.Complex;

/**
 * Cost function for aligning one sub-spectrum onto another: the sum of absolute differences
 * (L1 norm) between the real parts of the reference spectrum and the corrected target spectrum,
 * taken only over the points selected by a frequency mask.
 *
 * Both signals are expected to already share a common amplitude scale, so that the size of the
 * cost (and thus the behavior of the solver steps) doesn't depend on the signal intensity.
 */
public class AlignmentObjective {

  private final Complex[] targetFid;
  private final double[] time;
  private final boolean[] mask;
  private final double[] referenceReal; // real part of reference spectrum, masked points only

  /**
   * @param referenceFid Time-domain data of the reference, amplitude-normalized
   * @param targetFid Time-domain data to be corrected, amplitude-normalized
   * @param time Sample times shared by both signals (seconds)
   * @param mask True for each point of the centered spectrum to include in the cost
   */
  public AlignmentObjective(Complex[] referenceFid, Complex[] targetFid, double[] time,
      boolean[] mask) {
    if (referenceFid.length != targetFid.length || time.length != targetFid.length
        || mask.length != targetFid.length) {
      throw new IllegalArgumentException("Reference, target, time axis and mask must all have "
          + "the same length");
    }
    this.targetFid = targetFid.clone();
    this.time = time.clone();
    this.mask = mask.clone();

    double[] realRef = SpectralUtils.realPart(SpectralUtils.transform(referenceFid));
    referenceReal = new double[NumericUtils.countSelected(mask)];
    int idx = 0;
    for (int i = 0; i < mask.length; ++i) {
      if (mask[i]) {
        referenceReal[idx] = realRef[i];
        ++idx;
      }
    }
  }

  /**
   * Get the absolute difference between reference and corrected target at each masked point
   *
   * @param params Candidate correction as {frequency (Hz), phase (degrees)}
   * @return Absolute differences, one per selected point, in axis order
   */
  public double[] differenceVector(double[] params) {
    double[] diffs = signedDifference(params);
    for (int i = 0; i < diffs.length; ++i) {
      diffs[i] = Math.abs(diffs[i]);
    }
    return diffs;
  }

  /**
   * Get the difference (reference minus corrected target) of the real spectra at each
   * masked point
   *
   * @param params Candidate correction as {frequency (Hz), phase (degrees)}
   * @return Differences, one per selected point, in axis order
   */
  public double[] signedDifference(double[] params) {
    Complex[] corrected =
        SpectralUtils.applyCorrection(targetFid, time, params[0], params[1]);
    double[] correctedReal = SpectralUtils.realPart(SpectralUtils.transform(corrected));

    double[] diffs = new double[referenceReal.length];
    int idx = 0;
    for (int i = 0; i < mask.length; ++i) {
      if (mask[i]) {
        diffs[idx] = referenceReal[idx] - correctedReal[i];
        ++idx;
      }
    }
    return diffs;
  }

  /**
   * Number of spectral points the cost is taken over
   *
   * @return Count of masked points
   */
  public int getSelectedPointCount() {
    return referenceReal.length;
  }

  /**
   * Sum of absolute values of a difference vector
   *
   * @param diffs Differences between two spectra
   * @return L1 norm of the differences
   */
  public static double l1Norm(double[] diffs) {
    double sum = 0.;
    for (double diff : diffs) {
      sum += Math.abs(diff);
    }
    return sum;
  }

  /**
   * Evaluate the cost for a candidate correction
   *
   * @param params Candidate correction as {frequency (Hz), phase (degrees)}
   * @return Sum of absolute differences over the masked points
   */
  public double value(double[] params) {
    return l1Norm(signedDifference(params));
  }

}
