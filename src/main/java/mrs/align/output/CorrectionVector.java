package mrs.align.output;

import mrs.align.utils.NumericUtils;

/**
 * Frequency shift (Hz) and zero-order phase shift (degrees) that, applied to a sub-spectrum's
 * time-domain data, bring it into line with its reference.
 */
public class CorrectionVector {

  public static final CorrectionVector ZERO = new CorrectionVector(0., 0.);

  private final double frequencyShift;
  private final double phaseShift;

  /**
   * @param frequencyShift Frequency shift in Hz
   * @param phaseShift Phase shift in degrees
   */
  public CorrectionVector(double frequencyShift, double phaseShift) {
    this.frequencyShift = frequencyShift;
    this.phaseShift = phaseShift;
  }

  /**
   * Build a correction from a solver parameter array of form {freq, phase}
   *
   * @param params Frequency (Hz) and phase (degrees), in that order
   * @return Correction holding those values
   */
  public static CorrectionVector fromArray(double[] params) {
    return new CorrectionVector(params[0], params[1]);
  }

  public double getFrequencyShift() {
    return frequencyShift;
  }

  public double getPhaseShift() {
    return phaseShift;
  }

  /**
   * Get the correction that undoes this one
   *
   * @return Correction with both terms negated
   */
  public CorrectionVector negate() {
    return new CorrectionVector(-frequencyShift, -phaseShift);
  }

  public double[] toArray() {
    return new double[]{frequencyShift, phaseShift};
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CorrectionVector)) {
      return false;
    }
    CorrectionVector other = (CorrectionVector) o;
    return Double.compare(frequencyShift, other.frequencyShift) == 0
        && Double.compare(phaseShift, other.phaseShift) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(frequencyShift) + Double.hashCode(phaseShift);
  }

  @Override
  public String toString() {
    return NumericUtils.DECIMAL_FORMAT.get().format(frequencyShift) + " Hz, "
        + NumericUtils.DECIMAL_FORMAT.get().format(phaseShift) + " deg";
  }

}
