package mrs.align.output;

import mrs.align.input.Spectrum;

/**
 * Result of aligning one sub-spectrum onto a reference: the correction found by the solver, the
 * reference (unchanged) and the corrected target, plus the figures needed to judge whether the
 * fit can be trusted.
 *
 * Objective values are on the normalized amplitude scale used during the fit.
 */
public class PairwiseAlignment {

  private final Spectrum reference;
  private final Spectrum corrected;
  private final CorrectionVector correction;
  private final double initialObjective;
  private final double finalObjective;
  private final int iterations;
  private final int evaluations;
  private final boolean converged;
  private final boolean suspicious;

  public PairwiseAlignment(Spectrum reference, Spectrum corrected, CorrectionVector correction,
      double initialObjective, double finalObjective, int iterations, int evaluations,
      boolean converged, boolean suspicious) {
    this.reference = reference;
    this.corrected = corrected;
    this.correction = correction;
    this.initialObjective = initialObjective;
    this.finalObjective = finalObjective;
    this.iterations = iterations;
    this.evaluations = evaluations;
    this.converged = converged;
    this.suspicious = suspicious;
  }

  /**
   * Get the target spectrum with the correction applied at its original amplitude
   *
   * @return Corrected target
   */
  public Spectrum getCorrected() {
    return corrected;
  }

  public CorrectionVector getCorrection() {
    return correction;
  }

  /**
   * Number of cost function evaluations, not counting the extra ones made for derivatives
   *
   * @return Evaluation count
   */
  public int getEvaluations() {
    return evaluations;
  }

  /**
   * Get the cost (L1 difference over the window) after applying the correction
   *
   * @return Final cost
   */
  public double getFinalObjective() {
    return finalObjective;
  }

  /**
   * Get the cost (L1 difference over the window) of the uncorrected target
   *
   * @return Cost at zero correction
   */
  public double getInitialObjective() {
    return initialObjective;
  }

  public int getIterations() {
    return iterations;
  }

  public Spectrum getReference() {
    return reference;
  }

  /**
   * False if the solver stopped on an iteration or evaluation limit (or could not make progress)
   * before meeting its tolerances. The correction is then the best point it visited.
   *
   * @return True if the solver converged
   */
  public boolean isConverged() {
    return converged;
  }

  /**
   * True if the frequency correction is larger than the configured plausibility limit, which
   * usually means the alignment locked onto the wrong feature and should be reviewed
   *
   * @return Whether the correction is implausibly large
   */
  public boolean isSuspicious() {
    return suspicious;
  }

}
