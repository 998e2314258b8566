package mrs.align.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import mrs.align.EditingMode;
import mrs.align.EditingMode.CorrectionStep;
import mrs.align.input.Spectrum;
import mrs.align.utils.NumericUtils;

/**
 * Result of aligning all the sub-spectra of one edited acquisition: the merged, aligned
 * acquisition, plus the result of each pairwise alignment in the order it was performed.
 * Downstream checks can use the per-step corrections to spot datasets where the alignment
 * went wrong (e.g., an implausibly large frequency correction).
 */
public class SubspectrumAlignment {

  private final EditingMode mode;
  private final Spectrum aligned;
  private final List<PairwiseAlignment> steps;

  public SubspectrumAlignment(EditingMode mode, Spectrum aligned,
      List<PairwiseAlignment> steps) {
    this.mode = mode;
    this.aligned = aligned;
    this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
  }

  /**
   * True only if the solver converged for every step
   *
   * @return Whether all steps converged
   */
  public boolean allConverged() {
    for (PairwiseAlignment step : steps) {
      if (!step.isConverged()) {
        return false;
      }
    }
    return true;
  }

  /**
   * True if any step produced a frequency correction beyond the plausibility limit
   *
   * @return Whether any step needs review
   */
  public boolean anySuspicious() {
    for (PairwiseAlignment step : steps) {
      if (step.isSuspicious()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Get the merged acquisition, holding the reference sub-spectrum and the corrected others
   * in their original order
   *
   * @return Aligned acquisition
   */
  public Spectrum getAligned() {
    return aligned;
  }

  /**
   * Get the correction applied at each step, in the mode's correction order
   *
   * @return List of corrections
   */
  public List<CorrectionVector> getCorrections() {
    List<CorrectionVector> corrections = new ArrayList<>();
    for (PairwiseAlignment step : steps) {
      corrections.add(step.getCorrection());
    }
    return corrections;
  }

  public EditingMode getMode() {
    return mode;
  }

  /**
   * Produce a human-readable summary of each step's correction and cost reduction
   *
   * @return Report text, one line per step after a header line
   */
  public String getReportString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Sub-spectrum alignment (");
    sb.append(mode.getName());
    sb.append(")");
    List<CorrectionStep> order = mode.getCorrectionOrder();
    for (int i = 0; i < steps.size(); ++i) {
      PairwiseAlignment step = steps.get(i);
      CorrectionVector correction = step.getCorrection();
      double phase = NumericUtils.rewrapAngleDegrees(correction.getPhaseShift());
      sb.append('\n');
      sb.append(order.get(i));
      sb.append(": freq. ");
      sb.append(NumericUtils.DECIMAL_FORMAT.get().format(correction.getFrequencyShift()));
      sb.append(" Hz, phase ");
      sb.append(NumericUtils.DECIMAL_FORMAT.get().format(phase));
      sb.append(" deg, cost ");
      sb.append(NumericUtils.DECIMAL_FORMAT.get().format(step.getInitialObjective()));
      sb.append(" -> ");
      sb.append(NumericUtils.DECIMAL_FORMAT.get().format(step.getFinalObjective()));
      if (!step.isConverged()) {
        sb.append(" [NOT CONVERGED]");
      }
      if (step.isSuspicious()) {
        sb.append(" [CHECK]");
      }
    }
    return sb.toString();
  }

  /**
   * Get the full result of each pairwise alignment, in the mode's correction order
   *
   * @return Unmodifiable list of step results
   */
  public List<PairwiseAlignment> getSteps() {
    return steps;
  }

}
