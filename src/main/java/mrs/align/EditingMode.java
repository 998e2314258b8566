package mrs.align;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Enumerated type defining each spectral-editing scheme the sub-spectrum alignment handles, with
 * the number of sub-spectra each one acquires and the fixed order in which those sub-spectra are
 * aligned onto each other.
 *
 * If adding a new scheme, give it its sub-spectrum count and a correction order whose steps only
 * reference sub-spectra that are either never corrected or corrected by an earlier step.
 *
 * @see mrs.align.process.SubspectrumAligner
 */
public enum EditingMode {

  MEGA("MEGA-edited", 2) {
    @Override
    public List<CorrectionStep> getCorrectionOrder() {
      return MEGA_ORDER;
    }
  },
  HERMES("Hadamard encoding and reconstruction of MEGA-edited spectroscopy", 4) {
    @Override
    public List<CorrectionStep> getCorrectionOrder() {
      return FOUR_WAY_ORDER;
    }
  },
  HERCULES("Hadamard editing resolves chemicals using linear-combination estimation of spectra",
      4) {
    @Override
    public List<CorrectionStep> getCorrectionOrder() {
      return FOUR_WAY_ORDER;
    }
  };

  private static final List<CorrectionStep> MEGA_ORDER =
      Collections.singletonList(new CorrectionStep(1, 0));

  // D is aligned onto the corrected C, not onto A; C and D form their own editing pair
  private static final List<CorrectionStep> FOUR_WAY_ORDER = Collections.unmodifiableList(
      Arrays.asList(
          new CorrectionStep(1, 0),
          new CorrectionStep(2, 0),
          new CorrectionStep(3, 2)));

  private final String name;
  private final int subspectrumCount;

  EditingMode(String name, int subspectrumCount) {
    this.name = name;
    this.subspectrumCount = subspectrumCount;
  }

  /**
   * Get the name of a sub-spectrum by its index (A, B, C, ...)
   *
   * @param index Sub-spectrum index, from 0
   * @return Letter naming that sub-spectrum
   */
  public static String subspectrumLabel(int index) {
    return String.valueOf((char) ('A' + index));
  }

  /**
   * Get the pairwise alignments to perform, in the order they must be done. A step's reference
   * is taken as it stands once all previous steps are finished, so it is the corrected version
   * of that sub-spectrum if an earlier step aligned it.
   *
   * @return Unmodifiable list of steps
   */
  public abstract List<CorrectionStep> getCorrectionOrder();

  /**
   * Get the full name of this editing scheme
   *
   * @return Name of scheme, as String
   */
  public String getName() {
    return name;
  }

  /**
   * Get the number of sub-spectra an acquisition with this scheme holds
   *
   * @return Sub-spectrum count
   */
  public int getSubspectrumCount() {
    return subspectrumCount;
  }

  /**
   * One pairwise alignment: which sub-spectrum gets corrected and which one it is aligned onto
   */
  public static final class CorrectionStep {

    private final int target;
    private final int reference;

    CorrectionStep(int target, int reference) {
      this.target = target;
      this.reference = reference;
    }

    public int getReference() {
      return reference;
    }

    public int getTarget() {
      return target;
    }

    @Override
    public String toString() {
      return subspectrumLabel(target) + " onto " + subspectrumLabel(reference);
    }
  }

}
