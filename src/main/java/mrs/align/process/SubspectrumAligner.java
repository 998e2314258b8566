package mrs.align.process;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import javax.swing.event.EventListenerList;
import mrs.align.EditingMode;
import mrs.align.EditingMode.CorrectionStep;
import mrs.align.input.AlignmentConfiguration;
import mrs.align.input.Spectrum;
import mrs.align.output.PairwiseAlignment;
import mrs.align.output.SubspectrumAlignment;
import mrs.align.process.PreconditionException.Reason;
import org.apache.log4j.Logger;

/**
 * Aligns the sub-spectra of an edited MRS acquisition onto each other so that they can be
 * subtracted or summed without frequency and phase mismatch artifacts.
 *
 * The input is either one acquisition with its sub-spectra still packed together, which is split
 * by sub-spectrum index, or the sub-spectra already separated. Each sub-spectrum is then aligned
 * onto its reference with a {@link PairwiseAligner}, following the fixed correction order of the
 * editing mode (for MEGA, B onto A; for HERMES and HERCULES, B onto A, C onto A and then D onto
 * the corrected C), and the results are merged back into one acquisition in A, B, C, D order.
 *
 * The data must already be coil-combined and averaged, and the number of sub-spectra must match
 * the editing mode; otherwise a {@link PreconditionException} is thrown before any alignment
 * is attempted.
 *
 * Steps that don't depend on each other (B onto A and C onto A) can be run on separate threads
 * when parallel execution is enabled in the configuration. The results are the same either way.
 *
 * Listeners registered with {@link #addChangeListener(ChangeListener)} are notified as each step
 * starts, so that a caller can display progress.
 */
public class SubspectrumAligner {

  private static final Logger logger = Logger.getLogger(SubspectrumAligner.class);

  private final PairwiseAligner pairwiseAligner;
  private final EventListenerList eventHelper;
  private volatile String status;

  /**
   * Create an aligner using the shared configuration
   */
  public SubspectrumAligner() {
    this(AlignmentConfiguration.getInstance());
  }

  public SubspectrumAligner(AlignmentConfiguration config) {
    this(new PairwiseAligner(config));
  }

  public SubspectrumAligner(PairwiseAligner pairwiseAligner) {
    this.pairwiseAligner = pairwiseAligner;
    eventHelper = new EventListenerList();
    status = "";
  }

  private static void checkMode(EditingMode mode) {
    if (mode == null) {
      throw new PreconditionException(Reason.UNSUPPORTED_MODE, "no editing mode given");
    }
  }

  /**
   * Check that the data has been through the processing that must come before alignment
   *
   * @param spectrum Data to check
   * @param label Name of the data, used in the error message
   */
  private static void checkProcessed(Spectrum spectrum, String label) {
    if (!spectrum.isCoilCombined()) {
      throw new PreconditionException(Reason.NOT_COIL_COMBINED, label
          + " still has separate receiver channels");
    }
    if (!spectrum.isAveraged()) {
      throw new PreconditionException(Reason.NOT_AVERAGED, label
          + " still has separate averages");
    }
  }

  /**
   * Add an object to the list of objects to be notified when the aligner's status changes
   *
   * @param listener ChangeListener to be notified
   */
  public void addChangeListener(ChangeListener listener) {
    eventHelper.add(ChangeListener.class, listener);
  }

  /**
   * Align the sub-spectra of a packed acquisition.
   *
   * @param packed Acquisition holding all the sub-spectra of the editing scheme
   * @param mode Editing scheme the data was acquired with
   * @return Merged, aligned acquisition with the result of each step
   * @throws PreconditionException if the data isn't coil-combined and averaged or doesn't hold
   * the number of sub-spectra the mode needs
   */
  public SubspectrumAlignment align(Spectrum packed, EditingMode mode) {
    fireStateChange("Checking input data...");
    checkMode(mode);
    checkProcessed(packed, "Input data");

    int count = packed.getSubspectrumCount();
    if (count == 1) {
      throw new PreconditionException(Reason.SUBSPECTRUM_COUNT,
          "the data must have more than 1 sub-spectrum to align");
    }
    if (count != mode.getSubspectrumCount()) {
      throw new PreconditionException(Reason.SUBSPECTRUM_COUNT, mode + " needs "
          + mode.getSubspectrumCount() + " sub-spectra but the data has " + count);
    }

    Spectrum[] subspectra = new Spectrum[count];
    for (int i = 0; i < count; ++i) {
      subspectra[i] = packed.takeSubspectrum(i);
    }
    return alignSubspectra(mode, subspectra);
  }

  /**
   * Align sub-spectra that have already been separated, then merge them.
   *
   * @param mode Editing scheme the data was acquired with
   * @param separated One single sub-spectrum acquisition per sub-spectrum of the mode, in order
   * @return Merged, aligned acquisition with the result of each step
   * @throws PreconditionException if the data isn't coil-combined and averaged, the number of
   * inputs doesn't match the mode, any input has more than one sub-spectrum, or the inputs don't
   * share the same axes
   */
  public SubspectrumAlignment align(EditingMode mode, Spectrum... separated) {
    fireStateChange("Checking input data...");
    checkMode(mode);
    if (separated.length != mode.getSubspectrumCount()) {
      throw new PreconditionException(Reason.SUBSPECTRUM_COUNT, mode + " needs "
          + mode.getSubspectrumCount() + " sub-spectra but " + separated.length + " were given");
    }
    for (int i = 0; i < separated.length; ++i) {
      String label = "Sub-spectrum " + EditingMode.subspectrumLabel(i);
      checkProcessed(separated[i], label);
      if (separated[i].getSubspectrumCount() != 1) {
        throw new PreconditionException(Reason.SUBSPECTRUM_COUNT, label + " has "
            + separated[i].getSubspectrumCount() + " sub-spectra, expected 1");
      }
      if (separated[i].getSampleCount() != separated[0].getSampleCount()) {
        throw new PreconditionException(Reason.SHAPE_MISMATCH, label + " has "
            + separated[i].getSampleCount() + " points, sub-spectrum A has "
            + separated[0].getSampleCount());
      }
      if (!separated[i].hasSameAxes(separated[0])) {
        throw new PreconditionException(Reason.AXIS_MISMATCH, label
            + " is not sampled on the same axes as sub-spectrum A");
      }
    }
    return alignSubspectra(mode, separated.clone());
  }

  /**
   * Align one MEGA sub-spectrum onto the other without merging them.
   *
   * @param reference Sub-spectrum to align to, returned unchanged
   * @param target Sub-spectrum to correct
   * @return Result holding the reference and corrected target separately
   * @throws PreconditionException if either input isn't coil-combined and averaged, has more
   * than one sub-spectrum, or the two don't share the same axes
   */
  public PairwiseAlignment alignPair(Spectrum reference, Spectrum target) {
    fireStateChange("Checking input data...");
    checkProcessed(reference, "Reference");
    checkProcessed(target, "Target");
    PairwiseAligner.validatePair(reference, target);
    fireStateChange("Aligning target onto reference...");
    PairwiseAlignment result = pairwiseAligner.align(reference, target);
    fireStateChange("Alignment done!");
    return result;
  }

  private SubspectrumAlignment alignSubspectra(EditingMode mode, Spectrum[] subspectra) {
    logger.info("Aligning " + subspectra.length + " sub-spectra of " + mode + " data");

    List<PairwiseAlignment> results;
    if (pairwiseAligner.getConfiguration().isParallel()) {
      results = runParallel(mode, subspectra);
    } else {
      results = runSequential(mode, subspectra);
    }

    Spectrum[] corrected = subspectra.clone();
    List<CorrectionStep> order = mode.getCorrectionOrder();
    for (int i = 0; i < order.size(); ++i) {
      corrected[order.get(i).getTarget()] = results.get(i).getCorrected();
    }

    fireStateChange("Merging aligned sub-spectra...");
    Spectrum merged = Spectrum.mergeSubspectra(corrected);
    SubspectrumAlignment alignment = new SubspectrumAlignment(mode, merged, results);
    if (!alignment.allConverged()) {
      logger.warn("At least one " + mode + " alignment step did not converge; flag for review");
    }
    fireStateChange("Alignment done!");
    return alignment;
  }

  /**
   * Update processing status and notify listeners of change
   *
   * @param newStatus Status change message to notify listeners of
   */
  void fireStateChange(String newStatus) {
    status = newStatus;
    ChangeListener[] listeners = eventHelper.getListeners(ChangeListener.class);
    if (listeners != null && listeners.length > 0) {
      ChangeEvent event = new ChangeEvent(this);
      for (ChangeListener listener : listeners) {
        listener.stateChanged(event);
      }
    }
  }

  /**
   * Return newest status message produced by this aligner
   *
   * @return String representing status of the alignment
   */
  public String getStatus() {
    return status;
  }

  public void removeChangeListener(ChangeListener listener) {
    eventHelper.remove(ChangeListener.class, listener);
  }

  // status is fired by the caller, so listeners are only ever notified on the calling thread
  private PairwiseAlignment runStep(CorrectionStep step, Spectrum reference, Spectrum target) {
    PairwiseAlignment result = pairwiseAligner.align(reference, target);
    logger.info(step + ": " + result.getCorrection());
    return result;
  }

  private List<PairwiseAlignment> runSequential(EditingMode mode, Spectrum[] subspectra) {
    Spectrum[] working = subspectra.clone();
    List<PairwiseAlignment> results = new ArrayList<>();
    for (CorrectionStep step : mode.getCorrectionOrder()) {
      fireStateChange("Aligning " + step + "...");
      PairwiseAlignment result =
          runStep(step, working[step.getReference()], working[step.getTarget()]);
      working[step.getTarget()] = result.getCorrected();
      results.add(result);
    }
    return results;
  }

  /**
   * Run the steps on a thread pool, in rounds. A step joins a round once no earlier step that is
   * still pending has to correct its reference or target, so each step sees the same data as in
   * the sequential order.
   */
  private List<PairwiseAlignment> runParallel(EditingMode mode, Spectrum[] subspectra) {
    int threads = Math.max(1, pairwiseAligner.getConfiguration().getThreads());
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    List<CorrectionStep> order = mode.getCorrectionOrder();
    Spectrum[] working = subspectra.clone();
    PairwiseAlignment[] results = new PairwiseAlignment[order.size()];

    List<Integer> pending = new ArrayList<>();
    for (int i = 0; i < order.size(); ++i) {
      pending.add(i);
    }

    try {
      while (!pending.isEmpty()) {
        List<Integer> ready = readySteps(order, pending);
        List<Future<PairwiseAlignment>> futureList = new ArrayList<>();
        for (int idx : ready) {
          CorrectionStep step = order.get(idx);
          Spectrum reference = working[step.getReference()];
          Spectrum target = working[step.getTarget()];
          fireStateChange("Aligning " + step + "...");
          futureList.add(executor.submit(() -> runStep(step, reference, target)));
        }
        for (int i = 0; i < ready.size(); ++i) {
          int idx = ready.get(i);
          results[idx] = futureList.get(i).get();
          working[order.get(idx).getTarget()] = results[idx].getCorrected();
        }
        pending.removeAll(ready);
      }
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw new IllegalStateException("Alignment step failed", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while aligning sub-spectra", e);
    } finally {
      executor.shutdownNow();
    }
    return Arrays.asList(results);
  }

  private static List<Integer> readySteps(List<CorrectionStep> order, List<Integer> pending) {
    List<Integer> ready = new ArrayList<>();
    for (int idx : pending) {
      CorrectionStep step = order.get(idx);
      boolean blocked = false;
      for (int earlier : pending) {
        if (earlier >= idx) {
          break;
        }
        int corrected = order.get(earlier).getTarget();
        if (corrected == step.getReference() || corrected == step.getTarget()) {
          blocked = true;
          break;
        }
      }
      if (!blocked) {
        ready.add(idx);
      }
    }
    return ready;
  }

}
