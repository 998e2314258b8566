package mrs.align.process;

import mrs.align.input.AlignmentConfiguration;
import mrs.align.input.Spectrum;
import mrs.align.output.CorrectionVector;
import mrs.align.output.PairwiseAlignment;
import mrs.align.process.PreconditionException.Reason;
import mrs.align.utils.NumericUtils;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;

/**
 * Finds the frequency and phase correction that best aligns one single sub-spectrum onto a
 * reference sub-spectrum.
 *
 * The comparison is made over a fixed ppm window of the reference (1.95 to 4.0 ppm by default,
 * covering water, NAA, creatine and choline). Both spectra are first brought to a common
 * amplitude scale by dividing by the largest absolute real value found in either of them, so
 * the solver behaves the same way regardless of the signal intensity. The cost is the L1 norm
 * of the difference of the real spectra inside the window, see {@link AlignmentObjective}.
 *
 * The L1 cost is minimized by iteratively reweighted least squares. Each pass hands the
 * per-point differences to the Apache Commons Levenberg-Marquardt optimizer as a residual
 * vector, weighted by the inverse of the size of each difference at the end of the previous
 * pass, so that the weighted sum of squares matches the L1 cost at that point. The first pass
 * starts from a correction of (0 Hz, 0 degrees), neither parameter is bounded, and derivatives
 * are taken by forward differences. Passes stop once one of them no longer lowers the L1 cost
 * by more than the configured relative tolerance. The iteration and evaluation limits cover
 * all passes together.
 *
 * If the solver runs out of iterations, evaluations or passes, the lowest-cost point it visited
 * is used, a warning is logged and the result is marked as not converged. Running again with
 * the same inputs would give the same answer, so there is no retry.
 */
public class PairwiseAligner {

  private static final Logger logger = Logger.getLogger(PairwiseAligner.class);

  /**
   * Smallest difference used when computing weights, on the normalized amplitude scale
   */
  private static final double WEIGHT_FLOOR = 1E-6;

  private final AlignmentConfiguration config;

  /**
   * Create an aligner using the shared configuration
   */
  public PairwiseAligner() {
    this(AlignmentConfiguration.getInstance());
  }

  public PairwiseAligner(AlignmentConfiguration config) {
    this.config = config;
  }

  /**
   * Check that two spectra can be compared point-by-point by the aligner
   *
   * @param reference Spectrum to align to
   * @param target Spectrum to be aligned
   * @throws PreconditionException if either has more than one sub-spectrum, or if their sample
   * counts or axes differ
   */
  static void validatePair(Spectrum reference, Spectrum target) {
    if (reference.getSubspectrumCount() != 1 || target.getSubspectrumCount() != 1) {
      throw new PreconditionException(Reason.SUBSPECTRUM_COUNT,
          "both spectra must have exactly 1 sub-spectrum (got "
              + reference.getSubspectrumCount() + " and " + target.getSubspectrumCount() + ")");
    }
    if (reference.getSampleCount() != target.getSampleCount()) {
      throw new PreconditionException(Reason.SHAPE_MISMATCH,
          "reference has " + reference.getSampleCount() + " points, target has "
              + target.getSampleCount());
    }
    if (!reference.hasSameAxes(target)) {
      throw new PreconditionException(Reason.AXIS_MISMATCH,
          "reference and target must be sampled on identical time and ppm axes");
    }
  }

  /**
   * Get least-squares weights that turn a weighted sum of squares of the given differences
   * into their L1 norm
   *
   * @param diffs Differences at the current correction
   * @return 1 / |diff| for each point, with |diff| floored to keep the weights finite
   */
  static double[] l1Weights(double[] diffs) {
    double[] weights = new double[diffs.length];
    for (int i = 0; i < diffs.length; ++i) {
      weights[i] = 1. / Math.max(Math.abs(diffs[i]), WEIGHT_FLOOR);
    }
    return weights;
  }

  /**
   * Align a target sub-spectrum onto a reference sub-spectrum.
   *
   * @param reference Spectrum to align to (returned unchanged in the result)
   * @param target Spectrum to be corrected
   * @return The correction found, the corrected target, and fit diagnostics
   * @throws PreconditionException if the two spectra can't be compared or the ppm window
   * selects no points
   */
  public PairwiseAlignment align(Spectrum reference, Spectrum target) {

    validatePair(reference, target);

    boolean[] mask = NumericUtils.ppmWindowMask(reference.getPpm(),
        config.getWindowLowPpm(), config.getWindowHighPpm());
    if (NumericUtils.countSelected(mask) == 0) {
      throw new PreconditionException(Reason.EMPTY_WINDOW,
          config.getWindowLowPpm() + " to " + config.getWindowHighPpm() + " ppm");
    }

    // common amplitude scale for both spectra, found once outside the solver loop
    double maxReal = NumericUtils.maxAbsReal(reference.getSpecs(0), target.getSpecs(0));
    double scale = maxReal > 0 ? 1. / maxReal : 1.;
    Spectrum scaledReference = reference.scaleAmplitude(scale);
    Spectrum scaledTarget = target.scaleAmplitude(scale);

    AlignmentObjective objective = new AlignmentObjective(scaledReference.getFids(0),
        scaledTarget.getFids(0), reference.getTime(), mask);
    DifferenceModel model = new DifferenceModel(objective, config.getDerivativeStep());

    LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer().
        withCostRelativeTolerance(config.getCostTolerance()).
        withParameterRelativeTolerance(config.getParameterTolerance());
    RealVector observedComponents =
        MatrixUtils.createRealVector(new double[objective.getSelectedPointCount()]);

    double[] point = new double[]{0., 0.};
    double[] diffs = objective.signedDifference(point);
    double initialObjective = AlignmentObjective.l1Norm(diffs);
    double cost = initialObjective;

    // iteration and evaluation limits are shared by all passes
    int iterations = 0;
    boolean converged = initialObjective == 0.;
    try {
      for (int pass = 0; pass < config.getMaxReweights() && !converged; ++pass) {
        int iterationsLeft = config.getMaxIterations() - iterations;
        int evaluationsLeft = config.getMaxEvaluations() - model.getEvaluationCount();
        if (iterationsLeft <= 0 || evaluationsLeft <= 0) {
          break;
        }

        LeastSquaresProblem lsp = new LeastSquaresBuilder().
            start(point).
            target(observedComponents).
            model(model).
            weight(new DiagonalMatrix(l1Weights(diffs))).
            lazyEvaluation(false).
            maxEvaluations(evaluationsLeft).
            maxIterations(iterationsLeft).
            build();

        LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(lsp);
        iterations += optimum.getIterations();

        point = optimum.getPoint().toArray();
        diffs = objective.signedDifference(point);
        double previousCost = cost;
        cost = AlignmentObjective.l1Norm(diffs);
        // settled once a pass no longer lowers the L1 cost by a meaningful fraction
        converged = cost == 0.
            || previousCost - cost <= config.getReweightTolerance() * previousCost;
      }
      if (!converged) {
        logger.warn("Alignment did not settle within " + config.getMaxReweights()
            + " reweighting passes, " + config.getMaxIterations() + " iterations and "
            + config.getMaxEvaluations() + " evaluations");
      }
    } catch (MaxCountExceededException | ConvergenceException e) {
      converged = false;
      logger.warn("Alignment solver did not converge: " + e.getMessage());
    }

    // a final pass may end slightly above the lowest cost seen
    double[] fitParams = point;
    if (model.getBestValue() < objective.value(point)) {
      fitParams = model.getBestPoint();
    }
    if (!converged) {
      logger.warn("Using best iterate found, " + CorrectionVector.fromArray(fitParams));
    }

    CorrectionVector correction = CorrectionVector.fromArray(fitParams);
    double finalObjective = objective.value(fitParams);

    boolean suspicious = Math.abs(correction.getFrequencyShift()) > config.getMaxPlausibleShift();
    if (suspicious) {
      logger.warn("Frequency correction of " + correction
          + " exceeds plausible limit of " + config.getMaxPlausibleShift()
          + " Hz; alignment should be reviewed");
    }

    logger.debug("Aligned with correction " + correction + ", cost " + initialObjective
        + " -> " + finalObjective);

    // correction goes onto the original, unscaled target
    Spectrum corrected = target.applyCorrection(correction);

    return new PairwiseAlignment(reference, corrected, correction, initialObjective,
        finalObjective, iterations, model.getEvaluationCount(), converged, suspicious);
  }

  public AlignmentConfiguration getConfiguration() {
    return config;
  }

  /**
   * Least-squares model of the per-point differences between reference and corrected target,
   * with a forward-difference Jacobian. Also remembers the point with the lowest L1 cost it
   * has been asked about, which is the fallback answer when the solver gives up.
   */
  private static class DifferenceModel implements MultivariateJacobianFunction {

    private final AlignmentObjective objective;
    private final double step;
    private double[] bestPoint = new double[]{0., 0.};
    private double bestValue = Double.POSITIVE_INFINITY;
    private int evaluationCount = 0;

    DifferenceModel(AlignmentObjective objective, double step) {
      this.objective = objective;
      this.step = step;
    }

    double[] getBestPoint() {
      return bestPoint.clone();
    }

    double getBestValue() {
      return bestValue;
    }

    int getEvaluationCount() {
      return evaluationCount;
    }

    @Override
    public Pair<RealVector, RealMatrix> value(RealVector point) {
      ++evaluationCount;
      double[] params = point.toArray();
      double[] diffs = objective.signedDifference(params);
      double cost = AlignmentObjective.l1Norm(diffs);
      if (cost < bestValue) {
        bestValue = cost;
        bestPoint = params.clone();
      }

      double[][] jacobian = new double[diffs.length][params.length];
      for (int j = 0; j < params.length; ++j) {
        double[] shifted = params.clone();
        shifted[j] += step;
        double[] diffOnParam = objective.signedDifference(shifted);
        for (int i = 0; i < diffs.length; ++i) {
          jacobian[i][j] = (diffOnParam[i] - diffs[i]) / step;
        }
      }

      RealVector fnc = MatrixUtils.createRealVector(diffs);
      RealMatrix jMat = MatrixUtils.createRealMatrix(jacobian);
      return new Pair<>(fnc, jMat);
    }
  }

}
