package mrs.align.input;

import java.io.IOException;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Configuration of the sub-spectrum alignment: the ppm window used as the alignment reporter
 * signal, the tolerances and limits handed to the least-squares solver, and whether independent
 * alignment steps may run in parallel.
 *
 * Values are read from an XML file (by default subspec-align-config.xml, found in the working
 * directory or on the classpath). Anything not given in the file keeps its default value.
 */
public class AlignmentConfiguration {

  private static AlignmentConfiguration instance;

  static final String DEFAULT_CONFIG_PATH = "subspec-align-config.xml";
  private static final Logger logger = Logger.getLogger(AlignmentConfiguration.class);

  private String loadedConfigPath = DEFAULT_CONFIG_PATH;

  // water / NAA / Cho region
  private double windowLowPpm = 1.95;
  private double windowHighPpm = 4.0;

  private double costTolerance = 1.0E-10;
  private double parameterTolerance = 1.0E-10;
  private int maxIterations = 1000;
  private int maxEvaluations = 5000;
  private double derivativeStep = 1.0E-6;
  private double maxPlausibleShift = 20.; // Hz
  private int maxReweights = 50;
  private double reweightTolerance = 1.0E-4;

  private boolean parallel = false;
  private int threads = 2;

  /**
   * Create a configuration holding only the default values
   */
  public AlignmentConfiguration() {
  }

  private AlignmentConfiguration(String configLocation) {
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration(configLocation);

      windowLowPpm = config.getDouble("FrequencyWindow.LowPpm", windowLowPpm);
      windowHighPpm = config.getDouble("FrequencyWindow.HighPpm", windowHighPpm);

      costTolerance = config.getDouble("Solver.CostTolerance", costTolerance);
      parameterTolerance = config.getDouble("Solver.ParameterTolerance", parameterTolerance);
      maxIterations = config.getInt("Solver.MaxIterations", maxIterations);
      maxEvaluations = config.getInt("Solver.MaxEvaluations", maxEvaluations);
      derivativeStep = config.getDouble("Solver.DerivativeStep", derivativeStep);
      maxPlausibleShift = config.getDouble("Solver.MaxPlausibleShiftHz", maxPlausibleShift);
      maxReweights = config.getInt("Solver.MaxReweights", maxReweights);
      reweightTolerance = config.getDouble("Solver.ReweightTolerance", reweightTolerance);

      parallel = config.getBoolean("Execution.Parallel", parallel);
      threads = config.getInt("Execution.Threads", threads);

      if (config.getFile() != null) {
        try {
          loadedConfigPath = config.getFile().getCanonicalPath();
        } catch (IOException e) {
          logger.warn("Could not resolve path of loaded configuration", e);
        }
      } else if (config.getURL() != null) {
        loadedConfigPath = config.getURL().toString();
      }
      logger.info("Succesfully loaded in configuration: " + loadedConfigPath);
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    }
  }

  /**
   * Gets the current instance of the configuration, or creates one if none exists
   *
   * @return the current configuration instance
   */
  synchronized public static AlignmentConfiguration getInstance() {
    if (instance == null) {
      instance = new AlignmentConfiguration(DEFAULT_CONFIG_PATH);
    }
    return instance;
  }

  /**
   * Read a configuration from the given file, independent of the shared instance.
   * If the file can't be read, the defaults are used.
   *
   * @param configLocation Path or classpath name of an XML configuration file
   * @return Configuration holding the values read from the file
   */
  public static AlignmentConfiguration load(String configLocation) {
    return new AlignmentConfiguration(configLocation);
  }

  public double getCostTolerance() {
    return costTolerance;
  }

  public void setCostTolerance(double costTolerance) {
    this.costTolerance = costTolerance;
  }

  /**
   * Get the step used for the forward-difference derivatives of the cost function.
   * The same step is used for frequency (Hz) and phase (degrees).
   *
   * @return Derivative step size
   */
  public double getDerivativeStep() {
    return derivativeStep;
  }

  public void setDerivativeStep(double derivativeStep) {
    this.derivativeStep = derivativeStep;
  }

  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

  /**
   * Get the largest number of cost function evaluations for one pairwise alignment, shared by
   * all reweighting passes
   *
   * @return Evaluation limit
   */
  public int getMaxEvaluations() {
    return maxEvaluations;
  }

  public void setMaxEvaluations(int maxEvaluations) {
    this.maxEvaluations = maxEvaluations;
  }

  /**
   * Get the largest number of solver iterations for one pairwise alignment. The limit is shared
   * by all reweighting passes, so it bounds the whole alignment and not each pass.
   *
   * @return Iteration limit
   */
  public int getMaxIterations() {
    return maxIterations;
  }

  public void setMaxIterations(int maxIterations) {
    this.maxIterations = maxIterations;
  }

  /**
   * Get the largest frequency correction (Hz, either sign) considered believable. Corrections
   * beyond this are still applied but flagged for review.
   *
   * @return Plausibility limit in Hz
   */
  public double getMaxPlausibleShift() {
    return maxPlausibleShift;
  }

  public void setMaxPlausibleShift(double maxPlausibleShift) {
    this.maxPlausibleShift = maxPlausibleShift;
  }

  /**
   * Get the largest number of reweighting passes made while minimizing the L1 cost. Each pass
   * is one full least-squares solve.
   *
   * @return Reweighting pass limit
   */
  public int getMaxReweights() {
    return maxReweights;
  }

  public void setMaxReweights(int maxReweights) {
    this.maxReweights = maxReweights;
  }

  /**
   * Get the fraction of the L1 cost a reweighting pass must remove for the minimization to keep
   * going. Once a pass lowers the cost by less than this fraction (or raises it), the alignment
   * is considered converged.
   *
   * @return Relative cost-reduction tolerance
   */
  public double getReweightTolerance() {
    return reweightTolerance;
  }

  public void setReweightTolerance(double reweightTolerance) {
    this.reweightTolerance = reweightTolerance;
  }

  public double getParameterTolerance() {
    return parameterTolerance;
  }

  public void setParameterTolerance(double parameterTolerance) {
    this.parameterTolerance = parameterTolerance;
  }

  public int getThreads() {
    return threads;
  }

  public void setThreads(int threads) {
    this.threads = threads;
  }

  public double getWindowHighPpm() {
    return windowHighPpm;
  }

  public double getWindowLowPpm() {
    return windowLowPpm;
  }

  /**
   * Set the ppm window over which sub-spectra are compared
   *
   * @param lowPpm Lower chemical shift bound
   * @param highPpm Upper chemical shift bound
   */
  public void setWindow(double lowPpm, double highPpm) {
    windowLowPpm = Math.min(lowPpm, highPpm);
    windowHighPpm = Math.max(lowPpm, highPpm);
  }

  /**
   * True if alignment steps that don't depend on each other may run on separate threads
   *
   * @return Whether parallel execution is enabled
   */
  public boolean isParallel() {
    return parallel;
  }

  public void setParallel(boolean parallel) {
    this.parallel = parallel;
  }

}
