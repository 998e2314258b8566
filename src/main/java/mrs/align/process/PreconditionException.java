package mrs.align.process;

/**
 * Thrown when the data handed to an alignment routine can't be aligned as given. This is raised
 * before any solver work starts, and names the condition that failed.
 */
public class PreconditionException extends IllegalArgumentException {

  private static final long serialVersionUID = -3154823374587012744L;

  /**
   * The condition that was not met
   */
  public enum Reason {
    NOT_COIL_COMBINED("Receiver channels must be combined before sub-spectrum alignment"),
    NOT_AVERAGED("Averages must be combined before sub-spectrum alignment"),
    SUBSPECTRUM_COUNT("Wrong number of sub-spectra"),
    AXIS_MISMATCH("Time or ppm axes differ"),
    SHAPE_MISMATCH("Sample counts differ"),
    EMPTY_WINDOW("No points of the spectrum fall inside the alignment window"),
    UNSUPPORTED_MODE("Editing mode not supported");

    private final String description;

    Reason(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

  private final Reason reason;

  public PreconditionException(Reason reason, String detail) {
    super(reason.getDescription() + ": " + detail);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }

}
