package mrs.align.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import org.apache.commons.math3.complex.Complex;

/**
 * Class containing small numeric helpers shared by the alignment code: amplitude normalization,
 * ppm window masks, angle wrapping and number formatting.
 */
public class NumericUtils {

  /**
   * 2 * Pi, sometimes also referred to as Tau.
   * The number of radians in a full circle.
   */
  public final static double TAU = Math.PI * 2; // radians in full circle

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.###");
        setInfinityPrintable(format);
        return format;
      });

  private NumericUtils() {
  }

  /**
   * Count the entries of a mask that are set
   *
   * @param mask Boolean mask
   * @return Number of true entries
   */
  public static int countSelected(boolean[] mask) {
    int count = 0;
    for (boolean selected : mask) {
      if (selected) {
        ++count;
      }
    }
    return count;
  }

  /**
   * Get a mask over a ppm axis that is true for every point inside the (inclusive) window.
   * The bounds may be given in either order.
   *
   * @param ppm Chemical shift axis
   * @param lowPpm One edge of the window
   * @param highPpm Other edge of the window
   * @return Mask matching the ppm axis point for point
   */
  public static boolean[] ppmWindowMask(double[] ppm, double lowPpm, double highPpm) {
    double low = Math.min(lowPpm, highPpm);
    double high = Math.max(lowPpm, highPpm);
    boolean[] mask = new boolean[ppm.length];
    for (int i = 0; i < ppm.length; ++i) {
      mask[i] = ppm[i] <= high && ppm[i] >= low;
    }
    return mask;
  }

  /**
   * Get the largest absolute value of the real part over all the given series.
   * Used to bring two spectra to a common amplitude scale before comparing them.
   *
   * @param series Any number of complex series
   * @return Largest |Re(x)| found, or 0 if every series is empty or purely imaginary
   */
  public static double maxAbsReal(Complex[]... series) {
    double max = 0.;
    for (Complex[] data : series) {
      for (Complex point : data) {
        max = Math.max(max, Math.abs(point.getReal()));
      }
    }
    return max;
  }

  /**
   * Wrap a degree to be between -180 and 180
   *
   * @param angle in degrees
   * @return same angle but between -180 and 180
   */
  public static double rewrapAngleDegrees(double angle) {
    while (angle < -180) {
      angle += 360;
    }
    while (angle > 180) {
      angle -= 360;
    }
    return angle;
  }

  /**
   * Multiply every entry of a complex series by a real value
   *
   * @param data Series to scale (not modified)
   * @param scale Scale factor
   * @return New, scaled series
   */
  public static Complex[] scale(Complex[] data, double scale) {
    Complex[] scaled = new Complex[data.length];
    for (int i = 0; i < data.length; ++i) {
      scaled[i] = data[i].multiply(scale);
    }
    return scaled;
  }

  public static void setInfinityPrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Inf.");
    df.setDecimalFormatSymbols(symbols);
  }

}
