package ca.gc.cra.hostbridge.domain.scene;

import java.math.BigDecimal;

/**
 * Formats floating point values the way the bridge reports them: no trailing {@code .0}, no exponent.
 */
public final class Decimals {
  private Decimals() {}

  /**
   * Formats a float using its shortest decimal representation.
   *
   * @param value value to format
   * @return e.g. {@code "5"} for {@code 5.0f}, {@code "9.5"} for {@code 9.5f}
   */
  public static String format(float value) {
    if (!Float.isFinite(value)) {
      return Float.toString(value);
    }
    return strip(new BigDecimal(Float.toString(value)));
  }

  /**
   * Formats a double using its shortest decimal representation.
   *
   * @param value value to format
   * @return formatted value
   */
  public static String format(double value) {
    if (!Double.isFinite(value)) {
      return Double.toString(value);
    }
    return strip(new BigDecimal(Double.toString(value)));
  }

  private static String strip(BigDecimal decimal) {
    if (decimal.signum() == 0) {
      return "0";
    }
    return decimal.stripTrailingZeros().toPlainString();
  }
}
