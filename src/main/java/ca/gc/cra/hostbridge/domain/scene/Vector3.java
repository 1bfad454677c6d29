package ca.gc.cra.hostbridge.domain.scene;

import java.util.Map;

/**
 * Immutable three-component vector used for positions, Euler rotations and scales.
 *
 * @param x x component
 * @param y y component
 * @param z z component
 */
public record Vector3(float x, float y, float z) {
  public static final Vector3 ZERO = new Vector3(0f, 0f, 0f);
  public static final Vector3 ONE = new Vector3(1f, 1f, 1f);

  /**
   * Parses {@code "x,y,z"}, optionally wrapped in parentheses, e.g. {@code "(1, 2.5, 0)"}.
   *
   * @param raw textual vector
   * @return parsed vector
   * @throws IllegalArgumentException when the text does not contain exactly three numbers
   */
  public static Vector3 parse(String raw) {
    if (raw == null) {
      throw new IllegalArgumentException("vector must not be null");
    }
    String body = raw.trim();
    if (body.startsWith("(") && body.endsWith(")")) {
      body = body.substring(1, body.length() - 1);
    }
    String[] parts = body.split(",");
    if (parts.length != 3) {
      throw new IllegalArgumentException("vector must have three components (was '" + raw + "')");
    }
    try {
      return new Vector3(
          Float.parseFloat(parts[0].trim()),
          Float.parseFloat(parts[1].trim()),
          Float.parseFloat(parts[2].trim()));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("vector components must be numeric (was '" + raw + "')", ex);
    }
  }

  /**
   * Builds a vector from a {@code {x, y, z}} map; missing components default to {@code fallback}'s.
   *
   * @param values map with optional numeric {@code x}, {@code y}, {@code z}
   * @param fallback vector supplying missing components
   * @return merged vector
   */
  public static Vector3 fromMap(Map<?, ?> values, Vector3 fallback) {
    return new Vector3(
        component(values.get("x"), fallback.x),
        component(values.get("y"), fallback.y),
        component(values.get("z"), fallback.z));
  }

  private static float component(Object value, float fallback) {
    if (value == null) {
      return fallback;
    }
    if (value instanceof Number number) {
      return number.floatValue();
    }
    try {
      return Float.parseFloat(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("vector component must be numeric (was '" + value + "')", ex);
    }
  }

  @Override
  public String toString() {
    return "(" + Decimals.format(x) + ", " + Decimals.format(y) + ", " + Decimals.format(z) + ")";
  }
}
