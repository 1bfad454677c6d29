package ca.gc.cra.hostbridge.application.reflect;

import ca.gc.cra.hostbridge.domain.scene.Decimals;
import ca.gc.cra.hostbridge.domain.scene.Entity;
import java.util.Map;

/**
 * Stringification and type tags used by property reads.
 */
public final class ValueFormats {
  private static final Map<Class<?>, String> TAGS = Map.ofEntries(
      Map.entry(Integer.class, "int"), Map.entry(int.class, "int"),
      Map.entry(Long.class, "long"), Map.entry(long.class, "long"),
      Map.entry(Short.class, "short"), Map.entry(short.class, "short"),
      Map.entry(Byte.class, "byte"), Map.entry(byte.class, "byte"),
      Map.entry(Float.class, "float"), Map.entry(float.class, "float"),
      Map.entry(Double.class, "double"), Map.entry(double.class, "double"),
      Map.entry(Boolean.class, "bool"), Map.entry(boolean.class, "bool"),
      Map.entry(Character.class, "char"), Map.entry(char.class, "char"),
      Map.entry(String.class, "string"));

  private ValueFormats() {}

  /**
   * Renders a member value for the wire.
   *
   * @param value member value
   * @return {@code "null"}, trimmed decimals, entity names, or {@link String#valueOf(Object)}
   */
  public static String format(Object value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof Float f) {
      return Decimals.format(f);
    }
    if (value instanceof Double d) {
      return Decimals.format(d);
    }
    if (value instanceof Entity entity) {
      return entity.name();
    }
    return String.valueOf(value);
  }

  /**
   * Returns the tag of a value's runtime type, or {@code "null"}.
   *
   * @param value member value
   * @return tag such as {@code float} or a simple class name
   */
  public static String typeTag(Object value) {
    return value == null ? "null" : typeTag(value.getClass());
  }

  /**
   * Returns the tag for a declared type.
   *
   * @param type declared type
   * @return {@code int}, {@code long}, {@code float}, {@code double}, {@code bool}, {@code string}, ... or the
   *     simple class name
   */
  public static String typeTag(Class<?> type) {
    String tag = TAGS.get(type);
    return tag != null ? tag : type.getSimpleName();
  }
}
