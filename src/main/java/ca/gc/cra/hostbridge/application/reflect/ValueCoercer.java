package ca.gc.cra.hostbridge.application.reflect;

import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import ca.gc.cra.hostbridge.domain.scene.Vector3;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts wire strings into values of a member's declared type.
 *
 * <p>Scalar targets (numeric primitives and wrappers, {@code boolean}, {@code char}, {@code String}, enums and
 * {@link Vector3}) are parsed by target type. The wire type tag is only consulted when the target is
 * {@code Object}, where it selects the parse. Every other target is a reference and goes through the
 * {@link ReferenceResolver}.</p>
 */
public final class ValueCoercer {
  private final ReferenceResolver references;

  public ValueCoercer(ReferenceResolver references) {
    this.references = Objects.requireNonNull(references, "references");
  }

  /**
   * Coerces {@code raw} into a value assignable to {@code target}.
   *
   * @param raw wire string; {@code null} clears reference members
   * @param typeTag client-supplied type hint such as {@code float}; may be {@code null}
   * @param target declared member type
   * @param requireReference whether an unresolved reference is an error rather than {@code null}
   * @return coerced value
   * @throws BridgeException {@link ErrorKind#CONVERSION} for unparsable scalars,
   *     {@link ErrorKind#REFERENCE_NOT_RESOLVED} for required references that match nothing
   */
  public Object coerce(String raw, String typeTag, Class<?> target, boolean requireReference) {
    Objects.requireNonNull(target, "target");
    if (target == Object.class) {
      return coerceUntyped(raw, typeTag, requireReference);
    }
    if (isScalar(target)) {
      return coerceScalar(raw, typeTag, target);
    }
    return coerceReference(raw, target, requireReference);
  }

  /**
   * Returns whether {@code type} is parsed from text rather than resolved as a reference.
   *
   * @param type member type
   * @return {@code true} for scalar types
   */
  public static boolean isScalar(Class<?> type) {
    return type.isPrimitive()
        || Number.class.isAssignableFrom(type)
        || type == Boolean.class
        || type == Character.class
        || type == String.class
        || type == CharSequence.class
        || type.isEnum()
        || type == Vector3.class;
  }

  private Object coerceUntyped(String raw, String typeTag, boolean requireReference) {
    String tag = typeTag == null ? "" : typeTag.trim().toLowerCase(Locale.ROOT);
    return switch (tag) {
      case "int", "integer" -> coerceScalar(raw, typeTag, Integer.class);
      case "long" -> coerceScalar(raw, typeTag, Long.class);
      case "float" -> coerceScalar(raw, typeTag, Float.class);
      case "double" -> coerceScalar(raw, typeTag, Double.class);
      case "bool", "boolean" -> coerceScalar(raw, typeTag, Boolean.class);
      case "vector3" -> coerceScalar(raw, typeTag, Vector3.class);
      case "", "string" -> raw;
      default -> coerceReference(raw, Object.class, requireReference);
    };
  }

  private Object coerceScalar(String raw, String typeTag, Class<?> target) {
    if (raw == null) {
      if (target.isPrimitive()) {
        throw conversion("null", typeTag, target);
      }
      return null;
    }
    if (target == String.class || target == CharSequence.class) {
      return raw;
    }
    String text = raw.trim();
    try {
      if (target == int.class || target == Integer.class) {
        return Integer.parseInt(text);
      }
      if (target == long.class || target == Long.class) {
        return Long.parseLong(text);
      }
      if (target == short.class || target == Short.class) {
        return Short.parseShort(text);
      }
      if (target == byte.class || target == Byte.class) {
        return Byte.parseByte(text);
      }
      if (target == float.class || target == Float.class) {
        return Float.parseFloat(text);
      }
      if (target == double.class || target == Double.class) {
        return Double.parseDouble(text);
      }
      if (target == boolean.class || target == Boolean.class) {
        return parseBoolean(text, typeTag, target);
      }
      if (target == char.class || target == Character.class) {
        if (raw.length() != 1) {
          throw conversion(raw, typeTag, target);
        }
        return raw.charAt(0);
      }
      if (target == Vector3.class) {
        return Vector3.parse(text);
      }
      if (target.isEnum()) {
        return parseEnum(text, typeTag, target);
      }
    } catch (IllegalArgumentException ex) {
      // NumberFormatException is an IllegalArgumentException
      throw conversion(raw, typeTag, target);
    }
    throw conversion(raw, typeTag, target);
  }

  private Object coerceReference(String raw, Class<?> target, boolean requireReference) {
    Optional<ReferenceResolver.Resolution> resolution = references.resolve(raw, target);
    if (resolution.isPresent()) {
      return resolution.get().value();
    }
    if (requireReference && raw != null && !raw.isBlank()) {
      throw new BridgeException(ErrorKind.REFERENCE_NOT_RESOLVED,
          "No " + target.getSimpleName() + " reference found for '" + raw + "'");
    }
    return null;
  }

  private static Boolean parseBoolean(String text, String typeTag, Class<?> target) {
    if (text.equalsIgnoreCase("true")) {
      return Boolean.TRUE;
    }
    if (text.equalsIgnoreCase("false")) {
      return Boolean.FALSE;
    }
    throw conversion(text, typeTag, target);
  }

  private static Object parseEnum(String text, String typeTag, Class<?> target) {
    Object[] constants = target.getEnumConstants();
    for (Object constant : constants) {
      if (((Enum<?>) constant).name().equals(text)) {
        return constant;
      }
    }
    for (Object constant : constants) {
      if (((Enum<?>) constant).name().equalsIgnoreCase(text)) {
        return constant;
      }
    }
    throw conversion(text, typeTag, target);
  }

  private static BridgeException conversion(String raw, String typeTag, Class<?> target) {
    String given = typeTag == null || typeTag.isBlank() ? "untagged" : typeTag;
    return new BridgeException(ErrorKind.CONVERSION,
        "Cannot convert '" + raw + "' to " + ValueFormats.typeTag(target) + " (given " + given + ")");
  }
}
