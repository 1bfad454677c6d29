package ca.gc.cra.hostbridge.application.wiring;

import ca.gc.cra.hostbridge.application.reflect.MemberAccessor;
import ca.gc.cra.hostbridge.domain.scene.Entity;
import java.util.Locale;

/**
 * Field whose name contains the requested source name, lower-cased and with {@code "system"} removed, provided
 * the field can hold the source or its owning entity. {@code HealthSystem} matches a field named
 * {@code healthOwner}.
 */
public final class FieldNameMatcher implements WiringMatcher {
  @Override
  public String name() {
    return "field-name";
  }

  @Override
  public boolean matches(MemberAccessor field, Object source, String sourceName) {
    String normalized = normalize(sourceName);
    if (normalized.isEmpty() || !field.name().toLowerCase(Locale.ROOT).contains(normalized)) {
      return false;
    }
    Class<?> type = field.valueType();
    return type == Entity.class || type.isAssignableFrom(source.getClass());
  }

  static String normalize(String sourceName) {
    return sourceName.toLowerCase(Locale.ROOT).replace("system", "").trim();
  }
}
