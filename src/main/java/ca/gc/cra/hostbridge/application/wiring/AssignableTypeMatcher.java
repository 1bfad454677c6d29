package ca.gc.cra.hostbridge.application.wiring;

import ca.gc.cra.hostbridge.application.reflect.MemberAccessor;

/**
 * Field whose type is a supertype or interface of the source's class. {@code Object} fields never match, so
 * a catch-all slot is not filled with whatever component happens to come first.
 */
public final class AssignableTypeMatcher implements WiringMatcher {
  @Override
  public String name() {
    return "assignable-type";
  }

  @Override
  public boolean matches(MemberAccessor field, Object source, String sourceName) {
    Class<?> type = field.valueType();
    return type != Object.class && type.isAssignableFrom(source.getClass());
  }
}
