package ca.gc.cra.hostbridge.application.wiring;

import ca.gc.cra.hostbridge.application.reflect.MemberAccessor;

/** Field declared with exactly the source's runtime class. */
public final class ExactTypeMatcher implements WiringMatcher {
  @Override
  public String name() {
    return "exact-type";
  }

  @Override
  public boolean matches(MemberAccessor field, Object source, String sourceName) {
    return field.valueType() == source.getClass();
  }
}
