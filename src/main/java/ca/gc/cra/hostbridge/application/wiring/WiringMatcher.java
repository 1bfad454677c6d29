package ca.gc.cra.hostbridge.application.wiring;

import ca.gc.cra.hostbridge.application.reflect.MemberAccessor;

/**
 * One rule deciding whether a target field can receive a source component.
 */
public interface WiringMatcher {

  /** Short name reported as {@code via} in wiring results. */
  String name();

  /**
   * Tests a candidate field.
   *
   * @param field wireable field of the target component
   * @param source source component instance
   * @param sourceName source name as requested
   * @return whether the field matches
   */
  boolean matches(MemberAccessor field, Object source, String sourceName);
}
