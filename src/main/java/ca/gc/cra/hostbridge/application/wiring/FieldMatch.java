package ca.gc.cra.hostbridge.application.wiring;

import ca.gc.cra.hostbridge.application.reflect.MemberAccessor;

/**
 * A chosen target field and the value to store in it.
 *
 * @param field target field
 * @param value source component, or its owning entity for entity-typed fields
 * @param matcher name of the matcher that selected the field
 */
public record FieldMatch(MemberAccessor field, Object value, String matcher) {}
