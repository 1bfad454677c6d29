package ca.gc.cra.hostbridge.application.reflect;

/**
 * Stringified member value returned by property reads and writes.
 *
 * @param entity entity name as addressed
 * @param component component type name
 * @param member member name
 * @param kind field or property
 * @param value stringified value, {@code "null"} for null
 * @param valueType type tag of the runtime value (declared type when null)
 */
public record PropertyValue(
    String entity, String component, String member, MemberKind kind, String value, String valueType) {}
