package ca.gc.cra.hostbridge.application.reflect;

/** Whether a member is backed by a field or by getter/setter methods. */
public enum MemberKind {
  FIELD,
  PROPERTY
}
