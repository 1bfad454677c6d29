package ca.gc.cra.hostbridge.domain.error;

/**
 * <strong>What:</strong> Typed taxonomy of every failure a bridge response can carry.
 * <p><strong>Role:</strong> Surfaced on the wire as {@code errorCode} next to the human-readable {@code error}
 * message, and used as a metric suffix ({@code bridge.command.failed.<kind>}).</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ErrorKind {
  /** The request line was not a well-formed command envelope. */
  DECODE,
  /** The command name is not registered. */
  UNKNOWN_COMMAND,
  /** A command parameter was missing or had the wrong shape. */
  INVALID_PARAMS,
  /** No entity with the requested name exists in the active scene. */
  ENTITY_NOT_FOUND,
  /** The entity carries no component of the requested type. */
  COMPONENT_NOT_FOUND,
  /** The component type exposes no field or property with the requested name. */
  MEMBER_NOT_FOUND,
  /** The member exists but cannot be assigned (final field, getter without setter). */
  MEMBER_NOT_WRITABLE,
  /** A wire string could not be parsed into the member's type. */
  CONVERSION,
  /** A required reference value matched no entity or asset. */
  REFERENCE_NOT_RESOLVED,
  /** The host loop did not finish the invocation within the configured bound. */
  TIMEOUT,
  /** The invocation was cancelled before or while it ran. */
  CANCELLED,
  /** The host loop is stopped and cannot accept work. */
  HOST_UNAVAILABLE,
  /** The handler threw while running on the host loop. */
  HOST_EXCEPTION,
  /** The handler result could not be serialized. */
  ENCODE,
  /** Any failure the bridge did not anticipate. */
  INTERNAL;

  /**
   * Returns the metric-friendly lower-case form, e.g. {@code entity_not_found}.
   *
   * @return lower-case name
   */
  public String metricSuffix() {
    return name().toLowerCase(java.util.Locale.ROOT);
  }
}
