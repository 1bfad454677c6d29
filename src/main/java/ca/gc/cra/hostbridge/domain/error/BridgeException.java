package ca.gc.cra.hostbridge.domain.error;

import java.util.Objects;

/**
 * Unchecked failure carrying an {@link ErrorKind} and the message reported to the automation client.
 *
 * <p>Thrown by command handlers, the property bridge and the executor; the dispatcher converts it into an
 * error response without ever closing the session.</p>
 */
public class BridgeException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  /**
   * Creates an exception of the given kind.
   *
   * @param kind failure category; never {@code null}
   * @param message client-facing message
   */
  public BridgeException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Creates an exception of the given kind wrapping a cause.
   *
   * @param kind failure category; never {@code null}
   * @param message client-facing message
   * @param cause underlying failure
   */
  public BridgeException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the failure category.
   *
   * @return error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  public static BridgeException entityNotFound(String name) {
    return new BridgeException(ErrorKind.ENTITY_NOT_FOUND, "Entity not found: " + name);
  }

  public static BridgeException componentNotFound(String componentType, String entityName) {
    return new BridgeException(ErrorKind.COMPONENT_NOT_FOUND,
        "Component '" + componentType + "' not found on entity '" + entityName + "'");
  }

  public static BridgeException memberNotFound(String member, String componentType) {
    return new BridgeException(ErrorKind.MEMBER_NOT_FOUND,
        "Member '" + member + "' not found on component '" + componentType + "'");
  }

  public static BridgeException invalidParams(String message) {
    return new BridgeException(ErrorKind.INVALID_PARAMS, message);
  }
}
