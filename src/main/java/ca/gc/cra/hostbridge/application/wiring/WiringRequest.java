package ca.gc.cra.hostbridge.application.wiring;

import ca.gc.cra.hostbridge.validation.Strings;

/**
 * One requested connection: put a reference to the {@code source} component into a field of the {@code target}
 * component.
 *
 * @param source source component type name, matched exactly or as a substring
 * @param target target component type name, matched exactly or as a substring
 * @param eventName optional event member on the source that makes the pair wireable at runtime
 */
public record WiringRequest(String source, String target, String eventName) {
  public WiringRequest {
    source = Strings.requireNonBlank("source", source);
    target = Strings.requireNonBlank("target", target);
    eventName = eventName == null || eventName.isBlank() ? null : eventName.trim();
  }

  public static WiringRequest of(String source, String target) {
    return new WiringRequest(source, target, null);
  }

  /** Renders the pair as {@code "Source -> Target"}. */
  public String label() {
    return source + " -> " + target;
  }
}
