package ca.gc.cra.hostbridge.application.reflect;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A component kind known to the bridge by name.
 *
 * @param name simple type name used on the wire
 * @param type component class
 * @param factory creates new instances for {@code AddComponent}; {@code null} when the kind cannot be added
 * @param adapter typed member access
 */
public record ComponentType(String name, Class<?> type, Supplier<?> factory, ComponentAdapter adapter) {
  public ComponentType {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(adapter, "adapter");
  }

  public boolean instantiable() {
    return factory != null;
  }

  /**
   * Creates a fresh instance.
   *
   * @return new component, or empty when the kind has no factory
   */
  public Optional<Object> newInstance() {
    return factory == null ? Optional.empty() : Optional.of(factory.get());
  }
}
