package ca.gc.cra.hostbridge.application.reflect;

import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import ca.gc.cra.hostbridge.domain.scene.Renderer;
import ca.gc.cra.hostbridge.domain.scene.RigidBody;
import ca.gc.cra.hostbridge.domain.scene.Transform;
import ca.gc.cra.hostbridge.domain.scene.Vector3;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Maps component type names to typed adapters and factories.
 * <p><strong>Role:</strong> Resolves the string type names used by {@code AddComponent} and workflow commands, and
 * hands the property bridge and autowiring a {@link ComponentAdapter} for any component class. Registered types
 * keep their explicit adapters; any other class gets a reflective adapter derived on first use and cached.</p>
 * <p><strong>Thread-safety:</strong> Backed by {@link ConcurrentHashMap}; registration is expected at startup but
 * is safe at any time.</p>
 *
 * @since 0.1.0
 */
public final class ComponentTypeRegistry {
  private static final Logger log = LoggerFactory.getLogger(ComponentTypeRegistry.class);

  private final Map<String, ComponentType> byName = new ConcurrentHashMap<>();
  private final Map<Class<?>, ComponentAdapter> adapters = new ConcurrentHashMap<>();

  /**
   * Creates a registry pre-populated with {@link Transform}, {@link Renderer} and {@link RigidBody}.
   *
   * @return new registry
   */
  public static ComponentTypeRegistry withBuiltins() {
    ComponentTypeRegistry registry = new ComponentTypeRegistry();
    registry.register(Transform.class, null, ComponentAdapter.builder(Transform.class)
        .property("position", Vector3.class, Transform::getPosition, Transform::setPosition)
        .property("rotation", Vector3.class, Transform::getRotation, Transform::setRotation)
        .property("scale", Vector3.class, Transform::getScale, Transform::setScale)
        .build());
    registry.register(Renderer.class, Renderer::new);
    registry.register(RigidBody.class, RigidBody::new);
    return registry;
  }

  /**
   * Registers a component class with a reflectively derived adapter.
   *
   * @param type component class
   * @param factory instance factory, or {@code null} when the type cannot be added by name
   * @param <T> component type
   * @return this registry
   */
  public <T> ComponentTypeRegistry register(Class<T> type, Supplier<? extends T> factory) {
    return register(type, factory, adapterFor(type));
  }

  /**
   * Registers a component class with an explicit adapter.
   *
   * @param type component class
   * @param factory instance factory, or {@code null}
   * @param adapter typed adapter for the class
   * @param <T> component type
   * @return this registry
   * @throws IllegalStateException when another class is registered under the same simple name
   */
  public <T> ComponentTypeRegistry register(Class<T> type, Supplier<? extends T> factory, ComponentAdapter adapter) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(adapter, "adapter");
    ComponentType entry = new ComponentType(type.getSimpleName(), type, factory, adapter);
    ComponentType previous = byName.putIfAbsent(type.getSimpleName(), entry);
    if (previous != null && previous.type() != type) {
      throw new IllegalStateException("component type name already registered: " + type.getSimpleName()
          + " (" + previous.type().getName() + ")");
    }
    byName.put(type.getSimpleName(), entry);
    byName.put(type.getName(), entry);
    adapters.put(type, adapter);
    log.debug("Registered component type {}", type.getName());
    return this;
  }

  /**
   * Finds a registered type by simple or fully qualified name (case-sensitive).
   *
   * @param name type name
   * @return registered type, or empty
   */
  public Optional<ComponentType> find(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(byName.get(name.trim()));
  }

  /**
   * Finds a registered type or fails with {@link ErrorKind#COMPONENT_NOT_FOUND}.
   *
   * @param name type name
   * @return registered type
   */
  public ComponentType require(String name) {
    return find(name).orElseThrow(
        () -> new BridgeException(ErrorKind.COMPONENT_NOT_FOUND, "Component type not found: " + name));
  }

  /**
   * Returns the adapter for {@code type}, deriving and caching a reflective one for unregistered classes.
   *
   * @param type component class
   * @return adapter
   */
  public ComponentAdapter adapterFor(Class<?> type) {
    return adapters.computeIfAbsent(Objects.requireNonNull(type, "type"), ReflectiveMembers::derive);
  }

  /** Lists registered types ordered by simple name. */
  public List<ComponentType> types() {
    Collection<ComponentType> values = byName.values();
    List<ComponentType> unique = new ArrayList<>();
    for (ComponentType type : values) {
      if (!unique.contains(type)) {
        unique.add(type);
      }
    }
    unique.sort(Comparator.comparing(ComponentType::name));
    return unique;
  }
}
