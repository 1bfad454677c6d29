package ca.gc.cra.hostbridge.domain.scene;

import ca.gc.cra.hostbridge.validation.Numbers;
import ca.gc.cra.hostbridge.validation.Strings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Addressable node of the scene graph, composed of ordered components.
 * <p><strong>Role:</strong> Created and destroyed through its {@link Scene}; carries a {@link Transform} from the
 * moment it exists.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Entities are confined to the host loop thread; every
 * mutation reaches them through the main-thread executor.</p>
 *
 * @since 0.1.0
 */
public final class Entity {
  /** Tag assigned to new entities. */
  public static final String UNTAGGED = "Untagged";

  private final Scene scene;
  private final long instanceId;
  private final List<Entity> children = new ArrayList<>();
  private final List<Object> components = new ArrayList<>();
  private final Transform transform = new Transform();
  private String name;
  private String tag = UNTAGGED;
  private int layer;
  private boolean active = true;
  private boolean destroyed;
  private Entity parent;

  Entity(Scene scene, long instanceId, String name) {
    this.scene = Objects.requireNonNull(scene, "scene");
    this.instanceId = instanceId;
    this.name = Strings.requireNonBlank("name", name);
    components.add(transform);
  }

  public long instanceId() {
    return instanceId;
  }

  public Scene scene() {
    return scene;
  }

  public String name() {
    return name;
  }

  public void rename(String newName) {
    this.name = Strings.requireNonBlank("name", newName);
  }

  public String tag() {
    return tag;
  }

  public void setTag(String tag) {
    this.tag = Strings.requireNonBlank("tag", tag);
  }

  public int layer() {
    return layer;
  }

  public void setLayer(int layer) {
    this.layer = (int) Numbers.requireRange("layer", layer, 0, 31);
  }

  /** Returns the entity's own active flag, ignoring its ancestors. */
  public boolean isActive() {
    return active;
  }

  public void setActive(boolean active) {
    this.active = active;
  }

  /**
   * Returns whether this entity and all of its ancestors are active.
   *
   * @return effective activation state
   */
  public boolean isActiveInHierarchy() {
    for (Entity current = this; current != null; current = current.parent) {
      if (!current.active) {
        return false;
      }
    }
    return true;
  }

  public boolean isDestroyed() {
    return destroyed;
  }

  public Transform transform() {
    return transform;
  }

  public Optional<Entity> parent() {
    return Optional.ofNullable(parent);
  }

  public List<Entity> children() {
    return Collections.unmodifiableList(children);
  }

  /**
   * Re-parents this entity. {@code null} moves it to the scene roots.
   *
   * @param newParent new parent in the same scene, or {@code null}
   * @throws IllegalArgumentException when the parent belongs to another scene or is a descendant of this entity
   */
  public void setParent(Entity newParent) {
    if (newParent == parent) {
      return;
    }
    if (newParent != null) {
      if (newParent.scene != scene) {
        throw new IllegalArgumentException("parent must belong to scene " + scene.name());
      }
      for (Entity ancestor = newParent; ancestor != null; ancestor = ancestor.parent) {
        if (ancestor == this) {
          throw new IllegalArgumentException(
              "cannot parent '" + name + "' under its own descendant '" + newParent.name + "'");
        }
      }
    }
    detach();
    parent = newParent;
    if (newParent == null) {
      scene.addRoot(this);
    } else {
      newParent.children.add(this);
    }
  }

  /**
   * Returns the slash-separated path from the scene root, e.g. {@code "Player/Weapon"}.
   *
   * @return hierarchy path
   */
  public String path() {
    StringBuilder builder = new StringBuilder(name);
    for (Entity current = parent; current != null; current = current.parent) {
      builder.insert(0, '/').insert(0, current.name);
    }
    return builder.toString();
  }

  public List<Object> components() {
    return Collections.unmodifiableList(components);
  }

  /**
   * Attaches a component instance.
   *
   * @param component component to attach
   * @param <T> component type
   * @return the attached component
   * @throws IllegalArgumentException for a second {@link Transform} or an already attached instance
   */
  public <T> T addComponent(T component) {
    Objects.requireNonNull(component, "component");
    if (component instanceof Transform) {
      throw new IllegalArgumentException("entity '" + name + "' already has a Transform");
    }
    for (Object existing : components) {
      if (existing == component) {
        throw new IllegalArgumentException("component already attached to '" + name + "'");
      }
    }
    components.add(component);
    return component;
  }

  /**
   * Detaches a component instance.
   *
   * @param component component to remove
   * @return {@code true} if it was attached
   * @throws IllegalArgumentException when asked to remove the transform
   */
  public boolean removeComponent(Object component) {
    if (component == transform) {
      throw new IllegalArgumentException("the Transform of '" + name + "' cannot be removed");
    }
    return components.removeIf(existing -> existing == component);
  }

  /**
   * Returns the first attached component assignable to {@code type}.
   *
   * @param type component class or interface
   * @param <T> component type
   * @return first match in attach order
   */
  public <T> Optional<T> findComponent(Class<T> type) {
    for (Object component : components) {
      if (type.isInstance(component)) {
        return Optional.of(type.cast(component));
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the first attached component whose runtime type name equals {@code typeName}. Both the simple name
   * and the fully qualified name are accepted; matching is case-sensitive.
   *
   * @param typeName component type name
   * @return first match in attach order
   */
  public Optional<Object> findComponentByTypeName(String typeName) {
    for (Object component : components) {
      Class<?> type = component.getClass();
      if (type.getSimpleName().equals(typeName) || type.getName().equals(typeName)) {
        return Optional.of(component);
      }
    }
    return Optional.empty();
  }

  void detach() {
    if (parent != null) {
      parent.children.remove(this);
      parent = null;
    } else {
      scene.removeRoot(this);
    }
  }

  void markDestroyed() {
    destroyed = true;
    for (Entity child : children) {
      child.markDestroyed();
    }
  }

  @Override
  public String toString() {
    return "Entity[" + path() + "#" + instanceId + "]";
  }
}
