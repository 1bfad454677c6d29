package ca.gc.cra.hostbridge.application.commands;

import ca.gc.cra.hostbridge.application.command.CommandParams;
import ca.gc.cra.hostbridge.application.reflect.ComponentType;
import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.scene.Entity;
import ca.gc.cra.hostbridge.domain.scene.Renderer;
import ca.gc.cra.hostbridge.domain.scene.Scene;
import ca.gc.cra.hostbridge.domain.scene.Transform;
import ca.gc.cra.hostbridge.domain.scene.Vector3;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entity creation shared by the scene and workflow commands.
 */
final class EntityFactory {
  private static final Logger log = LoggerFactory.getLogger(EntityFactory.class);

  static final Set<String> PRIMITIVES = Set.of("Cube", "Sphere", "Capsule", "Cylinder", "Plane", "Quad");

  private final HostServices services;

  EntityFactory(HostServices services) {
    this.services = services;
  }

  /**
   * Creates an entity from {@code name}, optional {@code primitiveType}, {@code parent}, {@code position},
   * {@code rotation} and {@code scale}. An unknown parent leaves the entity at the scene root.
   */
  Entity create(CommandParams params) {
    String name = params.requireString("name");
    Scene scene = services.scene();
    Entity parent = params.optString("parent")
        .filter(value -> !value.isBlank())
        .flatMap(value -> {
          Optional<Entity> found = scene.find(value);
          if (found.isEmpty()) {
            log.debug("Parent '{}' not found; creating '{}' at the root", value, name);
          }
          return found;
        })
        .orElse(null);
    Entity entity = scene.createEntity(name, parent);
    params.optString("primitiveType")
        .filter(PRIMITIVES::contains)
        .ifPresent(mesh -> entity.addComponent(new Renderer(mesh)));
    applyTransform(entity, params);
    return entity;
  }

  /**
   * Applies optional {@code position}, {@code rotation} and {@code scale}; missing axes keep current values and
   * an all-zero scale counts as absent.
   */
  static void applyTransform(Entity entity, CommandParams params) {
    Transform transform = entity.transform();
    params.vector("position", transform.getPosition()).ifPresent(transform::setPosition);
    params.vector("rotation", transform.getRotation()).ifPresent(transform::setRotation);
    params.vector("scale", transform.getScale())
        .filter(scale -> !scale.equals(Vector3.ZERO))
        .ifPresent(transform::setScale);
  }

  /** Returns the first root named {@code name}, creating it when absent. */
  Entity findOrCreateRoot(String name) {
    Scene scene = services.scene();
    return scene.find(name).orElseGet(() -> scene.createEntity(name));
  }

  /**
   * Attaches components by registered type name. Unknown or non-instantiable names are skipped and collected.
   *
   * @param entity target entity
   * @param typeNames component type names
   * @param missing receives skipped names
   * @return attached names, in order
   */
  List<String> attach(Entity entity, List<String> typeNames, List<String> missing) {
    List<String> attached = new ArrayList<>();
    for (String typeName : typeNames) {
      Optional<Object> component = services.componentTypes().find(typeName).flatMap(ComponentType::newInstance);
      if (component.isPresent()) {
        entity.addComponent(component.get());
        attached.add(typeName);
      } else {
        log.warn("System type not found: {}", typeName);
        missing.add(typeName);
      }
    }
    return attached;
  }

  /** Resolves an entity by name or path. */
  Entity require(String nameOrPath) {
    return services.scene().find(nameOrPath).orElseThrow(() -> BridgeException.entityNotFound(nameOrPath));
  }
}
