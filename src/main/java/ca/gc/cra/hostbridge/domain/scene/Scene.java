package ca.gc.cra.hostbridge.domain.scene;

import ca.gc.cra.hostbridge.validation.Strings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * <strong>What:</strong> Ordered forest of entities forming the live object graph.
 * <p><strong>Lookup rule:</strong> {@link #find(String)} walks roots in creation order and each subtree depth-first
 * in pre-order; the first entity whose name matches wins. Inactive entities are included. Names containing
 * {@code '/'} are resolved as exact paths from a root, with the same first-match rule at every level.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the host loop thread.</p>
 *
 * @since 0.1.0
 */
public final class Scene {
  private final String name;
  private final List<Entity> roots = new ArrayList<>();
  private long nextInstanceId = 1;

  public Scene(String name) {
    this.name = Strings.requireNonBlank("sceneName", name);
  }

  public String name() {
    return name;
  }

  /**
   * Creates a root entity.
   *
   * @param entityName display name; duplicates are permitted
   * @return new entity
   */
  public Entity createEntity(String entityName) {
    return createEntity(entityName, null);
  }

  /**
   * Creates an entity under {@code parent}, or at the root when {@code parent} is {@code null}.
   *
   * @param entityName display name; duplicates are permitted
   * @param parent parent entity in this scene, or {@code null}
   * @return new entity
   */
  public Entity createEntity(String entityName, Entity parent) {
    Entity entity = new Entity(this, nextInstanceId++, entityName);
    roots.add(entity);
    if (parent != null) {
      entity.setParent(parent);
    }
    return entity;
  }

  public List<Entity> roots() {
    return Collections.unmodifiableList(roots);
  }

  /**
   * Resolves an entity by name or by slash-separated path.
   *
   * @param nameOrPath entity name such as {@code "Player"} or path such as {@code "Player/Weapon"}
   * @return first match in depth-first pre-order
   */
  public Optional<Entity> find(String nameOrPath) {
    if (nameOrPath == null || nameOrPath.isEmpty()) {
      return Optional.empty();
    }
    if (nameOrPath.indexOf('/') >= 0) {
      String[] segments = nameOrPath.split("/");
      return findPath(roots, segments, 0);
    }
    return findFirst(entity -> entity.name().equals(nameOrPath));
  }

  /**
   * Returns the first entity in depth-first pre-order matching {@code predicate}.
   *
   * @param predicate match condition
   * @return first match
   */
  public Optional<Entity> findFirst(Predicate<Entity> predicate) {
    for (Entity root : roots) {
      Entity match = findFirst(root, predicate);
      if (match != null) {
        return Optional.of(match);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns every entity matching {@code predicate} in depth-first pre-order.
   *
   * @param predicate match condition
   * @return matches, possibly empty
   */
  public List<Entity> findAll(Predicate<Entity> predicate) {
    List<Entity> matches = new ArrayList<>();
    for (Entity entity : walk()) {
      if (predicate.test(entity)) {
        matches.add(entity);
      }
    }
    return matches;
  }

  public List<Entity> findByTag(String tag) {
    return findAll(entity -> entity.tag().equals(tag));
  }

  /**
   * Lists every entity in depth-first pre-order.
   *
   * @return snapshot of the scene's entities
   */
  public List<Entity> walk() {
    List<Entity> ordered = new ArrayList<>();
    for (Entity root : roots) {
      collect(root, ordered);
    }
    return ordered;
  }

  public int entityCount() {
    return walk().size();
  }

  /**
   * Removes an entity and its subtree from the scene.
   *
   * @param entity entity to destroy
   * @throws IllegalArgumentException when the entity belongs to another scene
   */
  public void destroy(Entity entity) {
    if (entity.scene() != this) {
      throw new IllegalArgumentException("entity does not belong to scene " + name);
    }
    if (entity.isDestroyed()) {
      return;
    }
    entity.detach();
    entity.markDestroyed();
  }

  void addRoot(Entity entity) {
    roots.add(entity);
  }

  void removeRoot(Entity entity) {
    roots.remove(entity);
  }

  private static Entity findFirst(Entity entity, Predicate<Entity> predicate) {
    if (predicate.test(entity)) {
      return entity;
    }
    for (Entity child : entity.children()) {
      Entity match = findFirst(child, predicate);
      if (match != null) {
        return match;
      }
    }
    return null;
  }

  private static Optional<Entity> findPath(List<Entity> candidates, String[] segments, int depth) {
    for (Entity candidate : candidates) {
      if (!candidate.name().equals(segments[depth])) {
        continue;
      }
      if (depth == segments.length - 1) {
        return Optional.of(candidate);
      }
      Optional<Entity> deeper = findPath(candidate.children(), segments, depth + 1);
      if (deeper.isPresent()) {
        return deeper;
      }
    }
    return Optional.empty();
  }

  private static void collect(Entity entity, List<Entity> ordered) {
    ordered.add(entity);
    for (Entity child : entity.children()) {
      collect(child, ordered);
    }
  }
}
