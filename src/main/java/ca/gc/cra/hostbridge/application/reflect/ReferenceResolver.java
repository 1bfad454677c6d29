package ca.gc.cra.hostbridge.application.reflect;

import ca.gc.cra.hostbridge.application.port.AssetCatalog;
import ca.gc.cra.hostbridge.domain.scene.Entity;
import ca.gc.cra.hostbridge.domain.scene.Scene;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a wire string into an object reference for members of non-scalar type.
 *
 * <p>Tiers are tried in order and the first hit wins:</p>
 * <ol>
 *   <li>{@link Tier#LIVE_ENTITY}: an entity in the active scene named {@code value}; yields the entity itself when
 *       the target type accepts entities, otherwise its first component of the target type. An entity without
 *       such a component falls through to the next tier.</li>
 *   <li>{@link Tier#ASSET_PATH}: the asset stored at path {@code value}, if it has the target type.</li>
 *   <li>{@link Tier#ASSET_SEARCH}: the first asset, in path order, whose name contains {@code value} and whose
 *       value has the target type.</li>
 * </ol>
 */
public final class ReferenceResolver {
  private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

  /** Resolution tier that produced a reference. */
  public enum Tier { LIVE_ENTITY, ASSET_PATH, ASSET_SEARCH }

  /**
   * A resolved reference.
   *
   * @param value referenced object
   * @param tier tier that produced it
   */
  public record Resolution(Object value, Tier tier) {}

  private final Supplier<Scene> activeScene;
  private final AssetCatalog assets;

  public ReferenceResolver(Supplier<Scene> activeScene, AssetCatalog assets) {
    this.activeScene = Objects.requireNonNull(activeScene, "activeScene");
    this.assets = Objects.requireNonNull(assets, "assets");
  }

  /**
   * Resolves {@code value} to an instance of {@code target}.
   *
   * @param value entity name, asset path or asset name
   * @param target required reference type
   * @return resolution, or empty when every tier misses
   */
  public Optional<Resolution> resolve(String value, Class<?> target) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    Optional<Entity> entity = activeScene.get().find(value);
    if (entity.isPresent()) {
      if (target.isInstance(entity.get())) {
        return hit(value, entity.get(), Tier.LIVE_ENTITY);
      }
      Optional<?> component = entity.get().findComponent(target);
      if (component.isPresent()) {
        return hit(value, component.get(), Tier.LIVE_ENTITY);
      }
    }
    Optional<?> asset = assets.load(value, target);
    if (asset.isPresent()) {
      return hit(value, asset.get(), Tier.ASSET_PATH);
    }
    List<String> matches = assets.search(value, target);
    for (String path : matches) {
      Optional<?> found = assets.load(path, target);
      if (found.isPresent()) {
        return hit(value, found.get(), Tier.ASSET_SEARCH);
      }
    }
    log.debug("No {} reference found for '{}'", target.getSimpleName(), value);
    return Optional.empty();
  }

  private static Optional<Resolution> hit(String value, Object resolved, Tier tier) {
    log.debug("Resolved '{}' via {} to {}", value, tier, resolved.getClass().getSimpleName());
    return Optional.of(new Resolution(resolved, tier));
  }
}
