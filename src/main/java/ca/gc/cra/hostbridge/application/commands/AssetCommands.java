package ca.gc.cra.hostbridge.application.commands;

import ca.gc.cra.hostbridge.application.command.CommandContext;
import ca.gc.cra.hostbridge.application.command.CommandModule;
import ca.gc.cra.hostbridge.application.command.CommandRegistry;
import ca.gc.cra.hostbridge.application.reflect.ComponentType;
import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.scene.Entity;
import ca.gc.cra.hostbridge.domain.scene.Scene;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asset catalog commands. Paths are rooted at {@code Assets/}; a missing prefix is added.
 */
public final class AssetCommands implements CommandModule {
  private static final Logger log = LoggerFactory.getLogger(AssetCommands.class);
  static final String ROOT = "Assets/";

  private final HostServices services;
  private final EntityFactory entities;

  public AssetCommands(HostServices services) {
    this.services = Objects.requireNonNull(services, "services");
    this.entities = new EntityFactory(services);
  }

  @Override
  public void registerInto(CommandRegistry.Builder registry) {
    registry.register("FindAssets", this::find);
    registry.register("CreatePrefab", this::createPrefab);
    registry.register("DeleteAsset", this::delete);
  }

  /** Normalizes an asset path to start with {@code Assets/}. */
  static String assetPath(String raw) {
    String path = raw.trim();
    return path.startsWith(ROOT) ? path : ROOT + path;
  }

  private Object find(CommandContext ctx) {
    String query = ctx.params().optString("searchQuery").orElseGet(() -> ctx.params().string("query", ""));
    Class<?> type = ctx.params().optString("type")
        .filter(name -> !name.isBlank())
        .map(this::assetType)
        .orElse(Object.class);
    List<String> paths = services.assets().search(query, type);
    Map<String, Object> result = Results.success("assets", paths);
    result.put("count", paths.size());
    return result;
  }

  private Class<?> assetType(String name) {
    return switch (name) {
      case "Entity", "Prefab" -> Entity.class;
      case "Scene" -> Scene.class;
      default -> services.componentTypes().find(name)
          .map(ComponentType::type)
          .orElseThrow(() -> BridgeException.invalidParams("Unknown asset type: " + name));
    };
  }

  private Object createPrefab(CommandContext ctx) {
    Entity entity = entities.require(ctx.params().requireString("entityName"));
    String path = assetPath(ctx.params().optString("prefabPath")
        .filter(value -> !value.isBlank())
        .orElseGet(() -> "Prefabs/" + entity.name().replace(' ', '_') + ".prefab"));
    services.assets().save(path, entity);
    log.info("Prefab saved to {}", path);
    Map<String, Object> result = Results.success("prefabPath", path);
    result.put("prefabName", entity.name());
    return result;
  }

  private Object delete(CommandContext ctx) {
    String path = assetPath(ctx.params().requireString("assetPath"));
    boolean removed = services.assets().remove(path);
    Map<String, Object> result = Results.success("assetPath", path);
    result.put("success", removed);
    return result;
  }
}
