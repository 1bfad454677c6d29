package ca.gc.cra.hostbridge.application.commands;

import ca.gc.cra.hostbridge.application.command.CommandContext;
import ca.gc.cra.hostbridge.application.command.CommandModule;
import ca.gc.cra.hostbridge.application.command.CommandParams;
import ca.gc.cra.hostbridge.application.command.CommandRegistry;
import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.scene.Entity;
import ca.gc.cra.hostbridge.domain.scene.Scene;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scene-graph commands: entity lifecycle, hierarchy, naming, tags, layers, transforms and scenes.
 *
 * <p>Entities are addressed by {@code entityName}, which accepts a plain name (first depth-first match) or a
 * slash-separated path.</p>
 */
public final class SceneCommands implements CommandModule {
  private final HostServices services;
  private final EntityFactory entities;

  public SceneCommands(HostServices services) {
    this.services = Objects.requireNonNull(services, "services");
    this.entities = new EntityFactory(services);
  }

  @Override
  public void registerInto(CommandRegistry.Builder registry) {
    registry.register("CreateEntity", this::createEntity);
    registry.register("BatchCreateEntities", this::batchCreate);
    registry.register("DeleteEntity", this::deleteEntity);
    registry.register("RenameEntity", this::rename);
    registry.register("SetActive", this::setActive);
    registry.register("GetActiveState", this::activeState);
    registry.register("SetParent", this::setParent);
    registry.register("GetParent", this::parent);
    registry.register("GetChildren", this::children);
    registry.register("SetTag", this::setTag);
    registry.register("SetLayer", this::setLayer);
    registry.register("FindEntitiesByTag", this::findByTag);
    registry.register("GetHierarchy", this::hierarchy);
    registry.register("SetTransform", this::setTransform);
    registry.register("CreateScene", this::createScene);
    registry.register("GetActiveScene", ctx -> describeScene(services.scene()));
  }

  private Object createEntity(CommandContext ctx) {
    Entity entity = Guards.valueOrInvalid(() -> entities.create(ctx.params()));
    Map<String, Object> result = Results.success("name", entity.name());
    result.put("path", entity.path());
    result.put("instanceId", entity.instanceId());
    return result;
  }

  private Object batchCreate(CommandContext ctx) {
    List<CommandParams> items = ctx.params().objectList("entities");
    if (items.isEmpty()) {
      throw BridgeException.invalidParams("Missing required parameter: entities");
    }
    List<String> created = new ArrayList<>();
    for (CommandParams item : items) {
      ctx.cancellation().throwIfCancelled();
      created.add(Guards.valueOrInvalid(() -> entities.create(item)).name());
    }
    Map<String, Object> result = Results.success("created", created);
    result.put("count", created.size());
    return result;
  }

  private Object deleteEntity(CommandContext ctx) {
    Entity entity = target(ctx);
    String path = entity.path();
    services.scene().destroy(entity);
    return Results.success("deleted", path);
  }

  private Object rename(CommandContext ctx) {
    Entity entity = target(ctx);
    String oldName = entity.name();
    String newName = ctx.params().requireString("newName");
    Guards.invalidIfRejected(() -> entity.rename(newName));
    Map<String, Object> result = Results.success("oldName", oldName);
    result.put("newName", entity.name());
    return result;
  }

  private Object setActive(CommandContext ctx) {
    Entity entity = target(ctx);
    boolean active = ctx.params().optBool("active")
        .orElseThrow(() -> BridgeException.invalidParams("Missing required parameter: active"));
    entity.setActive(active);
    return activeState(entity);
  }

  private Object activeState(CommandContext ctx) {
    return activeState(target(ctx));
  }

  private static Map<String, Object> activeState(Entity entity) {
    Map<String, Object> result = Results.success("name", entity.name());
    result.put("activeSelf", entity.isActive());
    result.put("activeInHierarchy", entity.isActiveInHierarchy());
    return result;
  }

  private Object setParent(CommandContext ctx) {
    Entity entity = target(ctx);
    String parentName = ctx.params().string("parentName", "");
    Entity parent = parentName.isBlank() ? null : entities.require(parentName);
    Guards.invalidIfRejected(() -> entity.setParent(parent));
    Map<String, Object> result = Results.success("name", entity.name());
    result.put("parent", parent == null ? null : parent.name());
    result.put("path", entity.path());
    return result;
  }

  private Object parent(CommandContext ctx) {
    Entity entity = target(ctx);
    Map<String, Object> result = Results.success("name", entity.name());
    result.put("parent", entity.parent().map(Entity::name).orElse(null));
    return result;
  }

  private Object children(CommandContext ctx) {
    Entity entity = target(ctx);
    List<String> names = entity.children().stream().map(Entity::name).toList();
    Map<String, Object> result = Results.success("name", entity.name());
    result.put("children", names);
    result.put("count", names.size());
    return result;
  }

  private Object setTag(CommandContext ctx) {
    Entity entity = target(ctx);
    String tag = ctx.params().optString("tag").orElseGet(() -> ctx.params().requireString("tagName"));
    Guards.invalidIfRejected(() -> entity.setTag(tag));
    Map<String, Object> result = Results.success("name", entity.name());
    result.put("tag", entity.tag());
    return result;
  }

  private Object setLayer(CommandContext ctx) {
    Entity entity = target(ctx);
    if (!ctx.params().has("layer")) {
      throw BridgeException.invalidParams("Missing required parameter: layer");
    }
    int layer = ctx.params().integer("layer", 0);
    Guards.invalidIfRejected(() -> entity.setLayer(layer));
    Map<String, Object> result = Results.success("name", entity.name());
    result.put("layer", entity.layer());
    return result;
  }

  private Object findByTag(CommandContext ctx) {
    String tag = ctx.params().requireString("tag");
    List<String> paths = services.scene().findByTag(tag).stream().map(Entity::path).toList();
    Map<String, Object> result = Results.success("tag", tag);
    result.put("entities", paths);
    result.put("count", paths.size());
    return result;
  }

  private Object hierarchy(CommandContext ctx) {
    boolean rootOnly = ctx.params().bool("rootOnly", false);
    List<String> lines = new ArrayList<>();
    for (Entity root : services.scene().roots()) {
      if (rootOnly) {
        lines.add(root.name());
      } else {
        indent(root, "", lines);
      }
    }
    return Results.success("hierarchy", lines);
  }

  private static void indent(Entity entity, String prefix, List<String> lines) {
    lines.add(prefix + entity.name());
    for (Entity child : entity.children()) {
      indent(child, prefix + "  ", lines);
    }
  }

  private Object setTransform(CommandContext ctx) {
    Entity entity = target(ctx);
    EntityFactory.applyTransform(entity, ctx.params());
    Map<String, Object> result = Results.success("name", entity.name());
    result.put("position", entity.transform().getPosition());
    result.put("rotation", entity.transform().getRotation());
    result.put("scale", entity.transform().getScale());
    return result;
  }

  private Object createScene(CommandContext ctx) {
    String name = ctx.params().optString("sceneName").orElseGet(() -> ctx.params().requireString("name"));
    return describeScene(services.world().createScene(name));
  }

  private static Map<String, Object> describeScene(Scene scene) {
    Map<String, Object> result = Results.success("name", scene.name());
    result.put("rootCount", scene.roots().size());
    result.put("entityCount", scene.entityCount());
    return result;
  }

  private Entity target(CommandContext ctx) {
    return entities.require(ctx.params().requireString("entityName"));
  }
}
