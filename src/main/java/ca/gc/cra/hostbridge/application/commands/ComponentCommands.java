package ca.gc.cra.hostbridge.application.commands;

import ca.gc.cra.hostbridge.application.command.CommandContext;
import ca.gc.cra.hostbridge.application.command.CommandModule;
import ca.gc.cra.hostbridge.application.command.CommandRegistry;
import ca.gc.cra.hostbridge.application.reflect.ComponentType;
import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.scene.Entity;
import ca.gc.cra.hostbridge.domain.scene.Transform;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Component attachment commands. Types are named by their registered simple or fully qualified name.
 */
public final class ComponentCommands implements CommandModule {
  private final HostServices services;
  private final EntityFactory entities;

  public ComponentCommands(HostServices services) {
    this.services = Objects.requireNonNull(services, "services");
    this.entities = new EntityFactory(services);
  }

  @Override
  public void registerInto(CommandRegistry.Builder registry) {
    registry.register("AddComponent", this::add);
    registry.register("RemoveComponent", this::remove);
    registry.register("HasComponent", this::has);
    registry.register("GetAllComponents", this::all);
  }

  private Object add(CommandContext ctx) {
    Entity entity = target(ctx);
    ComponentType type = services.componentTypes().require(ctx.params().requireString("componentType"));
    Object component = type.newInstance()
        .orElseThrow(() -> BridgeException.invalidParams("Component type cannot be added: " + type.name()));
    entity.addComponent(component);
    Map<String, Object> result = Results.success("entity", entity.name());
    result.put("component", type.name());
    return result;
  }

  private Object remove(CommandContext ctx) {
    Entity entity = target(ctx);
    String typeName = ctx.params().requireString("componentType");
    Object component = services.properties().requireComponent(entity, typeName);
    if (component instanceof Transform) {
      throw BridgeException.invalidParams("The Transform of '" + entity.name() + "' cannot be removed");
    }
    entity.removeComponent(component);
    Map<String, Object> result = Results.success("entity", entity.name());
    result.put("removed", typeName);
    return result;
  }

  private Object has(CommandContext ctx) {
    Entity entity = target(ctx);
    String typeName = ctx.params().requireString("componentType");
    Map<String, Object> result = Results.success("entity", entity.name());
    result.put("componentType", typeName);
    result.put("hasComponent", entity.findComponentByTypeName(typeName).isPresent());
    return result;
  }

  private Object all(CommandContext ctx) {
    Entity entity = target(ctx);
    List<String> names = entity.components().stream().map(c -> c.getClass().getSimpleName()).toList();
    Map<String, Object> result = Results.success("entity", entity.name());
    result.put("components", names);
    result.put("count", names.size());
    return result;
  }

  private Entity target(CommandContext ctx) {
    return entities.require(ctx.params().requireString("entityName"));
  }
}
