package ca.gc.cra.hostbridge.application.commands;

import ca.gc.cra.hostbridge.application.command.CommandContext;
import ca.gc.cra.hostbridge.application.command.CommandModule;
import ca.gc.cra.hostbridge.application.command.CommandParams;
import ca.gc.cra.hostbridge.application.command.CommandRegistry;
import java.util.Map;
import java.util.Objects;

/**
 * Thin wrappers over the property bridge.
 *
 * <p>{@code memberName} may also be sent as {@code propertyName}. {@code SetComponentProperty} takes the wire
 * string in {@code value}, an optional {@code valueType} hint and {@code required}, which turns an unresolved
 * reference into an error instead of a {@code null} assignment.</p>
 */
public final class PropertyCommands implements CommandModule {
  private final HostServices services;

  public PropertyCommands(HostServices services) {
    this.services = Objects.requireNonNull(services, "services");
  }

  @Override
  public void registerInto(CommandRegistry.Builder registry) {
    registry.register("GetComponentProperty", ctx -> services.properties().get(
        ctx.params().requireString("entityName"),
        ctx.params().requireString("componentType"),
        memberName(ctx.params())));
    registry.register("SetComponentProperty", this::set);
    registry.register("GetComponentMembers", ctx -> {
      String entityName = ctx.params().requireString("entityName");
      String componentType = ctx.params().requireString("componentType");
      Map<String, Object> result = Results.success("entity", entityName);
      result.put("componentType", componentType);
      result.put("members", services.properties().members(entityName, componentType));
      return result;
    });
  }

  private Object set(CommandContext ctx) {
    CommandParams params = ctx.params();
    return services.properties().set(
        params.requireString("entityName"),
        params.requireString("componentType"),
        memberName(params),
        params.optString("value").orElse(null),
        params.optString("valueType").orElse(null),
        params.bool("required", false));
  }

  private static String memberName(CommandParams params) {
    return params.optString("memberName")
        .filter(name -> !name.isBlank())
        .orElseGet(() -> params.requireString("propertyName"));
  }
}
