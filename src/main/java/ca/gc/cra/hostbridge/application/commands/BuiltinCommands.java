package ca.gc.cra.hostbridge.application.commands;

import ca.gc.cra.hostbridge.application.command.CommandModule;
import ca.gc.cra.hostbridge.application.command.CommandRegistry;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Builds the command registry from the built-in modules plus any extra modules supplied by the embedder.
 */
public final class BuiltinCommands {
  private BuiltinCommands() {
    // Utility
  }

  /**
   * Creates the registry.
   *
   * @param services host collaborators
   * @param extraModules additional modules, installed after the built-ins
   * @return immutable registry
   * @throws IllegalStateException when an extra module registers a name already taken
   */
  public static CommandRegistry registry(HostServices services, List<CommandModule> extraModules) {
    Objects.requireNonNull(services, "services");
    AtomicReference<CommandRegistry> built = new AtomicReference<>();
    CommandRegistry.Builder builder = CommandRegistry.builder()
        .install(new HostCommands(services, () -> built.get().names()))
        .install(new SceneCommands(services))
        .install(new ComponentCommands(services))
        .install(new PropertyCommands(services))
        .install(new AssetCommands(services))
        .install(new WorkflowCommands(services));
    for (CommandModule module : extraModules) {
      builder.install(module);
    }
    CommandRegistry registry = builder.build();
    built.set(registry);
    return registry;
  }

  public static CommandRegistry registry(HostServices services) {
    return registry(services, List.of());
  }
}
