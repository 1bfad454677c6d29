package ca.gc.cra.hostbridge.application.commands;

import ca.gc.cra.hostbridge.application.command.CommandModule;
import ca.gc.cra.hostbridge.application.command.CommandRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Liveness and introspection commands: {@code ping}, {@code GetHostInfo}, {@code ListCommands}.
 */
public final class HostCommands implements CommandModule {
  private final HostServices services;
  private final Supplier<Collection<String>> commandNames;

  /**
   * @param services host collaborators
   * @param commandNames supplies the final registry's names once it is built
   */
  public HostCommands(HostServices services, Supplier<Collection<String>> commandNames) {
    this.services = Objects.requireNonNull(services, "services");
    this.commandNames = Objects.requireNonNull(commandNames, "commandNames");
  }

  @Override
  public void registerInto(CommandRegistry.Builder registry) {
    registry.register("ping", ctx -> "pong");
    registry.register("GetHostInfo", ctx -> hostInfo());
    registry.register("ListCommands", ctx -> {
      List<String> names = new ArrayList<>(commandNames.get());
      Map<String, Object> result = new LinkedHashMap<>();
      result.put("commands", names);
      result.put("count", names.size());
      return result;
    });
  }

  private Map<String, Object> hostInfo() {
    Map<String, Object> info = new LinkedHashMap<>();
    Package pkg = HostCommands.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    info.put("product", "hostbridge");
    info.put("version", version == null ? "dev" : version);
    info.put("javaVersion", System.getProperty("java.version"));
    info.put("activeScene", services.scene().name());
    info.put("entityCount", services.scene().entityCount());
    info.put("componentTypes", services.componentTypes().types().stream().map(t -> t.name()).toList());
    info.put("assetCount", services.assets().list().size());
    info.put("batchMode", services.batchMode());
    return info;
  }
}
