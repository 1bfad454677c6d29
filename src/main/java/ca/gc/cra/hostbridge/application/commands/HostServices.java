package ca.gc.cra.hostbridge.application.commands;

import ca.gc.cra.hostbridge.application.port.AssetCatalog;
import ca.gc.cra.hostbridge.application.reflect.ComponentTypeRegistry;
import ca.gc.cra.hostbridge.application.reflect.PropertyBridge;
import ca.gc.cra.hostbridge.application.wiring.Autowirer;
import ca.gc.cra.hostbridge.application.wiring.BatchMode;
import ca.gc.cra.hostbridge.domain.scene.Scene;
import ca.gc.cra.hostbridge.domain.scene.World;
import java.util.Objects;

/**
 * Host-side collaborators shared by the built-in command modules. Everything reachable from here is confined
 * to the host loop thread.
 *
 * @param world owner of the active scene
 * @param componentTypes component kinds addressable by name
 * @param properties reflective get/set
 * @param autowirer component wiring
 * @param assets persisted assets
 * @param batchMode default failure semantics for wiring batches
 */
public record HostServices(
    World world,
    ComponentTypeRegistry componentTypes,
    PropertyBridge properties,
    Autowirer autowirer,
    AssetCatalog assets,
    BatchMode batchMode) {

  public HostServices {
    Objects.requireNonNull(world, "world");
    Objects.requireNonNull(componentTypes, "componentTypes");
    Objects.requireNonNull(properties, "properties");
    Objects.requireNonNull(autowirer, "autowirer");
    Objects.requireNonNull(assets, "assets");
    Objects.requireNonNull(batchMode, "batchMode");
  }

  public Scene scene() {
    return world.activeScene();
  }
}
