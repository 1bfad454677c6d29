package ca.gc.cra.hostbridge.application.commands;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import ca.gc.cra.hostbridge.support.BridgeHarness;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ComponentCommandsTest {
  private final BridgeHarness bridge = BridgeHarness.start();

  @BeforeEach
  void setUp() {
    bridge.ok("CreateEntity", "name", "Player");
  }

  @AfterEach
  void tearDown() {
    bridge.close();
  }

  @Test
  void addHasAndRemove() {
    bridge.ok("AddComponent", "entityName", "Player", "componentType", "RigidBody");

    assertEquals(true, bridge.ok("HasComponent", "entityName", "Player", "componentType", "RigidBody")
        .get("hasComponent"));
    bridge.ok("RemoveComponent", "entityName", "Player", "componentType", "RigidBody");
    assertEquals(false, bridge.ok("HasComponent", "entityName", "Player", "componentType", "RigidBody")
        .get("hasComponent"));
  }

  @Test
  void customComponentsAreAddressableByName() {
    bridge.ok("AddComponent", "entityName", "Player", "componentType", "PlayerController");

    Map<String, Object> all = bridge.ok("GetAllComponents", "entityName", "Player");
    assertEquals(List.of("Transform", "PlayerController"), all.get("components"));
    assertEquals(2, all.get("count"));
  }

  @Test
  void unknownTypeIsComponentNotFound() {
    assertEquals(ErrorKind.COMPONENT_NOT_FOUND,
        bridge.call("AddComponent", "entityName", "Player", "componentType", "Jetpack").errorKind());
    assertEquals("Component type not found: Jetpack",
        bridge.call("AddComponent", "entityName", "Player", "componentType", "Jetpack").error());
  }

  @Test
  void transformCannotBeAddedOrRemoved() {
    assertEquals(ErrorKind.INVALID_PARAMS,
        bridge.call("AddComponent", "entityName", "Player", "componentType", "Transform").errorKind());
    assertEquals(ErrorKind.INVALID_PARAMS,
        bridge.call("RemoveComponent", "entityName", "Player", "componentType", "Transform").errorKind());
  }

  @Test
  void removingAbsentComponentFails() {
    assertEquals(ErrorKind.COMPONENT_NOT_FOUND,
        bridge.call("RemoveComponent", "entityName", "Player", "componentType", "Renderer").errorKind());
  }
}
