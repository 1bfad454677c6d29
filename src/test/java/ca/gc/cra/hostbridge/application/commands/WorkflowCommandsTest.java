package ca.gc.cra.hostbridge.application.commands;

import static ca.gc.cra.hostbridge.support.BridgeHarness.params;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import ca.gc.cra.hostbridge.domain.scene.Entity;
import ca.gc.cra.hostbridge.domain.scene.Scene;
import ca.gc.cra.hostbridge.support.BridgeHarness;
import ca.gc.cra.hostbridge.support.TestComponents.HealthBar;
import ca.gc.cra.hostbridge.support.TestComponents.HealthSystem;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class WorkflowCommandsTest {
  private final BridgeHarness bridge = BridgeHarness.start();

  @AfterEach
  void tearDown() {
    bridge.close();
  }

  @Test
  void sceneStructureIsIdempotent() {
    Map<String, Object> first = bridge.ok("SetupSceneStructure");
    Map<String, Object> second = bridge.ok("SetupSceneStructure");

    assertEquals(WorkflowCommands.STRUCTURE, first.get("created"));
    assertEquals(List.of(), second.get("created"));
    assertEquals("Scene structure created with 0 root objects", second.get("message"));
  }

  @Test
  void wireSystemsReportsPerPair() {
    bridge.ok("AssembleEntity", "name", "Hud", "components", List.of("HealthBar", "HudText"), "wire", false);
    bridge.ok("AssembleEntity", "name", "Core", "components", List.of("HealthSystem"));

    Map<String, Object> result = bridge.ok("WireSystems", "connections", List.of(
        params("source", "HealthSystem", "target", "HealthBar"),
        params("source", "HealthSystem", "target", "HudText", "eventName", "onHealthChanged"),
        params("source", "AudioManager", "target", "HudText")));

    assertEquals(false, result.get("success"));
    assertEquals("Wired 2 connections, 1 failed", result.get("message"));
    assertEquals("BEST_EFFORT", result.get("mode"));
    HealthBar bar = component("Hud", HealthBar.class);
    assertSame(component("Core", HealthSystem.class), bar.healthSystem);
  }

  @Test
  void atomicOverrideAppliesNothingOnFailure() {
    bridge.ok("AssembleEntity", "name", "Hud", "components", List.of("HealthBar"));
    bridge.ok("AssembleEntity", "name", "Core", "components", List.of("HealthSystem"));

    Map<String, Object> result = bridge.ok("WireSystems", "atomic", true, "connections", List.of(
        params("source", "HealthSystem", "target", "HealthBar"),
        params("source", "Shield", "target", "HealthBar")));

    assertEquals("ATOMIC", result.get("mode"));
    assertEquals(List.of("HealthSystem -> HealthBar"), result.get("skipped"));
    assertEquals(null, component("Hud", HealthBar.class).healthSystem);
  }

  @Test
  void wireSystemsWithoutConnectionsIsInvalid() {
    assertEquals(ErrorKind.INVALID_PARAMS, bridge.call("WireSystems").errorKind());
  }

  @Test
  void assembleEntityWiresAttachedComponents() {
    Map<String, Object> result = bridge.ok("AssembleEntity",
        "name", "Hero", "tag", "Player", "components", List.of("HealthSystem", "HealthBar", "Jetpack"));

    assertEquals(List.of("HealthSystem", "HealthBar"), result.get("attachedSystems"));
    assertEquals(List.of("Jetpack"), result.get("missingSystems"));
    assertNotNull(result.get("wiring"));
    assertSame(component("Hero", HealthSystem.class), component("Hero", HealthBar.class).healthSystem);
  }

  @Test
  void secondAssemblyWiresItsOwnComponents() {
    bridge.ok("AssembleEntity", "name", "Hero1", "components", List.of("HealthSystem", "HealthBar"));
    HealthBar firstBar = component("Hero1", HealthBar.class);
    HealthSystem firstSystem = component("Hero1", HealthSystem.class);

    Map<String, Object> result = bridge.ok("AssembleEntity",
        "name", "Hero2", "components", List.of("HealthSystem", "HealthBar"));

    @SuppressWarnings("unchecked")
    Map<String, Object> wiring = (Map<String, Object>) result.get("wiring");
    assertEquals("Wired 1 connections, 0 failed", wiring.get("message"));
    assertSame(component("Hero2", HealthSystem.class), component("Hero2", HealthBar.class).healthSystem);
    assertSame(firstSystem, firstBar.healthSystem);
  }

  @Test
  void generateGameIgnoresEarlierPlayer() {
    bridge.ok("AssembleEntity", "name", "Player", "components", List.of("HealthSystem", "HealthBar"), "wire", false);
    HealthBar earlierBar = component("Player", HealthBar.class);

    bridge.ok("GenerateGame", "gameName", "Second Run", "systems", List.of("HealthSystem", "HealthBar"));

    Entity player = scene().find("--- PLAYER ---/Player").orElseThrow();
    HealthBar bar = player.findComponent(HealthBar.class).orElseThrow();
    assertSame(player.findComponent(HealthSystem.class).orElseThrow(), bar.healthSystem);
    assertEquals(null, earlierBar.healthSystem);
  }

  @Test
  void createEnemySavesPrefab() {
    Map<String, Object> result = bridge.ok("CreateEnemy", "enemyName", "Orc Brute", "systems", List.of("HealthSystem"));

    assertEquals("Assets/Prefabs/Enemies/Orc_Brute.prefab", result.get("prefabPath"));
    assertEquals("--- ENEMIES ---/Orc Brute", scene().find("Orc Brute").orElseThrow().path());
    assertEquals("Enemy", scene().find("Orc Brute").orElseThrow().tag());
  }

  @Test
  void generateGameReportsMissingSystems() {
    Map<String, Object> result = bridge.ok("GenerateGame", "gameName", "Dungeon Crawl",
        "systems", List.of("AudioManager", "HealthSystem", "HealthBar", "Unknown"));

    assertEquals(List.of("Unknown"), result.get("missingSystems"));
    assertEquals("Assets/Scenes/Dungeon_Crawl.scene", result.get("scenePath"));
    Entity manager = scene().find("--- MANAGERS ---/GameManager").orElseThrow();
    assertTrue(manager.findComponentByTypeName("AudioManager").isPresent());
    Entity player = scene().find("--- PLAYER ---/Player").orElseThrow();
    HealthBar bar = player.findComponent(HealthBar.class).orElseThrow();
    assertSame(player.findComponent(HealthSystem.class).orElseThrow(), bar.healthSystem);
    assertTrue(bridge.root().assets().list().contains(WorkflowCommands.PLAYER_PREFAB));
  }

  @Test
  void setupPlayer2dUsesPlanarBody() {
    bridge.ok("SetupPlayer", "playerType", "2D");

    Map<String, Object> components = bridge.ok("GetAllComponents", "entityName", "Player");
    assertEquals(List.of("Transform", "Renderer", "RigidBody"), components.get("components"));
    assertEquals("true", bridge.ok("GetComponentProperty",
        "entityName", "Player", "componentType", "RigidBody", "memberName", "planar").get("value"));
  }

  private Scene scene() {
    return bridge.root().world().activeScene();
  }

  private <T> T component(String entity, Class<T> type) {
    return scene().find(entity).orElseThrow().findComponent(type).orElseThrow();
  }
}
